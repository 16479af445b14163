package edu.stanford.futuredata.crashserve.worker;

import edu.stanford.futuredata.crashserve.DataMessage;
import edu.stanford.futuredata.crashserve.ShardQueryMessage;
import edu.stanford.futuredata.crashserve.ShardQueryResponse;
import edu.stanford.futuredata.crashserve.crash.Borough;
import edu.stanford.futuredata.crashserve.crash.CrashRecord;
import edu.stanford.futuredata.crashserve.crash.CrashShard;
import edu.stanford.futuredata.crashserve.ingest.IngestionException;
import edu.stanford.futuredata.crashserve.interfaces.ShardFactory;
import edu.stanford.futuredata.crashserve.query.CompiledQuery;
import edu.stanford.futuredata.crashserve.query.QueryCompiler;
import edu.stanford.futuredata.crashserve.query.QueryException;
import edu.stanford.futuredata.crashserve.utilities.TimingReport;
import edu.stanford.futuredata.crashserve.utilities.Utilities;
import edu.stanford.futuredata.crashserve.utilities.WorkerDescription;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Serves one or more borough shards.  Shards are loaded before the server starts and are read-only afterwards,
 * so concurrent queries scan them without locking.
 */
public class Worker {

    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    // Entries per result page when the coordinator does not ask for a size.
    static final int DEFAULT_PAGE_SIZE = 100;

    public final String workerID;
    private final WorkerDescription description;
    private final ShardFactory<CrashRecord, CrashShard> shardFactory;
    private final Server server;
    private final Map<Borough, CrashShard> shards = new EnumMap<>(Borough.class);
    public boolean serving = false;

    // Collect scan and full execution times of all queries, in microseconds.
    public final Collection<Long> scanTimes = new ConcurrentLinkedQueue<>();
    public final Collection<Long> executeTimes = new ConcurrentLinkedQueue<>();

    private final AtomicLong numReceivedMessages = new AtomicLong(0);
    private final AtomicReference<DataMessage> lastReceivedMessage = new AtomicReference<>();

    public Worker(WorkerDescription description, ShardFactory<CrashRecord, CrashShard> shardFactory) {
        this.workerID = description.workerID;
        this.description = description;
        this.shardFactory = shardFactory;
        this.server = ServerBuilder.forPort(description.port)
                .addService(new ServiceCoordinatorWorker(this))
                .build();
    }

    /** Load every owned shard and start serving.  A worker with a shard that fails to load never serves. */
    public boolean startServing() {
        assert(!serving);
        for (Map.Entry<Borough, Path> e : description.shards.entrySet()) {
            try {
                shards.put(e.getKey(), shardFactory.createShardFromFile(e.getValue(), e.getKey().getShardNum()));
            } catch (IngestionException ex) {
                logger.error("Worker {} could not load shard {}: {}", workerID, e.getKey(), ex.getMessage());
                destroyShards();
                return false;
            }
        }
        try {
            server.start();
        } catch (IOException e) {
            logger.warn("Worker {} startup failed: {}", workerID, e.getMessage());
            destroyShards();
            return false;
        }
        serving = true;
        logger.info("Worker {} serving {}, listening on {}", workerID,
                shards.entrySet().stream()
                        .map(e -> String.format("%s (%d records)", e.getKey(), e.getValue().getNumRows()))
                        .collect(Collectors.joining(", ")),
                server.getPort());
        return true;
    }

    private void destroyShards() {
        for (CrashShard shard : shards.values()) {
            shard.destroy();
        }
        shards.clear();
    }

    /** Stop serving requests and shutdown resources. */
    public void shutDown() {
        if (!serving) {
            return;
        }
        serving = false;
        server.shutdownNow();
        try {
            server.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        destroyShards();
        int numQueries = executeTimes.size();
        if (numQueries > 0) {
            long p50Scan = scanTimes.stream().mapToLong(i -> i).sorted().toArray()[scanTimes.size() / 2];
            long p99Scan = scanTimes.stream().mapToLong(i -> i).sorted().toArray()[scanTimes.size() * 99 / 100];
            long p50Exec = executeTimes.stream().mapToLong(i -> i).sorted().toArray()[numQueries / 2];
            long p99Exec = executeTimes.stream().mapToLong(i -> i).sorted().toArray()[numQueries * 99 / 100];
            logger.info("Worker {} Queries: {} p50 Scan: {}μs p99 Scan: {}μs p50 Exec: {}μs p99 Exec: {}μs",
                    workerID, numQueries, p50Scan, p99Scan, p50Exec, p99Exec);
        }
        logger.info("Worker {} stopped", workerID);
    }

    /** Port the server is bound to; differs from the configured port when that was 0. */
    public int getPort() {
        return server.getPort();
    }

    public WorkerDescription getDescription() {
        return description.withPort(getPort());
    }

    public Set<Borough> getBoroughs() {
        return description.shards.keySet();
    }

    public long getNumReceivedMessages() {
        return numReceivedMessages.get();
    }

    public Optional<DataMessage> getLastReceivedMessage() {
        return Optional.ofNullable(lastReceivedMessage.get());
    }

    /**
     * Run a query over the requested shards, or over every owned shard when none is named.  Matches come back as
     * pages of at most page_size entries, tagged with their shard and in scan order, followed by one summary page
     * carrying status, message and timing.  A requested shard this worker does not own contributes nothing.
     */
    List<ShardQueryResponse> executeQuery(ShardQueryMessage m) {
        long totalStart = System.nanoTime();
        TimingReport timing = new TimingReport();
        List<ShardQueryResponse> pages = new ArrayList<>();
        CompiledQuery query;
        try {
            query = QueryCompiler.compile(m.getQueryString(), m.getParametersList());
        } catch (QueryException e) {
            logger.warn("Worker {} rejected query {}: {}", workerID, m.getQueryId(), e.getMessage());
            timing.recordNanos(workerID, TimingReport.TOTAL_PROCESSING, System.nanoTime() - totalStart);
            pages.add(summaryPage(m.getQueryId(), false, e.getMessage(), timing));
            return pages;
        }
        int pageSize = m.getPageSize() > 0 ? m.getPageSize() : DEFAULT_PAGE_SIZE;
        List<String> requested = m.getBoroughsCount() > 0 ? m.getBoroughsList()
                : shards.keySet().stream().map(Borough::getDisplayName).collect(Collectors.toList());

        long scanNanos = 0;
        long filterNanos = 0;
        int numEntries = 0;
        List<String> notOwned = new ArrayList<>();
        for (String name : requested) {
            Optional<Borough> target = Borough.fromName(name);
            if (target.isEmpty() || !shards.containsKey(target.get())) {
                // Routing errors are the coordinator's concern.  Answer with nothing rather than failing.
                logger.warn("Worker {} owns {} but was asked for shard {}", workerID, shards.keySet(), name);
                notOwned.add(name);
                continue;
            }
            Borough borough = target.get();
            Pair<List<CrashRecord>, Long> scan = shards.get(borough).scan(query.getPredicate());
            scanNanos += scan.getValue1();

            long filterStart = System.nanoTime();
            List<CrashRecord> matches = scan.getValue0();
            for (int start = 0; start < matches.size(); start += pageSize) {
                ShardQueryResponse.Builder page = ShardQueryResponse.newBuilder().setQueryId(m.getQueryId())
                        .setSuccess(true).setBorough(borough.getDisplayName());
                for (CrashRecord r : matches.subList(start, Math.min(matches.size(), start + pageSize))) {
                    page.addResults(r.toResultEntry());
                }
                pages.add(page.build());
            }
            filterNanos += System.nanoTime() - filterStart;
            numEntries += matches.size();
        }
        timing.recordNanos(workerID, TimingReport.SCAN, scanNanos);
        timing.recordNanos(workerID, TimingReport.FILTER, filterNanos);

        long totalNanos = System.nanoTime() - totalStart;
        timing.recordNanos(workerID, TimingReport.TOTAL_PROCESSING, totalNanos);
        scanTimes.add(scanNanos / 1000L);
        executeTimes.add(totalNanos / 1000L);
        String message = String.format("%d records from %d shard(s)", numEntries,
                requested.size() - notOwned.size());
        if (!notOwned.isEmpty()) {
            message += String.format(", shard(s) not owned by worker %s: %s", workerID, String.join(", ", notOwned));
        }
        logger.debug("Worker {} query {} {}: {} in {} page(s)", workerID, m.getQueryId(), m.getQueryString(),
                message, pages.size());
        pages.add(summaryPage(m.getQueryId(), true, message, timing));
        return pages;
    }

    private ShardQueryResponse summaryPage(String queryID, boolean success, String message, TimingReport timing) {
        return ShardQueryResponse.newBuilder().setQueryId(queryID).setSuccess(success).setMessage(message)
                .setTiming(timing.toMessage(workerID)).setIsLast(true).build();
    }

    void receiveData(DataMessage m) {
        logger.info("Worker {} received data {} from {}: {}", workerID, m.getMessageId(), m.getSource(),
                Utilities.hexPreview(m.getData().toByteArray(), 16));
        numReceivedMessages.incrementAndGet();
        lastReceivedMessage.set(m);
    }
}
