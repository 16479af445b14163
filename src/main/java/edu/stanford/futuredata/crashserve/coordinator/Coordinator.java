package edu.stanford.futuredata.crashserve.coordinator;

import edu.stanford.futuredata.crashserve.*;
import edu.stanford.futuredata.crashserve.crash.Borough;
import edu.stanford.futuredata.crashserve.query.CompiledQuery;
import edu.stanford.futuredata.crashserve.query.QueryCompiler;
import edu.stanford.futuredata.crashserve.query.QueryException;
import edu.stanford.futuredata.crashserve.utilities.ServiceConfig;
import edu.stanford.futuredata.crashserve.utilities.TimingFormat;
import edu.stanford.futuredata.crashserve.utilities.TimingReport;
import edu.stanford.futuredata.crashserve.utilities.Utilities;
import edu.stanford.futuredata.crashserve.utilities.WorkerDescription;
import io.grpc.*;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Accepts client queries, fans each one out to the workers owning the shards it can match, and merges their
 * answers into one response ordered by shard.
 */
public class Coordinator {

    private static final Logger logger = LoggerFactory.getLogger(Coordinator.class);

    // Extra wait past the per-worker deadline before a silent worker is given up on.
    private static final long RESPONSE_GRACE_MILLIS = 500;

    public final String coordinatorID;
    private final Server server;
    private final long workerTimeoutMillis;
    private final int streamChunkSize;

    // Routing table.  Immutable after construction.
    private final Map<Borough, WorkerDescription> routingTable;
    // Map from worker IDs to their descriptions.
    private final Map<String, WorkerDescription> workersMap;
    // Map from worker IDs to their channels.
    private final Map<String, ManagedChannel> workerChannelsMap = new ConcurrentHashMap<>();

    public final Collection<Long> remoteExecutionTimes = new ConcurrentLinkedQueue<>();
    public final Collection<Long> aggregationTimes = new ConcurrentLinkedQueue<>();
    // Payloads addressed to the coordinator itself.
    private final AtomicLong numReceivedMessages = new AtomicLong(0);
    private final AtomicReference<DataMessage> lastReceivedMessage = new AtomicReference<>();

    public Coordinator(ServiceConfig config) {
        this(config.coordinatorID, config.coordinatorPort, config.routingTable(), config.workerTimeoutMillis,
                config.streamChunkSize);
    }

    public Coordinator(String coordinatorID, int coordinatorPort, Map<Borough, WorkerDescription> routingTable,
                       long workerTimeoutMillis, int streamChunkSize) {
        this.coordinatorID = coordinatorID;
        Map<Borough, WorkerDescription> table = new EnumMap<>(Borough.class);
        table.putAll(routingTable);
        this.routingTable = Collections.unmodifiableMap(table);
        Map<String, WorkerDescription> workers = new HashMap<>();
        for (WorkerDescription w : routingTable.values()) {
            workers.put(w.workerID, w);
        }
        this.workersMap = Collections.unmodifiableMap(workers);
        this.workerTimeoutMillis = workerTimeoutMillis;
        this.streamChunkSize = streamChunkSize;
        this.server = ServerBuilder.forPort(coordinatorPort)
                .addService(new ServiceClientCoordinator(this))
                .build();
    }

    /** Start serving requests. */
    public int startServing() {
        for (WorkerDescription w : workersMap.values()) {
            ManagedChannel channel = ManagedChannelBuilder.forAddress(w.host, w.port).usePlaintext()
                    .maxInboundMessageSize(Utilities.MAX_INBOUND_MESSAGE_BYTES).build();
            workerChannelsMap.put(w.workerID, channel);
        }
        try {
            server.start();
        } catch (IOException e) {
            logger.warn("Coordinator startup failed: {}", e.getMessage());
            this.stopServing();
            return 1;
        }
        logger.info("Coordinator {} started, listening on {}, routing {}", coordinatorID, server.getPort(),
                routingTable.entrySet().stream()
                        .map(e -> e.getKey().getDisplayName() + "->" + e.getValue().workerID)
                        .collect(Collectors.joining(", ")));
        return 0;
    }

    /** Stop serving requests and shutdown resources. */
    public void stopServing() {
        server.shutdownNow();
        for (ManagedChannel channel : workerChannelsMap.values()) {
            channel.shutdownNow();
        }
        try {
            server.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int numQueries = remoteExecutionTimes.size();
        if (numQueries > 0) {
            long p50RE = remoteExecutionTimes.stream().mapToLong(i -> i).sorted().toArray()[numQueries / 2];
            long p99RE = remoteExecutionTimes.stream().mapToLong(i -> i).sorted().toArray()[numQueries * 99 / 100];
            long p50agg = aggregationTimes.stream().mapToLong(i -> i).sorted().toArray()[aggregationTimes.size() / 2];
            long p99agg = aggregationTimes.stream().mapToLong(i -> i).sorted().toArray()[aggregationTimes.size() * 99 / 100];
            logger.info("Queries: {} p50 Remote: {}μs p99 Remote: {}μs  p50 Aggregation: {}μs p99 Aggregation: {}μs",
                    numQueries, p50RE, p99RE, p50agg, p99agg);
        }
    }

    public int getPort() {
        return server.getPort();
    }

    public Map<Borough, WorkerDescription> getRoutingTable() {
        return routingTable;
    }

    public long getNumReceivedMessages() {
        return numReceivedMessages.get();
    }

    public Optional<DataMessage> getLastReceivedMessage() {
        return Optional.ofNullable(lastReceivedMessage.get());
    }

    /*
     * QUERY PATH
     */

    /**
     * Run a query against every shard it can match.  Malformed queries are rejected before any dispatch.  A shard
     * that fails or does not answer in time is left out of the results and named in the message, and the response
     * is marked unsuccessful.  Results are ordered by shard, then by scan order within the shard.
     */
    public QueryResponse queryData(QueryRequest request) {
        long totalStart = System.nanoTime();
        TimingReport timing = new TimingReport();
        logger.info("Query {} received: {} {}", request.getQueryId(), request.getQueryString(),
                request.getParametersList());
        CompiledQuery query;
        try {
            query = QueryCompiler.compile(request.getQueryString(), request.getParametersList());
        } catch (QueryException e) {
            logger.info("Query {} rejected: {}", request.getQueryId(), e.getMessage());
            timing.recordNanos(coordinatorID, TimingReport.TOTAL_PROCESSING, System.nanoTime() - totalStart);
            return QueryResponse.newBuilder().setQueryId(request.getQueryId()).setSuccess(false)
                    .setMessage(e.getMessage())
                    .setTimingData(TimingFormat.encode(timing)).addAllTimings(timing.toMessages())
                    .build();
        }

        List<WorkerUnavailableException> failures = new ArrayList<>();
        List<Borough> targets = new ArrayList<>();
        if (!query.matchesNothing()) {
            for (Borough b : query.targetShards()) {
                if (routingTable.containsKey(b)) {
                    targets.add(b);
                } else {
                    failures.add(new WorkerUnavailableException(b, "-", "no worker configured"));
                }
            }
        }

        long downstreamStart = System.nanoTime();
        Map<Borough, List<ResultEntry>> shardResults = dispatch(request, targets, timing, failures);
        long downstreamNanos = System.nanoTime() - downstreamStart;
        timing.recordNanos(coordinatorID, TimingReport.DOWNSTREAM_QUERIES, downstreamNanos);

        long mergeStart = System.nanoTime();
        QueryResponse.Builder response = QueryResponse.newBuilder().setQueryId(request.getQueryId());
        int numEntries = 0;
        // EnumMap iterates in shard order regardless of reply order.
        for (List<ResultEntry> entries : shardResults.values()) {
            response.addAllResults(entries);
            numEntries += entries.size();
        }
        long mergeNanos = System.nanoTime() - mergeStart;
        timing.recordNanos(coordinatorID, TimingReport.MERGE, mergeNanos);

        failures.sort(Comparator.comparing(WorkerUnavailableException::getShard));
        boolean success = failures.isEmpty();
        String message = String.format("Combined results from %d shard(s) (%d total entries)",
                shardResults.size(), numEntries);
        if (!success) {
            message = "Shard(s) unavailable: " + failures.stream().map(Throwable::getMessage)
                    .collect(Collectors.joining("; ")) + ". " + message;
        }
        timing.recordNanos(coordinatorID, TimingReport.TOTAL_PROCESSING, System.nanoTime() - totalStart);
        remoteExecutionTimes.add(downstreamNanos / 1000L);
        aggregationTimes.add(mergeNanos / 1000L);
        logger.info("Query {} finished: success={} entries={}", request.getQueryId(), success, numEntries);
        return response.setSuccess(success).setMessage(message)
                .setTimingData(TimingFormat.encode(timing))
                .addAllTimings(timing.toMessages())
                .build();
    }

    /**
     * Send the query to every worker owning a target shard, in parallel, and wait for all of them, each bounded by
     * the worker timeout.  Workers stream their matches back in pages, which are reassembled per shard in scan
     * order.  Outgoing calls inherit the caller's gRPC context, so its deadline and cancellation propagate.
     */
    private Map<Borough, List<ResultEntry>> dispatch(QueryRequest request, List<Borough> targets, TimingReport timing,
                                                     List<WorkerUnavailableException> failures) {
        // One call per worker, covering every target shard it owns.
        Map<String, List<Borough>> shardsByWorker = new LinkedHashMap<>();
        for (Borough shard : targets) {
            shardsByWorker.computeIfAbsent(routingTable.get(shard).workerID, k -> new ArrayList<>()).add(shard);
        }
        Map<String, Collection<ShardQueryResponse>> pages = new ConcurrentHashMap<>();
        Map<String, Long> roundTripNanos = new ConcurrentHashMap<>();
        Map<String, Status> errors = new ConcurrentHashMap<>();
        CountDownLatch latch = new CountDownLatch(shardsByWorker.size());
        for (Map.Entry<String, List<Borough>> e : shardsByWorker.entrySet()) {
            String workerID = e.getKey();
            CoordinatorWorkerGrpc.CoordinatorWorkerStub stub = CoordinatorWorkerGrpc
                    .newStub(workerChannelsMap.get(workerID))
                    .withDeadlineAfter(workerTimeoutMillis, TimeUnit.MILLISECONDS);
            ShardQueryMessage m = ShardQueryMessage.newBuilder()
                    .setQueryId(request.getQueryId())
                    .setQueryString(request.getQueryString())
                    .addAllParameters(request.getParametersList())
                    .addAllBoroughs(e.getValue().stream().map(Borough::getDisplayName).collect(Collectors.toList()))
                    .setPageSize(streamChunkSize)
                    .build();
            Collection<ShardQueryResponse> workerPages = new ConcurrentLinkedQueue<>();
            pages.put(workerID, workerPages);
            long sendTime = System.nanoTime();
            StreamObserver<ShardQueryResponse> responseObserver = new StreamObserver<>() {
                @Override
                public void onNext(ShardQueryResponse page) {
                    workerPages.add(page);
                }

                @Override
                public void onError(Throwable throwable) {
                    logger.warn("Query {} error on worker {} ({}): {}", request.getQueryId(), workerID, e.getValue(),
                            throwable.getMessage());
                    errors.put(workerID, Status.fromThrowable(throwable));
                    latch.countDown();
                }

                @Override
                public void onCompleted() {
                    roundTripNanos.put(workerID, System.nanoTime() - sendTime);
                    latch.countDown();
                }
            };
            stub.executeQuery(m, responseObserver);
        }
        try {
            if (!latch.await(workerTimeoutMillis + RESPONSE_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                logger.warn("Query {}: {} worker(s) did not answer within {}ms", request.getQueryId(),
                        latch.getCount(), workerTimeoutMillis);
            }
        } catch (InterruptedException e) {
            logger.warn("Query {} interrupted while waiting for workers", request.getQueryId());
            Thread.currentThread().interrupt();
        }

        Map<Borough, List<ResultEntry>> collected = new EnumMap<>(Borough.class);
        for (Map.Entry<String, List<Borough>> e : shardsByWorker.entrySet()) {
            String workerID = e.getKey();
            List<Borough> shards = e.getValue();
            try {
                List<ShardQueryResponse> workerPages = collect(workerID, shards.get(0), pages.get(workerID),
                        roundTripNanos, errors, timing);
                Map<Borough, List<ResultEntry>> byShard = new EnumMap<>(Borough.class);
                for (Borough shard : shards) {
                    byShard.put(shard, new ArrayList<>());
                }
                for (ShardQueryResponse page : workerPages) {
                    Optional<Borough> shard = Borough.fromName(page.getBorough());
                    if (shard.isPresent() && byShard.containsKey(shard.get())) {
                        byShard.get(shard.get()).addAll(page.getResultsList());
                    }
                }
                collected.putAll(byShard);
            } catch (WorkerUnavailableException ex) {
                for (Borough shard : shards) {
                    failures.add(new WorkerUnavailableException(shard, workerID, ex.getReason()));
                }
            }
        }
        return collected;
    }

    // The worker's pages in arrival order, once its summary page reports success.
    private List<ShardQueryResponse> collect(String workerID, Borough firstShard,
                                             Collection<ShardQueryResponse> workerPages,
                                             Map<String, Long> roundTripNanos, Map<String, Status> errors,
                                             TimingReport timing) throws WorkerUnavailableException {
        Status error = errors.get(workerID);
        if (error != null) {
            String reason = error.getCode().toString();
            if (error.getDescription() != null) {
                reason += ": " + error.getDescription();
            }
            throw new WorkerUnavailableException(firstShard, workerID, reason);
        }
        Long rtt = roundTripNanos.get(workerID);
        if (rtt == null) {
            throw new WorkerUnavailableException(firstShard, workerID,
                    String.format("no response within %dms", workerTimeoutMillis));
        }
        List<ShardQueryResponse> received = new ArrayList<>(workerPages);
        if (received.isEmpty() || !received.get(received.size() - 1).getIsLast()) {
            throw new WorkerUnavailableException(firstShard, workerID, "incomplete response");
        }
        ShardQueryResponse summary = received.get(received.size() - 1);
        timing.recordNanos(coordinatorID, TimingReport.QUERY_TO_PREFIX + workerID, rtt);
        timing.merge(summary.getTiming());
        if (!summary.getSuccess()) {
            throw new WorkerUnavailableException(firstShard, workerID, summary.getMessage());
        }
        return received;
    }

    /**
     * Page a response into chunks of at most streamChunkSize entries.  The last chunk carries the summary (status,
     * message, timing) and is always present, even for an empty or failed result set.
     */
    public List<DataChunk> toChunks(QueryResponse response) {
        List<DataChunk> chunks = new ArrayList<>();
        List<ResultEntry> results = response.getResultsList();
        int numChunks = Math.max(1, (results.size() + streamChunkSize - 1) / streamChunkSize);
        for (int i = 0; i < numChunks; i++) {
            List<ResultEntry> page = results.subList(Math.min(results.size(), i * streamChunkSize),
                    Math.min(results.size(), (i + 1) * streamChunkSize));
            DataChunk.Builder chunk = DataChunk.newBuilder()
                    .setChunkId(String.format("%s-%d", response.getQueryId(), i))
                    .setData(ResultPage.newBuilder().addAllEntries(page).build().toByteString())
                    .setIsLast(i == numChunks - 1);
            if (i == numChunks - 1) {
                chunk.setSummary(response.toBuilder().clearResults().build());
            }
            chunks.add(chunk.build());
        }
        return chunks;
    }

    /*
     * POINT-TO-POINT DATA
     */

    /** Accept a payload addressed to the coordinator, or forward it to the named worker. */
    public Status sendData(DataMessage m) {
        if (m.getDestination().equals(coordinatorID)) {
            logger.info("Coordinator received data {} from {}: {}", m.getMessageId(), m.getSource(),
                    Utilities.hexPreview(m.getData().toByteArray(), 16));
            numReceivedMessages.incrementAndGet();
            lastReceivedMessage.set(m);
            return Status.OK;
        }
        WorkerDescription w = workersMap.get(m.getDestination());
        if (w == null) {
            return Status.NOT_FOUND.withDescription("Unknown destination " + m.getDestination());
        }
        try {
            CoordinatorWorkerGrpc.newBlockingStub(workerChannelsMap.get(w.workerID))
                    .withDeadlineAfter(workerTimeoutMillis, TimeUnit.MILLISECONDS)
                    .sendData(m);
            logger.debug("Forwarded data {} from {} to {}", m.getMessageId(), m.getSource(), w.workerID);
            return Status.OK;
        } catch (StatusRuntimeException e) {
            logger.warn("Cannot forward data {} to {}: {}", m.getMessageId(), w.workerID, e.getStatus());
            if (e.getStatus().getCode() == Status.Code.NOT_FOUND) {
                return e.getStatus();
            }
            return Status.UNAVAILABLE.withDescription("Worker " + w.workerID + " unreachable").withCause(e);
        }
    }
}
