package edu.stanford.futuredata.crashserve.integration;

import edu.stanford.futuredata.crashserve.client.CrashQueryClient;
import edu.stanford.futuredata.crashserve.coordinator.Coordinator;
import edu.stanford.futuredata.crashserve.crash.Borough;
import edu.stanford.futuredata.crashserve.crash.CrashShardFactory;
import edu.stanford.futuredata.crashserve.ingest.CrashDataPartitioner;
import edu.stanford.futuredata.crashserve.utilities.WorkerDescription;
import edu.stanford.futuredata.crashserve.worker.Worker;
import io.grpc.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/** A coordinator and its workers on ephemeral localhost ports, serving the sample crash file. */
public class CrashServeCluster implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CrashServeCluster.class);

    public static final String COORDINATOR_ID = "A";

    public final Map<Borough, Worker> workers = new EnumMap<>(Borough.class);
    public final Map<Borough, WorkerDescription> routingTable = new EnumMap<>(Borough.class);
    private final List<Server> extraServers = new ArrayList<>();
    private final List<CrashQueryClient> clients = new ArrayList<>();
    public Coordinator coordinator;

    public static Path sampleFile() {
        try {
            return Path.of(Objects.requireNonNull(CrashServeCluster.class.getResource("/sample_crashes.csv")).toURI());
        } catch (Exception e) {
            throw new IllegalStateException("Missing sample_crashes.csv", e);
        }
    }

    /** Partition the sample file into shardDir. */
    public static Path partitionSample(Path shardDir) throws Exception {
        CrashDataPartitioner.partition(sampleFile(), shardDir);
        return shardDir;
    }

    // B for the first shard, C for the second, and so on.  Staten Island and the overflow shard share worker E.
    public static String workerID(Borough borough) {
        if (borough == Borough.OTHER) {
            return workerID(Borough.STATEN_ISLAND);
        }
        return String.valueOf((char) ('B' + borough.ordinal()));
    }

    public static CrashServeCluster startAll(Path shardDir, long workerTimeoutMillis, int streamChunkSize) {
        return new CrashServeCluster()
                .startWorkers(shardDir, EnumSet.allOf(Borough.class))
                .startCoordinator(workerTimeoutMillis, streamChunkSize);
    }

    /** Start the workers owning the given shards.  A worker owning several shards is keyed under each of them. */
    public CrashServeCluster startWorkers(Path shardDir, Collection<Borough> boroughs) {
        Map<String, Map<Borough, Path>> layout = new LinkedHashMap<>();
        for (Borough b : boroughs) {
            layout.computeIfAbsent(workerID(b), k -> new EnumMap<>(Borough.class))
                    .put(b, shardDir.resolve(b.getShardFileName()));
        }
        for (Map.Entry<String, Map<Borough, Path>> e : layout.entrySet()) {
            Worker worker = new Worker(new WorkerDescription(e.getKey(), "127.0.0.1", 0, e.getValue()),
                    new CrashShardFactory());
            assertTrue(worker.startServing());
            WorkerDescription started = worker.getDescription();
            for (Borough b : e.getValue().keySet()) {
                workers.put(b, worker);
                routingTable.put(b, started);
            }
        }
        return this;
    }

    /** Route a shard to a server the test controls. */
    public CrashServeCluster route(Borough borough, Server server) {
        extraServers.add(server);
        routingTable.put(borough, new WorkerDescription(workerID(borough), "127.0.0.1", server.getPort(), borough,
                Path.of(borough.getShardFileName())));
        return this;
    }

    public CrashServeCluster startCoordinator(long workerTimeoutMillis, int streamChunkSize) {
        coordinator = new Coordinator(COORDINATOR_ID, 0, routingTable, workerTimeoutMillis, streamChunkSize);
        assertEquals(0, coordinator.startServing());
        return this;
    }

    public CrashQueryClient client() {
        return client(0);
    }

    public CrashQueryClient client(long deadlineMillis) {
        CrashQueryClient client = new CrashQueryClient("127.0.0.1", coordinator.getPort(), deadlineMillis);
        clients.add(client);
        return client;
    }

    @Override
    public void close() {
        for (CrashQueryClient client : clients) {
            client.close();
        }
        if (coordinator != null) {
            coordinator.stopServing();
        }
        for (Worker worker : new LinkedHashSet<>(workers.values())) {
            worker.shutDown();
        }
        for (Server server : extraServers) {
            server.shutdownNow();
        }
        logger.info("Cluster stopped");
    }
}
