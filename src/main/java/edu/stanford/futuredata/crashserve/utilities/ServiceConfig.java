package edu.stanford.futuredata.crashserve.utilities;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import edu.stanford.futuredata.crashserve.crash.Borough;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process layout of a deployment: where the coordinator listens and which worker owns which borough shard.
 * Loaded once at startup; immutable afterwards.
 */
public class ServiceConfig {

    public static final String ROOT = "crashserve";

    public final String coordinatorID;
    public final String coordinatorHost;
    public final int coordinatorPort;
    public final long workerTimeoutMillis;
    public final int streamChunkSize;
    public final List<WorkerDescription> workers;

    public ServiceConfig(String coordinatorID, String coordinatorHost, int coordinatorPort, long workerTimeoutMillis,
                         int streamChunkSize, List<WorkerDescription> workers) {
        this.coordinatorID = coordinatorID;
        this.coordinatorHost = coordinatorHost;
        this.coordinatorPort = coordinatorPort;
        this.workerTimeoutMillis = workerTimeoutMillis;
        this.streamChunkSize = streamChunkSize;
        this.workers = Collections.unmodifiableList(new ArrayList<>(workers));
    }

    /** Load reference.conf/application.conf, overridden by configFile when given. */
    public static ServiceConfig load(Optional<Path> configFile) {
        Config config = ConfigFactory.load();
        if (configFile.isPresent()) {
            File f = configFile.get().toFile();
            if (!f.isFile()) {
                throw new ConfigException.Generic("Config file not found: " + f);
            }
            config = ConfigFactory.parseFile(f).withFallback(config).resolve();
        }
        return fromConfig(config);
    }

    public static ServiceConfig fromConfig(Config root) {
        Config c = root.getConfig(ROOT);
        Config coordinator = c.getConfig("coordinator");
        long timeout = coordinator.getLong("worker-timeout-millis");
        int chunkSize = coordinator.getInt("stream-chunk-size");
        if (timeout <= 0) {
            throw new ConfigException.BadValue("coordinator.worker-timeout-millis", "must be positive");
        }
        if (chunkSize <= 0) {
            throw new ConfigException.BadValue("coordinator.stream-chunk-size", "must be positive");
        }
        List<WorkerDescription> workers = new ArrayList<>();
        for (Config w : c.getConfigList("workers")) {
            // A worker owns either one shard (borough, data-file) or a list of them (shards).
            List<? extends Config> shardConfigs = w.hasPath("shards")
                    ? w.getConfigList("shards") : Collections.singletonList(w);
            if (shardConfigs.isEmpty()) {
                throw new ConfigException.BadValue(w.origin(), "shards", "Worker owns no shard");
            }
            Map<Borough, Path> shards = new EnumMap<>(Borough.class);
            for (Config s : shardConfigs) {
                String boroughName = s.getString("borough");
                Borough borough = Borough.fromName(boroughName).orElseThrow(() ->
                        new ConfigException.BadValue(s.origin(), "borough", "Unknown borough " + boroughName));
                if (shards.put(borough, Path.of(s.getString("data-file"))) != null) {
                    throw new ConfigException.BadValue(s.origin(), "borough", "Borough " + borough + " listed twice");
                }
            }
            workers.add(new WorkerDescription(w.getString("id"), w.getString("host"), w.getInt("port"), shards));
        }
        ServiceConfig serviceConfig = new ServiceConfig(coordinator.getString("id"), coordinator.getString("host"),
                coordinator.getInt("port"), timeout, chunkSize, workers);
        serviceConfig.routingTable();
        return serviceConfig;
    }

    public Optional<WorkerDescription> getWorker(String workerID) {
        return workers.stream().filter(w -> w.workerID.equals(workerID)).findFirst();
    }

    /**
     * Borough to owning worker.  Each borough may be owned by at most one worker and worker IDs are unique.  A
     * worker owning several boroughs appears once per borough.
     */
    public Map<Borough, WorkerDescription> routingTable() {
        Map<Borough, WorkerDescription> table = new EnumMap<>(Borough.class);
        List<String> ids = new ArrayList<>();
        for (WorkerDescription w : workers) {
            if (w.workerID.equals(coordinatorID) || ids.contains(w.workerID)) {
                throw new ConfigException.BadValue("workers", "Duplicate process id " + w.workerID);
            }
            ids.add(w.workerID);
            for (Borough b : w.shards.keySet()) {
                if (table.putIfAbsent(b, w) != null) {
                    throw new ConfigException.BadValue("workers", "Borough " + b + " assigned twice");
                }
            }
        }
        return Collections.unmodifiableMap(table);
    }
}
