package edu.stanford.futuredata.crashserve.utilities;

import edu.stanford.futuredata.crashserve.crash.Borough;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

public class WorkerDescription {

    public final String workerID;
    public final String host;
    public final int port;
    // Owned shards and the files they load from, in shard order.
    public final Map<Borough, Path> shards;

    public final String summaryString;

    public WorkerDescription(String workerID, String host, int port, Map<Borough, Path> shards) {
        this.workerID = workerID;
        this.host = host;
        this.port = port;
        Map<Borough, Path> owned = new EnumMap<>(Borough.class);
        owned.putAll(shards);
        this.shards = Collections.unmodifiableMap(owned);
        this.summaryString = String.format("%s %s:%d %s", workerID, host, port,
                owned.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(" ")));
    }

    public WorkerDescription(String workerID, String host, int port, Borough borough, Path dataFile) {
        this(workerID, host, port, Collections.singletonMap(borough, dataFile));
    }

    /** Same worker, listening elsewhere.  Used when a worker was bound to an ephemeral port. */
    public WorkerDescription withPort(int port) {
        return new WorkerDescription(workerID, host, port, shards);
    }

    @Override
    public String toString() {
        return summaryString;
    }
}
