package edu.stanford.futuredata.crashserve.coordinator;

import edu.stanford.futuredata.crashserve.crash.Borough;

/** A shard left out of a query's results because its worker failed or did not answer. */
public class WorkerUnavailableException extends Exception {

    private final Borough shard;
    private final String reason;

    public WorkerUnavailableException(Borough shard, String workerID, String reason) {
        super(String.format("%s (worker %s): %s", shard.getDisplayName(), workerID, reason));
        this.shard = shard;
        this.reason = reason;
    }

    public Borough getShard() {
        return shard;
    }

    public String getReason() {
        return reason;
    }
}
