package edu.stanford.futuredata.crashserve.ingest;

/** A crash data file that cannot be read, or whose rows do not belong to the shard being loaded. */
public class IngestionException extends Exception {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
