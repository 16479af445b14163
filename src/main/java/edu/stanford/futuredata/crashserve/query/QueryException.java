package edu.stanford.futuredata.crashserve.query;

/** A query rejected before any shard is contacted. */
public class QueryException extends Exception {

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
