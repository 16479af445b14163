package edu.stanford.futuredata.crashserve.client;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;

/** The coordinator could not be reached, or the call to it failed below the query level. */
public class TransportException extends Exception {

    private final Status.Code code;

    public TransportException(StatusRuntimeException cause) {
        super(cause.getStatus().getCode() + ": " + cause.getStatus().getDescription(), cause);
        this.code = cause.getStatus().getCode();
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.code = Status.Code.UNKNOWN;
    }

    public TransportException(String message) {
        super(message);
        this.code = Status.Code.UNKNOWN;
    }

    public Status.Code getCode() {
        return code;
    }
}
