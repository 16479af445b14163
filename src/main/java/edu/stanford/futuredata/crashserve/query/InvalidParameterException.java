package edu.stanford.futuredata.crashserve.query;

/** A parameter with the right arity but an unusable value, such as a negative threshold. */
public class InvalidParameterException extends QueryException {

    public InvalidParameterException(String message) {
        super(message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
