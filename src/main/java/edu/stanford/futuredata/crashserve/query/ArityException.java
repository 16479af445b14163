package edu.stanford.futuredata.crashserve.query;

public class ArityException extends QueryException {

    public ArityException(Verb verb, int actual) {
        super(String.format("%s expects %d parameter(s), got %d", verb.getQueryString(), verb.getArity(), actual));
    }
}
