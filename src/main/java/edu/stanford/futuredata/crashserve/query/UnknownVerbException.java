package edu.stanford.futuredata.crashserve.query;

public class UnknownVerbException extends QueryException {

    private final String queryString;

    public UnknownVerbException(String queryString) {
        super("Unknown query: " + queryString);
        this.queryString = queryString;
    }

    public String getQueryString() {
        return queryString;
    }
}
