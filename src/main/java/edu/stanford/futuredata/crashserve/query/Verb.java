package edu.stanford.futuredata.crashserve.query;

import java.util.Optional;

/** The fixed set of query types and the number of positional parameters each takes. */
public enum Verb {
    GET_ALL("get_all", 0),
    GET_BY_BOROUGH("get_by_borough", 1),
    GET_BY_STREET("get_by_street", 1),
    GET_BY_DATE_RANGE("get_by_date_range", 2),
    GET_CRASHES_WITH_INJURIES("get_crashes_with_injuries", 1),
    GET_CRASHES_WITH_FATALITIES("get_crashes_with_fatalities", 1),
    GET_BY_TIME("get_by_time", 1);

    private final String queryString;
    private final int arity;

    Verb(String queryString, int arity) {
        this.queryString = queryString;
        this.arity = arity;
    }

    public String getQueryString() {
        return queryString;
    }

    public int getArity() {
        return arity;
    }

    public static Optional<Verb> fromQueryString(String queryString) {
        for (Verb v : values()) {
            if (v.queryString.equals(queryString)) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }
}
