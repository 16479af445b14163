package edu.stanford.futuredata.crashserve.query;

import edu.stanford.futuredata.crashserve.crash.Borough;
import edu.stanford.futuredata.crashserve.crash.CrashRecord;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/** A validated query: the record test and the shards it can match. */
public class CompiledQuery {

    private final Verb verb;
    private final Predicate<CrashRecord> predicate;
    // Only set for get_by_borough with a recognized borough name.
    private final Borough borough;
    private final boolean matchesNothing;

    CompiledQuery(Verb verb, Predicate<CrashRecord> predicate, Borough borough, boolean matchesNothing) {
        this.verb = verb;
        this.predicate = predicate;
        this.borough = borough;
        this.matchesNothing = matchesNothing;
    }

    public Predicate<CrashRecord> getPredicate() {
        return predicate;
    }

    /**
     * Shards that may hold matching records.  A borough query touches one shard, or none when the borough name
     * is not recognized; every other verb can match records anywhere.
     */
    public Set<Borough> targetShards() {
        if (verb == Verb.GET_BY_BOROUGH) {
            return borough == null ? EnumSet.noneOf(Borough.class) : EnumSet.of(borough);
        }
        return EnumSet.allOf(Borough.class);
    }

    /** True if the predicate is known to reject every record, e.g. a reversed date range. */
    public boolean matchesNothing() {
        return matchesNothing;
    }
}
