package edu.stanford.futuredata.crashserve.interfaces;

import org.javatuples.Pair;

import java.util.List;
import java.util.function.Predicate;

public interface Shard<R extends Row> {
    /*
     A read-only data structure holding the rows of one partition.

     Shard concurrency contract:
     A shard is fully built before it is published.
     Scans run at any time and in parallel; nothing mutates a published shard.
     */

    // Number of rows held by this shard.
    int getNumRows();
    // Destroy shard data.  After destruction, shard is no longer usable.
    void destroy();
    // Full linear scan.  Returns matching rows in storage order and the scan time in nanoseconds.
    Pair<List<R>, Long> scan(Predicate<R> predicate);
}
