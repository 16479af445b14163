package edu.stanford.futuredata.crashserve.crash;

import edu.stanford.futuredata.crashserve.interfaces.Shard;
import org.javatuples.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Crash records of one borough, held in memory in file order.  There is no secondary index: every query is a
 * full linear scan, which is fast enough for per-borough data sets and needs no locking once loaded.
 */
public class CrashShard implements Shard<CrashRecord> {

    private final Borough borough;
    private volatile List<CrashRecord> rows;

    public CrashShard(Borough borough, List<CrashRecord> rows) {
        for (CrashRecord row : rows) {
            if (row.getPartitionKey() != borough.getShardNum()) {
                throw new IllegalArgumentException(
                        String.format("Record %s does not belong to shard %s", row, borough));
            }
        }
        this.borough = borough;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public Borough getBorough() {
        return borough;
    }

    public List<CrashRecord> getRows() {
        return rows;
    }

    @Override
    public int getNumRows() {
        return rows.size();
    }

    @Override
    public void destroy() {
        rows = Collections.emptyList();
    }

    @Override
    public Pair<List<CrashRecord>, Long> scan(Predicate<CrashRecord> predicate) {
        long scanStart = System.nanoTime();
        List<CrashRecord> matches = new ArrayList<>();
        for (CrashRecord row : rows) {
            if (predicate.test(row)) {
                matches.add(row);
            }
        }
        return new Pair<>(matches, System.nanoTime() - scanStart);
    }
}
