package edu.stanford.futuredata.crashserve.crash;

import java.util.Locale;
import java.util.Optional;

/**
 * The partitioning key of the crash data set.  One shard exists per constant; declaration order is the
 * shard identifier order used when merging results.
 */
public enum Borough {
    BROOKLYN("BROOKLYN", "brooklyn_crashes.csv"),
    QUEENS("QUEENS", "queens_crashes.csv"),
    BRONX("BRONX", "bronx_crashes.csv"),
    STATEN_ISLAND("STATEN ISLAND", "staten_island_crashes.csv"),
    // Overflow shard for blank and unmapped boroughs.
    OTHER("OTHER", "other_crashes.csv");

    private final String displayName;
    private final String shardFileName;

    Borough(String displayName, String shardFileName) {
        this.displayName = displayName;
        this.shardFileName = shardFileName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getShardFileName() {
        return shardFileName;
    }

    public int getShardNum() {
        return ordinal();
    }

    public static Borough fromShardNum(int shardNum) {
        Borough[] values = values();
        if (shardNum < 0 || shardNum >= values.length) {
            throw new IllegalArgumentException("No shard " + shardNum);
        }
        return values[shardNum];
    }

    /** Case-insensitive lookup by display name ("STATEN ISLAND") or constant name ("STATEN_ISLAND"). */
    public static Optional<Borough> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (Borough b : values()) {
            if (b.displayName.equals(normalized) || b.name().equals(normalized)) {
                return Optional.of(b);
            }
        }
        return Optional.empty();
    }

    /** Shard owning a raw BOROUGH column value.  Anything that is not one of the four mapped boroughs is OTHER. */
    public static Borough forRecord(String rawBorough) {
        return fromName(rawBorough).orElse(OTHER);
    }
}
