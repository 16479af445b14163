package edu.stanford.futuredata.crashserve.interfaces;

import edu.stanford.futuredata.crashserve.ingest.IngestionException;

import java.nio.file.Path;

public interface ShardFactory<R extends Row, S extends Shard<R>> {
    /*
     Load a shard from a shard file written by ingestion.
     */

    // Load the shard stored at shardPath, which must only hold rows for partition shardNum.
    S createShardFromFile(Path shardPath, int shardNum) throws IngestionException;
}
