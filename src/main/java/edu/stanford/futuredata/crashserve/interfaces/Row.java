package edu.stanford.futuredata.crashserve.interfaces;

import java.io.Serializable;

public interface Row extends Serializable {
    /*
     A row of data.  Exposes a partition key.  Key must be nonnegative.
     Rows with the same key are stored in the same shard.
     */
    int getPartitionKey();
}
