package shardcache.persistence;

import java.io.Closeable;
import java.util.List;

public interface ShardSet extends Closeable {
    int getNumShards();
    int shardIndex(Object shardKey);
    String shardPath(int shardIdx);
    Shard getShard(int shardIdx);
    Shard shardFor(Object shardKey);

    /** All shards, in index order. The list is immutable. */
    List<Shard> getShards();
}
