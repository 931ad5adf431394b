package shardcache.retry;

import shardcache.persistence.Shard;

/**
 * A single call against one shard, replayed as is on every retry.
 */
public interface ShardCall<T> {
    T call(Shard shard);
}
