package shardcache.partition;

import java.io.Serializable;

/**
 * Maps a key to the index of the shard that owns it. Implementations must be pure: the same key and
 * shard count always give the same index, in this process and in any other.
 */
public interface ShardingScheme extends Serializable {
    int shardIndex(Object shardKey, int shardCount);
}
