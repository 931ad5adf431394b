package shardcache.partition;

import shardcache.Utils;
import shardcache.serialize.KryoSerializer;
import shardcache.serialize.Serializer;
import org.apache.log4j.Logger;

/**
 * md5 of the serialized key, mod the shard count. Never uses Object.hashCode(), whose value for
 * strings and other types is not guaranteed across JVMs.
 */
public class HashModScheme implements ShardingScheme {
    public static final Logger LOG = Logger.getLogger(HashModScheme.class);

    /** Bumped whenever the key-to-shard mapping changes; existing caches become unreadable. */
    public static final int VERSION = 1;

    private transient Serializer serializer;

    public HashModScheme() {
    }

    public HashModScheme(Serializer serializer) {
        this.serializer = serializer;
    }

    private Serializer getSerializer() {
        if (serializer == null)
            serializer = new KryoSerializer();

        return serializer;
    }

    public int shardIndex(Object shardKey, int shardCount) {
        if (shardCount < 1)
            throw new IllegalArgumentException("Shard count must be positive, got " + shardCount);

        byte[] serializedKey = getSerializer().serialize(shardKey);
        int idx = Utils.keyShard(serializedKey, shardCount);
        if (LOG.isDebugEnabled())
            LOG.debug("shardIndex for " + shardKey + " (" + serializedKey.length + " bytes) is " + idx);
        return idx;
    }
}
