package shardcache.persistence;

import java.io.IOException;
import java.io.Serializable;
import java.util.Map;

/**
 * Opens shards of one storage kind. A cache keeps the coordinator's class name in its descriptor, so
 * implementations need a public no-arg constructor.
 */
public interface Coordinator extends Serializable {
    /**
     * Opens, creating if needed, the shard stored under root.
     *
     * @param timeoutMillis how long any single call may wait on a lock before failing
     * @param settings options passed unchanged from the cache
     */
    Shard openShard(String root, long timeoutMillis, Map<String, Object> settings) throws IOException;
}
