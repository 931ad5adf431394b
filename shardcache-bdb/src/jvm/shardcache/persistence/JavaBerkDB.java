package shardcache.persistence;

import java.io.IOException;
import java.util.Map;

/**
 * Opens shards stored in BerkeleyDB Java Edition environments, one environment per shard
 * directory.
 *
 * Several handles in one JVM may share a shard directory. JE lets only one process at a time open
 * an environment for writing, so processes sharing a cache directory must coordinate above this.
 */
public class JavaBerkDB implements Coordinator {

    public JavaBerkDB() {
        super();
    }

    public Shard openShard(String root, long timeoutMillis, Map<String, Object> settings) throws IOException {
        return new JavaBerkDBShard(root, timeoutMillis, settings);
    }
}
