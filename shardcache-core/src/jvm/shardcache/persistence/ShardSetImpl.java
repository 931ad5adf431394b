package shardcache.persistence;

import shardcache.CacheSpec;
import shardcache.Utils;
import shardcache.partition.ShardingScheme;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The fixed, ordered set of shards owned by one cache. Shard i lives under root/%03d.
 */
public class ShardSetImpl implements ShardSet {
    public static final Logger LOG = Logger.getLogger(ShardSetImpl.class);

    private final String root;
    private final CacheSpec spec;
    private final List<Shard> shards;

    ShardSetImpl(String root, CacheSpec spec, List<Shard> shards) {
        this.root = root;
        this.spec = spec;
        this.shards = Collections.unmodifiableList(new ArrayList<Shard>(shards));
    }

    /**
     * Opens every shard of the spec under root, in index order. If any shard fails to open, the ones
     * already opened are closed before the failure is rethrown.
     */
    public static ShardSetImpl open(String root, CacheSpec spec, long timeoutMillis,
                                    Map<String, Object> settings) throws IOException {
        List<Shard> opened = new ArrayList<Shard>(spec.getNumShards());
        ShardSetImpl partial = new ShardSetImpl(root, spec, opened);
        try {
            for (int i = 0; i < spec.getNumShards(); i++) {
                opened.add(spec.getCoordinator().openShard(partial.shardPath(i), timeoutMillis, settings));
            }
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to open shard " + opened.size() + " under " + root + ", closing "
                    + opened.size() + " opened shards");
            closeAll(opened, e);
            throw e;
        }
        return new ShardSetImpl(root, spec, opened);
    }

    public ShardingScheme getShardScheme() {
        return spec.getShardScheme();
    }

    public int getNumShards() {
        return spec.getNumShards();
    }

    public void assertValidShard(int shardIdx) {
        if ( !(shardIdx >= 0 && shardIdx < getNumShards())) {
            String errorStr = shardIdx +
                    " is not a valid shard index. Index must be between 0 and " + (getNumShards() - 1);
            throw new IllegalArgumentException(errorStr);
        }
    }

    public String shardPath(int shardIdx) {
        assertValidShard(shardIdx);
        return root + File.separator + Utils.shardDirName(shardIdx);
    }

    public int shardIndex(Object shardKey) {
        return getShardScheme().shardIndex(shardKey, getNumShards());
    }

    public Shard getShard(int shardIdx) {
        assertValidShard(shardIdx);
        return shards.get(shardIdx);
    }

    public Shard shardFor(Object shardKey) {
        return getShard(shardIndex(shardKey));
    }

    public List<Shard> getShards() {
        return shards;
    }

    public void close() throws IOException {
        closeAll(shards, null);
    }

    private static void closeAll(List<Shard> shards, Exception pending) throws IOException {
        IOException first = null;
        for (Shard shard : shards) {
            try {
                shard.close();
            } catch (IOException e) {
                if (pending != null) {
                    pending.addSuppressed(e);
                } else if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null)
            throw first;
    }
}
