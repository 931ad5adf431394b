package shardcache.aggregate;

import shardcache.persistence.CacheStats;
import shardcache.persistence.Shard;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-mostly reductions over all shards. None of them retry: a timeout from any shard reaches the
 * caller.
 */
public final class ShardAggregates {
    public static final Logger LOG = Logger.getLogger(ShardAggregates.class);

    private ShardAggregates() {
    }

    /**
     * Checks each shard in turn. Each check holds that shard's write lock while it runs, blocking
     * writers of that shard only.
     */
    public static List<String> check(List<Shard> shards, boolean fix) {
        List<String> warnings = new ArrayList<String>();
        for (Shard shard : shards) {
            List<String> shardWarnings = shard.check(fix);
            for (String warning : shardWarnings) {
                LOG.warn(warning);
            }
            warnings.addAll(shardWarnings);
        }
        return warnings;
    }

    public static CacheStats stats(List<Shard> shards, boolean enable, boolean reset) {
        CacheStats total = CacheStats.EMPTY;
        for (Shard shard : shards) {
            total = total.plus(shard.stats(enable, reset));
        }
        return total;
    }

    public static long volume(List<Shard> shards) {
        long total = 0;
        for (Shard shard : shards) {
            total += shard.volume();
        }
        return total;
    }

    public static long size(List<Shard> shards) {
        long total = 0;
        for (Shard shard : shards) {
            total += shard.size();
        }
        return total;
    }

    public static void createTagIndex(List<Shard> shards) {
        for (Shard shard : shards) {
            shard.createTagIndex();
        }
    }

    public static void dropTagIndex(List<Shard> shards) {
        for (Shard shard : shards) {
            shard.dropTagIndex();
        }
    }
}
