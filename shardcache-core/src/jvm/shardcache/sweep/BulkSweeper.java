package shardcache.sweep;

import shardcache.persistence.Shard;
import shardcache.persistence.ShardTimeoutException;
import shardcache.retry.Backoff;
import org.apache.log4j.Logger;

import java.util.List;

/**
 * Runs a sweep over every shard, in index order, and counts what it removed.
 *
 * Each shard is swept until a call returns zero. A call that times out still counts the items it
 * removed before failing and is then retried on the same shard, so the total is exact whatever the
 * number of timeouts. Shards are not swept atomically as a group: a sweep interrupted part way has
 * already removed the items of the shards it visited.
 */
public class BulkSweeper {
    public static final Logger LOG = Logger.getLogger(BulkSweeper.class);

    private final Backoff backoff;

    public BulkSweeper() {
        this(Backoff.NONE);
    }

    public BulkSweeper(Backoff backoff) {
        this.backoff = backoff;
    }

    public long sweep(List<Shard> shards, Sweep sweep) {
        long total = 0;
        for (int i = 0; i < shards.size(); i++) {
            Shard shard = shards.get(i);
            int timeouts = 0;
            while (true) {
                int count;
                try {
                    count = sweep.apply(shard);
                } catch (ShardTimeoutException e) {
                    total += e.getCount();
                    timeouts++;
                    if (LOG.isDebugEnabled())
                        LOG.debug(sweep + " on shard " + i + " timed out after removing " + e.getCount()
                                + " items, retrying");
                    backoff.pause(timeouts);
                    continue;
                }
                total += count;
                if (count == 0)
                    break;
            }
        }
        LOG.debug(sweep + " removed " + total + " items");
        return total;
    }
}
