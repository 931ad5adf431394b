package shardcache.aggregate;

import shardcache.persistence.Shard;
import shardcache.persistence.ShardTimeoutException;
import shardcache.retry.Backoff;
import org.apache.log4j.Logger;

import java.util.List;

/**
 * Pushes one settings change, or reload, to every shard.
 *
 * Each shard is retried until it accepts the change. Only the last shard's answer is returned;
 * the shards are expected to agree and this is not checked.
 */
public class SettingsBroadcaster {
    public static final Logger LOG = Logger.getLogger(SettingsBroadcaster.class);

    private final Backoff backoff;

    public SettingsBroadcaster(Backoff backoff) {
        this.backoff = backoff;
    }

    public Object reset(List<Shard> shards, String key, Object value) {
        Object result = null;
        for (int i = 0; i < shards.size(); i++) {
            Shard shard = shards.get(i);
            int attempt = 0;
            while (true) {
                try {
                    result = shard.reset(key, value);
                    break;
                } catch (ShardTimeoutException e) {
                    attempt++;
                    LOG.debug("Resetting " + key + " on shard " + i + " timed out, attempt " + attempt);
                    backoff.pause(attempt);
                }
            }
        }
        return result;
    }
}
