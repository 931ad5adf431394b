package shardcache.retry;

import shardcache.persistence.KeyNotFoundException;
import shardcache.persistence.Shard;
import shardcache.persistence.ShardTimeoutException;
import org.apache.log4j.Logger;

/**
 * How a single-shard call reacts to a timeout and to a missing key.
 *
 * The named cache methods (set, add, get, delete) and their item forms (setItem, deleteItem) run
 * the same calls under different presets: the named methods give up on timeout unless asked to
 * retry and report a missing key as "no effect"; the item forms retry until the shard answers and
 * let KeyNotFoundException through.
 */
public final class RetryPolicy {
    public static final Logger LOG = Logger.getLogger(RetryPolicy.class);

    /** Named methods, default: no retry, missing key is "no effect". */
    public static final RetryPolicy NAMED = new RetryPolicy("NAMED", false, false);

    /** Named methods called with retry = true. */
    public static final RetryPolicy NAMED_RETRY = new RetryPolicy("NAMED_RETRY", true, false);

    /** Item forms: retry forever, missing key propagates. */
    public static final RetryPolicy ITEM = new RetryPolicy("ITEM", true, true);

    private final String name;
    private final boolean retry;
    private final boolean propagateNotFound;

    private RetryPolicy(String name, boolean retry, boolean propagateNotFound) {
        this.name = name;
        this.retry = retry;
        this.propagateNotFound = propagateNotFound;
    }

    public static RetryPolicy named(boolean retry) {
        return retry ? NAMED_RETRY : NAMED;
    }

    public boolean retries() {
        return retry;
    }

    public boolean propagatesNotFound() {
        return propagateNotFound;
    }

    /**
     * Runs call against shard under this policy.
     *
     * @param noEffect what to return when the call times out without retry, or finds no key while
     *                 KeyNotFoundException is absorbed
     */
    public <T> T execute(Shard shard, ShardCall<T> call, T noEffect, Backoff backoff) {
        int attempt = 0;
        while (true) {
            try {
                return call.call(shard);
            } catch (ShardTimeoutException e) {
                if (!retry) {
                    LOG.debug("Shard call timed out, giving up under " + name);
                    return noEffect;
                }
                attempt++;
                if (LOG.isDebugEnabled())
                    LOG.debug("Shard call timed out, retry attempt " + attempt + " under " + name);
                backoff.pause(attempt);
            } catch (KeyNotFoundException e) {
                if (propagateNotFound)
                    throw e;
                return noEffect;
            }
        }
    }

    @Override public String toString() {
        return "RetryPolicy." + name;
    }
}
