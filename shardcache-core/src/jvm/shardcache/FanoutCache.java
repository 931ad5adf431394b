package shardcache;

import shardcache.aggregate.SettingsBroadcaster;
import shardcache.aggregate.ShardAggregates;
import shardcache.persistence.CacheStats;
import shardcache.persistence.Coordinator;
import shardcache.persistence.KeyNotFoundException;
import shardcache.persistence.Shard;
import shardcache.persistence.ShardSet;
import shardcache.persistence.ShardSetImpl;
import shardcache.retry.Backoff;
import shardcache.retry.RetryPolicy;
import shardcache.retry.ShardCall;
import shardcache.sweep.BulkSweeper;
import shardcache.sweep.Sweep;
import org.apache.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Cache that spreads its keys over a fixed number of shards.
 *
 * Every key belongs to exactly one shard, picked by the cache's sharding scheme. Writes to keys in
 * different shards do not contend with each other; writes to the same shard are arbitrated by the
 * shard's own locking, which also covers other processes that open the same directory.
 *
 * A shard call that cannot get its locks within the wait bound fails with a timeout. The named
 * methods (set, add, get, delete) return their "no effect" result in that case unless asked to
 * retry; the item forms (setItem, getItem, deleteItem, read) behave like map operations and either
 * retry or fail. Retries run on the caller's thread with the configured {@link Backoff} between
 * attempts, by default none.
 *
 * The shard count cannot change once a directory holds data: keys would route to other shards and
 * the data already written would no longer be found. Opening a directory with a different count
 * fails.
 */
public class FanoutCache implements Closeable {
    public static final Logger LOG = Logger.getLogger(FanoutCache.class);

    public static final int DEFAULT_SHARDS = 8;
    public static final long DEFAULT_TIMEOUT_MILLIS = 25;

    private final String directory;
    private final ShardSet shardSet;
    private final Backoff backoff;
    private final Clock clock;
    private final BulkSweeper sweeper;
    private final SettingsBroadcaster broadcaster;

    public FanoutCache(String directory, Coordinator coordinator) throws IOException {
        this(directory, coordinator, DEFAULT_SHARDS);
    }

    public FanoutCache(String directory, Coordinator coordinator, int numShards) throws IOException {
        this(directory, coordinator, numShards, DEFAULT_TIMEOUT_MILLIS, Collections.<String, Object>emptyMap());
    }

    /**
     * @param timeoutMillis how long each shard call may wait for its locks
     * @param settings      passed unchanged to every shard
     */
    public FanoutCache(String directory, Coordinator coordinator, int numShards, long timeoutMillis,
                       Map<String, Object> settings) throws IOException {
        this(directory, new CacheSpec(coordinator, numShards), timeoutMillis, settings,
                Backoff.NONE, Clock.systemUTC());
    }

    public FanoutCache(String directory, CacheSpec spec, long timeoutMillis, Map<String, Object> settings,
                       Backoff backoff, Clock clock) throws IOException {
        this.directory = directory;
        this.backoff = backoff;
        this.clock = clock;
        this.sweeper = new BulkSweeper(backoff);
        this.broadcaster = new SettingsBroadcaster(backoff);

        CacheSpec existing = CacheSpec.readOrWrite(directory, spec);
        LOG.info("Opening cache at " + directory + " with " + existing.getNumShards() + " shards");
        this.shardSet = ShardSetImpl.open(directory, existing, timeoutMillis, settings);
    }

    public int getNumShards() {
        return shardSet.getNumShards();
    }

    /** Index of the shard that owns key. */
    public int shardIndex(Object key) {
        return shardSet.shardIndex(key);
    }

    private <T> T onOwningShard(Object key, RetryPolicy policy, T noEffect, ShardCall<T> call) {
        return policy.execute(shardSet.shardFor(key), call, noEffect, backoff);
    }

    public boolean set(Object key, Object value) {
        return set(key, value, null, false, null, false);
    }

    public boolean set(Object key, Object value, Long expireMillis, String tag) {
        return set(key, value, expireMillis, false, tag, false);
    }

    /**
     * Stores value under key.
     *
     * @param expireMillis milliseconds until the item expires, or null for none
     * @param read         value is an InputStream to be stored as raw bytes
     * @param tag          text to associate with the item, or null
     * @param retry        keep retrying when the shard times out
     * @return true if the item was stored, false if the shard timed out and retry is off
     */
    public boolean set(Object key, Object value, Long expireMillis, boolean read, String tag, boolean retry) {
        return store(key, value, expireMillis, read, tag, RetryPolicy.named(retry));
    }

    /** Stores value under key, retrying for as long as the shard times out. */
    public boolean setItem(Object key, Object value) {
        return store(key, value, null, false, null, RetryPolicy.ITEM);
    }

    private boolean store(final Object key, final Object value, final Long expireMillis, final boolean read,
                          final String tag, RetryPolicy policy) {
        return onOwningShard(key, policy, Boolean.FALSE, new ShardCall<Boolean>() {
            public Boolean call(Shard shard) {
                return shard.set(key, value, expireMillis, read, tag);
            }
        });
    }

    public boolean add(Object key, Object value) {
        return add(key, value, null, false, null, false);
    }

    public boolean add(Object key, Object value, Long expireMillis, String tag) {
        return add(key, value, expireMillis, false, tag, false);
    }

    /**
     * Stores value under key only if the key is absent. Of several concurrent adds of one key, from
     * any thread or process, at most one succeeds.
     *
     * @return true if the item was added
     */
    public boolean add(final Object key, final Object value, final Long expireMillis, final boolean read,
                       final String tag, boolean retry) {
        return onOwningShard(key, RetryPolicy.named(retry), Boolean.FALSE, new ShardCall<Boolean>() {
            public Boolean call(Shard shard) {
                return shard.add(key, value, expireMillis, read, tag);
            }
        });
    }

    public Object get(Object key) {
        return get(key, null);
    }

    public Object get(Object key, Object defaultValue) {
        return get(key, defaultValue, false, false, false, false);
    }

    /**
     * Returns the value for key, or defaultValue if it is missing or the shard timed out and retry is
     * off.
     *
     * When expireTime or tag is set, a present key returns an immutable list holding the value, then
     * the expire time in epoch millis (null if none) if asked for, then the tag if asked for. A
     * missing key still returns defaultValue alone.
     *
     * @param read return an InputStream over the stored bytes instead of the value
     */
    public Object get(final Object key, final Object defaultValue, final boolean read, final boolean expireTime,
                      final boolean tag, boolean retry) {
        return onOwningShard(key, RetryPolicy.named(retry), defaultValue, new ShardCall<Object>() {
            public Object call(Shard shard) {
                return shard.get(key, defaultValue, read, expireTime, tag);
            }
        });
    }

    /**
     * @throws KeyNotFoundException if key is missing, or its shard timed out
     */
    public Object getItem(Object key) {
        Object value = get(key, NoValue.INSTANCE);
        if (NoValue.isNoValue(value))
            throw new KeyNotFoundException(key);
        return value;
    }

    /**
     * Opens the stored bytes of key for reading, retrying while its shard times out.
     *
     * @throws KeyNotFoundException if key is missing
     */
    public InputStream read(Object key) {
        Object handle = get(key, NoValue.INSTANCE, true, false, false, true);
        if (NoValue.isNoValue(handle))
            throw new KeyNotFoundException(key);
        return (InputStream) handle;
    }

    /**
     * Asks the owning shard directly. Unlike every other single-key call this neither retries nor
     * absorbs a timeout: the ShardTimeoutException reaches the caller.
     */
    public boolean contains(Object key) {
        return shardSet.shardFor(key).contains(key);
    }

    public boolean delete(Object key) {
        return delete(key, false);
    }

    /**
     * Deletes key. A missing key is not an error.
     *
     * @return true if an item was deleted
     */
    public boolean delete(Object key, boolean retry) {
        return remove(key, RetryPolicy.named(retry));
    }

    /**
     * Deletes key, retrying while its shard times out.
     *
     * @throws KeyNotFoundException if key is missing
     */
    public void deleteItem(Object key) {
        remove(key, RetryPolicy.ITEM);
    }

    private boolean remove(final Object key, RetryPolicy policy) {
        return onOwningShard(key, policy, Boolean.FALSE, new ShardCall<Boolean>() {
            public Boolean call(Shard shard) {
                shard.delete(key);
                return Boolean.TRUE;
            }
        });
    }

    public List<String> check() {
        return check(false);
    }

    /**
     * Checks every shard for inconsistencies between its records and its value files. Meant for
     * tests and post-mortem analysis: each shard's writers are blocked while it is checked.
     *
     * @param fix repair what is found
     * @return the warnings of all shards, in shard order
     */
    public List<String> check(boolean fix) {
        return ShardAggregates.check(shardSet.getShards(), fix);
    }

    /**
     * Removes expired items. Expiry is judged against a single time read once, at the start of the
     * call, for all shards.
     *
     * @return count of items removed
     */
    public long expire() {
        return sweeper.sweep(shardSet.getShards(), Sweep.expire(clock.millis()));
    }

    /** @return count of items removed */
    public long evict(String tag) {
        return sweeper.sweep(shardSet.getShards(), Sweep.evict(tag));
    }

    /** @return count of items removed */
    public long clear() {
        return sweeper.sweep(shardSet.getShards(), Sweep.clear());
    }

    public void createTagIndex() {
        ShardAggregates.createTagIndex(shardSet.getShards());
    }

    public void dropTagIndex() {
        ShardAggregates.dropTagIndex(shardSet.getShards());
    }

    public CacheStats stats() {
        return stats(true, false);
    }

    /**
     * @param enable collect statistics from now on
     * @param reset  set hits and misses back to zero
     * @return hits and misses counted before this call
     */
    public CacheStats stats(boolean enable, boolean reset) {
        return ShardAggregates.stats(shardSet.getShards(), enable, reset);
    }

    /** Estimated size on disk, in bytes. */
    public long volume() {
        return ShardAggregates.volume(shardSet.getShards());
    }

    /** Number of items stored, expired ones included until they are swept. */
    public long size() {
        return ShardAggregates.size(shardSet.getShards());
    }

    /** Reloads setting key in every shard from storage. */
    public Object reset(String key) {
        return reset(key, NoValue.INSTANCE);
    }

    /**
     * Sets setting key to value in every shard.
     *
     * @return the value reported by the last shard
     */
    public Object reset(String key, Object value) {
        return broadcaster.reset(shardSet.getShards(), key, value);
    }

    /** Value of a setting, as seen by the first shard. */
    public Object getSetting(String key) {
        return shardSet.getShard(0).getSetting(key);
    }

    public void close() throws IOException {
        LOG.info("Closing cache at " + directory);
        shardSet.close();
    }
}
