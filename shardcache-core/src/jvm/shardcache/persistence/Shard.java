package shardcache.persistence;

import java.io.Closeable;
import java.util.List;

/**
 * One independently locked, independently persisted partition of the cache.
 *
 * Every call may block for up to the shard's wait bound and then fail with a
 * {@link ShardTimeoutException}. Calls that remove items in bulk (expire, evict, clear) report in
 * that exception how many items they had already removed.
 */
public interface Shard extends Closeable {

    /**
     * Stores the value, replacing any existing one.
     *
     * @param expireMillis milliseconds until the item expires, or null for no expiry
     * @param read when true, value is an InputStream whose bytes are stored raw
     * @param tag text to associate with the key, or null
     */
    boolean set(Object key, Object value, Long expireMillis, boolean read, String tag);

    /** Like set, but only when the key is absent. Atomic against concurrent adds of the same key. */
    boolean add(Object key, Object value, Long expireMillis, boolean read, String tag);

    /**
     * Returns the value for key, or defaultValue when it is absent. When expireTime or tag is
     * requested, a present key yields an immutable list of (value, [expireTime], [tag]).
     */
    Object get(Object key, Object defaultValue, boolean read, boolean expireTime, boolean tag);

    /** @throws KeyNotFoundException if the key is absent */
    void delete(Object key);

    boolean contains(Object key);

    /** Removes up to one batch of items that expired at or before now. */
    int expire(long now);

    /** Removes up to one batch of items carrying tag. */
    int evict(String tag);

    /** Removes up to one batch of items. */
    int clear();

    List<String> check(boolean fix);

    /** Returns the counts collected so far, then applies enable and reset. */
    CacheStats stats(boolean enable, boolean reset);

    long volume();

    long size();

    /**
     * Updates setting key to value and returns it. When value is {@link shardcache.NoValue#INSTANCE}
     * the setting is reloaded from storage instead.
     */
    Object reset(String key, Object value);

    Object getSetting(String key);

    void createTagIndex();

    void dropTagIndex();
}
