package shardcache.persistence;

public final class CacheStats {
    public static final CacheStats EMPTY = new CacheStats(0, 0);

    private final long hits;
    private final long misses;

    public CacheStats(long hits, long misses) {
        this.hits = hits;
        this.misses = misses;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public CacheStats plus(CacheStats other) {
        return new CacheStats(hits + other.hits, misses + other.misses);
    }

    @Override public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof CacheStats))
            return false;

        CacheStats other = (CacheStats) obj;
        return hits == other.hits && misses == other.misses;
    }

    @Override public int hashCode() {
        return 31 * Long.hashCode(hits) + Long.hashCode(misses);
    }

    @Override public String toString() {
        return "(hits=" + hits + ", misses=" + misses + ")";
    }
}
