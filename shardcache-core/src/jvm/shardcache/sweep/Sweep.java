package shardcache.sweep;

import shardcache.persistence.Shard;

/**
 * One batch of a whole-shard removal. A call removes up to a shard-chosen number of matching items
 * and returns how many it removed; zero means the shard has nothing left to remove.
 */
public abstract class Sweep {
    private final String name;

    protected Sweep(String name) {
        this.name = name;
    }

    public abstract int apply(Shard shard);

    /** Removes items whose expire time is at or before now, in epoch millis. */
    public static Sweep expire(final long now) {
        return new Sweep("expire") {
            public int apply(Shard shard) {
                return shard.expire(now);
            }
        };
    }

    public static Sweep evict(final String tag) {
        return new Sweep("evict") {
            public int apply(Shard shard) {
                return shard.evict(tag);
            }
        };
    }

    public static Sweep clear() {
        return new Sweep("clear") {
            public int apply(Shard shard) {
                return shard.clear();
            }
        };
    }

    @Override public String toString() {
        return name;
    }
}
