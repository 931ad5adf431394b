package shardcache.persistence;

/**
 * A shard could not get what it needed within its wait bound. Always safe to retry.
 *
 * For bulk removals the count holds the number of items already removed, and committed, by the
 * call that failed.
 */
public class ShardTimeoutException extends RuntimeException {
    private final int count;

    public ShardTimeoutException() {
        this(0);
    }

    public ShardTimeoutException(int count) {
        super("Shard wait bound exceeded after removing " + count + " items");
        this.count = count;
    }

    public ShardTimeoutException(int count, Throwable cause) {
        super("Shard wait bound exceeded after removing " + count + " items", cause);
        this.count = count;
    }

    public int getCount() {
        return count;
    }
}
