package shardcache.retry;

/**
 * Decides how long to wait before retrying a call that timed out.
 */
public abstract class Backoff {

    /** Retries immediately. */
    public static final Backoff NONE = new Backoff() {
        public void pause(int attempt) {
        }

        @Override public String toString() {
            return "Backoff.NONE";
        }
    };

    /**
     * Called after the given failed attempt (1 for the first) and before the next one.
     */
    public abstract void pause(int attempt);

    /** Sleeps for the same number of milliseconds before every retry. */
    public static Backoff fixed(final long millis) {
        if (millis < 0)
            throw new IllegalArgumentException("Backoff must not be negative: " + millis);

        return new Backoff() {
            public void pause(int attempt) {
                try {
                    Thread.sleep(millis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RuntimeException("Interrupted while backing off", e);
                }
            }

            @Override public String toString() {
                return "Backoff.fixed(" + millis + ")";
            }
        };
    }
}
