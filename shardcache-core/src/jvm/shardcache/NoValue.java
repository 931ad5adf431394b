package shardcache;

/**
 * Marker for "no value". Distinct from every storable value, null included, so it can be passed as
 * the default of a lookup to tell a missing key apart from a stored null.
 */
public final class NoValue {
    public static final NoValue INSTANCE = new NoValue();

    private NoValue() {
    }

    public static boolean isNoValue(Object o) {
        return o == INSTANCE;
    }

    @Override public String toString() {
        return "ENOVAL";
    }
}
