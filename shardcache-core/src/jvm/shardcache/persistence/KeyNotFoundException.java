package shardcache.persistence;

public class KeyNotFoundException extends RuntimeException {
    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super("Key not found: " + key);
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
