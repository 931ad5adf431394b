package shardcache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import shardcache.partition.HashModScheme;
import shardcache.partition.ShardingScheme;
import shardcache.persistence.Coordinator;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes how a cache directory is laid out: how many shards, which coordinator opens them and
 * which scheme routes keys to them. Written once, as cache-spec.json in the cache directory, and
 * checked on every later open, since data written under one shard count cannot be found under
 * another.
 */
public class CacheSpec {
    public static final String CACHE_SPEC_FILENAME = "cache-spec.json";

    private static final String COORDINATOR_CONF = "coordinator";
    private static final String SHARD_SCHEME_CONF = "shard_scheme";
    private static final String SHARD_SCHEME_VERSION_CONF = "shard_scheme_version";
    private static final String SHARD_COUNT_CONF = "shard_count";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final int numShards;
    private final Coordinator coordinator;
    private final ShardingScheme shardingScheme;

    public CacheSpec(String coordinatorClass, String shardSchemeClass, int numShards) {
        this(Utils.classForName(coordinatorClass), Utils.classForName(shardSchemeClass), numShards);
    }

    public CacheSpec(Class coordinatorClass, Class shardSchemeClass, int numShards) {
        this((Coordinator) Utils.newInstance(coordinatorClass),
                (ShardingScheme) Utils.newInstance(shardSchemeClass),
                numShards);
    }

    public CacheSpec(Coordinator coordinator, int numShards) {
        this(coordinator, new HashModScheme(), numShards);
    }

    public CacheSpec(Coordinator coordinator, ShardingScheme shardingScheme, int numShards) {
        if (numShards < 1)
            throw new IllegalArgumentException("A cache needs at least one shard, got " + numShards);
        this.numShards = numShards;
        this.coordinator = coordinator;
        this.shardingScheme = shardingScheme;
    }

    public int getNumShards() {
        return numShards;
    }

    public Coordinator getCoordinator() {
        return coordinator;
    }

    public ShardingScheme getShardScheme() {
        return shardingScheme;
    }

    @Override public String toString() {
        return mapify().toString();
    }

    @Override public boolean equals(Object other) {
        if (!(other instanceof CacheSpec))
            return false;
        CacheSpec o = (CacheSpec) other;
        return mapify().equals(o.mapify());
    }

    @Override public int hashCode() {
        return mapify().hashCode();
    }

    public static boolean exists(String dirpath) {
        return new File(dirpath, CACHE_SPEC_FILENAME).exists();
    }

    public static CacheSpec readFromDirectory(String dirpath) throws IOException {
        if (!exists(dirpath)) {
            return null;
        }
        Map<String, Object> specmap = MAPPER.readValue(new File(dirpath, CACHE_SPEC_FILENAME), Map.class);
        return parseFromMap(specmap);
    }

    protected static CacheSpec parseFromMap(Map<String, Object> specmap) {
        String coordinatorConf = (String) specmap.get(COORDINATOR_CONF);
        String shardSchemeConf = (String) specmap.get(SHARD_SCHEME_CONF);
        int numShards = ((Number) specmap.get(SHARD_COUNT_CONF)).intValue();
        Number version = (Number) Utils.get(specmap, SHARD_SCHEME_VERSION_CONF, HashModScheme.VERSION);
        if (version.intValue() != HashModScheme.VERSION) {
            throw new IllegalArgumentException("Cache was written with shard scheme version " + version
                    + ", this build routes with version " + HashModScheme.VERSION);
        }
        return new CacheSpec(coordinatorConf, shardSchemeConf, numShards);
    }

    public void writeToDirectory(String dirpath) throws IOException {
        File dir = new File(dirpath);
        if (!dir.isDirectory() && !dir.mkdirs()) {
            throw new IOException("Could not create cache directory " + dirpath);
        }
        MAPPER.writeValue(new File(dir, CACHE_SPEC_FILENAME), mapify());
    }

    /**
     * Returns the spec stored in dirpath, writing the supplied one first if the directory holds none.
     *
     * @throws IllegalArgumentException if a stored spec differs from the supplied one
     */
    public static CacheSpec readOrWrite(String dirpath, CacheSpec spec) throws IOException {
        CacheSpec existing = readFromDirectory(dirpath);
        if (existing == null) {
            spec.writeToDirectory(dirpath);
            return spec;
        }
        if (!existing.equals(spec)) {
            throw new IllegalArgumentException(spec.toString() + " does not match existing " + existing.toString());
        }
        return spec;
    }

    private Map<String, Object> mapify() {
        Map<String, Object> spec = new LinkedHashMap<String, Object>();
        spec.put(COORDINATOR_CONF, coordinator.getClass().getName());
        spec.put(SHARD_SCHEME_CONF, shardingScheme.getClass().getName());
        spec.put(SHARD_SCHEME_VERSION_CONF, HashModScheme.VERSION);
        spec.put(SHARD_COUNT_CONF, numShards);
        return spec;
    }
}
