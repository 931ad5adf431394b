package shardcache.persistence;

import com.sleepycat.je.EnvironmentConfig;
import shardcache.NoValue;
import shardcache.serialize.KryoSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JavaBerkDBShardTest {

    private static final long TIMEOUT_MILLIS = 25;

    @TempDir
    Path dir;

    private final KryoSerializer serializer = new KryoSerializer();

    private String root;
    private JavaBerkDBShard shard;

    @BeforeEach
    void setUp() throws Exception {
        root = dir.resolve("000").toString();
        shard = open(Collections.<String, Object>emptyMap());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (shard != null)
            shard.close();
    }

    private JavaBerkDBShard open(Map<String, Object> settings) throws Exception {
        return new JavaBerkDBShard(root, TIMEOUT_MILLIS, settings);
    }

    private void reopen(Map<String, Object> settings) throws Exception {
        shard.close();
        shard = null;
        shard = open(settings);
    }

    private File valuesDir() {
        return new File(root, "values");
    }

    private byte[] objectRecord(long expireTime, Object value) {
        return Record.inline(Record.MODE_OBJECT, expireTime, null, serializer.serialize(value)).toBytes();
    }

    private int valueFileCount() {
        String[] names = valuesDir().list();
        return names == null ? 0 : names.length;
    }

    @Test
    void storesAndReadsObjects() {
        assertTrue(shard.set("k", Arrays.asList(1, 2, 3), null, false, null));
        assertEquals(Arrays.asList(1, 2, 3), shard.get("k", null, false, false, false));
        assertTrue(shard.contains("k"));
        assertEquals(1, shard.size());
    }

    @Test
    void setReplacesExistingValues() {
        shard.set("k", "old", null, false, "t1");
        shard.set("k", "new", null, false, null);
        assertEquals(Arrays.asList("new", null), shard.get("k", null, false, false, true));
        assertEquals(1, shard.size());
    }

    @Test
    void missingKeysReturnTheDefault() {
        assertSame(NoValue.INSTANCE, shard.get("nope", NoValue.INSTANCE, false, true, true));
        assertFalse(shard.contains("nope"));
    }

    @Test
    void addRespectsPresentButNotExpiredItems() throws Exception {
        assertTrue(shard.add("k", 1, null, false, null));
        assertFalse(shard.add("k", 2, null, false, null));
        assertEquals(1, shard.get("k", null, false, false, false));

        assertTrue(shard.add("short", 1, 1L, false, null));
        Thread.sleep(5);
        assertTrue(shard.add("short", 2, null, false, null));
        assertEquals(2, shard.get("short", null, false, false, false));
    }

    @Test
    void expiredItemsAreInvisible() throws Exception {
        shard.set("k", "v", 1L, false, null);
        Thread.sleep(5);
        assertNull(shard.get("k", null, false, false, false));
        assertFalse(shard.contains("k"));
        assertThrows(KeyNotFoundException.class, () -> shard.delete("k"));
    }

    @Test
    void metadataFollowsTheValue() {
        long before = System.currentTimeMillis();
        shard.set("k", "v", 60000L, false, "red");
        List<?> result = (List<?>) shard.get("k", null, false, true, true);
        assertEquals("v", result.get(0));
        long expireTime = (Long) result.get(1);
        assertTrue(expireTime >= before + 60000L && expireTime <= System.currentTimeMillis() + 60000L);
        assertEquals("red", result.get(2));

        shard.set("plain", "v", null, false, null);
        assertEquals(Arrays.asList("v", null), shard.get("plain", null, false, true, false));
    }

    @Test
    void deleteRemovesAndThenRaises() {
        shard.set("k", "v", null, false, null);
        shard.delete("k");
        assertFalse(shard.contains("k"));
        assertThrows(KeyNotFoundException.class, () -> shard.delete("k"));
    }

    @Test
    void bytesCanBeStreamedInAndOut() throws Exception {
        byte[] payload = new byte[]{5, 4, 3, 2, 1};
        shard.set("blob", new ByteArrayInputStream(payload), null, true, null);
        assertArrayEquals(payload, (byte[]) shard.get("blob", null, false, false, false));
        InputStream in = (InputStream) shard.get("blob", null, true, false, false);
        try {
            assertArrayEquals(payload, in.readAllBytes());
        } finally {
            in.close();
        }

        shard.set("object", "serialized", null, false, null);
        in = (InputStream) shard.get("object", null, true, false, false);
        try {
            assertEquals("serialized", serializer.deserialize(in.readAllBytes()));
        } finally {
            in.close();
        }
    }

    @Test
    void largeValuesLiveInFiles() throws Exception {
        reopen(Collections.<String, Object>singletonMap(JavaBerkDBShard.LARGE_VALUE_THRESHOLD, 16));
        byte[] big = new byte[64];
        Arrays.fill(big, (byte) 7);

        shard.set("big", big, null, false, null);
        assertEquals(1, valueFileCount());
        assertArrayEquals(big, (byte[]) shard.get("big", null, false, false, false));
        InputStream in = (InputStream) shard.get("big", null, true, false, false);
        try {
            assertArrayEquals(big, in.readAllBytes());
        } finally {
            in.close();
        }

        shard.set("big", "small", null, false, null);
        assertEquals(0, valueFileCount());

        shard.set("big", big, null, false, null);
        shard.delete("big");
        assertEquals(0, valueFileCount());
    }

    @Test
    void checkFindsAndFixesMissingAndUnreferencedFiles() throws Exception {
        reopen(Collections.<String, Object>singletonMap(JavaBerkDBShard.LARGE_VALUE_THRESHOLD, 16));
        shard.set("big", new byte[64], null, false, null);
        shard.set("small", "v", null, false, null);
        assertTrue(shard.check(false).isEmpty());

        File[] files = valuesDir().listFiles();
        assertEquals(1, files.length);
        assertTrue(files[0].delete());

        File orphan = new File(valuesDir(), "orphan.val");
        assertTrue(orphan.createNewFile());
        assertTrue(orphan.setLastModified(System.currentTimeMillis() - 60000L));

        assertEquals(2, shard.check(false).size());
        assertEquals(2, shard.check(true).size());
        assertTrue(shard.check(false).isEmpty());
        assertFalse(orphan.exists());
        assertNull(shard.get("big", null, false, false, false));
        assertEquals("v", shard.get("small", null, false, false, false));
    }

    @Test
    void sweepsWorkInBatches() throws Exception {
        reopen(Collections.<String, Object>singletonMap(JavaBerkDBShard.SWEEP_BATCH_SIZE, 3));
        for (int i = 0; i < 7; i++) {
            shard.set("k" + i, i, null, false, null);
        }
        assertEquals(3, shard.clear());
        assertEquals(3, shard.clear());
        assertEquals(1, shard.clear());
        assertEquals(0, shard.clear());
    }

    @Test
    void expireRemovesOnlyItemsDueByNow() {
        shard.set("soon", 1, 1000L, false, null);
        shard.set("later", 2, 100000L, false, null);
        shard.set("never", 3, null, false, null);
        long now = System.currentTimeMillis() + 5000L;

        assertEquals(1, shard.expire(now));
        assertEquals(0, shard.expire(now));
        assertEquals(2, shard.size());
    }

    @Test
    void evictWithAndWithoutTagIndex() {
        shard.set("a", 1, null, false, "red");
        shard.set("b", 2, null, false, "blue");
        assertEquals(1, shard.evict("red"));
        assertEquals(0, shard.evict("red"));

        shard.createTagIndex();
        assertEquals(Boolean.TRUE, shard.getSetting(JavaBerkDBShard.TAG_INDEX));
        shard.set("c", 3, null, false, "blue");
        shard.set("d", 4, null, false, "green");
        assertEquals(2, shard.evict("blue"));
        assertEquals(0, shard.evict("blue"));
        assertEquals(1, shard.size());

        shard.dropTagIndex();
        assertEquals(Boolean.FALSE, shard.getSetting(JavaBerkDBShard.TAG_INDEX));
        assertEquals(1, shard.evict("green"));
    }

    @Test
    void settingsPersistAndConstructorValuesWin() throws Exception {
        assertEquals(100, shard.getSetting(JavaBerkDBShard.SWEEP_BATCH_SIZE));
        assertEquals(25, shard.reset(JavaBerkDBShard.SWEEP_BATCH_SIZE, 25));
        assertEquals("custom", shard.reset("owner", "custom"));

        reopen(Collections.<String, Object>emptyMap());
        assertEquals(25, shard.getSetting(JavaBerkDBShard.SWEEP_BATCH_SIZE));
        assertEquals("custom", shard.reset("owner", NoValue.INSTANCE));

        reopen(Collections.<String, Object>singletonMap(JavaBerkDBShard.SWEEP_BATCH_SIZE, 7));
        assertEquals(7, shard.getSetting(JavaBerkDBShard.SWEEP_BATCH_SIZE));
        assertThrows(KeyNotFoundException.class, () -> shard.reset("unknown", NoValue.INSTANCE));
    }

    @Test
    void environmentParametersPassThrough() throws Exception {
        Map<String, Object> settings = new HashMap<String, Object>();
        settings.put("je." + EnvironmentConfig.CLEANER_MIN_UTILIZATION, "40");
        reopen(settings);
        assertNull(shard.getSetting("je." + EnvironmentConfig.CLEANER_MIN_UTILIZATION));
        assertTrue(shard.set("k", 1, null, false, null));
    }

    @Test
    void statsCountOnlyWhileEnabled() {
        shard.get("missing", null, false, false, false);
        assertEquals(CacheStats.EMPTY, shard.stats(true, false));

        shard.set("k", 1, null, false, null);
        shard.get("k", null, false, false, false);
        shard.get("missing", null, false, false, false);
        assertEquals(new CacheStats(1, 1), shard.stats(true, true));
        assertEquals(CacheStats.EMPTY, shard.stats(false, false));
        assertEquals(Boolean.FALSE, shard.getSetting(JavaBerkDBShard.STATISTICS));
    }

    @Test
    void volumeCountsTheShardDirectory() {
        shard.set("k", new byte[1000], null, false, null);
        assertTrue(shard.volume() > 0);
    }

    @Test
    void lockedRecordsTimeOutAndSweepsReportPartialProgress() throws Exception {
        for (String key : Arrays.asList("a", "b", "c")) {
            shard.set(key, key, null, false, null);
        }

        LockHolder holder = new LockHolder(root, TIMEOUT_MILLIS, "cache");
        try {
            holder.put(serializer.serialize("locked"), objectRecord(Record.NO_EXPIRY, "x"));

            assertThrows(ShardTimeoutException.class, () -> shard.get("locked", null, false, false, false));
            assertThrows(ShardTimeoutException.class, () -> shard.set("locked", "y", null, false, null));

            int removed;
            try {
                removed = shard.clear();
            } catch (ShardTimeoutException e) {
                removed = e.getCount();
            }
            int gone = 0;
            for (String key : Arrays.asList("a", "b", "c")) {
                if (shard.get(key, NoValue.INSTANCE, false, false, false) == NoValue.INSTANCE)
                    gone++;
            }
            assertEquals(gone, removed);
        } finally {
            holder.close();
        }

        int rest = shard.clear();
        assertEquals(0, shard.clear());
        assertEquals(0, shard.size());
        assertTrue(rest <= 3);
    }

    @Test
    void statsTimeoutKeepsTheCounts() throws Exception {
        shard.stats(true, false);
        shard.set("k", 1, null, false, null);
        shard.get("k", null, false, false, false);
        shard.get("missing", null, false, false, false);

        LockHolder holder = new LockHolder(root, TIMEOUT_MILLIS, "settings");
        try {
            holder.put(JavaBerkDBShard.STATISTICS, serializer.serialize(Boolean.TRUE));
            assertThrows(ShardTimeoutException.class, () -> shard.stats(false, true));
        } finally {
            holder.close();
        }
        assertEquals(new CacheStats(1, 1), shard.stats(false, true));
        assertEquals(CacheStats.EMPTY, shard.stats(false, false));
    }

    @Test
    void sweepMovesPastCandidatesThatStopMatching() throws Exception {
        shard.close();
        shard = null;
        shard = new JavaBerkDBShard(root, 5000, Collections.<String, Object>singletonMap(JavaBerkDBShard.SWEEP_BATCH_SIZE, 2));
        shard.set("k1", 1, null, false, null);
        shard.set("k2", 2, null, false, null);
        shard.set("z", 3, 1000L, false, null);

        final LockHolder holder = new LockHolder(root, 5000, "cache");
        try {
            // uncommitted updates that look expired to the sweep's scan, then roll back
            holder.put(serializer.serialize("k1"), objectRecord(1L, 1));
            holder.put(serializer.serialize("k2"), objectRecord(1L, 2));
            Thread releaser = new Thread(new Runnable() {
                public void run() {
                    try {
                        Thread.sleep(500);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    holder.release();
                }
            });
            releaser.start();
            assertEquals(1, shard.expire(System.currentTimeMillis() + 10000L));
            releaser.join();
        } finally {
            holder.close();
        }
        assertEquals(1, shard.get("k1", null, false, false, false));
        assertEquals(2, shard.get("k2", null, false, false, false));
        assertNull(shard.get("z", null, false, false, false));
    }

    @Test
    void longTagsAreStoredAndEvicted() {
        StringBuilder tag = new StringBuilder();
        for (int i = 0; i < 70000; i++) {
            tag.append((char) ('a' + i % 26));
        }
        assertTrue(shard.set("k", 1, null, false, tag.toString()));
        assertEquals(Arrays.asList(1, tag.toString()), shard.get("k", null, false, false, true));
        assertEquals(1, shard.evict(tag.toString()));
    }
}
