package shardcache.persistence;

import com.sleepycat.je.Cursor;
import com.sleepycat.je.CursorConfig;
import com.sleepycat.je.Database;
import com.sleepycat.je.DatabaseConfig;
import com.sleepycat.je.DatabaseEntry;
import com.sleepycat.je.Durability;
import com.sleepycat.je.Environment;
import com.sleepycat.je.EnvironmentConfig;
import com.sleepycat.je.LockConflictException;
import com.sleepycat.je.LockMode;
import com.sleepycat.je.OperationStatus;
import com.sleepycat.je.SecondaryConfig;
import com.sleepycat.je.SecondaryCursor;
import com.sleepycat.je.SecondaryDatabase;
import com.sleepycat.je.SecondaryKeyCreator;
import com.sleepycat.je.Transaction;
import shardcache.NoValue;
import shardcache.serialize.KryoSerializer;
import shardcache.serialize.Serializer;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A shard kept in one transactional JE environment.
 *
 * Items live in the "cache" database, keyed by their serialized key. Settings live in the
 * "settings" database. Values at or above the large_value_threshold setting are written to files
 * under values/ and the record keeps only the file name. With the tag_index setting on, a
 * secondary database maps tags to keys.
 *
 * Every lock wait is bounded by the timeout given at open; a lock conflict aborts the transaction
 * and surfaces as a ShardTimeoutException.
 */
public class JavaBerkDBShard implements Shard {
    public static final Logger LOG = Logger.getLogger(JavaBerkDBShard.class);

    public static final String STATISTICS = "statistics";
    public static final String TAG_INDEX = "tag_index";
    public static final String SWEEP_BATCH_SIZE = "sweep_batch_size";
    public static final String LARGE_VALUE_THRESHOLD = "large_value_threshold";

    /** Settings with this prefix go to EnvironmentConfig.setConfigParam, minus the prefix. */
    public static final String JE_PARAM_PREFIX = "je.";

    public static final Map<String, Object> DEFAULT_SETTINGS;

    static {
        Map<String, Object> defaults = new HashMap<String, Object>();
        defaults.put(STATISTICS, Boolean.FALSE);
        defaults.put(TAG_INDEX, Boolean.FALSE);
        defaults.put(SWEEP_BATCH_SIZE, 100);
        defaults.put(LARGE_VALUE_THRESHOLD, 1 << 15);
        DEFAULT_SETTINGS = Collections.unmodifiableMap(defaults);
    }

    private static final String DATABASE_NAME = "cache";
    private static final String SETTINGS_DATABASE_NAME = "settings";
    private static final String TAG_INDEX_NAME = "tag_index";
    private static final String VALUES_DIR = "values";
    private static final String VALUE_FILE_SUFFIX = ".val";

    /** Value files younger than this, beyond the lock timeout, may belong to a write in flight. */
    private static final long UNREFERENCED_FILE_GRACE_MILLIS = 1000;

    private static final Object MISSING = new Object();

    private final String root;
    private final File valuesDir;
    private final long timeoutMillis;
    private final Serializer serializer = new KryoSerializer();
    private final Map<String, Object> settings = new ConcurrentHashMap<String, Object>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private final Environment env;
    private final Database db;
    private final Database settingsDb;
    private volatile SecondaryDatabase tagIndex;
    private volatile boolean statsEnabled;

    public JavaBerkDBShard(String root, long timeoutMillis, Map<String, Object> options) throws IOException {
        this.root = root;
        this.timeoutMillis = timeoutMillis;
        this.valuesDir = new File(root, VALUES_DIR);
        if (!valuesDir.isDirectory() && !valuesDir.mkdirs()) {
            throw new IOException("Could not create shard directory " + valuesDir);
        }

        EnvironmentConfig envConf = new EnvironmentConfig();
        envConf.setAllowCreate(true);
        envConf.setTransactional(true);
        envConf.setSharedCache(true);
        envConf.setLockTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
        envConf.setDurability(Durability.COMMIT_NO_SYNC);

        Map<String, Object> cacheSettings = new HashMap<String, Object>();
        for (Map.Entry<String, Object> option : options.entrySet()) {
            if (option.getKey().startsWith(JE_PARAM_PREFIX)) {
                envConf.setConfigParam(option.getKey().substring(JE_PARAM_PREFIX.length()),
                        String.valueOf(option.getValue()));
            } else {
                cacheSettings.put(option.getKey(), option.getValue());
            }
        }

        LOG.info("Opening shard at " + root);
        env = new Environment(new File(root), envConf);

        DatabaseConfig dbConf = new DatabaseConfig();
        dbConf.setAllowCreate(true);
        dbConf.setTransactional(true);
        db = env.openDatabase(null, DATABASE_NAME, dbConf);
        settingsDb = env.openDatabase(null, SETTINGS_DATABASE_NAME, dbConf);

        loadSettings(cacheSettings);
        statsEnabled = (Boolean) settings.get(STATISTICS);
        if ((Boolean) settings.get(TAG_INDEX)) {
            openTagIndex();
        } else {
            removeTagIndex();
        }
    }

    public String getRoot() {
        return root;
    }

    /*
    Settings: stored values win over defaults, values passed at open win over stored values.
     */

    private void loadSettings(Map<String, Object> supplied) {
        settings.putAll(DEFAULT_SETTINGS);

        Cursor cursor = settingsDb.openCursor(null, CursorConfig.READ_COMMITTED);
        try {
            DatabaseEntry key = new DatabaseEntry();
            DatabaseEntry val = new DatabaseEntry();
            while (cursor.getNext(key, val, LockMode.DEFAULT) == OperationStatus.SUCCESS) {
                settings.put(new String(key.getData(), StandardCharsets.UTF_8), serializer.deserialize(val.getData()));
            }
        } finally {
            cursor.close();
        }

        settings.putAll(supplied);
        for (Map.Entry<String, Object> setting : settings.entrySet()) {
            writeSetting(setting.getKey(), setting.getValue());
        }
    }

    private void writeSetting(String key, Object value) {
        if (value == null)
            throw new IllegalArgumentException("Setting " + key + " must not be null");

        Transaction txn = env.beginTransaction(null, null);
        boolean committed = false;
        try {
            settingsDb.put(txn, settingKey(key), new DatabaseEntry(serializer.serialize(value)));
            txn.commit();
            committed = true;
        } catch (LockConflictException e) {
            throw new ShardTimeoutException(0, e);
        } finally {
            if (!committed)
                txn.abort();
        }
        settings.put(key, value);
    }

    private Object readSetting(String key) {
        DatabaseEntry val = new DatabaseEntry();
        OperationStatus status;
        try {
            status = settingsDb.get(null, settingKey(key), val, LockMode.DEFAULT);
        } catch (LockConflictException e) {
            throw new ShardTimeoutException(0, e);
        }
        if (status != OperationStatus.SUCCESS)
            throw new KeyNotFoundException(key);
        Object value = serializer.deserialize(val.getData());
        settings.put(key, value);
        return value;
    }

    private static DatabaseEntry settingKey(String key) {
        return new DatabaseEntry(key.getBytes(StandardCharsets.UTF_8));
    }

    private void applySetting(String key, Object value) {
        if (STATISTICS.equals(key)) {
            statsEnabled = (Boolean) value;
        } else if (TAG_INDEX.equals(key)) {
            if ((Boolean) value) {
                openTagIndex();
            } else {
                removeTagIndex();
            }
        }
    }

    private int intSetting(String key) {
        return ((Number) settings.get(key)).intValue();
    }

    public Object reset(String key, Object value) {
        Object current;
        if (NoValue.isNoValue(value)) {
            current = readSetting(key);
        } else {
            writeSetting(key, value);
            current = value;
        }
        applySetting(key, current);
        return current;
    }

    public Object getSetting(String key) {
        return settings.get(key);
    }

    /*
    Tag index
     */

    private static class TagKeyCreator implements SecondaryKeyCreator {
        public boolean createSecondaryKey(SecondaryDatabase secondary, DatabaseEntry key,
                                          DatabaseEntry data, DatabaseEntry result) {
            String tag = Record.fromBytes(data.getData()).getTag();
            if (tag == null)
                return false;
            result.setData(tag.getBytes(StandardCharsets.UTF_8));
            return true;
        }
    }

    private synchronized void openTagIndex() {
        if (tagIndex != null)
            return;

        SecondaryConfig secConf = new SecondaryConfig();
        secConf.setAllowCreate(true);
        secConf.setTransactional(true);
        secConf.setSortedDuplicates(true);
        secConf.setAllowPopulate(true);
        secConf.setKeyCreator(new TagKeyCreator());
        tagIndex = env.openSecondaryDatabase(null, TAG_INDEX_NAME, db, secConf);
        LOG.info("Opened tag index at " + root);
    }

    private synchronized void removeTagIndex() {
        if (tagIndex != null) {
            tagIndex.close();
            tagIndex = null;
        }
        if (env.getDatabaseNames().contains(TAG_INDEX_NAME)) {
            env.removeDatabase(null, TAG_INDEX_NAME);
            LOG.info("Removed tag index at " + root);
        }
    }

    public void createTagIndex() {
        try {
            openTagIndex();
        } catch (LockConflictException e) {
            throw new ShardTimeoutException(0, e);
        }
        writeSetting(TAG_INDEX, Boolean.TRUE);
    }

    public void dropTagIndex() {
        try {
            removeTagIndex();
        } catch (LockConflictException e) {
            throw new ShardTimeoutException(0, e);
        }
        writeSetting(TAG_INDEX, Boolean.FALSE);
    }

    /*
    Single key operations
     */

    private DatabaseEntry keyEntry(Object key) {
        return new DatabaseEntry(serializer.serialize(key));
    }

    /** Builds the record for value, writing the value file first if it is large. */
    private Record prepare(Object value, Long expireMillis, boolean read, String tag) {
        byte[] bytes;
        byte mode;
        try {
            if (read) {
                bytes = IOUtils.toByteArray((InputStream) value);
                mode = Record.MODE_RAW;
            } else if (value instanceof byte[]) {
                bytes = (byte[]) value;
                mode = Record.MODE_RAW;
            } else {
                bytes = serializer.serialize(value);
                mode = Record.MODE_OBJECT;
            }

            long expireTime = expireMillis == null ? Record.NO_EXPIRY : System.currentTimeMillis() + expireMillis;
            if (bytes.length >= intSetting(LARGE_VALUE_THRESHOLD)) {
                String filename = UUID.randomUUID().toString() + VALUE_FILE_SUFFIX;
                FileUtils.writeByteArrayToFile(new File(valuesDir, filename), bytes);
                return Record.inFile(mode, expireTime, tag, filename);
            }
            return Record.inline(mode, expireTime, tag, bytes);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private void removeValueFile(String filename) {
        if (filename != null && !FileUtils.deleteQuietly(new File(valuesDir, filename))) {
            LOG.warn("Could not delete value file " + filename + " in " + valuesDir + ", check() will report it");
        }
    }

    public boolean set(Object key, Object value, Long expireMillis, boolean read, String tag) {
        Record record = prepare(value, expireMillis, read, tag);
        DatabaseEntry k = keyEntry(key);
        String replacedFile = null;

        Transaction txn = env.beginTransaction(null, null);
        boolean committed = false;
        try {
            DatabaseEntry old = new DatabaseEntry();
            if (db.get(txn, k, old, LockMode.RMW) == OperationStatus.SUCCESS) {
                replacedFile = Record.fromBytes(old.getData()).getFilename();
            }
            db.put(txn, k, new DatabaseEntry(record.toBytes()));
            txn.commit();
            committed = true;
        } catch (LockConflictException e) {
            throw new ShardTimeoutException(0, e);
        } finally {
            if (!committed) {
                txn.abort();
                removeValueFile(record.getFilename());
            }
        }
        removeValueFile(replacedFile);
        return true;
    }

    public boolean add(Object key, Object value, Long expireMillis, boolean read, String tag) {
        Record record = prepare(value, expireMillis, read, tag);
        DatabaseEntry k = keyEntry(key);
        DatabaseEntry data = new DatabaseEntry(record.toBytes());
        String replacedFile = null;
        boolean added = false;

        Transaction txn = env.beginTransaction(null, null);
        boolean committed = false;
        try {
            if (db.putNoOverwrite(txn, k, data) == OperationStatus.SUCCESS) {
                added = true;
            } else {
                // an expired item does not count as present
                DatabaseEntry old = new DatabaseEntry();
                OperationStatus status = db.get(txn, k, old, LockMode.RMW);
                Record existing = status == OperationStatus.SUCCESS ? Record.fromBytes(old.getData()) : null;
                if (existing == null || existing.isExpired(System.currentTimeMillis())) {
                    db.put(txn, k, data);
                    replacedFile = existing == null ? null : existing.getFilename();
                    added = true;
                }
            }
            txn.commit();
            committed = true;
        } catch (LockConflictException e) {
            throw new ShardTimeoutException(0, e);
        } finally {
            if (!committed)
                txn.abort();
            if (!committed || !added)
                removeValueFile(record.getFilename());
        }
        removeValueFile(replacedFile);
        return added;
    }

    private Record lookup(Object key) {
        DatabaseEntry data = new DatabaseEntry();
        OperationStatus status;
        try {
            status = db.get(null, keyEntry(key), data, LockMode.DEFAULT);
        } catch (LockConflictException e) {
            throw new ShardTimeoutException(0, e);
        }
        if (status != OperationStatus.SUCCESS)
            return null;
        Record record = Record.fromBytes(data.getData());
        return record.isExpired(System.currentTimeMillis()) ? null : record;
    }

    private byte[] valueBytes(Record record) throws IOException {
        if (!record.isInFile())
            return record.getData();
        File file = new File(valuesDir, record.getFilename());
        if (!file.isFile())
            return null;
        return FileUtils.readFileToByteArray(file);
    }

    private Object materialize(Record record) {
        try {
            byte[] bytes = valueBytes(record);
            if (bytes == null)
                return MISSING;
            return record.getMode() == Record.MODE_RAW ? bytes : serializer.deserialize(bytes);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    /** Objects stream their serialized bytes. */
    private Object openStream(Record record) {
        if (!record.isInFile())
            return new ByteArrayInputStream(record.getData());
        try {
            return new FileInputStream(new File(valuesDir, record.getFilename()));
        } catch (FileNotFoundException e) {
            return MISSING;
        }
    }

    public Object get(Object key, Object defaultValue, boolean read, boolean expireTime, boolean tag) {
        Record record = lookup(key);
        Object value = record == null ? MISSING : (read ? openStream(record) : materialize(record));
        if (value == MISSING) {
            if (statsEnabled)
                misses.incrementAndGet();
            return defaultValue;
        }
        if (statsEnabled)
            hits.incrementAndGet();

        if (!expireTime && !tag)
            return value;

        List<Object> result = new ArrayList<Object>(3);
        result.add(value);
        if (expireTime)
            result.add(record.hasExpiry() ? Long.valueOf(record.getExpireTime()) : null);
        if (tag)
            result.add(record.getTag());
        return Collections.unmodifiableList(result);
    }

    public boolean contains(Object key) {
        return lookup(key) != null;
    }

    public void delete(Object key) {
        DatabaseEntry k = keyEntry(key);
        String removedFile;

        Transaction txn = env.beginTransaction(null, null);
        boolean committed = false;
        try {
            DatabaseEntry old = new DatabaseEntry();
            if (db.get(txn, k, old, LockMode.RMW) != OperationStatus.SUCCESS)
                throw new KeyNotFoundException(key);
            Record record = Record.fromBytes(old.getData());
            if (record.isExpired(System.currentTimeMillis()))
                throw new KeyNotFoundException(key);
            db.delete(txn, k);
            removedFile = record.getFilename();
            txn.commit();
            committed = true;
        } catch (LockConflictException e) {
            throw new ShardTimeoutException(0, e);
        } finally {
            if (!committed)
                txn.abort();
        }
        removeValueFile(removedFile);
    }

    /*
    Sweeps. A call collects up to one batch of candidate keys without locking, then removes each one
    in its own transaction after checking it still matches. A timeout reports the removals already
    committed by this call.
     */

    private abstract static class RecordFilter {
        abstract boolean matches(Record record);
    }

    /** Collects up to limit matching keys that sort after the given key, or from the start if it is null. */
    private List<byte[]> scan(RecordFilter filter, int limit, byte[] after) {
        List<byte[]> keys = new ArrayList<byte[]>();
        Cursor cursor = db.openCursor(null, CursorConfig.READ_UNCOMMITTED);
        try {
            DatabaseEntry key = new DatabaseEntry();
            DatabaseEntry val = new DatabaseEntry();
            OperationStatus status;
            if (after == null) {
                status = cursor.getFirst(key, val, LockMode.READ_UNCOMMITTED);
            } else {
                key.setData(after);
                status = cursor.getSearchKeyRange(key, val, LockMode.READ_UNCOMMITTED);
                if (status == OperationStatus.SUCCESS && Arrays.equals(after, key.getData()))
                    status = cursor.getNext(key, val, LockMode.READ_UNCOMMITTED);
            }
            while (status == OperationStatus.SUCCESS && keys.size() < limit) {
                if (filter.matches(Record.fromBytes(val.getData())))
                    keys.add(key.getData());
                status = cursor.getNext(key, val, LockMode.READ_UNCOMMITTED);
            }
        } finally {
            cursor.close();
        }
        return keys;
    }

    private List<byte[]> scanTag(SecondaryDatabase index, String tag, int limit) {
        List<byte[]> keys = new ArrayList<byte[]>();
        SecondaryCursor cursor = index.openCursor(null, CursorConfig.READ_UNCOMMITTED);
        try {
            DatabaseEntry tagKey = new DatabaseEntry(tag.getBytes(StandardCharsets.UTF_8));
            DatabaseEntry pKey = new DatabaseEntry();
            DatabaseEntry val = new DatabaseEntry();
            OperationStatus status = cursor.getSearchKey(tagKey, pKey, val, LockMode.READ_UNCOMMITTED);
            while (status == OperationStatus.SUCCESS && keys.size() < limit) {
                keys.add(pKey.getData());
                status = cursor.getNextDup(tagKey, pKey, val, LockMode.READ_UNCOMMITTED);
            }
        } finally {
            cursor.close();
        }
        return keys;
    }

    private int removeMatching(List<byte[]> keys, RecordFilter filter) {
        int count = 0;
        for (byte[] key : keys) {
            DatabaseEntry k = new DatabaseEntry(key);
            String removedFile = null;
            boolean removed = false;

            Transaction txn = env.beginTransaction(null, null);
            boolean committed = false;
            try {
                DatabaseEntry val = new DatabaseEntry();
                if (db.get(txn, k, val, LockMode.RMW) == OperationStatus.SUCCESS) {
                    Record record = Record.fromBytes(val.getData());
                    if (filter.matches(record)) {
                        db.delete(txn, k);
                        removedFile = record.getFilename();
                        removed = true;
                    }
                }
                txn.commit();
                committed = true;
            } catch (LockConflictException e) {
                throw new ShardTimeoutException(count, e);
            } finally {
                if (!committed)
                    txn.abort();
            }

            if (removed) {
                count++;
                removeValueFile(removedFile);
            }
        }
        return count;
    }

    /**
     * Candidates come from an uncommitted read and may no longer match once locked. A batch that
     * removes nothing moves on to the next one, so zero is only returned once the scan is exhausted.
     */
    private int sweep(RecordFilter filter) {
        int limit = intSetting(SWEEP_BATCH_SIZE);
        byte[] after = null;
        try {
            while (true) {
                List<byte[]> keys = scan(filter, limit, after);
                int removed = removeMatching(keys, filter);
                if (removed > 0 || keys.size() < limit)
                    return removed;
                after = keys.get(keys.size() - 1);
            }
        } catch (LockConflictException e) {
            throw new ShardTimeoutException(0, e);
        }
    }

    public int expire(final long now) {
        return sweep(new RecordFilter() {
            boolean matches(Record record) {
                return record.isExpired(now);
            }
        });
    }

    public int evict(final String tag) {
        RecordFilter filter = new RecordFilter() {
            boolean matches(Record record) {
                return tag.equals(record.getTag());
            }
        };
        SecondaryDatabase index = tagIndex;
        if (index == null)
            return sweep(filter);
        int limit = intSetting(SWEEP_BATCH_SIZE);
        List<byte[]> keys;
        int removed;
        try {
            keys = scanTag(index, tag, limit);
            removed = removeMatching(keys, filter);
        } catch (LockConflictException e) {
            throw new ShardTimeoutException(0, e);
        }
        // a full batch of stale index entries, fall back to scanning the records
        if (removed == 0 && keys.size() == limit)
            return sweep(filter);
        return removed;
    }

    public int clear() {
        return sweep(new RecordFilter() {
            boolean matches(Record record) {
                return true;
            }
        });
    }

    /*
    Whole shard
     */

    /**
     * Write-locks every record while it compares records against value files: records whose file is
     * gone, and files no record points to. Cost grows with the number of value files.
     */
    public List<String> check(boolean fix) {
        List<String> warnings = new ArrayList<String>();
        Set<String> referenced = new HashSet<String>();
        long started = System.currentTimeMillis();

        Transaction txn = env.beginTransaction(null, null);
        boolean committed = false;
        try {
            Cursor cursor = db.openCursor(txn, null);
            try {
                DatabaseEntry key = new DatabaseEntry();
                DatabaseEntry val = new DatabaseEntry();
                while (cursor.getNext(key, val, LockMode.RMW) == OperationStatus.SUCCESS) {
                    Record record = Record.fromBytes(val.getData());
                    if (!record.isInFile())
                        continue;
                    File file = new File(valuesDir, record.getFilename());
                    if (file.isFile()) {
                        referenced.add(record.getFilename());
                    } else {
                        warnings.add("Missing value file " + file.getPath() + " for a record in " + root);
                        if (fix)
                            cursor.delete();
                    }
                }
            } finally {
                cursor.close();
            }

            File[] files = valuesDir.listFiles();
            if (files != null) {
                for (File file : files) {
                    if (referenced.contains(file.getName())
                            || file.lastModified() > started - timeoutMillis - UNREFERENCED_FILE_GRACE_MILLIS)
                        continue;
                    warnings.add("Unreferenced value file " + file.getPath());
                    if (fix)
                        FileUtils.deleteQuietly(file);
                }
            }

            txn.commit();
            committed = true;
        } catch (LockConflictException e) {
            throw new ShardTimeoutException(0, e);
        } finally {
            if (!committed)
                txn.abort();
        }
        return warnings;
    }

    public CacheStats stats(boolean enable, boolean reset) {
        if (enable != statsEnabled) {
            writeSetting(STATISTICS, enable);
            statsEnabled = enable;
        }
        if (reset)
            return new CacheStats(hits.getAndSet(0), misses.getAndSet(0));
        return new CacheStats(hits.get(), misses.get());
    }

    public long volume() {
        return FileUtils.sizeOfDirectory(new File(root));
    }

    public long size() {
        return db.count();
    }

    public void close() throws IOException {
        LOG.info("Syncing environment at " + env.getHome().getPath());
        env.sync();
        LOG.info("Done syncing environment at " + env.getHome().getPath());

        synchronized (this) {
            if (tagIndex != null) {
                tagIndex.close();
                tagIndex = null;
            }
        }
        settingsDb.close();
        db.close();
        env.close();
    }
}
