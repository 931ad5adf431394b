package shardcache.persistence;

import shardcache.Utils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * The stored form of one cache item: how its value was written, when it expires, its tag, and
 * either the value bytes or the name of the file that holds them.
 */
public class Record {
    public static final long NO_EXPIRY = -1;

    /** Value bytes are the caller's raw bytes. */
    public static final byte MODE_RAW = 1;
    /** Value bytes are a serialized object. */
    public static final byte MODE_OBJECT = 2;

    private static final byte FORMAT_VERSION = 1;

    private final byte mode;
    private final long expireTime;
    private final String tag;
    private final String filename;
    private final byte[] data;

    private Record(byte mode, long expireTime, String tag, String filename, byte[] data) {
        this.mode = mode;
        this.expireTime = expireTime;
        this.tag = tag;
        this.filename = filename;
        this.data = data;
    }

    public static Record inline(byte mode, long expireTime, String tag, byte[] data) {
        return new Record(mode, expireTime, tag, null, data);
    }

    public static Record inFile(byte mode, long expireTime, String tag, String filename) {
        return new Record(mode, expireTime, tag, filename, null);
    }

    public byte getMode() {
        return mode;
    }

    public long getExpireTime() {
        return expireTime;
    }

    public boolean hasExpiry() {
        return expireTime != NO_EXPIRY;
    }

    /** Expired items are invisible to reads from their expire time on. */
    public boolean isExpired(long now) {
        return hasExpiry() && expireTime <= now;
    }

    public String getTag() {
        return tag;
    }

    public boolean isInFile() {
        return filename != null;
    }

    /** Name of the value file, relative to the shard's value directory; null for inline values. */
    public String getFilename() {
        return filename;
    }

    public byte[] getData() {
        return data;
    }

    public void write(DataOutput d) throws IOException {
        d.writeByte(FORMAT_VERSION);
        d.writeByte(mode);
        d.writeLong(expireTime);
        d.writeBoolean(tag != null);
        if (tag != null)
            Utils.writeByteArray(d, tag.getBytes(StandardCharsets.UTF_8));
        d.writeBoolean(filename != null);
        if (filename != null) {
            d.writeUTF(filename);
        } else {
            Utils.writeByteArray(d, data);
        }
    }

    public static Record read(DataInput di) throws IOException {
        byte version = di.readByte();
        if (version != FORMAT_VERSION)
            throw new IOException("Unknown record format " + version);
        byte mode = di.readByte();
        long expireTime = di.readLong();
        String tag = di.readBoolean() ? new String(Utils.readByteArray(di), StandardCharsets.UTF_8) : null;
        if (di.readBoolean()) {
            return inFile(mode, expireTime, tag, di.readUTF());
        }
        return inline(mode, expireTime, tag, Utils.readByteArray(di));
    }

    public byte[] toBytes() {
        try {
            ByteArrayOutputStream bos = new ByteArrayOutputStream();
            DataOutputStream dos = new DataOutputStream(bos);
            write(dos);
            dos.close();
            return bos.toByteArray();
        } catch (IOException ioe) {
            throw new RuntimeException(ioe);
        }
    }

    public static Record fromBytes(byte[] bytes) {
        try {
            return read(new DataInputStream(new ByteArrayInputStream(bytes)));
        } catch (IOException ioe) {
            throw new RuntimeException(ioe);
        }
    }
}
