package shardcache;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;

public class Utils {

    public static byte[] md5Hash(byte[] key) {
        try {
            return MessageDigest.getInstance("MD5").digest(key);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    /** Resolves the supplied string into its class. Throws a runtime exception on failure. */
    public static Class classForName(String name) {
        try {
            return Class.forName(name);
        } catch (ClassNotFoundException ex) {
            throw new RuntimeException(ex);
        }
    }

    /** generates a new instance of the supplied class. */
    public static Object newInstance(Class klass) {
        try {
            return klass.getDeclaredConstructor().newInstance();
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Accepts a byte array key and a total number of shards and returns the appropriate shard for
     * the supplied key. The md5 digest is read as a signed big-endian integer; BigInteger.mod never
     * returns a negative result, so the index always lies in [0, numShards).
     */
    public static int keyShard(byte[] key, int numShards) {
        BigInteger hash = new BigInteger(md5Hash(key));
        return hash.mod(BigInteger.valueOf(numShards)).intValue();
    }

    public static void writeByteArray(DataOutput out, byte[] arr) throws IOException {
        out.writeInt(arr.length);
        out.write(arr);
    }

    public static byte[] readByteArray(DataInput in) throws IOException {
        int length = in.readInt();
        byte[] ret = new byte[length];
        in.readFully(ret);
        return ret;
    }

    public static Object get(Map m, Object key, Object defaultVal) {
        return (!m.containsKey(key)) ? defaultVal : m.get(key);
    }

    public static String shardDirName(int shardIdx) {
        return String.format("%03d", shardIdx);
    }
}
