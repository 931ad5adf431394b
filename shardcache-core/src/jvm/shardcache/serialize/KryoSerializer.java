package shardcache.serialize;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import org.apache.log4j.Logger;
import org.objenesis.strategy.StdInstantiatorStrategy;

/**
 * Kryo-backed serializer. Kryo instances are not thread-safe, so each thread gets its own.
 *
 * The bytes produced for a key feed the shard routing hash, so the output for a given object must
 * not change between processes. Only Kryo's default registrations are used; unregistered classes
 * are written by name.
 */
public class KryoSerializer implements Serializer {
    public static final Logger LOG = Logger.getLogger(KryoSerializer.class);

    private static final int INITIAL_BUFFER_SIZE = 256;

    private static final ThreadLocal<Kryo> kryo = new ThreadLocal<Kryo>();

    public KryoSerializer() {
    }

    private Kryo freshKryo() {
        Kryo k = new Kryo();
        k.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));
        k.setRegistrationRequired(false);
        k.setReferences(false);
        return k;
    }

    public Kryo getKryo() {
        if (kryo.get() == null)
            kryo.set(freshKryo());

        return kryo.get();
    }

    public byte[] serialize(Object o) {
        Output ko = new Output(INITIAL_BUFFER_SIZE, -1);
        getKryo().writeClassAndObject(ko, o);
        return ko.toBytes();
    }

    public Object deserialize(byte[] bytes) {
        return getKryo().readClassAndObject(new Input(bytes));
    }
}
