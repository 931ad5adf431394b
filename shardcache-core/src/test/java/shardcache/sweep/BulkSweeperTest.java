package shardcache.sweep;

import shardcache.persistence.MemoryShard;
import shardcache.persistence.Shard;
import shardcache.persistence.ShardTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BulkSweeperTest {

    private MemoryShard first;
    private MemoryShard second;
    private List<Shard> shards;

    @BeforeEach
    void setUp() {
        first = new MemoryShard("000", 2, Collections.<String, Object>emptyMap());
        second = new MemoryShard("001", 2, Collections.<String, Object>emptyMap());
        shards = Arrays.<Shard>asList(first, second);
    }

    private static void fill(MemoryShard shard, String prefix, int n, String tag) {
        for (int i = 0; i < n; i++) {
            shard.set(prefix + i, i, null, false, tag);
        }
    }

    @Test
    void countsEveryBatchOfEveryShard() {
        fill(first, "a", 5, null);
        fill(second, "b", 3, null);
        assertEquals(8, new BulkSweeper().sweep(shards, Sweep.clear()));
        assertEquals(0, first.size());
        assertEquals(0, second.size());
    }

    @Test
    void timeoutAfterPartialProgressCountsExactlyThatProgress() {
        fill(first, "a", 3, null);
        first.failNextSweepAfter(3);
        assertEquals(3, new BulkSweeper().sweep(Collections.<Shard>singletonList(first), Sweep.clear()));
    }

    @Test
    void repeatedTimeoutsNeverLoseOrDoubleCountItems() {
        fill(first, "a", 7, null);
        fill(second, "b", 4, null);
        first.failNextSweepAfter(1);
        second.timeoutNext(3);
        assertEquals(11, new BulkSweeper().sweep(shards, Sweep.clear()));
    }

    @Test
    void timeoutWithoutProgressAddsNothing() {
        fill(second, "b", 2, null);
        second.failNextSweepAfter(0);
        assertEquals(2, new BulkSweeper().sweep(shards, Sweep.clear()));
    }

    @Test
    void evictOnlyRemovesTheTag() {
        fill(first, "a", 3, "red");
        fill(first, "c", 2, "blue");
        fill(second, "b", 4, "red");
        assertEquals(7, new BulkSweeper().sweep(shards, Sweep.evict("red")));
        assertEquals(2, first.size());
        assertEquals(0, second.size());
    }

    @Test
    void shardsAreSweptInIndexOrder() {
        fill(first, "a", 1, null);
        fill(second, "b", 1, null);
        final List<Shard> visited = new ArrayList<Shard>();
        Sweep recording = new Sweep("recording") {
            public int apply(Shard shard) {
                visited.add(shard);
                return shard.clear();
            }
        };
        new BulkSweeper().sweep(shards, recording);
        assertEquals(Arrays.<Shard>asList(first, first, second, second), visited);
    }

    @Test
    void expirePassesTheSameTimeToEveryShard() {
        new BulkSweeper().sweep(shards, Sweep.expire(1234L));
        assertEquals(Collections.singletonList(1234L), first.getExpireCalls());
        assertEquals(Collections.singletonList(1234L), second.getExpireCalls());
    }

    @Test
    void otherFailuresStopTheSweep() {
        Shard broken = new MemoryShard("002", 2, Collections.<String, Object>emptyMap()) {
            @Override public synchronized int clear() {
                throw new IllegalStateException("disk gone");
            }
        };
        assertThrows(IllegalStateException.class,
                () -> new BulkSweeper().sweep(Collections.singletonList(broken), Sweep.clear()));
    }

    @Test
    void timeoutExceptionCarriesItsCount() {
        assertEquals(4, new ShardTimeoutException(4).getCount());
        assertEquals(0, new ShardTimeoutException().getCount());
    }
}
