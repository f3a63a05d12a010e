package outreach.store;

import org.junit.jupiter.api.Test;
import outreach.spi.StoreException;
import outreach.stub.MutableClock;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryKeyValueStoreTest {

    private final MutableClock clock = MutableClock.atEpochSecond(1_000);
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);

    // ── Hashes ──────────────────────────────────────────────────────

    @Test
    void hashPutIfAbsentKeepsFirstValue() {
        assertTrue(store.hashPutIfAbsent("h", "f", "1"));
        assertFalse(store.hashPutIfAbsent("h", "f", "2"));
        assertEquals("1", store.hashGet("h", "f"));
    }

    @Test
    void hashIncrementStartsFromZero() {
        assertEquals(1, store.hashIncrement("h", "n", 1));
        assertEquals(3, store.hashIncrement("h", "n", 2));
    }

    @Test
    void hashIncrementOnTextFails() {
        store.hashPut("h", "n", "abc");
        StoreException e = assertThrows(StoreException.class, () -> store.hashIncrement("h", "n", 1));
        assertEquals(StoreException.Kind.WRONG_TYPE, e.kind());
    }

    @Test
    void deletingLastFieldRemovesKey() {
        store.hashPut("h", "f", "v");
        store.hashDelete("h", "f");
        assertEquals(Map.of(), store.hashGetAll("h"));
        store.listPush("h", "now-a-list");
        assertEquals(1, store.listSize("h"));
    }

    @Test
    void wrongTypeIsRejected() {
        store.setAdd("k", "m");
        StoreException e = assertThrows(StoreException.class, () -> store.hashGet("k", "f"));
        assertEquals(StoreException.Kind.WRONG_TYPE, e.kind());
        assertFalse(e.isTransient());
    }

    // ── Sets ────────────────────────────────────────────────────────

    @Test
    void setSampleIsBounded() {
        for (int i = 0; i < 10; i++) {
            store.setAdd("s", "m" + i);
        }
        Set<String> sample = store.setSample("s", 4);
        assertEquals(4, sample.size());
        assertEquals(10, store.setSize("s"));
        assertEquals(10, store.setSample("s", 50).size());
    }

    // ── Sorted sets ─────────────────────────────────────────────────

    @Test
    void rangeByScoreIsOrderedAndLimited() {
        store.sortedSetAdd("z", "c", 30);
        store.sortedSetAdd("z", "a", 10);
        store.sortedSetAdd("z", "b", 20);
        store.sortedSetAdd("z", "late", 99);

        assertEquals(List.of("a", "b"), store.sortedSetRangeByScore("z", Double.NEGATIVE_INFINITY, 30, 2));
        assertEquals(List.of("a", "b", "c"), store.sortedSetRangeByScore("z", 0, 30, 10));
    }

    @Test
    void sortedSetAddOverwritesScore() {
        store.sortedSetAdd("z", "a", 10);
        store.sortedSetAdd("z", "a", 50);
        assertEquals(50.0, store.sortedSetScore("z", "a"));
        assertEquals(1, store.sortedSetSize("z"));
    }

    // ── Lists ───────────────────────────────────────────────────────

    @Test
    void listMoveTakesHeadAndAppendsToTail() {
        store.listPush("src", "1");
        store.listPush("src", "2");
        store.listPush("dst", "0");

        assertEquals("1", store.listMove("src", "dst"));
        assertEquals(List.of("0", "1"), store.listRange("dst", 0, -1));
        assertEquals(List.of("2"), store.listRange("src", 0, -1));
    }

    @Test
    void moveToHeadPreservesSourceOrderInFrontOfDestination() {
        store.listPush("src", "1");
        store.listPush("src", "2");
        store.listPush("dst", "3");

        assertEquals("2", store.listMoveToHead("src", "dst"));
        assertEquals("1", store.listMoveToHead("src", "dst"));
        assertNull(store.listMoveToHead("src", "dst"));
        assertEquals(List.of("1", "2", "3"), store.listRange("dst", 0, -1));
        assertEquals(0, store.listSize("src"));
    }

    @Test
    void blockingMoveTimesOutOnEmptyList() {
        assertNull(store.listBlockingMove("src", "dst", Duration.ofMillis(20)));
    }

    @Test
    void blockingMoveWakesOnPush() throws Exception {
        CompletableFuture<String> moved = CompletableFuture.supplyAsync(
                () -> store.listBlockingMove("src", "dst", Duration.ofSeconds(5)));
        Thread.sleep(50);
        store.listPush("src", "event");
        assertEquals("event", moved.get(5, TimeUnit.SECONDS));
        assertEquals(List.of("event"), store.listRange("dst", 0, -1));
    }

    @Test
    void listRemoveRemovesOneOccurrence() {
        store.listPush("l", "a");
        store.listPush("l", "b");
        store.listPush("l", "a");
        assertEquals(1, store.listRemove("l", "a", 1));
        assertEquals(List.of("b", "a"), store.listRange("l", 0, -1));
    }

    @Test
    void listTrimKeepsRange() {
        for (int i = 0; i < 5; i++) {
            store.listPushHead("l", "e" + i);
        }
        store.listTrim("l", 0, 2);
        assertEquals(List.of("e4", "e3", "e2"), store.listRange("l", 0, -1));
    }

    // ── Expiry ──────────────────────────────────────────────────────

    @Test
    void expiredKeysDisappear() {
        store.hashPut("h", "f", "v");
        store.expire("h", Duration.ofSeconds(10));
        assertEquals(clock.instant().plusSeconds(10), store.expiresAt("h"));

        clock.advance(Duration.ofSeconds(9));
        assertEquals("v", store.hashGet("h", "f"));

        clock.advance(Duration.ofSeconds(1));
        assertNull(store.hashGet("h", "f"));
        assertNull(store.expiresAt("h"));
    }

    @Test
    void expireOnMissingKeyIsNoOp() {
        store.expire("missing", Duration.ofSeconds(1));
        assertNull(store.expiresAt("missing"));
    }
}
