package outreach.ops;

import org.junit.jupiter.api.Test;
import outreach.funnel.FunnelRecorder;
import outreach.store.InMemoryKeyValueStore;
import outreach.store.StoreKeys;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OpsReporterTest {

    @Test
    void snapshotReportsQueueDepths() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        StoreKeys keys = new StoreKeys();
        FunnelRecorder funnel = new FunnelRecorder(store, keys, Clock.systemUTC());
        store.listPush(keys.eventQueue(), "a");
        store.listPush(keys.eventQueue(), "b");
        store.listPush(keys.processing("worker-1"), "c");
        store.listPush(keys.processing("worker-2"), "d");
        store.setAdd(keys.pendingPayments(), "7");
        store.sortedSetAdd(keys.dueIndex(), "42", 1.0);
        store.sortedSetAdd(keys.dueIndex(), "43", 2.0);
        store.sortedSetAdd(keys.dueIndex(), "44", 3.0);
        store.listPush(keys.retryQueue(), "r");
        funnel.record("start", "42");

        OpsSnapshot snapshot = new OpsReporter(store, keys, "worker-1", funnel).snapshot();

        assertEquals(2, snapshot.queueDepth());
        assertEquals(1, snapshot.processingDepth());
        assertEquals(1, snapshot.pendingPayments());
        assertEquals(3, snapshot.dueFollowups());
        assertEquals(1, snapshot.retryDepth());
        assertEquals(1L, snapshot.counters().get("start"));
    }
}
