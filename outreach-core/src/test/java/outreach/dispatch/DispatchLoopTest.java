package outreach.dispatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import outreach.EventKind;
import outreach.InboundEvent;
import outreach.store.InMemoryKeyValueStore;
import outreach.store.StoreKeys;
import outreach.stub.Await;
import outreach.stub.CountingMetrics;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatchLoopTest {

    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
    private final StoreKeys keys = new StoreKeys();
    private final FlatEventDecoder codec = new FlatEventDecoder();
    private final CountingMetrics metrics = new CountingMetrics();
    private DispatchLoop loop;

    @AfterEach
    void tearDown() {
        if (loop != null) {
            loop.close();
        }
    }

    private void push(EventKind kind, String subjectId) {
        store.listPush(keys.eventQueue(), codec.encode(InboundEvent.of(kind, subjectId, subjectId)));
    }

    private DispatchLoop.Builder builder(HandlerRegistry registry) {
        return DispatchLoop.builder()
                .store(store)
                .keys(keys)
                .handlerRegistry(registry)
                .consumerId("worker-1")
                .popTimeout(Duration.ofMillis(50))
                .metrics(metrics);
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsMissingStore() {
        assertThrows(NullPointerException.class, () ->
                DispatchLoop.builder().handlerRegistry(new DefaultHandlerRegistry()).build());
    }

    @Test
    void builderRejectsMissingRegistry() {
        assertThrows(NullPointerException.class, () -> DispatchLoop.builder().store(store).build());
    }

    @Test
    void builderRequiresConsumerId() {
        assertThrows(NullPointerException.class, () -> DispatchLoop.builder()
                .store(store)
                .handlerRegistry(new DefaultHandlerRegistry())
                .build());
        assertThrows(IllegalArgumentException.class, () ->
                builder(new DefaultHandlerRegistry()).consumerId(" ").build());
    }

    @Test
    void builderRejectsZeroConcurrency() {
        assertThrows(IllegalArgumentException.class, () ->
                builder(new DefaultHandlerRegistry()).maxConcurrency(0).build());
    }

    @Test
    void builderRejectsZeroPopTimeout() {
        assertThrows(IllegalArgumentException.class, () ->
                builder(new DefaultHandlerRegistry()).popTimeout(Duration.ZERO).build());
    }

    // ── Backpressure ────────────────────────────────────────────────

    @Test
    void inFlightNeverExceedsMaxConcurrency() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        AtomicInteger handled = new AtomicInteger();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry().register(EventKind.MESSAGE, event -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                gate.await(10, TimeUnit.SECONDS);
            } finally {
                running.decrementAndGet();
                handled.incrementAndGet();
            }
        });
        for (int i = 0; i < 20; i++) {
            push(EventKind.MESSAGE, "s" + i);
        }

        loop = builder(registry).maxConcurrency(3).build();
        loop.start();

        Await.until(() -> running.get() == 3, 5000);
        Thread.sleep(100);
        assertEquals(3, loop.inFlight());
        assertEquals(3, running.get());
        // three running plus at most one popped and waiting for a slot
        assertTrue(store.listSize(keys.eventQueue()) >= 16);
        assertTrue(store.listSize(keys.processing("worker-1")) <= 4);

        gate.countDown();
        Await.until(() -> handled.get() == 20, 5000);
        assertEquals(3, peak.get());
        assertTrue(metrics.maxInFlight.get() <= 3);
        Await.until(() -> store.listSize(keys.processing("worker-1")) == 0, 5000);
        assertEquals(20, metrics.dispatched.get());
    }

    @Test
    void eventsAreTakenInArrivalOrder() {
        List<String> order = new CopyOnWriteArrayList<>();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register(EventKind.MESSAGE, event -> order.add(event.subjectId()));
        for (int i = 0; i < 5; i++) {
            push(EventKind.MESSAGE, "s" + i);
        }
        loop = builder(registry).maxConcurrency(1).build();
        loop.start();

        Await.until(() -> order.size() == 5, 5000);
        assertEquals(List.of("s0", "s1", "s2", "s3", "s4"), order);
    }

    // ── Isolation ───────────────────────────────────────────────────

    @Test
    void malformedPayloadIsDroppedAndLoopContinues() {
        List<String> seen = new CopyOnWriteArrayList<>();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register(EventKind.START, event -> seen.add(event.subjectId()));
        store.listPush(keys.eventQueue(), "{not json");
        store.listPush(keys.eventQueue(), "{\"kind\":\"NOPE\",\"subject_id\":\"1\"}");
        push(EventKind.START, "42");

        loop = builder(registry).build();
        loop.start();

        Await.until(() -> seen.size() == 1, 5000);
        Await.until(() -> metrics.dropped.get() == 2, 5000);
        assertEquals(List.of("42"), seen);
        Await.until(() -> store.listSize(keys.processing("worker-1")) == 0, 5000);
    }

    @Test
    void unroutableEventIsDropped() {
        List<String> seen = new CopyOnWriteArrayList<>();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register(EventKind.START, event -> seen.add(event.subjectId()));
        push(EventKind.CALLBACK, "1");
        push(EventKind.START, "2");

        loop = builder(registry).build();
        loop.start();

        Await.until(() -> seen.size() == 1, 5000);
        Await.until(() -> metrics.dropped.get() == 1, 5000);
    }

    @Test
    void handlerFailureReleasesSlot() {
        AtomicInteger calls = new AtomicInteger();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry().register(EventKind.MESSAGE, event -> {
            calls.incrementAndGet();
            throw new IllegalStateException("handler bug");
        });
        for (int i = 0; i < 5; i++) {
            push(EventKind.MESSAGE, "s" + i);
        }
        loop = builder(registry).maxConcurrency(1).build();
        loop.start();

        Await.until(() -> calls.get() == 5, 5000);
        Await.until(() -> metrics.failed.get() == 5, 5000);
        Await.until(() -> loop.inFlight() == 0, 5000);
    }

    @Test
    void handlerIllegalArgumentCountsAsFailureNotMalformed() {
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry().register(EventKind.MESSAGE, event -> {
            throw new IllegalArgumentException("bad amount");
        });
        push(EventKind.MESSAGE, "s");
        loop = builder(registry).build();
        loop.start();

        Await.until(() -> metrics.failed.get() == 1, 5000);
        assertEquals(0, metrics.dropped.get());
    }

    // ── Acknowledgement ─────────────────────────────────────────────

    @Test
    void unacknowledgedEventsAreRequeuedOnStart() {
        List<String> seen = new CopyOnWriteArrayList<>();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register(EventKind.START, event -> seen.add(event.subjectId()));
        store.listPush(keys.processing("worker-1"),
                codec.encode(new InboundEvent("e1", EventKind.START, "7", "7", null, Map.of())));

        loop = builder(registry).build();
        loop.start();

        Await.until(() -> seen.size() == 1, 5000);
        assertEquals(List.of("7"), seen);
        Await.until(() -> store.listSize(keys.processing("worker-1")) == 0, 5000);
    }

    @Test
    void recoveredEventsRunBeforeEventsQueuedSinceTheCrash() {
        List<String> order = new CopyOnWriteArrayList<>();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register(EventKind.MESSAGE, event -> order.add(event.subjectId()));
        store.listPush(keys.processing("worker-1"), codec.encode(InboundEvent.of(EventKind.MESSAGE, "old1", "old1")));
        store.listPush(keys.processing("worker-1"), codec.encode(InboundEvent.of(EventKind.MESSAGE, "old2", "old2")));
        push(EventKind.MESSAGE, "new1");
        push(EventKind.MESSAGE, "new2");

        loop = builder(registry).maxConcurrency(1).build();
        loop.start();

        Await.until(() -> order.size() == 4, 5000);
        assertEquals(List.of("old1", "old2", "new1", "new2"), order);
    }

    @Test
    void otherConsumersProcessingListIsLeftAlone() {
        store.listPush(keys.processing("worker-2"), codec.encode(InboundEvent.of(EventKind.START, "9", "9")));
        loop = builder(new DefaultHandlerRegistry()).build();
        loop.start();
        loop.close();
        assertEquals(1, store.listSize(keys.processing("worker-2")));
    }

    @Test
    void startAfterCloseFails() {
        loop = builder(new DefaultHandlerRegistry()).build();
        loop.close();
        assertThrows(IllegalStateException.class, loop::start);
    }
}
