package outreach.retry;

import org.junit.jupiter.api.Test;
import outreach.store.InMemoryKeyValueStore;
import outreach.stub.RecordingSink;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationPublisherTest {

    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    @Test
    void successfulSendIsNotQueued() {
        RecordingSink sink = new RecordingSink();
        RetryQueue queue = RetryQueue.builder().store(store).sink("orders", sink).build();
        NotificationPublisher publisher = new NotificationPublisher(Map.of("orders", sink), queue);

        assertTrue(publisher.publish("orders", "p"));

        assertEquals(List.of("p"), sink.delivered());
        assertEquals(0, queue.size());
    }

    @Test
    void failedSendIsQueuedAndDeliveredLater() {
        RecordingSink sink = new RecordingSink(1);
        RetryQueue queue = RetryQueue.builder().store(store).sink("orders", sink).build();
        NotificationPublisher publisher = new NotificationPublisher(Map.of("orders", sink), queue);

        assertFalse(publisher.publish("orders", "p"));
        assertEquals(1, queue.size());

        queue.drainOnce();
        assertEquals(List.of("p"), sink.delivered());
    }

    @Test
    void throwingSinkIsQueued() {
        RetryQueue queue = RetryQueue.builder().store(store).build();
        NotificationPublisher publisher = new NotificationPublisher(Map.of("orders", payload -> {
            throw new IllegalStateException("closed");
        }), queue);

        assertFalse(publisher.publish("orders", "p"));
        assertEquals(1, queue.size());
    }

    @Test
    void unknownSinkIsSkipped() {
        RetryQueue queue = RetryQueue.builder().store(store).build();
        NotificationPublisher publisher = new NotificationPublisher(Map.of(), queue);

        assertFalse(publisher.publish("crm", "p"));
        assertEquals(0, queue.size());
    }

    @Test
    void deferQueuesWithoutSending() {
        RecordingSink sink = new RecordingSink();
        RetryQueue queue = RetryQueue.builder().store(store).sink("orders", sink).build();
        NotificationPublisher publisher = new NotificationPublisher(Map.of("orders", sink), queue);

        publisher.defer("orders", "p", "chat down");

        assertEquals(0, sink.attempts());
        assertEquals(1, queue.size());
    }
}
