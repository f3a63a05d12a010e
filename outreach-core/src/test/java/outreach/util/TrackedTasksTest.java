package outreach.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrackedTasksTest {

    @Test
    void submittedTaskRuns() throws Exception {
        try (TrackedTasks tasks = new TrackedTasks("test-", 1000)) {
            CountDownLatch ran = new CountDownLatch(1);
            tasks.submit(ran::countDown);
            assertTrue(ran.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void failingTaskDoesNotAffectOthers() throws Exception {
        try (TrackedTasks tasks = new TrackedTasks("test-", 1000)) {
            tasks.submit(() -> {
                throw new IllegalStateException("boom");
            });
            CountDownLatch ran = new CountDownLatch(1);
            tasks.submit(ran::countDown);
            assertTrue(ran.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void delayedTaskIsCancelledOnClose() throws Exception {
        AtomicBoolean ran = new AtomicBoolean();
        TrackedTasks tasks = new TrackedTasks("test-", 1000);
        tasks.schedule(() -> ran.set(true), Duration.ofSeconds(30));
        assertEquals(1, tasks.size());

        tasks.close();
        Thread.sleep(50);
        assertFalse(ran.get());
        assertEquals(0, tasks.size());
    }

    @Test
    void delayedTaskRunsAfterDelay() throws Exception {
        try (TrackedTasks tasks = new TrackedTasks("test-", 1000)) {
            CountDownLatch ran = new CountDownLatch(1);
            tasks.schedule(ran::countDown, Duration.ofMillis(20));
            assertTrue(ran.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void closeWaitsForRunningTask() throws Exception {
        TrackedTasks tasks = new TrackedTasks("test-", 5000);
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean finished = new AtomicBoolean();
        tasks.submit(() -> {
            started.countDown();
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            finished.set(true);
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        tasks.close();
        assertTrue(finished.get());
    }

    @Test
    void submitAfterCloseIsRejected() {
        TrackedTasks tasks = new TrackedTasks("test-", 100);
        tasks.close();
        assertThrows(RejectedExecutionException.class, () -> tasks.submit(() -> { }));
        assertThrows(RejectedExecutionException.class, () -> tasks.schedule(() -> { }, Duration.ZERO));
    }

    @Test
    void rejectsNegativeDrainTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new TrackedTasks("test-", -1));
    }
}
