package outreach.schedule;

import outreach.spi.KeyValueStore;
import outreach.spi.MetricsExporter;
import outreach.store.StoreKeys;
import outreach.subject.SubjectRepository;
import outreach.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fires a one-shot {@link DueAction} per subject, at most {@code maxFirings} times per cycle.
 *
 * <p>Due entries live in a sorted set scored by fire time (epoch seconds), one member per
 * subject, so scheduling again only moves the time. Each {@link #poll} cycle takes due
 * entries oldest first and, for each one:
 * <ol>
 *   <li>removes the entry; if another poller removed it first, skips it,</li>
 *   <li>claims a firing by incrementing the subject's fired count; if the count now exceeds
 *       the limit, skips it,</li>
 *   <li>runs the action. Failures are logged and never rescheduled.</li>
 * </ol>
 *
 * <p>{@link #reset} starts a new cycle by dropping the entry and zeroing the fired count.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized.
 */
public final class DueTimeScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DueTimeScheduler.class.getName());

    private final KeyValueStore store;
    private final String dueKey;
    private final SubjectRepository subjects;
    private final DueAction action;
    private final Clock clock;
    private final int batchSize;
    private final int maxFirings;
    private final long idleIntervalMs;
    private final long errorBackoffMs;
    private final MetricsExporter metrics;

    private ScheduledExecutorService executor;
    private volatile ScheduledFuture<?> loopTask;
    private volatile boolean closed;

    private DueTimeScheduler(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.subjects = Objects.requireNonNull(builder.subjects, "subjects");
        this.action = Objects.requireNonNull(builder.action, "action");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.maxFirings < 1) {
            throw new IllegalArgumentException("maxFirings must be >= 1");
        }
        if (builder.idleIntervalMs <= 0) {
            throw new IllegalArgumentException("idleIntervalMs must be > 0");
        }
        if (builder.errorBackoffMs <= 0) {
            throw new IllegalArgumentException("errorBackoffMs must be > 0");
        }

        this.dueKey = (builder.keys != null ? builder.keys : new StoreKeys()).dueIndex();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.batchSize = builder.batchSize;
        this.maxFirings = builder.maxFirings;
        this.idleIntervalMs = builder.idleIntervalMs;
        this.errorBackoffMs = builder.errorBackoffMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sets the subject's due entry to {@code now + delay}, replacing any existing entry.
     */
    public void schedule(String subjectId, Duration delay) {
        Objects.requireNonNull(subjectId, "subjectId");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        long fireAt = clock.instant().plus(delay).getEpochSecond();
        store.sortedSetAdd(dueKey, subjectId, fireAt);
    }

    /**
     * Drops the subject's due entry, if any. The fired count is left unchanged.
     *
     * @return {@code true} if an entry was removed
     */
    public boolean unschedule(String subjectId) {
        return store.sortedSetRemove(dueKey, subjectId);
    }

    /**
     * Moves the subject back to {@link SchedulingState#UNSCHEDULED}: drops the entry and
     * zeroes the fired count so the next {@link #schedule} can fire again.
     */
    public void reset(String subjectId) {
        store.sortedSetRemove(dueKey, subjectId);
        subjects.resetFollowup(subjectId);
    }

    public SchedulingState state(String subjectId) {
        if (store.sortedSetScore(dueKey, subjectId) != null) {
            return SchedulingState.SCHEDULED;
        }
        return subjects.followupFired(subjectId) >= maxFirings
            ? SchedulingState.FIRED : SchedulingState.UNSCHEDULED;
    }

    /**
     * @return number of outstanding due entries
     */
    public long dueCount() {
        return store.sortedSetSize(dueKey);
    }

    /**
     * Runs one cycle with the configured batch size.
     *
     * @return number of due entries selected
     */
    public int poll() {
        return poll(batchSize);
    }

    /**
     * Selects up to {@code limit} entries due now, oldest first, and processes each.
     *
     * @return number of due entries selected
     */
    public int poll(int limit) {
        long now = clock.instant().getEpochSecond();
        List<String> due = store.sortedSetRangeByScore(dueKey, Double.NEGATIVE_INFINITY, now, limit);
        for (String subjectId : due) {
            if (!store.sortedSetRemove(dueKey, subjectId)) {
                continue;
            }
            fireOnce(subjectId);
        }
        return due.size();
    }

    private void fireOnce(String subjectId) {
        try {
            if (subjects.followupFired(subjectId) >= maxFirings
                || subjects.claimFollowup(subjectId) > maxFirings) {
                metrics.incrementFollowupsSkipped();
                logger.log(Level.FINE, "Followup already fired for subject {0}", subjectId);
                return;
            }
            if (action.fire(subjectId)) {
                metrics.incrementFollowupsFired();
                logger.log(Level.INFO, "Followup fired for subject {0}", subjectId);
            } else {
                metrics.incrementFollowupsSkipped();
            }
        } catch (Exception e) {
            metrics.incrementFollowupsSkipped();
            logger.log(Level.WARNING, "Followup failed for subject " + subjectId + "; not rescheduling", e);
        }
    }

    /**
     * Starts polling on a daemon thread: full batches are followed immediately by another
     * cycle, otherwise the loop waits the idle interval, or the error backoff after a failed
     * cycle. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("DueTimeScheduler has been closed");
        }
        if (loopTask != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("outreach-scheduler-"));
        scheduleNext(idleIntervalMs);
    }

    private synchronized void scheduleNext(long delayMs) {
        if (closed) {
            return;
        }
        try {
            loopTask = executor.schedule(this::runCycle, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.log(Level.FINE, "Scheduler stopped; not rescheduling", e);
        }
    }

    private void runCycle() {
        scheduleNext(drainDue());
    }

    /**
     * Polls until a batch comes back short.
     *
     * @return the pause before the next cycle
     */
    long drainDue() {
        if (closed) {
            return idleIntervalMs;
        }
        try {
            int selected;
            do {
                selected = poll(batchSize);
            } while (!closed && selected >= batchSize);
            return idleIntervalMs;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Due-time poll failed; retrying in " + errorBackoffMs + " ms", t);
            return errorBackoffMs;
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (loopTask != null) {
            loopTask.cancel(false);
            loopTask = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link DueTimeScheduler}.
     */
    public static final class Builder {
        private KeyValueStore store;
        private StoreKeys keys;
        private SubjectRepository subjects;
        private DueAction action;
        private Clock clock;
        private int batchSize = 50;
        private int maxFirings = 1;
        private long idleIntervalMs = 1000;
        private long errorBackoffMs = 2000;
        private MetricsExporter metrics;

        private Builder() {
        }

        /** Required. */
        public Builder store(KeyValueStore store) {
            this.store = store;
            return this;
        }

        /**
         * Optional. Defaults to {@link StoreKeys#DEFAULT_PREFIX}.
         */
        public Builder keys(StoreKeys keys) {
            this.keys = keys;
            return this;
        }

        /**
         * Sets the repository holding each subject's fired count.
         *
         * <p><b>Required.</b>
         */
        public Builder subjects(SubjectRepository subjects) {
            this.subjects = subjects;
            return this;
        }

        /** Required. */
        public Builder action(DueAction action) {
            this.action = action;
            return this;
        }

        /**
         * Optional. Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the maximum entries taken per poll cycle.
         *
         * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets how many times the action may fire per subject per cycle.
         *
         * <p>Optional. Defaults to {@code 1}. Must be &ge; 1.
         */
        public Builder maxFirings(int maxFirings) {
            this.maxFirings = maxFirings;
            return this;
        }

        /**
         * Sets the pause between cycles when nothing was due.
         *
         * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
         */
        public Builder idleIntervalMs(long idleIntervalMs) {
            this.idleIntervalMs = idleIntervalMs;
            return this;
        }

        /**
         * Sets the pause after a cycle failed, typically because the store was unreachable.
         *
         * <p>Optional. Defaults to {@code 2000}. Must be &gt; 0.
         */
        public Builder errorBackoffMs(long errorBackoffMs) {
            this.errorBackoffMs = errorBackoffMs;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public DueTimeScheduler build() {
            return new DueTimeScheduler(this);
        }
    }
}
