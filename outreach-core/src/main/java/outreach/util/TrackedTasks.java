package outreach.util;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cancellable set of background tasks.
 *
 * <p>Every submitted or delayed task is tracked until it completes, so {@link #close()} can
 * wait for running work up to a drain timeout and cancel whatever is left. Failures inside a
 * task are logged and never propagate to the submitter.
 *
 * <p>This class is thread-safe.
 */
public final class TrackedTasks implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TrackedTasks.class.getName());

  private final String name;
  private final ExecutorService workers;
  private final ScheduledExecutorService timer;
  private final Set<Future<?>> pending = ConcurrentHashMap.newKeySet();
  private final long drainTimeoutMs;
  private volatile boolean closed;

  /**
   * @param threadPrefix   prefix for worker thread names
   * @param drainTimeoutMs how long {@link #close()} waits for running tasks
   */
  public TrackedTasks(String threadPrefix, long drainTimeoutMs) {
    Objects.requireNonNull(threadPrefix, "threadPrefix");
    if (drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.name = threadPrefix;
    this.drainTimeoutMs = drainTimeoutMs;
    this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory(threadPrefix));
    this.timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory(threadPrefix + "timer-"));
  }

  /**
   * Runs the task on a worker thread.
   *
   * @throws RejectedExecutionException if this set has been closed
   */
  public Future<?> submit(Runnable task) {
    Objects.requireNonNull(task, "task");
    ensureOpen();
    TrackedFuture tracked = new TrackedFuture();
    tracked.delegate = workers.submit(() -> runTracked(task, tracked));
    pending.add(tracked.delegate);
    if (tracked.delegate.isDone()) {
      pending.remove(tracked.delegate);
    }
    return tracked.delegate;
  }

  /**
   * Runs the task on a worker thread after {@code delay}. The task is cancelled if this set is
   * closed before the delay elapses.
   */
  public Future<?> schedule(Runnable task, Duration delay) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(delay, "delay");
    ensureOpen();
    TrackedFuture tracked = new TrackedFuture();
    tracked.delegate = timer.schedule(() -> {
      pending.remove(tracked.delegate);
      if (!closed) {
        try {
          submit(task);
        } catch (RejectedExecutionException e) {
          logger.log(Level.FINE, "Delayed task dropped, {0} is closing", name);
        }
      }
    }, Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
    pending.add(tracked.delegate);
    return tracked.delegate;
  }

  /**
   * @return number of tasks submitted or scheduled and not yet finished
   */
  public int size() {
    pending.removeIf(Future::isDone);
    return pending.size();
  }

  /**
   * Stops accepting tasks, cancels delayed tasks that have not started, waits up to the drain
   * timeout for running tasks and interrupts the rest.
   */
  @Override
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
    }
    timer.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded for {0}; cancelling {1} task(s)",
            new Object[] {name, size()});
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    pending.forEach(f -> f.cancel(true));
    pending.clear();
  }

  private void runTracked(Runnable task, TrackedFuture tracked) {
    try {
      task.run();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Background task failed in " + name, t);
    } finally {
      Future<?> self = tracked.delegate;
      if (self != null) {
        pending.remove(self);
      }
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new RejectedExecutionException(name + " is closed");
    }
  }

  private static final class TrackedFuture {
    volatile Future<?> delegate;
  }
}
