package outreach.payment;

import outreach.spi.CallResult;
import outreach.spi.ErrorKind;
import outreach.spi.PaymentGateway;
import outreach.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Poll path of payment reconciliation.
 *
 * <p>Each sweep samples up to {@code sampleSize} subjects from the pending index, asks the
 * gateway for the status of each stored transaction with at most {@code maxConcurrentLookups}
 * calls in flight, and feeds the answer to the {@link PaymentReconciler}. Transient gateway
 * errors leave the subject pending for the next sweep.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class PendingPaymentPoller implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PendingPaymentPoller.class.getName());

  private final PaymentRepository payments;
  private final PaymentGateway gateway;
  private final PaymentReconciler reconciler;
  private final int sampleSize;
  private final int maxConcurrentLookups;
  private final long intervalMs;

  private final Semaphore lookups;
  private ExecutorService workers;
  private ScheduledExecutorService executor;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private PendingPaymentPoller(Builder builder) {
    this.payments = Objects.requireNonNull(builder.payments, "payments");
    this.gateway = Objects.requireNonNull(builder.gateway, "gateway");
    this.reconciler = Objects.requireNonNull(builder.reconciler, "reconciler");
    if (builder.sampleSize <= 0) {
      throw new IllegalArgumentException("sampleSize must be > 0");
    }
    if (builder.maxConcurrentLookups <= 0) {
      throw new IllegalArgumentException("maxConcurrentLookups must be > 0");
    }
    if (builder.intervalMs <= 0) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.sampleSize = builder.sampleSize;
    this.maxConcurrentLookups = builder.maxConcurrentLookups;
    this.intervalMs = builder.intervalMs;
    this.lookups = new Semaphore(maxConcurrentLookups);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs one sweep and waits for its lookups.
   *
   * @return number of subjects examined
   */
  public int pollOnce() {
    Set<String> sample = payments.samplePending(sampleSize);
    if (sample.isEmpty()) {
      return 0;
    }
    ExecutorService pool = lookupPool();
    List<Future<?>> futures = new ArrayList<>(sample.size());
    for (String subjectId : sample) {
      futures.add(pool.submit(() -> checkGuarded(subjectId)));
    }
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        futures.forEach(f -> f.cancel(true));
        break;
      } catch (ExecutionException e) {
        logger.log(Level.WARNING, "Pending payment check failed", e.getCause());
      }
    }
    return sample.size();
  }

  private void checkGuarded(String subjectId) {
    try {
      lookups.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return;
    }
    try {
      check(subjectId);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Pending payment check failed for subject " + subjectId, e);
    } finally {
      lookups.release();
    }
  }

  void check(String subjectId) {
    Optional<PaymentRecord> found = payments.find(subjectId);
    if (found.isEmpty() || found.get().transactionId() == null || found.get().transactionId().isEmpty()) {
      payments.removePending(subjectId);
      logger.log(Level.FINE, "Subject {0} has no transaction; removed from pending", subjectId);
      return;
    }
    PaymentRecord record = found.get();
    ExternalIds ids = ExternalIds.ofTransaction(record.transactionId());
    if (record.status() != PaymentStatus.PENDING) {
      reconciler.reconcile(subjectId, record.status(), record.rawStatus(), ids);
      return;
    }

    CallResult<String> result = gateway.fetchStatus(record.transactionId());
    if (result instanceof CallResult.Success<String> success) {
      reconciler.reconcile(subjectId, success.value(), ids);
      return;
    }
    CallResult.Failure<String> failure = (CallResult.Failure<String>) result;
    if (failure.kind() == ErrorKind.NOT_FOUND) {
      logger.log(Level.INFO, "Gateway no longer knows transaction {0} of subject {1}; expiring",
          new Object[] {record.transactionId(), subjectId});
      reconciler.reconcile(subjectId, PaymentStatus.EXPIRED, "NOT_FOUND", ids);
    } else {
      logger.log(Level.FINE, "Status lookup for subject {0} failed: {1} {2}",
          new Object[] {subjectId, failure.kind(), failure.message()});
    }
  }

  private synchronized ExecutorService lookupPool() {
    if (closed) {
      throw new IllegalStateException("PendingPaymentPoller has been closed");
    }
    if (workers == null) {
      workers = Executors.newCachedThreadPool(new DaemonThreadFactory("outreach-payment-lookup-"));
    }
    return workers;
  }

  /**
   * Starts sweeping every {@code intervalMs} on a daemon thread. Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PendingPaymentPoller has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("outreach-payment-poller-"));
    sweepTask = executor.scheduleWithFixedDelay(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  private void sweepSafely() {
    if (closed) {
      return;
    }
    try {
      int examined = pollOnce();
      if (examined > 0) {
        logger.log(Level.FINE, "Payment sweep examined {0} subject(s)", examined);
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Payment sweep failed", t);
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    for (ExecutorService service : new ExecutorService[] {executor, workers}) {
      if (service == null) {
        continue;
      }
      service.shutdownNow();
      try {
        service.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  int maxConcurrentLookups() {
    return maxConcurrentLookups;
  }

  /** Builder for {@link PendingPaymentPoller}. */
  public static final class Builder {
    private PaymentRepository payments;
    private PaymentGateway gateway;
    private PaymentReconciler reconciler;
    private int sampleSize = 50;
    private int maxConcurrentLookups = 10;
    private long intervalMs = 20_000;

    private Builder() {}

    /** Required. */
    public Builder payments(PaymentRepository payments) {
      this.payments = payments;
      return this;
    }

    /** Required. */
    public Builder gateway(PaymentGateway gateway) {
      this.gateway = gateway;
      return this;
    }

    /** Required. */
    public Builder reconciler(PaymentReconciler reconciler) {
      this.reconciler = reconciler;
      return this;
    }

    /**
     * Sets how many pending subjects one sweep examines.
     *
     * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
     */
    public Builder sampleSize(int sampleSize) {
      this.sampleSize = sampleSize;
      return this;
    }

    /**
     * Sets the bound on concurrent gateway lookups.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     */
    public Builder maxConcurrentLookups(int maxConcurrentLookups) {
      this.maxConcurrentLookups = maxConcurrentLookups;
      return this;
    }

    /**
     * Optional. Defaults to {@code 20000}. Must be &gt; 0.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public PendingPaymentPoller build() {
      return new PendingPaymentPoller(this);
    }
  }
}
