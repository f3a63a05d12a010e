package outreach.retry;

import outreach.spi.CallResult;
import outreach.spi.KeyValueStore;
import outreach.spi.MetricsExporter;
import outreach.spi.NotificationSink;
import outreach.store.StoreKeys;
import outreach.util.DaemonThreadFactory;
import outreach.util.JsonCodec;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable FIFO of notifications whose delivery failed.
 *
 * <p>{@link #enqueue} appends an item with {@code attempt=1}. Each {@link #drainOnce()} pops up
 * to {@code batchSize} items from the head and sends each to its named sink. A failed send is
 * appended again with {@code attempt+1}, unless the item already used {@code maxAttempts}, in
 * which case it is dropped with a log line. Items are therefore attempted at most
 * {@code maxAttempts} times.
 *
 * <p>With a {@link RetryPolicy} other than {@link RetryPolicy#NEXT_CYCLE}, a re-enqueued item
 * carries a not-before time; a drain that meets it early rotates it to the tail without an
 * attempt. Malformed items and items for unknown sinks are dropped.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RetryQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetryQueue.class.getName());

  private final KeyValueStore store;
  private final String queueKey;
  private final Map<String, NotificationSink> sinks;
  private final int maxAttempts;
  private final int batchSize;
  private final long intervalMs;
  private final RetryPolicy retryPolicy;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final JsonCodec jsonCodec;

  private ScheduledExecutorService executor;
  private volatile ScheduledFuture<?> drainTask;
  private volatile boolean closed;

  private RetryQueue(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.queueKey = (builder.keys != null ? builder.keys : new StoreKeys()).retryQueue();
    this.sinks = Map.copyOf(builder.sinks);
    this.maxAttempts = builder.maxAttempts;
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.NEXT_CYCLE;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.jsonCodec = JsonCodec.getDefault();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Appends a notification for a later attempt.
   *
   * @param sink    registered sink name
   * @param payload serialized notification
   * @param reason  why delivery failed
   */
  public void enqueue(String sink, String payload, String reason) {
    long now = clock.millis();
    long notBefore = delayedUntil(now, 2);
    RetryItem item = new RetryItem(sink, payload, reason, 1, now / 1000, notBefore);
    store.listPush(queueKey, item.toJson(jsonCodec));
  }

  public boolean hasSink(String sink) {
    return sinks.containsKey(sink);
  }

  public long size() {
    return store.listSize(queueKey);
  }

  /**
   * Processes up to {@code batchSize} items from the head of the queue. Items re-appended
   * during the pass are left for the next one.
   *
   * @return number of items popped
   */
  public int drainOnce() {
    long limit = Math.min(batchSize, store.listSize(queueKey));
    int popped = 0;
    while (popped < limit) {
      String raw = store.listPop(queueKey);
      if (raw == null) {
        break;
      }
      popped++;
      process(raw);
    }
    return popped;
  }

  private void process(String raw) {
    RetryItem item;
    try {
      item = RetryItem.fromJson(jsonCodec, raw);
    } catch (IllegalArgumentException e) {
      metrics.incrementRetryDropped();
      logger.log(Level.WARNING, "Dropping unreadable retry item", e);
      return;
    }
    NotificationSink sink = sinks.get(item.sink());
    if (sink == null) {
      metrics.incrementRetryDropped();
      logger.log(Level.WARNING, "Dropping retry item for unknown sink {0}", item.sink());
      return;
    }
    long now = clock.millis();
    if (item.notBeforeMs() > now) {
      store.listPush(queueKey, raw);
      return;
    }

    String failure;
    try {
      CallResult<Void> result = sink.send(item.payload());
      if (result.isSuccess()) {
        metrics.incrementRetryDelivered();
        logger.log(Level.FINE, "Retry delivered to {0} on attempt {1}",
            new Object[] {item.sink(), item.attempt()});
        return;
      }
      CallResult.Failure<Void> f = (CallResult.Failure<Void>) result;
      failure = f.kind() + ": " + f.message();
    } catch (RuntimeException e) {
      failure = e.toString();
    }

    if (item.attempt() >= maxAttempts) {
      metrics.incrementRetryDropped();
      logger.log(Level.WARNING, "Dropping notification for {0} after {1} attempt(s): {2}",
          new Object[] {item.sink(), item.attempt(), failure});
      return;
    }
    RetryItem next = item.nextAttempt(failure, delayedUntil(now, item.attempt() + 1));
    store.listPush(queueKey, next.toJson(jsonCodec));
    metrics.incrementRetryRequeued();
  }

  private long delayedUntil(long nowMs, int attempt) {
    long delay = retryPolicy.delayBefore(attempt).toMillis();
    return delay <= 0 ? 0L : nowMs + delay;
  }

  /**
   * Starts draining on a daemon thread every {@code intervalMs}. Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RetryQueue has been closed");
    }
    if (drainTask != null) {
      return;
    }
    executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("outreach-retry-"));
    drainTask = executor.scheduleWithFixedDelay(this::drainSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  private void drainSafely() {
    if (closed) {
      return;
    }
    try {
      int popped = drainOnce();
      if (popped > 0) {
        logger.log(Level.FINE, "Retry drain processed {0} item(s)", popped);
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Retry drain failed", t);
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (drainTask != null) {
      drainTask.cancel(false);
      drainTask = null;
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

  /** Builder for {@link RetryQueue}. */
  public static final class Builder {
    private KeyValueStore store;
    private StoreKeys keys;
    private final Map<String, NotificationSink> sinks = new LinkedHashMap<>();
    private int maxAttempts = 3;
    private int batchSize = 10;
    private long intervalMs = 30_000;
    private RetryPolicy retryPolicy;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the store holding the queue.
     *
     * <p><b>Required.</b>
     */
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
     * Registers a sink by name. Items naming an unregistered sink are dropped.
     */
    public Builder sink(String name, NotificationSink sink) {
      sinks.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(sink, "sink"));
      return this;
    }

    /**
     * Sets the maximum delivery attempts per item.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the maximum items popped per drain.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the drain interval.
     *
     * <p>Optional. Defaults to {@code 30000}. Must be &gt; 0.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Optional. Defaults to {@link RetryPolicy#NEXT_CYCLE}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
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
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public RetryQueue build() {
      return new RetryQueue(this);
    }
  }
}
