package outreach.dispatch;

import outreach.EventHandler;
import outreach.InboundEvent;
import outreach.spi.KeyValueStore;
import outreach.spi.MetricsExporter;
import outreach.spi.StoreException;
import outreach.store.StoreKeys;
import outreach.util.DaemonThreadFactory;
import outreach.util.TrackedTasks;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded-concurrency consumer of the durable event queue.
 *
 * <p>The loop blocks on the queue with a timeout, moving each raw event atomically into a
 * per-owner <em>processing</em> list. It then acquires one of {@code maxConcurrency}
 * admission slots before spawning a handler task, so it never pops the next event while all
 * slots are taken. Each task decodes the event, routes it by {@link outreach.EventKind}
 * through the {@link HandlerRegistry}, and in a {@code finally} block acknowledges the event
 * (removes it from the processing list) and releases its slot.
 *
 * <p>Handler failures, malformed payloads and unroutable kinds are logged and acknowledged;
 * they never stop the loop or leak a slot. Events left in the processing list by a crash are
 * moved back to the head of the queue, in their original order, by {@link #start()} of the
 * next process with the same consumer id, which makes delivery at-least-once. Every running
 * process needs its own consumer id; two loops sharing one would requeue each other's
 * in-flight events.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized.
 *
 * @see DispatchLoop.Builder
 */
public final class DispatchLoop implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DispatchLoop.class.getName());

  private final KeyValueStore store;
  private final String queueKey;
  private final String processingKey;
  private final EventDecoder decoder;
  private final HandlerRegistry handlerRegistry;
  private final int maxConcurrency;
  private final Duration popTimeout;
  private final long storeErrorBackoffMs;
  private final MetricsExporter metrics;
  private final Semaphore slots;
  private final TrackedTasks tasks;

  private ExecutorService loopExecutor;
  private volatile boolean running;
  private volatile boolean closed;

  private DispatchLoop(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    StoreKeys keys = builder.keys != null ? builder.keys : new StoreKeys();
    String consumerId = Objects.requireNonNull(builder.consumerId, "consumerId");
    this.popTimeout = Objects.requireNonNull(builder.popTimeout, "popTimeout");

    if (builder.maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1");
    }
    if (popTimeout.isNegative() || popTimeout.isZero()) {
      throw new IllegalArgumentException("popTimeout must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }

    this.queueKey = keys.eventQueue();
    this.processingKey = keys.processing(consumerId);
    if (consumerId.isBlank()) {
      throw new IllegalArgumentException("consumerId must not be blank");
    }
    this.decoder = builder.decoder != null ? builder.decoder : new FlatEventDecoder();
    this.maxConcurrency = builder.maxConcurrency;
    this.storeErrorBackoffMs = builder.storeErrorBackoffMs;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.slots = new Semaphore(maxConcurrency);
    this.tasks = new TrackedTasks("outreach-handler-", builder.drainTimeoutMs);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Requeues events a previous process with the same consumer id left unacknowledged, then
   * starts the loop on a daemon thread. Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DispatchLoop has been closed");
    }
    if (running) {
      return;
    }
    recoverUnacknowledged();
    running = true;
    loopExecutor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("outreach-dispatch-"));
    loopExecutor.submit(this::run);
  }

  /**
   * Pops and dispatches events until {@link #close()} is called. Never throws.
   */
  public void run() {
    while (running && !Thread.currentThread().isInterrupted()) {
      try {
        String raw = store.listBlockingMove(queueKey, processingKey, popTimeout);
        if (raw == null) {
          continue;
        }
        admit(raw);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (StoreException e) {
        if (Thread.currentThread().isInterrupted()) {
          break;
        }
        logger.log(Level.SEVERE, "Event queue unavailable; backing off", e);
        sleepQuietly(storeErrorBackoffMs);
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Dispatch loop error", t);
      }
    }
  }

  /**
   * @return handler tasks currently holding an admission slot
   */
  public int inFlight() {
    return maxConcurrency - slots.availablePermits();
  }

  public int maxConcurrency() {
    return maxConcurrency;
  }

  private void admit(String raw) throws InterruptedException {
    slots.acquire();
    metrics.recordInFlight(inFlight());
    try {
      tasks.submit(() -> process(raw));
    } catch (RejectedExecutionException e) {
      // Shutting down: the event stays in the processing list and is requeued on next start.
      slots.release();
      logger.log(Level.FINE, "Dispatch stopped; event left for recovery");
    }
  }

  private void process(String raw) {
    try {
      InboundEvent event;
      try {
        event = decoder.decode(raw);
      } catch (RuntimeException e) {
        metrics.incrementEventsDropped();
        logger.log(Level.WARNING, "Dropping malformed event payload=" + abbreviate(raw), e);
        return;
      }
      if (event == null) {
        logger.log(Level.FINE, "Ignoring event without a routable payload");
        return;
      }
      dispatch(event);
    } finally {
      acknowledge(raw);
      slots.release();
      metrics.recordInFlight(inFlight());
    }
  }

  private void dispatch(InboundEvent event) {
    EventHandler handler = handlerRegistry.handlerFor(event.kind());
    try {
      if (handler == null) {
        throw new UnroutableEventException("No handler for kind=" + event.kind());
      }
      handler.handle(event);
      metrics.incrementEventsDispatched();
    } catch (UnroutableEventException e) {
      metrics.incrementEventsDropped();
      logger.log(Level.WARNING, e.getMessage() + "; dropping event for subject=" + event.subjectId());
    } catch (Exception e) {
      metrics.incrementEventsFailed();
      logger.log(Level.SEVERE, "Handler failed for kind=" + event.kind()
          + " subject=" + event.subjectId(), e);
    }
  }

  private void acknowledge(String raw) {
    try {
      store.listRemove(processingKey, raw, 1);
    } catch (StoreException e) {
      logger.log(Level.WARNING, "Failed to acknowledge event; it will be replayed on restart", e);
    }
  }

  private void recoverUnacknowledged() {
    int recovered = 0;
    try {
      while (store.listMoveToHead(processingKey, queueKey) != null) {
        recovered++;
      }
    } catch (StoreException e) {
      logger.log(Level.SEVERE, "Failed to requeue unacknowledged events from " + processingKey, e);
    }
    if (recovered > 0) {
      logger.log(Level.INFO, "Requeued {0} unacknowledged event(s) from {1}",
          new Object[] {recovered, processingKey});
    }
  }

  private static String abbreviate(String raw) {
    if (raw == null) {
      return "null";
    }
    return raw.length() <= 120 ? raw : raw.substring(0, 120) + "...";
  }

  private static void sleepQuietly(long ms) {
    try {
      Thread.sleep(ms);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Stops popping, waits for in-flight handler tasks up to the drain timeout, then interrupts
   * the remainder. Events whose tasks did not finish stay in the processing list.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    running = false;
    if (loopExecutor != null) {
      loopExecutor.shutdown();
      try {
        if (!loopExecutor.awaitTermination(popTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
          loopExecutor.shutdownNow();
        }
      } catch (InterruptedException e) {
        loopExecutor.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    tasks.close();
  }

  /** Builder for {@link DispatchLoop}. */
  public static final class Builder {
    private KeyValueStore store;
    private StoreKeys keys;
    private EventDecoder decoder;
    private HandlerRegistry handlerRegistry;
    private String consumerId;
    private int maxConcurrency = 100;
    private Duration popTimeout = Duration.ofSeconds(1);
    private long drainTimeoutMs = 5000;
    private long storeErrorBackoffMs = 1000;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the store holding the event queue.
     *
     * <p><b>Required.</b>
     *
     * @param store the shared store
     * @return this builder
     */
    public Builder store(KeyValueStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the key layout.
     *
     * <p>Optional. Defaults to {@link StoreKeys#DEFAULT_PREFIX}.
     *
     * @param keys key layout
     * @return this builder
     */
    public Builder keys(StoreKeys keys) {
      this.keys = keys;
      return this;
    }

    /**
     * Sets the payload decoder.
     *
     * <p>Optional. Defaults to {@link FlatEventDecoder}.
     *
     * @param decoder the decoder
     * @return this builder
     */
    public Builder decoder(EventDecoder decoder) {
      this.decoder = decoder;
      return this;
    }

    /**
     * Sets the registry that routes event kinds to handlers.
     *
     * <p><b>Required.</b>
     *
     * @param handlerRegistry the registry
     * @return this builder
     */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Sets the id naming this process's processing list. It must be unique among running
     * processes and stable across restarts of the same process, so a restarted process
     * recovers the events it had popped.
     *
     * <p><b>Required.</b>
     *
     * @param consumerId per-process id, such as a host or pod name
     * @return this builder
     */
    public Builder consumerId(String consumerId) {
      this.consumerId = consumerId;
      return this;
    }

    /**
     * Sets the number of admission slots.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &ge; 1.
     *
     * @param maxConcurrency concurrent handler tasks
     * @return this builder
     */
    public Builder maxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    /**
     * Sets how long one blocking pop waits before the loop checks for shutdown.
     *
     * <p>Optional. Defaults to 1 second. Must be &gt; 0.
     *
     * @param popTimeout blocking pop timeout
     * @return this builder
     */
    public Builder popTimeout(Duration popTimeout) {
      this.popTimeout = popTimeout;
      return this;
    }

    /**
     * Sets how long {@link DispatchLoop#close()} waits for in-flight tasks.
     *
     * <p>Optional. Defaults to {@code 5000}. Must be &ge; 0.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the pause after a store failure.
     *
     * <p>Optional. Defaults to {@code 1000}.
     *
     * @param storeErrorBackoffMs pause in milliseconds
     * @return this builder
     */
    public Builder storeErrorBackoffMs(long storeErrorBackoffMs) {
      this.storeErrorBackoffMs = storeErrorBackoffMs;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public DispatchLoop build() {
      return new DispatchLoop(this);
    }
  }
}
