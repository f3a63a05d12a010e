package outreach.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import outreach.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code outreach.events.dispatched}: events handled without error</li>
 *   <li>{@code outreach.events.failed}: events whose handler threw</li>
 *   <li>{@code outreach.events.dropped}: events that could not be decoded or routed</li>
 *   <li>{@code outreach.followups.fired}: followups sent</li>
 *   <li>{@code outreach.followups.skipped}: due entries consumed without a send</li>
 *   <li>{@code outreach.payments.confirmed}: payments confirmed for the first time</li>
 *   <li>{@code outreach.payments.failed}: payments that ended in a failure status</li>
 *   <li>{@code outreach.webhooks.rejected}: gateway webhooks with a bad signature</li>
 *   <li>{@code outreach.retry.delivered}: retried notifications delivered</li>
 *   <li>{@code outreach.retry.requeued}: retried notifications queued again</li>
 *   <li>{@code outreach.retry.dropped}: retried notifications given up on</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code outreach.dispatch.in_flight}: handler tasks holding an admission slot</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter dispatched;
  private final Counter failed;
  private final Counter dropped;
  private final Counter followupsFired;
  private final Counter followupsSkipped;
  private final Counter paymentsConfirmed;
  private final Counter paymentsFailed;
  private final Counter webhooksRejected;
  private final Counter retryDelivered;
  private final Counter retryRequeued;
  private final Counter retryDropped;
  private final Gauge inFlightGauge;

  private final AtomicInteger inFlight = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "outreach"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "outreach");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "shop.outreach"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.dispatched = counter(namePrefix + ".events.dispatched", "Events handled without error");
    this.failed = counter(namePrefix + ".events.failed", "Events whose handler threw");
    this.dropped = counter(namePrefix + ".events.dropped", "Events that could not be decoded or routed");
    this.followupsFired = counter(namePrefix + ".followups.fired", "Followups sent");
    this.followupsSkipped = counter(namePrefix + ".followups.skipped", "Due entries consumed without a send");
    this.paymentsConfirmed = counter(namePrefix + ".payments.confirmed", "Payments confirmed");
    this.paymentsFailed = counter(namePrefix + ".payments.failed", "Payments ended in a failure status");
    this.webhooksRejected = counter(namePrefix + ".webhooks.rejected", "Gateway webhooks with a bad signature");
    this.retryDelivered = counter(namePrefix + ".retry.delivered", "Retried notifications delivered");
    this.retryRequeued = counter(namePrefix + ".retry.requeued", "Retried notifications queued again");
    this.retryDropped = counter(namePrefix + ".retry.dropped", "Retried notifications given up on");

    this.inFlightGauge = Gauge.builder(namePrefix + ".dispatch.in_flight", inFlight, AtomicInteger::get)
        .description("Handler tasks holding an admission slot")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementEventsDispatched() {
    if (closed) return;
    dispatched.increment();
  }

  @Override
  public void incrementEventsFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementEventsDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void recordInFlight(int inFlight) {
    if (closed) return;
    this.inFlight.set(inFlight);
  }

  @Override
  public void incrementFollowupsFired() {
    if (closed) return;
    followupsFired.increment();
  }

  @Override
  public void incrementFollowupsSkipped() {
    if (closed) return;
    followupsSkipped.increment();
  }

  @Override
  public void incrementPaymentsConfirmed() {
    if (closed) return;
    paymentsConfirmed.increment();
  }

  @Override
  public void incrementPaymentsFailed() {
    if (closed) return;
    paymentsFailed.increment();
  }

  @Override
  public void incrementWebhooksRejected() {
    if (closed) return;
    webhooksRejected.increment();
  }

  @Override
  public void incrementRetryDelivered() {
    if (closed) return;
    retryDelivered.increment();
  }

  @Override
  public void incrementRetryRequeued() {
    if (closed) return;
    retryRequeued.increment();
  }

  @Override
  public void incrementRetryDropped() {
    if (closed) return;
    retryDropped.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link outreach.Outreach#close()} calls this, so a closed engine leaves no stale
   * gauges behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(dispatched, failed, dropped, followupsFired, followupsSkipped,
        paymentsConfirmed, paymentsFailed, webhooksRejected,
        retryDelivered, retryRequeued, retryDropped, inFlightGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
