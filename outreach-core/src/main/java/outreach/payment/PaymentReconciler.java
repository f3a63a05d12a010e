package outreach.payment;

import outreach.delivery.AccessDelivery;
import outreach.delivery.DeliveryResult;
import outreach.funnel.FunnelRecorder;
import outreach.retry.NotificationPublisher;
import outreach.retry.SinkNames;
import outreach.schedule.DueTimeScheduler;
import outreach.spi.MetricsExporter;
import outreach.subject.Attribution;
import outreach.subject.SubjectRepository;
import outreach.util.JsonCodec;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Merges payment signals from the webhook and the poller into one state transition.
 *
 * <p>Both paths call {@link #reconcile}. The first {@link PaymentStatus#OK} seen wins the
 * single-key confirmation claim and runs the one-time side effects: access delivery, analytics
 * notifications and the {@code payment_confirmed} funnel event. Every later signal, whatever
 * its status, returns {@link ReconcileOutcome#ALREADY_CONFIRMED} and changes nothing.
 *
 * <p>Side effects after the claim never throw. A failed or throwing delivery is queued for the
 * {@link SinkNames#ACCESS_DELIVERY} retry sink, and the analytics notifications are published
 * regardless.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class PaymentReconciler {
  private static final Logger logger = Logger.getLogger(PaymentReconciler.class.getName());

  private final PaymentRepository payments;
  private final SubjectRepository subjects;
  private final DueTimeScheduler scheduler;
  private final AccessDelivery delivery;
  private final NotificationPublisher publisher;
  private final FunnelRecorder funnel;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final JsonCodec jsonCodec;

  private PaymentReconciler(Builder builder) {
    this.payments = Objects.requireNonNull(builder.payments, "payments");
    this.subjects = Objects.requireNonNull(builder.subjects, "subjects");
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.delivery = Objects.requireNonNull(builder.delivery, "delivery");
    this.publisher = Objects.requireNonNull(builder.publisher, "publisher");
    this.funnel = Objects.requireNonNull(builder.funnel, "funnel");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.jsonCodec = JsonCodec.getDefault();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Normalizes {@code rawStatus} and reconciles.
   */
  public ReconcileOutcome reconcile(String subjectId, String rawStatus, ExternalIds ids) {
    return reconcile(subjectId, StatusNormalizer.normalize(rawStatus), rawStatus, ids);
  }

  /**
   * Applies an already normalized status.
   *
   * @param subjectId the resolved subject
   * @param status    normalized status
   * @param rawStatus the gateway's own wording, stored for support
   * @param ids       identifiers carried by the signal, mapped to the subject
   */
  public ReconcileOutcome reconcile(String subjectId, PaymentStatus status, String rawStatus, ExternalIds ids) {
    Objects.requireNonNull(subjectId, "subjectId");
    Objects.requireNonNull(status, "status");
    payments.recordIdentifiers(subjectId, ids != null ? ids : ExternalIds.NONE);

    if (status.isPaid()) {
      return confirm(subjectId, rawStatus);
    }
    if (payments.isConfirmed(subjectId)) {
      logger.log(Level.FINE, "Ignoring {0} for confirmed subject {1}", new Object[] {status, subjectId});
      return ReconcileOutcome.ALREADY_CONFIRMED;
    }
    payments.recordStatus(subjectId, status, rawStatus);
    if (status.isPending()) {
      return ReconcileOutcome.PENDING;
    }

    if (payments.removePending(subjectId)) {
      metrics.incrementPaymentsFailed();
      funnel.record("payment_failed", subjectId, Map.of("status", status.name()));
      logger.log(Level.INFO, "Payment for subject {0} ended as {1}", new Object[] {subjectId, status});
    }
    return ReconcileOutcome.FAILED;
  }

  private ReconcileOutcome confirm(String subjectId, String rawStatus) {
    subjects.markPaid(subjectId);
    payments.removePending(subjectId);
    scheduler.unschedule(subjectId);
    if (!payments.claimConfirmation(subjectId)) {
      return ReconcileOutcome.ALREADY_CONFIRMED;
    }

    // Past the claim nothing may throw; a later OK would not run these again.
    try {
      payments.recordStatus(subjectId, PaymentStatus.OK, rawStatus);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to record OK status for subject " + subjectId, e);
    }
    metrics.incrementPaymentsConfirmed();
    funnel.record("payment_confirmed", subjectId);
    logger.log(Level.INFO, "Payment confirmed for subject {0}", subjectId);

    deliverAccess(subjectId);

    PaymentRecord record = findQuietly(subjectId);
    Map<String, String> attribution = attributionQuietly(subjectId);
    publish(SinkNames.ANALYTICS_ORDER, subjectId, () -> orderPayload(subjectId, record, attribution));
    publish(SinkNames.ANALYTICS_EVENT, subjectId, () -> purchasePayload(subjectId, record, attribution));
    return ReconcileOutcome.CONFIRMED;
  }

  private void deliverAccess(String subjectId) {
    String reason;
    try {
      DeliveryResult result = delivery.deliverIfNeeded(subjectId, false);
      if (!result.failed()) {
        return;
      }
      reason = "delivery failed: " + result.error();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Access delivery for subject " + subjectId + " threw; queueing a retry", e);
      reason = "delivery failed: " + e;
    }
    try {
      publisher.defer(SinkNames.ACCESS_DELIVERY, subjectId, reason);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Could not queue access delivery for subject " + subjectId, e);
    }
  }

  private PaymentRecord findQuietly(String subjectId) {
    try {
      return payments.find(subjectId).orElse(null);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to read payment record for subject " + subjectId, e);
      return null;
    }
  }

  private Map<String, String> attributionQuietly(String subjectId) {
    try {
      return subjects.attribution(subjectId);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to read attribution for subject " + subjectId, e);
      return Map.of();
    }
  }

  private void publish(String sink, String subjectId, Supplier<String> payload) {
    try {
      publisher.publish(sink, payload.get());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Could not publish or queue " + sink + " for subject " + subjectId, e);
    }
  }

  private String orderPayload(String subjectId, PaymentRecord record, Map<String, String> attribution) {
    Map<String, String> order = new LinkedHashMap<>();
    order.put("subject_id", subjectId);
    if (record != null) {
      putIfPresent(order, "transaction_id", record.transactionId());
      putIfPresent(order, "identifier", record.identifier());
      if (record.amount() != null) {
        order.put("amount", record.amount().toPlainString());
      }
    }
    order.put("status", PaymentStatus.OK.name());
    putTracked(order, attribution);
    order.put("ts", Long.toString(clock.instant().getEpochSecond()));
    return jsonCodec.toJson(order);
  }

  private String purchasePayload(String subjectId, PaymentRecord record, Map<String, String> attribution) {
    Map<String, String> event = new LinkedHashMap<>();
    event.put("event", "purchase");
    event.put("subject_id", subjectId);
    if (record != null && record.amount() != null) {
      event.put("value", record.amount().toPlainString());
    }
    putTracked(event, attribution);
    event.put("ts", Long.toString(clock.instant().getEpochSecond()));
    return jsonCodec.toJson(event);
  }

  private static void putTracked(Map<String, String> payload, Map<String, String> attribution) {
    for (String field : Attribution.TRACKED_FIELDS) {
      putIfPresent(payload, field, attribution.get(field));
    }
  }

  private static void putIfPresent(Map<String, String> map, String key, String value) {
    if (value != null && !value.isEmpty()) {
      map.put(key, value);
    }
  }

  /** Builder for {@link PaymentReconciler}. */
  public static final class Builder {
    private PaymentRepository payments;
    private SubjectRepository subjects;
    private DueTimeScheduler scheduler;
    private AccessDelivery delivery;
    private NotificationPublisher publisher;
    private FunnelRecorder funnel;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /** Required. */
    public Builder payments(PaymentRepository payments) {
      this.payments = payments;
      return this;
    }

    /** Required. */
    public Builder subjects(SubjectRepository subjects) {
      this.subjects = subjects;
      return this;
    }

    /**
     * Sets the scheduler whose due entry is cancelled on confirmation.
     *
     * <p><b>Required.</b>
     */
    public Builder scheduler(DueTimeScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /** Required. */
    public Builder delivery(AccessDelivery delivery) {
      this.delivery = delivery;
      return this;
    }

    /** Required. Analytics notifications and failed deliveries go through it. */
    public Builder publisher(NotificationPublisher publisher) {
      this.publisher = publisher;
      return this;
    }

    /** Required. */
    public Builder funnel(FunnelRecorder funnel) {
      this.funnel = funnel;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public PaymentReconciler build() {
      return new PaymentReconciler(this);
    }
  }
}
