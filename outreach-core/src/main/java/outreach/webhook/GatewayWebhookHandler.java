package outreach.webhook;

import outreach.payment.PaymentReconciler;
import outreach.payment.PaymentRepository;
import outreach.payment.PaymentStatus;
import outreach.payment.ReconcileOutcome;
import outreach.payment.StatusNormalizer;
import outreach.spi.MetricsExporter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Push path of payment reconciliation.
 *
 * <p>Only a bad signature is answered with {@link WebhookResponse#REJECTED}. Every other
 * outcome, including unreadable bodies, unresolved subjects and internal errors, is
 * acknowledged so the gateway does not redeliver; the poller catches up on anything missed.
 */
public final class GatewayWebhookHandler {
  private static final Logger logger = Logger.getLogger(GatewayWebhookHandler.class.getName());

  private final SignatureVerifier verifier;
  private final GatewayEventParser parser;
  private final PaymentRepository payments;
  private final PaymentReconciler reconciler;
  private final MetricsExporter metrics;

  public GatewayWebhookHandler(SignatureVerifier verifier, GatewayEventParser parser,
      PaymentRepository payments, PaymentReconciler reconciler, MetricsExporter metrics) {
    this.verifier = Objects.requireNonNull(verifier, "verifier");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.payments = Objects.requireNonNull(payments, "payments");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public WebhookResponse handle(String body, String signatureHeader) {
    if (!verifier.verify(body, signatureHeader)) {
      metrics.incrementWebhooksRejected();
      logger.log(Level.WARNING, "Rejected gateway webhook with an invalid signature");
      return WebhookResponse.REJECTED;
    }
    try {
      GatewayNotification notification = parser.parse(body);
      String subjectId = resolve(notification);
      if (subjectId == null) {
        logger.log(Level.WARNING, "Gateway webhook {0} matches no subject; ids={1}",
            new Object[] {notification.eventType(), notification.ids().all()});
        return WebhookResponse.OK;
      }
      PaymentStatus status = StatusNormalizer.normalize(notification.eventType(), notification.rawStatus());
      String raw = notification.rawStatus() != null ? notification.rawStatus() : notification.eventType();
      ReconcileOutcome outcome = reconciler.reconcile(subjectId, status, raw, notification.ids());
      logger.log(Level.FINE, "Gateway webhook for subject {0}: {1}", new Object[] {subjectId, outcome});
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Ignoring unreadable gateway webhook: {0}", e.getMessage());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Gateway webhook processing failed", e);
    }
    return WebhookResponse.OK;
  }

  private String resolve(GatewayNotification notification) {
    String hint = notification.subjectHint();
    if (hint != null && !hint.isEmpty()) {
      return hint;
    }
    for (String id : notification.ids().all()) {
      String subjectId = payments.resolve(id);
      if (subjectId != null) {
        return subjectId;
      }
    }
    return null;
  }
}
