package outreach.webhook;

import outreach.payment.ExternalIds;

import java.util.Objects;

/**
 * Payment signal extracted from a gateway webhook.
 *
 * @param eventType   gateway event type, may be {@code null}
 * @param rawStatus   status field of the payment object, may be {@code null}
 * @param subjectHint subject id echoed back by the gateway, may be {@code null}
 * @param ids         identifiers used to resolve the subject when no hint is present
 */
public record GatewayNotification(String eventType, String rawStatus, String subjectHint, ExternalIds ids) {

  public GatewayNotification {
    ids = Objects.requireNonNullElse(ids, ExternalIds.NONE);
  }
}
