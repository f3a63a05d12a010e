package outreach.payment;

import java.util.Locale;
import java.util.Map;

/**
 * Maps gateway-specific status strings and webhook event types to {@link PaymentStatus}.
 *
 * <p>The mapping is a fixed table shared by every gateway. Matching ignores case and
 * surrounding whitespace; a missing or blank status counts as pending.
 */
public final class StatusNormalizer {

  private static final Map<String, PaymentStatus> STATUSES = Map.ofEntries(
      Map.entry("OK", PaymentStatus.OK),
      Map.entry("PAID", PaymentStatus.OK),
      Map.entry("COMPLETE", PaymentStatus.OK),
      Map.entry("COMPLETED", PaymentStatus.OK),
      Map.entry("APPROVED", PaymentStatus.OK),
      Map.entry("TRANSACTION_PAID", PaymentStatus.OK),
      Map.entry("PENDING", PaymentStatus.PENDING),
      Map.entry("TRANSACTION_CREATED", PaymentStatus.PENDING),
      Map.entry("WAITING_PAYMENT", PaymentStatus.PENDING),
      Map.entry("CREATED", PaymentStatus.PENDING),
      Map.entry("PROCESSING", PaymentStatus.PENDING),
      Map.entry("OPEN", PaymentStatus.PENDING),
      Map.entry("UNPAID", PaymentStatus.PENDING),
      Map.entry("FAILED", PaymentStatus.FAILED),
      Map.entry("CANCELED", PaymentStatus.CANCELED),
      Map.entry("CANCELLED", PaymentStatus.CANCELED),
      Map.entry("EXPIRED", PaymentStatus.EXPIRED),
      Map.entry("REFUNDED", PaymentStatus.REFUNDED),
      Map.entry("CHARGEBACK", PaymentStatus.CHARGEBACK),
      Map.entry("ERROR", PaymentStatus.ERROR));

  private static final Map<String, PaymentStatus> EVENT_TYPES = Map.of(
      "checkout.session.completed", PaymentStatus.OK,
      "checkout.session.async_payment_succeeded", PaymentStatus.OK,
      "checkout.session.expired", PaymentStatus.EXPIRED,
      "checkout.session.async_payment_failed", PaymentStatus.FAILED);

  private StatusNormalizer() {
  }

  public static PaymentStatus normalize(String rawStatus) {
    if (rawStatus == null || rawStatus.isBlank()) {
      return PaymentStatus.PENDING;
    }
    return STATUSES.getOrDefault(rawStatus.trim().toUpperCase(Locale.ROOT), PaymentStatus.UNKNOWN);
  }

  /**
   * Normalizes a webhook signal. A known event type wins over the status field.
   */
  public static PaymentStatus normalize(String eventType, String rawStatus) {
    if (eventType != null) {
      PaymentStatus byType = EVENT_TYPES.get(eventType.trim());
      if (byType != null) {
        return byType;
      }
    }
    return normalize(rawStatus);
  }
}
