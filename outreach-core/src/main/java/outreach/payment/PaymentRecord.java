package outreach.payment;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Snapshot of a subject's payment hash.
 *
 * @param subjectId     owning subject
 * @param transactionId gateway transaction or session id
 * @param identifier    our own reference sent to the gateway
 * @param status        effective status; {@link PaymentStatus#OK} once confirmed, whatever
 *                      later signals wrote
 * @param rawStatus     last raw status seen
 * @param amount        charged amount, may be {@code null}
 * @param checkoutUrl   URL the subject opens to pay, may be {@code null}
 * @param createdAt     checkout creation time, may be {@code null}
 * @param confirmedAt   first confirmation time, {@code null} until confirmed
 */
public record PaymentRecord(
    String subjectId,
    String transactionId,
    String identifier,
    PaymentStatus status,
    String rawStatus,
    BigDecimal amount,
    String checkoutUrl,
    Instant createdAt,
    Instant confirmedAt) {

  public boolean isConfirmed() {
    return confirmedAt != null;
  }
}
