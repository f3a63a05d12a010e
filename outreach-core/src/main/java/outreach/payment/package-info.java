/**
 * Payment state: checkouts, status normalization and reconciliation of webhook and polling
 * signals.
 *
 * <h2>Monotonic confirmation</h2>
 * <p>{@link outreach.payment.PaymentRepository#claimConfirmation} writes {@code confirmed_at}
 * with a put-if-absent. The write that succeeds runs the confirmation side effects; the field
 * is never removed, so a confirmed payment stays {@link outreach.payment.PaymentStatus#OK}
 * whatever order later signals arrive in.
 */
package outreach.payment;
