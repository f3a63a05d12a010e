package outreach.payment;

/**
 * Result of one {@link PaymentReconciler#reconcile} call.
 */
public enum ReconcileOutcome {
  /** This call confirmed the payment and ran the one-time side effects. */
  CONFIRMED,
  /** The payment was already confirmed; nothing changed. */
  ALREADY_CONFIRMED,
  /** Still pending; only the last-seen status was refreshed. */
  PENDING,
  /** Terminal failure recorded and the subject left the pending index. */
  FAILED
}
