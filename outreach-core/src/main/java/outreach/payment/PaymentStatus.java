package outreach.payment;

/**
 * Normalized payment status.
 */
public enum PaymentStatus {
  OK,
  PENDING,
  FAILED,
  CANCELED,
  EXPIRED,
  REFUNDED,
  CHARGEBACK,
  ERROR,
  /** A status outside the known vocabulary; treated as terminal. */
  UNKNOWN;

  public boolean isPaid() {
    return this == OK;
  }

  public boolean isPending() {
    return this == PENDING;
  }

  /**
   * @return {@code true} for every status that ends polling without a payment
   */
  public boolean isTerminalFailure() {
    return this != OK && this != PENDING;
  }
}
