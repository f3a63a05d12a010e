package outreach.spi;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Payment gateway client.
 */
public interface PaymentGateway {

  /**
   * Creates a hosted checkout for the given amount.
   *
   * @param request what to charge and the reference to echo back in callbacks
   * @return the created checkout on success
   */
  CallResult<Checkout> createCheckout(CheckoutRequest request);

  /**
   * Looks up the raw, gateway-specific status of a transaction.
   *
   * @param transactionId the gateway's transaction or session identifier
   * @return the raw status string on success
   */
  CallResult<String> fetchStatus(String transactionId);

  /**
   * @param subjectId  owning subject, echoed back as the client reference
   * @param identifier our reference for this checkout
   * @param amount     amount in the major currency unit
   */
  record CheckoutRequest(String subjectId, String identifier, BigDecimal amount) {
    public CheckoutRequest {
      Objects.requireNonNull(subjectId, "subjectId");
      Objects.requireNonNull(identifier, "identifier");
      Objects.requireNonNull(amount, "amount");
      if (amount.signum() <= 0) {
        throw new IllegalArgumentException("amount must be > 0");
      }
    }
  }

  /**
   * @param transactionId gateway transaction or session id
   * @param checkoutUrl   URL the subject opens to pay
   * @param rawStatus     status reported at creation time
   */
  record Checkout(String transactionId, String checkoutUrl, String rawStatus) {
    public Checkout {
      Objects.requireNonNull(transactionId, "transactionId");
      Objects.requireNonNull(checkoutUrl, "checkoutUrl");
    }
  }
}
