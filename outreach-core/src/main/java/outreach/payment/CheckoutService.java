package outreach.payment;

import outreach.funnel.FunnelRecorder;
import outreach.spi.CallResult;
import outreach.spi.PaymentGateway;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates gateway checkouts, reusing a recent pending one for the same amount.
 */
public final class CheckoutService {
  private static final Logger logger = Logger.getLogger(CheckoutService.class.getName());

  public static final Duration DEFAULT_REUSE_WINDOW = Duration.ofMinutes(30);

  private final PaymentRepository payments;
  private final PaymentGateway gateway;
  private final FunnelRecorder funnel;
  private final Duration reuseWindow;
  private final Clock clock;

  public CheckoutService(PaymentRepository payments, PaymentGateway gateway, FunnelRecorder funnel,
      Duration reuseWindow, Clock clock) {
    this.payments = Objects.requireNonNull(payments, "payments");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.funnel = Objects.requireNonNull(funnel, "funnel");
    this.reuseWindow = Objects.requireNonNull(reuseWindow, "reuseWindow");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns a checkout the subject can pay.
   *
   * <p>A confirmed payment is returned as is. A pending checkout for the same amount created
   * within the reuse window is returned without calling the gateway. Otherwise a new checkout
   * is created, stored and added to the pending index; a gateway failure is recorded for
   * support and returned.
   */
  public CallResult<PaymentRecord> checkout(String subjectId, BigDecimal amount) {
    Objects.requireNonNull(subjectId, "subjectId");
    Objects.requireNonNull(amount, "amount");
    Optional<PaymentRecord> existing = payments.find(subjectId);
    if (existing.isPresent()) {
      PaymentRecord record = existing.get();
      if (record.isConfirmed() || isReusable(record, amount)) {
        return CallResult.success(record);
      }
    }

    String identifier = subjectId + "-" + clock.millis();
    CallResult<PaymentGateway.Checkout> created =
        gateway.createCheckout(new PaymentGateway.CheckoutRequest(subjectId, identifier, amount));
    if (created instanceof CallResult.Failure<PaymentGateway.Checkout> failure) {
      payments.recordError(subjectId, failure.kind(), failure.message());
      funnel.record("checkout_failed", subjectId, Map.of("kind", failure.kind().name()));
      logger.log(Level.WARNING, "Checkout creation failed for subject {0}: {1} {2}",
          new Object[] {subjectId, failure.kind(), failure.message()});
      return CallResult.failure(failure.kind(), failure.message());
    }
    PaymentGateway.Checkout checkout = ((CallResult.Success<PaymentGateway.Checkout>) created).value();
    payments.saveCheckout(subjectId, identifier, amount, checkout);
    funnel.record("checkout_created", subjectId, Map.of("amount", amount.toPlainString()));
    logger.log(Level.INFO, "Checkout {0} created for subject {1}",
        new Object[] {checkout.transactionId(), subjectId});
    return CallResult.success(payments.find(subjectId).orElseThrow());
  }

  private boolean isReusable(PaymentRecord record, BigDecimal amount) {
    if (record.status() != PaymentStatus.PENDING
        || record.checkoutUrl() == null || record.checkoutUrl().isEmpty()
        || record.amount() == null || record.amount().compareTo(amount) != 0
        || record.createdAt() == null) {
      return false;
    }
    Instant cutoff = clock.instant().minus(reuseWindow);
    return record.createdAt().isAfter(cutoff);
  }
}
