package outreach.handler;

import outreach.EventHandler;
import outreach.InboundEvent;
import outreach.payment.ExternalIds;
import outreach.payment.PaymentReconciler;
import outreach.payment.PaymentRecord;
import outreach.payment.PaymentRepository;
import outreach.payment.ReconcileOutcome;
import outreach.spi.CallResult;
import outreach.spi.ChatMessage;
import outreach.spi.PaymentGateway;

import java.util.Objects;
import java.util.Optional;

/**
 * Handles {@code VERIFY_PAYMENT}: asks the gateway right away instead of waiting for the
 * poller, reconciles, and tells the subject where the payment stands.
 */
public final class VerifyPaymentHandler implements EventHandler {

  private final PaymentRepository payments;
  private final PaymentGateway gateway;
  private final PaymentReconciler reconciler;
  private final ChatReplies replies;
  private final Messages messages;

  public VerifyPaymentHandler(PaymentRepository payments, PaymentGateway gateway,
      PaymentReconciler reconciler, ChatReplies replies, Messages messages) {
    this.payments = Objects.requireNonNull(payments, "payments");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.replies = Objects.requireNonNull(replies, "replies");
    this.messages = Objects.requireNonNull(messages, "messages");
  }

  @Override
  public void handle(InboundEvent event) {
    String subjectId = event.subjectId();
    String chatId = event.replyChatId();
    Optional<PaymentRecord> found = payments.find(subjectId);
    if (found.isEmpty() || found.get().transactionId() == null) {
      replies.send(subjectId, ChatMessage.text(chatId, messages.noPayment()));
      return;
    }
    PaymentRecord record = found.get();
    if (record.isConfirmed()) {
      replies.send(subjectId, ChatMessage.text(chatId, messages.paymentConfirmed()));
      return;
    }

    CallResult<String> status = gateway.fetchStatus(record.transactionId());
    if (!(status instanceof CallResult.Success<String> success)) {
      replies.send(subjectId, ChatMessage.text(chatId, messages.paymentPending()));
      return;
    }
    ReconcileOutcome outcome =
        reconciler.reconcile(subjectId, success.value(), ExternalIds.ofTransaction(record.transactionId()));
    String text = switch (outcome) {
      case CONFIRMED, ALREADY_CONFIRMED -> messages.paymentConfirmed();
      case PENDING -> messages.paymentPending();
      case FAILED -> messages.paymentFailed();
    };
    replies.send(subjectId, ChatMessage.text(chatId, text));
  }
}
