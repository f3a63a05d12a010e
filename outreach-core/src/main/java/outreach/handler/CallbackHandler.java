package outreach.handler;

import outreach.EventHandler;
import outreach.EventKind;
import outreach.InboundEvent;
import outreach.funnel.FunnelRecorder;
import outreach.payment.PaymentRecord;
import outreach.payment.PaymentRepository;
import outreach.payment.PaymentStatus;
import outreach.spi.ChatMessage;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes button presses by their callback data.
 *
 * <ul>
 *   <li>{@code cta:buy:<amount>} goes to the checkout handler as a {@code BUY} event.</li>
 *   <li>{@code pay:verify} goes to the verify handler.</li>
 *   <li>{@code pay:show} resends the open checkout link.</li>
 * </ul>
 * Unknown data is ignored.
 */
public final class CallbackHandler implements EventHandler {
  private static final Logger logger = Logger.getLogger(CallbackHandler.class.getName());

  private final EventHandler checkout;
  private final EventHandler verify;
  private final PaymentRepository payments;
  private final ChatReplies replies;
  private final Messages messages;
  private final FunnelRecorder funnel;

  public CallbackHandler(EventHandler checkout, EventHandler verify, PaymentRepository payments,
      ChatReplies replies, Messages messages, FunnelRecorder funnel) {
    this.checkout = Objects.requireNonNull(checkout, "checkout");
    this.verify = Objects.requireNonNull(verify, "verify");
    this.payments = Objects.requireNonNull(payments, "payments");
    this.replies = Objects.requireNonNull(replies, "replies");
    this.messages = Objects.requireNonNull(messages, "messages");
    this.funnel = Objects.requireNonNull(funnel, "funnel");
  }

  @Override
  public void handle(InboundEvent event) throws Exception {
    String data = event.attribute(InboundEvent.ATTR_DATA);
    if (data == null) {
      data = "";
    }
    String subjectId = event.subjectId();
    if (data.startsWith(Offers.BUY_PREFIX)) {
      String amount = data.substring(Offers.BUY_PREFIX.length());
      funnel.record("cta_buy_clicked", subjectId, Map.of("amount", amount));
      checkout.handle(new InboundEvent(event.eventId(), EventKind.BUY, subjectId, event.chatId(), null,
          Map.of(InboundEvent.ATTR_AMOUNT, amount)));
    } else if (Offers.VERIFY.equals(data)) {
      funnel.record("verify_clicked", subjectId);
      verify.handle(new InboundEvent(event.eventId(), EventKind.VERIFY_PAYMENT, subjectId, event.chatId(),
          null, Map.of()));
    } else if (Offers.SHOW_CHECKOUT.equals(data)) {
      showCheckout(subjectId, event.replyChatId());
    } else {
      logger.log(Level.FINE, "Ignoring callback {0} from subject {1}", new Object[] {data, subjectId});
    }
  }

  private void showCheckout(String subjectId, String chatId) {
    Optional<PaymentRecord> record = payments.find(subjectId);
    if (record.isPresent() && record.get().status() == PaymentStatus.PENDING
        && record.get().checkoutUrl() != null) {
      funnel.record("checkout_reshown", subjectId);
      replies.send(subjectId, Offers.checkoutMessage(chatId, messages, record.get().checkoutUrl()));
    } else {
      replies.send(subjectId, ChatMessage.text(chatId, messages.noPayment()));
    }
  }
}
