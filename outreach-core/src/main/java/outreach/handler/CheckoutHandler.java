package outreach.handler;

import outreach.EventHandler;
import outreach.InboundEvent;
import outreach.payment.CheckoutService;
import outreach.payment.PaymentRecord;
import outreach.spi.CallResult;
import outreach.spi.ChatMessage;
import outreach.subject.SubjectRepository;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Handles {@code BUY}: answers with a checkout link, or asks to try again when the gateway
 * fails. A missing or invalid {@code amount} attribute falls back to the default offer.
 */
public final class CheckoutHandler implements EventHandler {

  private final SubjectRepository subjects;
  private final CheckoutService checkouts;
  private final ChatReplies replies;
  private final Messages messages;
  private final BigDecimal defaultAmount;

  public CheckoutHandler(SubjectRepository subjects, CheckoutService checkouts, ChatReplies replies,
      Messages messages, BigDecimal defaultAmount) {
    this.subjects = Objects.requireNonNull(subjects, "subjects");
    this.checkouts = Objects.requireNonNull(checkouts, "checkouts");
    this.replies = Objects.requireNonNull(replies, "replies");
    this.messages = Objects.requireNonNull(messages, "messages");
    this.defaultAmount = Objects.requireNonNull(defaultAmount, "defaultAmount");
  }

  @Override
  public void handle(InboundEvent event) {
    String subjectId = event.subjectId();
    String chatId = event.replyChatId();
    subjects.register(subjectId, chatId);

    BigDecimal amount = Offers.parseAmount(event.attribute(InboundEvent.ATTR_AMOUNT));
    CallResult<PaymentRecord> result = checkouts.checkout(subjectId, amount != null ? amount : defaultAmount);
    if (!(result instanceof CallResult.Success<PaymentRecord> success)) {
      replies.send(subjectId, ChatMessage.text(chatId, messages.tryAgain()));
      return;
    }
    PaymentRecord record = success.value();
    if (record.isConfirmed()) {
      replies.send(subjectId, ChatMessage.text(chatId, messages.paymentConfirmed()));
      return;
    }
    replies.send(subjectId, Offers.checkoutMessage(chatId, messages, record.checkoutUrl()));
  }
}
