package outreach.handler;

import outreach.payment.PaymentRecord;
import outreach.payment.PaymentRepository;
import outreach.payment.PaymentStatus;
import outreach.schedule.DueAction;
import outreach.spi.ChatMessage;
import outreach.subject.Subject;
import outreach.subject.SubjectRepository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Followup sent when a subject's due entry comes up.
 *
 * <p>Paid, blocked and ownerless subjects, and subjects registered by another deployment, are
 * skipped. A subject with an open checkout is reminded of its link; anyone else gets the
 * offer again.
 */
public final class FollowupAction implements DueAction {
  private static final Logger logger = Logger.getLogger(FollowupAction.class.getName());

  private final SubjectRepository subjects;
  private final PaymentRepository payments;
  private final ChatReplies replies;
  private final Messages messages;
  private final BigDecimal offerAmount;

  public FollowupAction(SubjectRepository subjects, PaymentRepository payments, ChatReplies replies,
      Messages messages, BigDecimal offerAmount) {
    this.subjects = Objects.requireNonNull(subjects, "subjects");
    this.payments = Objects.requireNonNull(payments, "payments");
    this.replies = Objects.requireNonNull(replies, "replies");
    this.messages = Objects.requireNonNull(messages, "messages");
    this.offerAmount = Objects.requireNonNull(offerAmount, "offerAmount");
  }

  @Override
  public boolean fire(String subjectId) {
    Optional<Subject> found = subjects.find(subjectId);
    if (found.isEmpty()) {
      return false;
    }
    Subject subject = found.get();
    if (subject.paid() || subject.blocked() || !subject.ownedBy(subjects.ownerTag())) {
      logger.log(Level.FINE, "Skipping followup for subject {0}", subjectId);
      return false;
    }
    String chatId = subject.chatId() != null ? subject.chatId() : subjectId;

    ChatMessage message;
    Optional<PaymentRecord> payment = payments.find(subjectId);
    if (payment.isPresent() && payment.get().status() == PaymentStatus.PENDING
        && payment.get().checkoutUrl() != null) {
      message = ChatMessage.withLink(chatId, messages.reminder(), messages.checkoutButton(),
          payment.get().checkoutUrl());
    } else {
      message = new ChatMessage(chatId, messages.offer(),
          List.of(ChatMessage.Button.callback(messages.buyButton(), Offers.buyCallback(offerAmount))));
    }
    return replies.send(subjectId, message).isSuccess();
  }
}
