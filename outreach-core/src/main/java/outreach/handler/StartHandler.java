package outreach.handler;

import outreach.EventHandler;
import outreach.InboundEvent;
import outreach.delivery.AccessDelivery;
import outreach.funnel.FunnelRecorder;
import outreach.schedule.DueTimeScheduler;
import outreach.spi.ChatMessage;
import outreach.subject.Attribution;
import outreach.subject.SubjectRepository;
import outreach.util.TrackedTasks;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Handles {@code START}: registers the subject, stores the campaign attribution carried by the
 * start parameter, starts a new followup cycle and greets.
 *
 * <p>A paid subject gets its access link again instead of the offer.
 */
public final class StartHandler implements EventHandler {

  public static final Duration DEFAULT_FOLLOWUP_DELAY = Duration.ofSeconds(360);
  public static final Duration DEFAULT_SECOND_MESSAGE_DELAY = Duration.ofSeconds(5);

  private final SubjectRepository subjects;
  private final DueTimeScheduler scheduler;
  private final AccessDelivery delivery;
  private final FunnelRecorder funnel;
  private final ChatReplies replies;
  private final TrackedTasks delayedTasks;
  private final Messages messages;
  private final BigDecimal offerAmount;
  private final Duration followupDelay;
  private final Duration secondMessageDelay;

  public StartHandler(SubjectRepository subjects, DueTimeScheduler scheduler, AccessDelivery delivery,
      FunnelRecorder funnel, ChatReplies replies, TrackedTasks delayedTasks, Messages messages,
      BigDecimal offerAmount, Duration followupDelay, Duration secondMessageDelay) {
    this.subjects = Objects.requireNonNull(subjects, "subjects");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.delivery = Objects.requireNonNull(delivery, "delivery");
    this.funnel = Objects.requireNonNull(funnel, "funnel");
    this.replies = Objects.requireNonNull(replies, "replies");
    this.delayedTasks = Objects.requireNonNull(delayedTasks, "delayedTasks");
    this.messages = Objects.requireNonNull(messages, "messages");
    this.offerAmount = Objects.requireNonNull(offerAmount, "offerAmount");
    this.followupDelay = Objects.requireNonNull(followupDelay, "followupDelay");
    this.secondMessageDelay = Objects.requireNonNull(secondMessageDelay, "secondMessageDelay");
  }

  @Override
  public void handle(InboundEvent event) {
    String subjectId = event.subjectId();
    String chatId = event.replyChatId();
    subjects.register(subjectId, chatId);
    subjects.saveAttribution(subjectId, Attribution.parse(Attribution.startParameter(event.text())));
    subjects.clearBlocked(subjectId);
    funnel.record("start", subjectId);

    if (subjects.isPaid(subjectId)) {
      delivery.deliverIfNeeded(subjectId, true);
      return;
    }

    scheduler.reset(subjectId);
    scheduler.schedule(subjectId, followupDelay);

    ChatMessage welcome = new ChatMessage(chatId, messages.welcome(),
        List.of(ChatMessage.Button.callback(messages.buyButton(), Offers.buyCallback(offerAmount))));
    if (!replies.send(subjectId, welcome).isSuccess()) {
      return;
    }
    delayedTasks.schedule(() -> {
      if (!subjects.isPaid(subjectId) && !subjects.isBlocked(subjectId)) {
        replies.send(subjectId, ChatMessage.text(chatId, messages.secondMessage()));
      }
    }, secondMessageDelay);
  }
}
