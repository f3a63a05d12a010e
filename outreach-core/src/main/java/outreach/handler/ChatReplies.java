package outreach.handler;

import outreach.spi.CallResult;
import outreach.spi.ChatMessage;
import outreach.spi.ChatSender;
import outreach.spi.ErrorKind;
import outreach.subject.SubjectRepository;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends chat messages on behalf of handlers. A {@link ErrorKind#FORBIDDEN} failure marks the
 * subject blocked and drops its due entry.
 */
public final class ChatReplies {
  private static final Logger logger = Logger.getLogger(ChatReplies.class.getName());

  private final ChatSender chatSender;
  private final SubjectRepository subjects;
  private final Consumer<String> cancelFollowup;

  /**
   * @param cancelFollowup drops a subject's due entry, usually
   *     {@code scheduler::unschedule}
   */
  public ChatReplies(ChatSender chatSender, SubjectRepository subjects, Consumer<String> cancelFollowup) {
    this.chatSender = Objects.requireNonNull(chatSender, "chatSender");
    this.subjects = Objects.requireNonNull(subjects, "subjects");
    this.cancelFollowup = Objects.requireNonNull(cancelFollowup, "cancelFollowup");
  }

  public CallResult<Void> send(String subjectId, ChatMessage message) {
    CallResult<Void> result = chatSender.send(message);
    if (result instanceof CallResult.Failure<Void> failure) {
      if (failure.kind() == ErrorKind.FORBIDDEN) {
        subjects.markBlocked(subjectId);
        cancelFollowup.accept(subjectId);
        logger.log(Level.INFO, "Subject {0} blocked the chat; followup cancelled", subjectId);
      } else {
        logger.log(Level.WARNING, "Message to subject {0} failed: {1} {2}",
            new Object[] {subjectId, failure.kind(), failure.message()});
      }
    }
    return result;
  }
}
