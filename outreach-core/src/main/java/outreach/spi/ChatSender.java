package outreach.spi;

/**
 * Chat-channel sender. Implementations wrap the chat platform's HTTP client and apply their
 * own request timeouts.
 */
@FunctionalInterface
public interface ChatSender {

  /**
   * Sends one message. A recipient that blocked the bot must be reported as
   * {@link ErrorKind#FORBIDDEN}.
   */
  CallResult<Void> send(ChatMessage message);
}
