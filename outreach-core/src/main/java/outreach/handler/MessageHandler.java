package outreach.handler;

import outreach.EventHandler;
import outreach.InboundEvent;
import outreach.spi.ChatMessage;

import java.util.Objects;

/**
 * Handles free text: {@code /ping} answers {@code pong}, other commands are ignored and
 * anything else gets an acknowledgement.
 */
public final class MessageHandler implements EventHandler {

  private final ChatReplies replies;
  private final Messages messages;

  public MessageHandler(ChatReplies replies, Messages messages) {
    this.replies = Objects.requireNonNull(replies, "replies");
    this.messages = Objects.requireNonNull(messages, "messages");
  }

  @Override
  public void handle(InboundEvent event) {
    String text = event.text() == null ? "" : event.text().trim();
    String reply;
    if ("/ping".equalsIgnoreCase(text)) {
      reply = messages.pong();
    } else if (text.startsWith("/")) {
      return;
    } else {
      reply = messages.acknowledgement();
    }
    replies.send(event.subjectId(), ChatMessage.text(event.replyChatId(), reply));
  }
}
