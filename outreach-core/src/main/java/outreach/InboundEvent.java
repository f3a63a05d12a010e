package outreach;

import java.util.Map;
import java.util.Objects;

/**
 * Decoded inbound event.
 *
 * @param eventId    identifier assigned by the channel, may be {@code null}
 * @param kind       routing tag
 * @param subjectId  subject the event belongs to
 * @param chatId     chat to answer in, may be {@code null}
 * @param text       message text, may be {@code null}
 * @param attributes kind-specific values (never {@code null})
 */
public record InboundEvent(
    String eventId,
    EventKind kind,
    String subjectId,
    String chatId,
    String text,
    Map<String, String> attributes) {

  public static final String ATTR_AMOUNT = "amount";
  public static final String ATTR_DATA = "data";

  public InboundEvent {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(subjectId, "subjectId");
    if (subjectId.isEmpty()) {
      throw new IllegalArgumentException("subjectId must not be empty");
    }
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public static InboundEvent of(EventKind kind, String subjectId, String chatId) {
    return new InboundEvent(null, kind, subjectId, chatId, null, Map.of());
  }

  public String attribute(String name) {
    return attributes.get(name);
  }

  /**
   * @return the chat to answer in, falling back to the subject id for private chats
   */
  public String replyChatId() {
    return chatId != null ? chatId : subjectId;
  }
}
