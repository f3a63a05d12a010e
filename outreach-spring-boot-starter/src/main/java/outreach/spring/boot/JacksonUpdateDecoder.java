package outreach.spring.boot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import outreach.EventKind;
import outreach.InboundEvent;
import outreach.dispatch.EventDecoder;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decodes Telegram Bot API updates as pushed to the ingress endpoint.
 *
 * <ul>
 *   <li>{@code callback_query} becomes {@link EventKind#CALLBACK} with the button data in
 *   {@link InboundEvent#ATTR_DATA}</li>
 *   <li>a text message starting with {@code /start} (optionally {@code /start@bot}) becomes
 *   {@link EventKind#START}</li>
 *   <li>any other text message becomes {@link EventKind#MESSAGE}</li>
 * </ul>
 *
 * <p>Other update types and messages without text decode to {@code null} and are skipped.
 * The subject is the sender's user id; {@code update_id} becomes the event id.
 */
public final class JacksonUpdateDecoder implements EventDecoder {

  public static final String ATTR_USERNAME = "username";

  private static final Pattern START = Pattern.compile("^/start(?:@\\w+)?(?:\\s|$)", Pattern.CASE_INSENSITIVE);

  private final ObjectMapper objectMapper;

  public JacksonUpdateDecoder(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public InboundEvent decode(String raw) {
    JsonNode update = JacksonNodes.readObject(objectMapper, raw, "update");
    String updateId = JacksonNodes.text(update, "update_id");

    JsonNode callback = update.get("callback_query");
    if (callback != null && callback.isObject()) {
      JsonNode from = callback.path("from");
      String subjectId = requireSubject(JacksonNodes.text(from, "id"));
      String chatId = JacksonNodes.text(callback.path("message").path("chat"), "id");
      Map<String, String> attributes = senderAttributes(from);
      String data = JacksonNodes.text(callback, "data");
      if (data != null) {
        attributes.put(InboundEvent.ATTR_DATA, data);
      }
      return new InboundEvent(updateId, EventKind.CALLBACK, subjectId, chatId, null, attributes);
    }

    JsonNode message = update.get("message");
    if (message == null || !message.isObject()) {
      return null;
    }
    String text = JacksonNodes.text(message, "text");
    if (text == null) {
      return null;
    }
    JsonNode from = message.path("from");
    String chatId = JacksonNodes.text(message.path("chat"), "id");
    String subjectId = requireSubject(JacksonNodes.text(from, "id"));
    EventKind kind = START.matcher(text).find() ? EventKind.START : EventKind.MESSAGE;
    return new InboundEvent(updateId, kind, subjectId, chatId, text, senderAttributes(from));
  }

  private static Map<String, String> senderAttributes(JsonNode from) {
    Map<String, String> attributes = new HashMap<>();
    String username = JacksonNodes.text(from, "username");
    if (username != null) {
      attributes.put(ATTR_USERNAME, username);
    }
    return attributes;
  }

  private static String requireSubject(String subjectId) {
    if (subjectId == null) {
      throw new IllegalArgumentException("Update carries no sender id");
    }
    return subjectId;
  }
}
