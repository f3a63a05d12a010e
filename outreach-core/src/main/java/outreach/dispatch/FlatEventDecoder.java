package outreach.dispatch;

import outreach.EventKind;
import outreach.InboundEvent;
import outreach.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes flat JSON events such as
 * {@code {"kind":"BUY","subject_id":"42","chat_id":"42","amount":"19.90"}}.
 *
 * <p>The fields {@code kind}, {@code subject_id}, {@code event_id}, {@code chat_id} and
 * {@code text} are lifted into the record; everything else becomes an attribute.
 */
public final class FlatEventDecoder implements EventDecoder {
  private final JsonCodec jsonCodec;

  public FlatEventDecoder() {
    this(JsonCodec.getDefault());
  }

  public FlatEventDecoder(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public InboundEvent decode(String raw) {
    Map<String, String> fields = new LinkedHashMap<>(jsonCodec.parseObject(raw));
    String kind = fields.remove("kind");
    String subjectId = fields.remove("subject_id");
    if (kind == null || subjectId == null) {
      throw new IllegalArgumentException("Event requires kind and subject_id");
    }
    EventKind eventKind;
    try {
      eventKind = EventKind.valueOf(kind.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown event kind: " + kind, e);
    }
    return new InboundEvent(
        fields.remove("event_id"),
        eventKind,
        subjectId,
        fields.remove("chat_id"),
        fields.remove("text"),
        fields);
  }

  /**
   * Encodes an event in the format this decoder reads.
   */
  public String encode(InboundEvent event) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("kind", event.kind().name());
    fields.put("subject_id", event.subjectId());
    if (event.eventId() != null) {
      fields.put("event_id", event.eventId());
    }
    if (event.chatId() != null) {
      fields.put("chat_id", event.chatId());
    }
    if (event.text() != null) {
      fields.put("text", event.text());
    }
    fields.putAll(event.attributes());
    return jsonCodec.toJson(fields);
  }
}
