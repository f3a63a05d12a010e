package outreach.spring.boot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Tree helpers shared by the Jackson decoders.
 */
final class JacksonNodes {

  private JacksonNodes() {
  }

  /**
   * @throws IllegalArgumentException if {@code raw} is not a JSON object
   */
  static JsonNode readObject(ObjectMapper objectMapper, String raw, String what) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Empty " + what);
    }
    JsonNode node;
    try {
      node = objectMapper.readTree(raw);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unreadable " + what + ": " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException(what + " must be a JSON object");
    }
    return node;
  }

  /**
   * @return the field as text, or {@code null} when absent, null or empty
   */
  static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return null;
    }
    String text = value.asText();
    return text.isEmpty() ? null : text;
  }

  static String firstNonNull(String... values) {
    for (String value : values) {
      if (value != null) {
        return value;
      }
    }
    return null;
  }
}
