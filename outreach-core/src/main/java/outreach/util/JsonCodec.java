package outreach.util;

import java.util.Map;

/**
 * Codec between flat JSON objects and {@code Map<String, String>}.
 *
 * <p>Used for everything the engine itself writes to the store (retry items, funnel events,
 * analytics payloads) and for flat inbound events. Nested provider payloads are decoded by
 * pluggable parsers instead.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the shared zero-dependency implementation.
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes the map as a JSON object. {@code null} values are written as JSON {@code null};
   * a {@code null} or empty map encodes as {@code {}}.
   */
  String toJson(Map<String, String> fields);

  /**
   * Parses a flat JSON object. String, number and boolean values are returned as their text;
   * {@code null} values are skipped.
   *
   * @throws IllegalArgumentException if the input is not a flat JSON object
   */
  Map<String, String> parseObject(String json);
}
