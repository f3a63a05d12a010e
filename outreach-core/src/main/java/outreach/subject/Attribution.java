package outreach.subject;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Campaign attribution carried by a {@code /start} deep-link parameter.
 *
 * <p>The parameter is either a query string ({@code utm_source=ads&utm_campaign=spring}) or
 * the same query string base64url-encoded, since chat deep links only allow
 * {@code [A-Za-z0-9_-]}. Anything else carries no attribution.
 */
public final class Attribution {
  private static final Logger logger = Logger.getLogger(Attribution.class.getName());

  /** Fields copied into order and purchase notifications. */
  public static final List<String> TRACKED_FIELDS = List.of(
      "utm_source", "utm_medium", "utm_campaign", "utm_content", "utm_term", "fbclid");

  static final int MAX_FIELDS = 20;
  static final int MAX_VALUE_LENGTH = 400;

  private Attribution() {}

  /**
   * Extracts the parameter of a {@code /start <param>} message.
   *
   * @return the parameter, or an empty string when there is none
   */
  public static String startParameter(String text) {
    if (text == null) {
      return "";
    }
    String trimmed = text.strip();
    int space = trimmed.indexOf(' ');
    return space < 0 ? "" : trimmed.substring(space + 1).strip();
  }

  /**
   * Parses a start parameter. The first value of a repeated field wins; blank values are kept.
   *
   * @return attribution fields in parameter order, empty when the parameter carries none
   */
  public static Map<String, String> parse(String parameter) {
    if (parameter == null || parameter.isBlank()) {
      return Map.of();
    }
    String raw = parameter.strip();
    if (raw.indexOf('=') >= 0) {
      return parseQuery(raw);
    }
    String decoded;
    try {
      decoded = new String(Base64.getUrlDecoder().decode(raw), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      logger.log(Level.FINE, "Start parameter is neither a query string nor base64url: {0}", raw);
      return Map.of();
    }
    return decoded.indexOf('=') >= 0 ? parseQuery(decoded) : Map.of();
  }

  private static Map<String, String> parseQuery(String query) {
    Map<String, String> fields = new LinkedHashMap<>();
    for (String pair : query.split("&")) {
      if (pair.isEmpty() || fields.size() >= MAX_FIELDS) {
        continue;
      }
      int eq = pair.indexOf('=');
      String name = decode(eq < 0 ? pair : pair.substring(0, eq));
      String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
      if (name == null || name.isBlank() || value == null) {
        continue;
      }
      if (value.length() > MAX_VALUE_LENGTH) {
        value = value.substring(0, MAX_VALUE_LENGTH);
      }
      fields.putIfAbsent(name.strip(), value);
    }
    return fields;
  }

  private static String decode(String part) {
    try {
      return URLDecoder.decode(part, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      logger.log(Level.FINE, "Skipping undecodable attribution field {0}", part);
      return null;
    }
  }
}
