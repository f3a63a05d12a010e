package outreach.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Zero-dependency {@link JsonCodec} for flat objects. Nested objects and arrays are rejected.
 */
final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  private DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> fields) {
    StringBuilder sb = new StringBuilder("{");
    if (fields != null) {
      boolean first = true;
      for (Map.Entry<String, String> entry : fields.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("fields cannot contain null keys");
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        appendString(sb, entry.getKey());
        sb.append(':');
        if (entry.getValue() == null) {
          sb.append("null");
        } else {
          appendString(sb, entry.getValue());
        }
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("Empty JSON input");
    }
    Cursor in = new Cursor(json);
    in.skipWhitespace();
    in.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    in.skipWhitespace();
    if (in.peek() == '}') {
      in.next();
      in.expectEnd();
      return result;
    }
    while (true) {
      in.skipWhitespace();
      String key = in.readString();
      in.skipWhitespace();
      in.expect(':');
      in.skipWhitespace();
      String value = in.readScalar();
      if (value != null) {
        result.put(key, value);
      }
      in.skipWhitespace();
      char c = in.next();
      if (c == '}') {
        in.expectEnd();
        return result;
      }
      if (c != ',') {
        throw new IllegalArgumentException("Expected ',' or '}' at " + (in.pos - 1));
      }
    }
  }

  private static void appendString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }

  private static final class Cursor {
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private final String input;
    private int pos;

    Cursor(String input) {
      this.input = input;
    }

    char peek() {
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON input");
      }
      return input.charAt(pos);
    }

    char next() {
      char c = peek();
      pos++;
      return c;
    }

    void expect(char expected) {
      char c = next();
      if (c != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at " + (pos - 1));
      }
    }

    void expectEnd() {
      skipWhitespace();
      if (pos != input.length()) {
        throw new IllegalArgumentException("Trailing characters at " + pos);
      }
    }

    void skipWhitespace() {
      while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
    }

    /** Reads a string, number, boolean or null; returns {@code null} for JSON null. */
    String readScalar() {
      char c = peek();
      if (c == '"') {
        return readString();
      }
      if (c == '{' || c == '[') {
        throw new IllegalArgumentException("Nested values are not supported at " + pos);
      }
      int start = pos;
      while (pos < input.length()) {
        char ch = input.charAt(pos);
        if (ch == ',' || ch == '}' || Character.isWhitespace(ch)) {
          break;
        }
        pos++;
      }
      String literal = input.substring(start, pos);
      if (literal.isEmpty()) {
        throw new IllegalArgumentException("Expected value at " + start);
      }
      if ("null".equals(literal)) {
        return null;
      }
      if ("true".equals(literal) || "false".equals(literal) || isNumber(literal)) {
        return literal;
      }
      throw new IllegalArgumentException("Invalid literal '" + literal + "' at " + start);
    }

    String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (true) {
        char c = next();
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        char esc = next();
        switch (esc) {
          case '"', '\\', '/' -> sb.append(esc);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (pos + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape at " + pos);
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape at " + pos, e);
            }
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape \\" + esc);
        }
      }
    }

    private static boolean isNumber(String literal) {
      return NUMBER.matcher(literal).matches();
    }
  }
}
