package checkin.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-dependency {@link JsonCodec} for flat string maps and string arrays.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON object cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      appendQuoted(sb, entry.getKey());
      sb.append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        appendQuoted(sb, entry.getValue());
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public String toJsonArray(List<String> values) {
    StringBuilder sb = new StringBuilder("[");
    if (values != null) {
      for (int i = 0; i < values.size(); i++) {
        if (i > 0) {
          sb.append(',');
        }
        String value = values.get(i);
        if (value == null) {
          throw new IllegalArgumentException("JSON array cannot contain null values");
        }
        appendQuoted(sb, value);
      }
    }
    return sb.append(']').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (isAbsent(json)) {
      return Collections.emptyMap();
    }
    Cursor in = new Cursor(json);
    in.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    if (in.consumeIf('}')) {
      in.expectEnd();
      return result;
    }
    do {
      String key = in.readString();
      in.expect(':');
      String value = in.readScalar();
      if (value != null) {
        result.put(key, value);
      }
    } while (in.consumeIf(','));
    in.expect('}');
    in.expectEnd();
    return result;
  }

  @Override
  public List<String> parseArray(String json) {
    if (isAbsent(json)) {
      return Collections.emptyList();
    }
    Cursor in = new Cursor(json);
    in.expect('[');
    List<String> result = new ArrayList<>();
    if (in.consumeIf(']')) {
      in.expectEnd();
      return result;
    }
    do {
      result.add(in.readString());
    } while (in.consumeIf(','));
    in.expect(']');
    in.expectEnd();
    return result;
  }

  private static boolean isAbsent(String json) {
    if (json == null) {
      return true;
    }
    String trimmed = json.trim();
    return trimmed.isEmpty() || "null".equals(trimmed);
  }

  private static void appendQuoted(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append('"');
  }

  /** Single-pass reader over the input. */
  private static final class Cursor {
    private final String input;
    private int pos;

    Cursor(String input) {
      this.input = input;
    }

    void skipWhitespace() {
      while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
    }

    void expect(char expected) {
      skipWhitespace();
      if (pos >= input.length() || input.charAt(pos) != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at position " + pos);
      }
      pos++;
    }

    boolean consumeIf(char expected) {
      skipWhitespace();
      if (pos < input.length() && input.charAt(pos) == expected) {
        pos++;
        return true;
      }
      return false;
    }

    void expectEnd() {
      skipWhitespace();
      if (pos != input.length()) {
        throw new IllegalArgumentException("Unexpected trailing content at position " + pos);
      }
    }

    /** Reads a string, number, boolean or null; null yields {@code null}. */
    String readScalar() {
      skipWhitespace();
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      if (input.charAt(pos) == '"') {
        return readString();
      }
      int start = pos;
      while (pos < input.length() && ",}] \t\r\n".indexOf(input.charAt(pos)) < 0) {
        pos++;
      }
      String literal = input.substring(start, pos);
      if ("null".equals(literal)) {
        return null;
      }
      if ("true".equals(literal) || "false".equals(literal) || literal.matches("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?")) {
        return literal;
      }
      throw new IllegalArgumentException("Unsupported JSON value at position " + start + ": " + literal);
    }

    String readString() {
      skipWhitespace();
      if (pos >= input.length() || input.charAt(pos) != '"') {
        throw new IllegalArgumentException("Expected string at position " + pos);
      }
      pos++;
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(pos++);
        switch (next) {
          case '"':
          case '\\':
          case '/':
            sb.append(next);
            break;
          case 'b':
            sb.append('\b');
            break;
          case 'f':
            sb.append('\f');
            break;
          case 'n':
            sb.append('\n');
            break;
          case 'r':
            sb.append('\r');
            break;
          case 't':
            sb.append('\t');
            break;
          case 'u':
            if (pos + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            pos += 4;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }
  }
}
