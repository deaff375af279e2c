package io.shortcast.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes item metadata as a flat JSON object of strings, the form in which it is stored in
 * the queue table.
 *
 * <p>Only string values are supported. A JSON {@code null} value is dropped on decode since
 * item metadata never holds nulls.
 */
public final class MetadataCodec {

  private MetadataCodec() {}

  /**
   * Encodes the map. Returns {@code "{}"} for a null or empty map.
   *
   * @param metadata the metadata
   * @return JSON object text
   */
  public static String encode(Map<String, String> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return "{}";
    }
    StringBuilder out = new StringBuilder("{");
    for (Map.Entry<String, String> entry : metadata.entrySet()) {
      if (out.length() > 1) {
        out.append(',');
      }
      quote(out, entry.getKey());
      out.append(':');
      quote(out, entry.getValue());
    }
    return out.append('}').toString();
  }

  /**
   * Decodes a JSON object of strings. Null or blank input decodes to an empty map.
   *
   * @param json JSON object text
   * @return the decoded map, in document order
   * @throws IllegalArgumentException if the text is not a flat object of strings
   */
  public static Map<String, String> decode(String json) {
    Map<String, String> result = new LinkedHashMap<>();
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return result;
    }
    Reader reader = new Reader(json);
    reader.expect('{');
    if (reader.peek() == '}') {
      reader.pos++;
      reader.end();
      return result;
    }
    do {
      String key = reader.string();
      reader.expect(':');
      if (reader.consumeNull()) {
        continue;
      }
      result.put(key, reader.string());
    } while (reader.comma());
    reader.expect('}');
    reader.end();
    return result;
  }

  private static void quote(StringBuilder out, String value) {
    if (value == null) {
      throw new IllegalArgumentException("metadata cannot contain nulls");
    }
    out.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '"' || c == '\\') {
        out.append('\\').append(c);
      } else if (c == '\n') {
        out.append("\\n");
      } else if (c == '\r') {
        out.append("\\r");
      } else if (c == '\t') {
        out.append("\\t");
      } else if (c < 0x20) {
        out.append(String.format("\\u%04x", (int) c));
      } else {
        out.append(c);
      }
    }
    out.append('"');
  }

  private static final class Reader {
    private final String text;
    private int pos;

    Reader(String text) {
      this.text = text;
    }

    char peek() {
      skipWhitespace();
      if (pos >= text.length()) {
        throw new IllegalArgumentException("Unexpected end of metadata JSON");
      }
      return text.charAt(pos);
    }

    void expect(char c) {
      if (peek() != c) {
        throw new IllegalArgumentException("Expected '" + c + "' at offset " + pos);
      }
      pos++;
    }

    boolean comma() {
      if (peek() == ',') {
        pos++;
        return true;
      }
      return false;
    }

    boolean consumeNull() {
      if (peek() == 'n' && text.startsWith("null", pos)) {
        pos += 4;
        return true;
      }
      return false;
    }

    void end() {
      skipWhitespace();
      if (pos != text.length()) {
        throw new IllegalArgumentException("Trailing characters in metadata JSON at offset " + pos);
      }
    }

    String string() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (pos < text.length()) {
        char c = text.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= text.length()) {
          break;
        }
        char esc = text.charAt(pos++);
        switch (esc) {
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'u' -> {
            if (pos + 4 > text.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape", e);
            }
            pos += 4;
          }
          case '"', '\\', '/' -> sb.append(esc);
          default -> throw new IllegalArgumentException("Unsupported escape: \\" + esc);
        }
      }
      throw new IllegalArgumentException("Unterminated string in metadata JSON");
    }

    private void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }
  }
}
