package io.relay.util;

/**
 * Dependency-free {@link JsonCodec} that scans the top level of a JSON object.
 *
 * <p>Only the requested member is decoded; every other value, including nested
 * objects and arrays, is skipped structurally.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String readTopLevelField(String json, String field) {
    if (json == null) {
      throw new IllegalArgumentException("Expected JSON object");
    }
    if (field == null) {
      throw new NullPointerException("field");
    }
    String input = json.trim();
    int len = input.length();
    int idx = skipWhitespace(input, 0);
    if (idx >= len || input.charAt(idx) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    idx++;
    String found = null;
    while (true) {
      idx = skipWhitespace(input, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char ch = input.charAt(idx);
      if (ch == '}') {
        return found;
      }
      if (ch != '"') {
        throw new IllegalArgumentException("Expected string key");
      }
      ParseResult key = parseString(input, idx + 1);
      idx = skipWhitespace(input, key.nextIndex);
      if (idx >= len || input.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key");
      }
      idx = skipWhitespace(input, idx + 1);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char valueStart = input.charAt(idx);
      if (valueStart == '"') {
        ParseResult value = parseString(input, idx + 1);
        if (found == null && field.equals(key.value)) {
          found = value.value;
        }
        idx = value.nextIndex;
      } else if (valueStart == '{' || valueStart == '[') {
        idx = skipContainer(input, idx);
      } else {
        int end = scanLiteral(input, idx);
        String literal = input.substring(idx, end);
        if (literal.isEmpty()) {
          throw new IllegalArgumentException("Expected value for key: " + key.value);
        }
        if (found == null && field.equals(key.value) && !"null".equals(literal)) {
          found = literal;
        }
        idx = end;
      }
      idx = skipWhitespace(input, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char next = input.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == '}') {
        return found;
      }
      throw new IllegalArgumentException("Expected ',' or '}'");
    }
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  private static int scanLiteral(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == ',' || c == '}' || c == ']' || c == ' ' || c == '\t' || c == '\n' || c == '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  /** Returns the index just past the object or array starting at {@code index}. */
  private static int skipContainer(String input, int index) {
    int depth = 0;
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        i = parseString(input, i + 1).nextIndex;
        continue;
      }
      if (c == '{' || c == '[') {
        depth++;
      } else if (c == '}' || c == ']') {
        depth--;
        if (depth == 0) {
          return i + 1;
        }
      }
      i++;
    }
    throw new IllegalArgumentException("Unterminated JSON container");
  }

  private static ParseResult parseString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new ParseResult(sb.toString(), i + 1);
      }
      if (c == '\\') {
        if (i + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(i + 1);
        switch (next) {
          case '"':
          case '\\':
          case '/':
            sb.append(next);
            i += 2;
            break;
          case 'b':
            sb.append('\b');
            i += 2;
            break;
          case 'f':
            sb.append('\f');
            i += 2;
            break;
          case 'n':
            sb.append('\n');
            i += 2;
            break;
          case 'r':
            sb.append('\r');
            i += 2;
            break;
          case 't':
            sb.append('\t');
            i += 2;
            break;
          case 'u':
            if (i + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            String hex = input.substring(i + 2, i + 6);
            try {
              sb.append((char) Integer.parseInt(hex, 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            i += 6;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
      } else {
        sb.append(c);
        i++;
      }
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private static final class ParseResult {
    private final String value;
    private final int nextIndex;

    private ParseResult(String value, int nextIndex) {
      this.value = value;
      this.nextIndex = nextIndex;
    }
  }
}
