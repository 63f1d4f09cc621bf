package io.xrdinfo.application.mime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Header block of a MIME part with case-insensitive lookup and parameter parsing.
 *
 * <p>Configuration proxies write {@code Content-location} where central servers write {@code Content-Location};
 * names are therefore matched without regard to case. Folded continuation lines are unfolded.</p>
 */
public final class MimeHeaders {
  private final Map<String, String> values;

  private MimeHeaders(Map<String, String> values) {
    this.values = values;
  }

  public static MimeHeaders empty() {
    return new MimeHeaders(Map.of());
  }

  /**
   * Parses a header block. Lines without a colon are ignored.
   *
   * @param block header lines separated by CRLF or LF
   * @return parsed headers; the first occurrence of a repeated name wins
   */
  public static MimeHeaders parse(String block) {
    Map<String, String> parsed = new LinkedHashMap<>();
    String current = null;
    StringBuilder value = new StringBuilder();
    for (String line : block.split("\r?\n", -1)) {
      if (!line.isEmpty() && (line.charAt(0) == ' ' || line.charAt(0) == '\t') && current != null) {
        value.append(' ').append(line.trim());
        continue;
      }
      if (current != null) {
        parsed.putIfAbsent(current, value.toString().trim());
      }
      current = null;
      value.setLength(0);
      int colon = line.indexOf(':');
      if (colon > 0) {
        current = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
        value.append(line.substring(colon + 1));
      }
    }
    if (current != null) {
      parsed.putIfAbsent(current, value.toString().trim());
    }
    return new MimeHeaders(Collections.unmodifiableMap(parsed));
  }

  public Optional<String> get(String name) {
    return Optional.ofNullable(values.get(name.toLowerCase(Locale.ROOT)));
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Value before the first {@code ;}, trimmed. */
  public static String mainValue(String headerValue) {
    int semicolon = indexOfUnquoted(headerValue, ';', 0);
    return (semicolon < 0 ? headerValue : headerValue.substring(0, semicolon)).trim();
  }

  /**
   * Extracts a {@code name=value} parameter; single or double quotes around the value are removed.
   *
   * @param headerValue full header value
   * @param name parameter name, matched case-insensitively
   * @return parameter value
   */
  public static Optional<String> parameter(String headerValue, String name) {
    int start = indexOfUnquoted(headerValue, ';', 0);
    while (start >= 0) {
      int end = indexOfUnquoted(headerValue, ';', start + 1);
      String token = (end < 0 ? headerValue.substring(start + 1) : headerValue.substring(start + 1, end)).trim();
      int eq = token.indexOf('=');
      if (eq > 0 && token.substring(0, eq).trim().equalsIgnoreCase(name)) {
        return Optional.of(unquote(token.substring(eq + 1).trim()));
      }
      start = end;
    }
    return Optional.empty();
  }

  private static String unquote(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      char last = value.charAt(value.length() - 1);
      if ((first == '"' || first == '\'') && first == last) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }

  private static int indexOfUnquoted(String value, char target, int from) {
    char quote = 0;
    for (int i = from; i < value.length(); i++) {
      char c = value.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '"' || c == '\'') {
        quote = c;
      } else if (c == target) {
        return i;
      }
    }
    return -1;
  }
}
