package io.xrdinfo.domain.id;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Codec for the slash-separated, percent-encoded wire form of identifiers.
 * <p><strong>Why:</strong> Identifier segments may contain {@code /}, spaces or non-ASCII characters, while REST paths,
 * the {@code X-Road-Client} header and CLI output need a single unambiguous token.</p>
 * <p><strong>Rules:</strong> every UTF-8 byte outside {@code A-Z a-z 0-9 - . _ ~} is written as {@code %XX} with upper
 * case hex digits; decoding turns each {@code %XX} back into its byte and leaves anything else, including {@code +},
 * untouched.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Identifiers {
  private static final char[] HEX = "0123456789ABCDEF".toCharArray();

  private Identifiers() {
    // Utility
  }

  /**
   * Joins segments into the wire form.
   *
   * @param segments identifier segments in order; must not contain {@code null}
   * @return encoded identifier such as {@code EE/GOV/70000310/sub%2Fsystem}
   */
  public static String encode(List<String> segments) {
    Objects.requireNonNull(segments, "segments");
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < segments.size(); i++) {
      if (i > 0) {
        sb.append('/');
      }
      appendEncoded(sb, Objects.requireNonNull(segments.get(i), "segment"));
    }
    return sb.toString();
  }

  /**
   * Splits a wire identifier on {@code /} and percent-decodes each segment.
   *
   * @param wire encoded identifier
   * @return decoded segments; never empty
   */
  public static List<String> decode(String wire) {
    Objects.requireNonNull(wire, "wire");
    List<String> segments = new ArrayList<>();
    int start = 0;
    while (true) {
      int slash = wire.indexOf('/', start);
      if (slash < 0) {
        segments.add(decodeSegment(wire.substring(start)));
        return List.copyOf(segments);
      }
      segments.add(decodeSegment(wire.substring(start, slash)));
      start = slash + 1;
    }
  }

  /**
   * Percent-encodes a single segment.
   *
   * @param segment raw segment
   * @return encoded segment
   */
  public static String encodeSegment(String segment) {
    StringBuilder sb = new StringBuilder(segment.length() + 8);
    appendEncoded(sb, segment);
    return sb.toString();
  }

  /**
   * Percent-decodes a single segment. Malformed escapes are kept literally.
   *
   * @param segment encoded segment
   * @return decoded text
   */
  public static String decodeSegment(String segment) {
    if (segment.indexOf('%') < 0) {
      return segment;
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream(segment.length());
    byte[] raw = segment.getBytes(StandardCharsets.UTF_8);
    for (int i = 0; i < raw.length; i++) {
      byte b = raw[i];
      if (b == '%' && i + 2 < raw.length && hexValue(raw[i + 1]) >= 0 && hexValue(raw[i + 2]) >= 0) {
        out.write((hexValue(raw[i + 1]) << 4) | hexValue(raw[i + 2]));
        i += 2;
      } else {
        out.write(b);
      }
    }
    return out.toString(StandardCharsets.UTF_8);
  }

  private static void appendEncoded(StringBuilder sb, String segment) {
    for (byte b : segment.getBytes(StandardCharsets.UTF_8)) {
      int c = b & 0xFF;
      if (isUnreserved(c)) {
        sb.append((char) c);
      } else {
        sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
      }
    }
  }

  private static boolean isUnreserved(int c) {
    return (c >= 'A' && c <= 'Z')
        || (c >= 'a' && c <= 'z')
        || (c >= '0' && c <= '9')
        || c == '-' || c == '.' || c == '_' || c == '~';
  }

  private static int hexValue(byte b) {
    if (b >= '0' && b <= '9') {
      return b - '0';
    }
    if (b >= 'A' && b <= 'F') {
      return b - 'A' + 10;
    }
    if (b >= 'a' && b <= 'f') {
      return b - 'a' + 10;
    }
    return -1;
  }
}
