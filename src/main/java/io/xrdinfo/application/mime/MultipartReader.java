package io.xrdinfo.application.mime;

import io.xrdinfo.domain.error.FormatException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits a multipart body into parts on its boundary.
 *
 * <p>The line break before each delimiter belongs to the delimiter, so {@link MimePart#raw()} carries exactly the
 * bytes between two delimiter lines. Preamble and epilogue are discarded.</p>
 */
public final class MultipartReader {

  private MultipartReader() {}

  /**
   * Splits {@code body} into parts.
   *
   * @param body multipart body
   * @param boundary boundary parameter value, without leading dashes
   * @return parts in order
   * @throws FormatException when the opening or closing delimiter is missing
   */
  public static List<MimePart> split(byte[] body, String boundary) throws FormatException {
    byte[] delimiter = ("--" + boundary).getBytes(StandardCharsets.US_ASCII);
    int position = findDelimiter(body, delimiter, 0);
    if (position < 0) {
      throw new FormatException("Multipart boundary '" + boundary + "' not found");
    }
    List<MimePart> parts = new ArrayList<>();
    while (true) {
      int afterDelimiter = position + delimiter.length;
      if (startsWith(body, afterDelimiter, "--")) {
        return List.copyOf(parts);
      }
      int contentStart = nextLine(body, afterDelimiter);
      if (contentStart < 0) {
        throw new FormatException("Multipart body ends inside a delimiter line");
      }
      int next = findDelimiter(body, delimiter, contentStart);
      if (next < 0) {
        throw new FormatException("Closing multipart boundary '" + boundary + "' not found");
      }
      int contentEnd = next == contentStart ? contentStart : lineBreakStart(body, next);
      parts.add(toPart(Arrays.copyOfRange(body, contentStart, Math.max(contentStart, contentEnd))));
      position = next;
    }
  }

  /**
   * Separates a leading header block from the rest of a document.
   *
   * @param document bytes starting with header lines
   * @return headers and the bytes following the blank line
   */
  public static MimePart splitHeaders(byte[] document) {
    return toPart(document);
  }

  private static MimePart toPart(byte[] raw) {
    int bodyStart;
    int headerEnd;
    if (startsWith(raw, 0, "\r\n")) {
      return new MimePart(MimeHeaders.empty(), raw, Arrays.copyOfRange(raw, 2, raw.length));
    }
    if (startsWith(raw, 0, "\n")) {
      return new MimePart(MimeHeaders.empty(), raw, Arrays.copyOfRange(raw, 1, raw.length));
    }
    int crlf = indexOf(raw, "\r\n\r\n".getBytes(StandardCharsets.US_ASCII), 0);
    int lf = indexOf(raw, "\n\n".getBytes(StandardCharsets.US_ASCII), 0);
    if (crlf >= 0 && (lf < 0 || crlf < lf)) {
      headerEnd = crlf;
      bodyStart = crlf + 4;
    } else if (lf >= 0) {
      headerEnd = lf;
      bodyStart = lf + 2;
    } else {
      headerEnd = raw.length;
      bodyStart = raw.length;
    }
    String headerBlock = new String(raw, 0, headerEnd, StandardCharsets.UTF_8);
    return new MimePart(MimeHeaders.parse(headerBlock), raw, Arrays.copyOfRange(raw, bodyStart, raw.length));
  }

  private static int findDelimiter(byte[] body, byte[] delimiter, int from) {
    int index = indexOf(body, delimiter, from);
    while (index >= 0) {
      boolean lineStart = index == 0 || body[index - 1] == '\n';
      if (lineStart && delimiterTerminates(body, index + delimiter.length)) {
        return index;
      }
      index = indexOf(body, delimiter, index + 1);
    }
    return -1;
  }

  private static boolean delimiterTerminates(byte[] body, int index) {
    if (index >= body.length) {
      return true;
    }
    byte b = body[index];
    return b == '\r' || b == '\n' || b == '-' || b == ' ' || b == '\t';
  }

  private static int nextLine(byte[] body, int from) {
    for (int i = from; i < body.length; i++) {
      if (body[i] == '\n') {
        return i + 1;
      }
    }
    return -1;
  }

  private static int lineBreakStart(byte[] body, int delimiterIndex) {
    int end = delimiterIndex - 1;
    if (end > 0 && body[end - 1] == '\r') {
      end--;
    }
    return end;
  }

  private static boolean startsWith(byte[] body, int offset, String prefix) {
    if (offset + prefix.length() > body.length) {
      return false;
    }
    for (int i = 0; i < prefix.length(); i++) {
      if (body[offset + i] != prefix.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  private static int indexOf(byte[] haystack, byte[] needle, int from) {
    outer:
    for (int i = Math.max(0, from); i <= haystack.length - needle.length; i++) {
      for (int j = 0; j < needle.length; j++) {
        if (haystack[i + j] != needle[j]) {
          continue outer;
        }
      }
      return i;
    }
    return -1;
  }
}
