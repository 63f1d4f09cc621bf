package io.xrdinfo.application.mime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.xrdinfo.domain.error.FormatException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class MultipartReaderTest {

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  private static String text(byte[] bytes) {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  @Test
  void splitsPartsAndIgnoresPreamble() throws FormatException {
    byte[] body = bytes("preamble\r\n"
        + "--b1\r\n"
        + "Content-Type: text/plain\r\n"
        + "\r\n"
        + "first\r\n"
        + "--b1\r\n"
        + "X-Custom: two\r\n"
        + "\r\n"
        + "second\r\n"
        + "--b1--\r\n"
        + "epilogue");

    List<MimePart> parts = MultipartReader.split(body, "b1");

    assertEquals(2, parts.size());
    assertEquals("text/plain", parts.get(0).headers().get("content-type").orElseThrow());
    assertEquals("first", text(parts.get(0).body()));
    assertEquals("Content-Type: text/plain\r\n\r\nfirst", text(parts.get(0).raw()));
    assertEquals("two", parts.get(1).headers().get("X-CUSTOM").orElseThrow());
    assertEquals("second", text(parts.get(1).body()));
  }

  @Test
  void headerOnlyPartHasEmptyBody() throws FormatException {
    byte[] body = bytes("--b\r\nExpire-date: 2024-05-14T10:00:00Z\r\nVersion: 2\r\n\r\n--b--");

    MimePart part = MultipartReader.split(body, "b").get(0);

    assertEquals("2", part.headers().get("Version").orElseThrow());
    assertEquals(0, part.body().length);
  }

  @Test
  void acceptsBareLineFeeds() throws FormatException {
    byte[] body = bytes("--b\nA: 1\n\nvalue\n--b--\n");

    MimePart part = MultipartReader.split(body, "b").get(0);

    assertEquals("1", part.headers().get("A").orElseThrow());
    assertEquals("value", text(part.body()));
  }

  @Test
  void boundaryTextInsideBodyIsNotADelimiter() throws FormatException {
    byte[] body = bytes("--b\r\n\r\nsee --b inline\r\n--b--\r\n");

    List<MimePart> parts = MultipartReader.split(body, "b");

    assertEquals(1, parts.size());
    assertEquals("see --b inline", text(parts.get(0).body()));
  }

  @Test
  void missingBoundaryFails() {
    assertThrows(FormatException.class, () -> MultipartReader.split(bytes("no parts here"), "b"));
  }

  @Test
  void missingClosingDelimiterFails() {
    assertThrows(FormatException.class, () -> MultipartReader.split(bytes("--b\r\nA: 1\r\n\r\nbody"), "b"));
  }

  @Test
  void headerContinuationLinesAreFolded() {
    MimeHeaders headers = MimeHeaders.parse("Content-identifier: SHARED-PARAMETERS;\r\n instance=\"EE\"");

    String value = headers.get("Content-identifier").orElseThrow();
    assertEquals("SHARED-PARAMETERS", MimeHeaders.mainValue(value));
    assertEquals("EE", MimeHeaders.parameter(value, "INSTANCE").orElseThrow());
  }

  @Test
  void parameterIgnoresSemicolonsInsideQuotes() {
    String value = "multipart/mixed; boundary=\"a;b\"; charset=UTF-8";

    assertEquals("a;b", MimeHeaders.parameter(value, "boundary").orElseThrow());
    assertEquals("UTF-8", MimeHeaders.parameter(value, "charset").orElseThrow());
    assertTrue(MimeHeaders.parameter(value, "missing").isEmpty());
  }
}
