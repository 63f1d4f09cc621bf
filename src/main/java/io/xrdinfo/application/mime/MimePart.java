package io.xrdinfo.application.mime;

import java.util.Objects;

/**
 * One body part of a multipart document.
 *
 * @param headers part headers
 * @param raw complete part bytes, headers included, exactly as received
 * @param body bytes after the header block
 */
public record MimePart(MimeHeaders headers, byte[] raw, byte[] body) {
  public MimePart {
    Objects.requireNonNull(headers, "headers");
    Objects.requireNonNull(raw, "raw");
    Objects.requireNonNull(body, "body");
  }
}
