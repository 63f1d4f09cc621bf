package io.xrdinfo.domain.metadata;

import java.util.Locale;

/** Message protocol used for a metadata request. */
public enum MetadataProtocol {
  SOAP,
  REST;

  public static MetadataProtocol parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("protocol must not be blank");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "soap" -> SOAP;
      case "rest" -> REST;
      default -> throw new IllegalArgumentException("protocol must be 'soap' or 'rest' (was '" + raw + "')");
    };
  }
}
