package io.xrdinfo.domain.metadata;

import java.util.Objects;

/**
 * WSDL attachment returned by {@code getWsdl}, as opaque text.
 *
 * @param text WSDL document
 */
public record WsdlDocument(String text) implements MetadataResponse {
  public WsdlDocument {
    Objects.requireNonNull(text, "text");
  }
}
