package io.xrdinfo.domain.metadata;

import java.util.Objects;

/**
 * OpenAPI description returned by {@code getOpenApi}, as opaque JSON or YAML text.
 *
 * @param text description document
 */
public record OpenApiDocument(String text) implements MetadataResponse {
  public OpenApiDocument {
    Objects.requireNonNull(text, "text");
  }
}
