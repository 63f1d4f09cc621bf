package io.xrdinfo.domain.metadata;

import java.util.Objects;
import java.util.Optional;

/**
 * One operation of an OpenAPI description.
 *
 * @param method upper case HTTP method, for example {@code GET}
 * @param path path template as written in the document
 * @param operationId operation id, or {@code null}
 * @param summary summary; empty when absent
 * @param description description; empty when absent
 */
public record OpenApiEndpoint(String method, String path, String operationId, String summary, String description) {
  public OpenApiEndpoint {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(path, "path");
    summary = summary == null ? "" : summary;
    description = description == null ? "" : description;
  }

  public Optional<String> operation() {
    return Optional.ofNullable(operationId);
  }
}
