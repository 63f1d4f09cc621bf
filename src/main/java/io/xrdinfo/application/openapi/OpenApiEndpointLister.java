package io.xrdinfo.application.openapi;

import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.metadata.OpenApiEndpoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Enumerates the operations of a parsed OpenAPI document.
 *
 * <p>Works on the {@code paths} section shared by OpenAPI 2 and 3. For each path and each HTTP method key beneath it,
 * in document order, one {@link OpenApiEndpoint} is produced. Other keys such as {@code parameters} are skipped. No
 * network access is performed.</p>
 *
 * @since 0.1.0
 */
public final class OpenApiEndpointLister {
  static final Set<String> METHODS = Set.of("get", "put", "post", "delete", "options", "head", "patch", "trace");

  /**
   * Lists the endpoints of a document.
   *
   * @param document top-level OpenAPI mapping
   * @return endpoints in document order; empty when {@code paths} is empty
   * @throws FormatException when {@code paths} is missing or is not a mapping of mappings
   */
  public List<OpenApiEndpoint> list(Map<?, ?> document) throws FormatException {
    Objects.requireNonNull(document, "document");
    if (!(document.get("paths") instanceof Map<?, ?> paths)) {
      throw new FormatException("OpenAPI document has no paths mapping");
    }
    List<OpenApiEndpoint> endpoints = new ArrayList<>();
    for (Map.Entry<?, ?> path : paths.entrySet()) {
      if (path.getValue() == null) {
        continue;
      }
      if (!(path.getValue() instanceof Map<?, ?> item)) {
        throw new FormatException("OpenAPI path item " + path.getKey() + " is not a mapping");
      }
      for (Map.Entry<?, ?> operation : item.entrySet()) {
        String key = String.valueOf(operation.getKey()).toLowerCase(Locale.ROOT);
        if (!METHODS.contains(key)) {
          continue;
        }
        Map<?, ?> details = operation.getValue() instanceof Map<?, ?> map ? map : Map.of();
        endpoints.add(new OpenApiEndpoint(
            key.toUpperCase(Locale.ROOT),
            String.valueOf(path.getKey()),
            text(details.get("operationId")),
            text(details.get("summary")),
            text(details.get("description"))));
      }
    }
    return List.copyOf(endpoints);
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }
}
