package io.xrdinfo.application.metadata;

import io.xrdinfo.application.json.JsonSupport;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.id.ServiceId;
import io.xrdinfo.domain.metadata.ProtocolFault;
import io.xrdinfo.domain.metadata.ServiceList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads JSON responses of REST metadata services.
 */
final class RestResponseParser {
  private final JsonSupport json;

  RestResponseParser(JsonSupport json) {
    this.json = json;
  }

  /**
   * Reads {@code {"service": [...]}}.
   *
   * @param body response text
   * @return services in response order
   * @throws FormatException when the payload is not a service list
   */
  ServiceList services(String body) throws FormatException {
    Map<String, Object> root = json.parseObject(body);
    if (!(root.get("service") instanceof List<?> entries)) {
      throw new FormatException("REST response has no service list");
    }
    List<ServiceId> services = new ArrayList<>(entries.size());
    for (Object entry : entries) {
      if (!(entry instanceof Map<?, ?> service)) {
        throw new FormatException("REST service entry is not an object");
      }
      String subsystemCode = optional(service, "subsystem_code").orElse(null);
      ClientId provider = new ClientId(
          required(service, "xroad_instance"),
          required(service, "member_class"),
          required(service, "member_code"),
          subsystemCode);
      services.add(new ServiceId(provider, required(service, "service_code"),
          optional(service, "service_version").orElse(null)));
    }
    return new ServiceList(services);
  }

  /**
   * Reads a {@code {"type": ..., "message": ...}} error body.
   *
   * @param body error response text
   * @return fault with the server's texts, or empty when the body is not such an object
   */
  Optional<ProtocolFault> fault(String body) {
    Map<String, Object> root;
    try {
      root = json.parseObject(body);
    } catch (FormatException ex) {
      return Optional.empty();
    }
    if (!root.containsKey("type") && !root.containsKey("message")) {
      return Optional.empty();
    }
    return Optional.of(new ProtocolFault(text(root.get("type")), text(root.get("message"))));
  }

  private static String required(Map<?, ?> service, String key) throws FormatException {
    return optional(service, key).orElseThrow(() -> new FormatException("REST service entry lacks " + key));
  }

  private static Optional<String> optional(Map<?, ?> service, String key) {
    Object value = service.get(key);
    if (value == null) {
      return Optional.empty();
    }
    String text = value.toString();
    return text.isBlank() ? Optional.empty() : Optional.of(text);
  }

  private static String text(Object value) {
    return value == null ? "" : value.toString();
  }
}
