package io.xrdinfo.domain.metadata;

import io.xrdinfo.domain.id.ServiceId;
import java.util.List;

/**
 * Services returned by {@code listMethods} or {@code allowedMethods}, in response order.
 *
 * @param services service identifiers
 */
public record ServiceList(List<ServiceId> services) implements MetadataResponse {
  public ServiceList {
    services = List.copyOf(services);
  }
}
