package io.xrdinfo.domain.params;

import io.xrdinfo.domain.id.ServiceId;
import java.util.Objects;
import java.util.Optional;

/**
 * Central service mapping, published only by older schema versions.
 *
 * @param serviceCode central service code
 * @param implementingService service that implements it, when mapped
 */
public record CentralService(String serviceCode, Optional<ServiceId> implementingService) {
  public CentralService {
    Objects.requireNonNull(serviceCode, "serviceCode");
    Objects.requireNonNull(implementingService, "implementingService");
  }
}
