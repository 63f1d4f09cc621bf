package io.xrdinfo.domain.metadata;

import java.util.Objects;
import java.util.Optional;

/**
 * Operation bound in a WSDL document.
 *
 * @param name operation name
 * @param version service version from the operation's {@code xrd:version} element, when present
 */
public record WsdlOperation(String name, Optional<String> version) {
  public WsdlOperation {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(version, "version");
  }
}
