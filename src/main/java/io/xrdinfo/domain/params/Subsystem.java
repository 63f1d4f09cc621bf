package io.xrdinfo.domain.params;

import io.xrdinfo.domain.id.ClientId;
import java.util.Objects;
import java.util.Optional;

/**
 * Registered subsystem.
 *
 * @param id subsystem identifier
 * @param name subsystem display name, present only in newer schema versions
 */
public record Subsystem(ClientId id, Optional<String> name) {
  public Subsystem {
    Objects.requireNonNull(id, "id");
    if (!id.isSubsystem()) {
      throw new IllegalArgumentException("subsystem id must carry a subsystem code: " + id);
    }
    Objects.requireNonNull(name, "name");
  }
}
