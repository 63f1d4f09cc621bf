package io.xrdinfo.domain.params;

import io.xrdinfo.domain.id.ClientId;
import java.util.Objects;

/**
 * Registered member.
 *
 * @param id member identifier
 * @param name member name; empty when the document has none
 */
public record Member(ClientId id, String name) {
  public Member {
    Objects.requireNonNull(id, "id");
    if (id.isSubsystem()) {
      throw new IllegalArgumentException("member id must not carry a subsystem code: " + id);
    }
    name = name == null ? "" : name;
  }
}
