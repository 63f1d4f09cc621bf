package io.xrdinfo.domain.id;

import io.xrdinfo.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Security server identifier: owning member plus server code.
 *
 * @param owner owning member; never a subsystem
 * @param serverCode server code
 * @since 0.1.0
 */
public record SecurityServerId(ClientId owner, String serverCode) {

  public SecurityServerId {
    Objects.requireNonNull(owner, "owner");
    if (owner.isSubsystem()) {
      throw new IllegalArgumentException("security server owner must be a member: " + owner);
    }
    Strings.requireNonBlank("serverCode", serverCode);
  }

  public List<String> segments() {
    List<String> segments = new ArrayList<>(owner.segments());
    segments.add(serverCode);
    return List.copyOf(segments);
  }

  public String toWire() {
    return Identifiers.encode(segments());
  }

  @Override
  public String toString() {
    return toWire();
  }
}
