package io.xrdinfo.domain.params;

import io.xrdinfo.domain.id.ClientId;
import java.util.List;
import java.util.Objects;

/**
 * Global group and its members.
 *
 * @param groupCode group code
 * @param description group description; empty when absent
 * @param members group members in document order
 */
public record GlobalGroup(String groupCode, String description, List<ClientId> members) {
  public GlobalGroup {
    Objects.requireNonNull(groupCode, "groupCode");
    description = description == null ? "" : description;
    members = List.copyOf(members);
  }
}
