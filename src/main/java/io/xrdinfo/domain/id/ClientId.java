package io.xrdinfo.domain.id;

import io.xrdinfo.validation.Strings;
import java.util.List;
import java.util.Optional;

/**
 * Member or subsystem identifier.
 *
 * <p>A {@code null} {@code subsystemCode} denotes the member itself. Segments are held decoded; {@link #toWire()}
 * produces the percent-encoded form.</p>
 *
 * @param instance federation instance identifier, for example {@code EE}
 * @param memberClass member class code
 * @param memberCode member code
 * @param subsystemCode subsystem code, or {@code null} for a member
 * @since 0.1.0
 */
public record ClientId(String instance, String memberClass, String memberCode, String subsystemCode) {

  public ClientId {
    Strings.requireNonBlank("instance", instance);
    Strings.requireNonBlank("memberClass", memberClass);
    Strings.requireNonBlank("memberCode", memberCode);
    if (subsystemCode != null) {
      Strings.requireNonBlank("subsystemCode", subsystemCode);
    }
  }

  public static ClientId member(String instance, String memberClass, String memberCode) {
    return new ClientId(instance, memberClass, memberCode, null);
  }

  public static ClientId subsystem(String instance, String memberClass, String memberCode, String subsystemCode) {
    return new ClientId(instance, memberClass, memberCode, Strings.requireNonBlank("subsystemCode", subsystemCode));
  }

  /**
   * Parses a wire identifier with three (member) or four (subsystem) segments.
   *
   * @param wire encoded identifier
   * @return parsed identifier
   * @throws IllegalArgumentException if the segment count is wrong or a segment is blank
   */
  public static ClientId parse(String wire) {
    return fromSegments(Identifiers.decode(Strings.requireNonBlank("client identifier", wire)));
  }

  static ClientId fromSegments(List<String> parts) {
    return switch (parts.size()) {
      case 3 -> member(parts.get(0), parts.get(1), parts.get(2));
      case 4 -> subsystem(parts.get(0), parts.get(1), parts.get(2), parts.get(3));
      default -> throw new IllegalArgumentException(
          "client identifier must have 3 or 4 segments (was " + parts.size() + ")");
    };
  }

  public boolean isSubsystem() {
    return subsystemCode != null;
  }

  public Optional<String> subsystem() {
    return Optional.ofNullable(subsystemCode);
  }

  public ObjectType objectType() {
    return isSubsystem() ? ObjectType.SUBSYSTEM : ObjectType.MEMBER;
  }

  /** Returns the owning member identifier (this instance when already a member). */
  public ClientId memberId() {
    return isSubsystem() ? member(instance, memberClass, memberCode) : this;
  }

  public List<String> segments() {
    return isSubsystem()
        ? List.of(instance, memberClass, memberCode, subsystemCode)
        : List.of(instance, memberClass, memberCode);
  }

  public String toWire() {
    return Identifiers.encode(segments());
  }

  @Override
  public String toString() {
    return toWire();
  }
}
