package io.xrdinfo.domain.params;

/**
 * Subsystem joined with its owning member's name.
 *
 * @param subsystem subsystem
 * @param memberName owning member's name
 */
public record NamedSubsystem(Subsystem subsystem, String memberName) {}
