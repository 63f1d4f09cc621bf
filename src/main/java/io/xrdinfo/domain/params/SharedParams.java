package io.xrdinfo.domain.params;

import io.xrdinfo.domain.error.AddressResolutionException;
import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Read-only indices over one verified shared-parameters document.
 * <p><strong>Role:</strong> Output of {@code SharedParamsParser}; input to metadata addressing and CLI listings.</p>
 * <p><strong>Ordering:</strong> Every listing follows document order.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads.</p>
 *
 * @since 0.1.0
 */
public final class SharedParams {
  private final String instanceIdentifier;
  private final List<Member> members;
  private final List<Subsystem> subsystems;
  private final List<SecurityServer> securityServers;
  private final List<GlobalGroup> globalGroups;
  private final List<CentralService> centralServices;
  private final Map<ClientId, Member> membersById;

  public SharedParams(
      String instanceIdentifier,
      List<Member> members,
      List<Subsystem> subsystems,
      List<SecurityServer> securityServers,
      List<GlobalGroup> globalGroups,
      List<CentralService> centralServices) {
    this.instanceIdentifier = Strings.requireNonBlank("instanceIdentifier", instanceIdentifier);
    this.members = List.copyOf(members);
    this.subsystems = List.copyOf(subsystems);
    this.securityServers = List.copyOf(securityServers);
    this.globalGroups = List.copyOf(globalGroups);
    this.centralServices = List.copyOf(centralServices);
    Map<ClientId, Member> index = new LinkedHashMap<>();
    for (Member member : this.members) {
      index.put(member.id(), member);
    }
    this.membersById = Map.copyOf(index);
  }

  public String instanceIdentifier() {
    return instanceIdentifier;
  }

  public List<Member> members() {
    return members;
  }

  public Optional<Member> member(ClientId id) {
    return Optional.ofNullable(membersById.get(Objects.requireNonNull(id, "id").memberId()));
  }

  public List<Subsystem> subsystems() {
    return subsystems;
  }

  /** Subsystems joined with the owning member's name. */
  public List<NamedSubsystem> subsystemsWithMemberName() {
    List<NamedSubsystem> result = new ArrayList<>(subsystems.size());
    for (Subsystem subsystem : subsystems) {
      String name = member(subsystem.id()).map(Member::name).orElse("");
      result.add(new NamedSubsystem(subsystem, name));
    }
    return List.copyOf(result);
  }

  /** Subsystems registered on at least one security server. */
  public List<Subsystem> registeredSubsystems() {
    List<Subsystem> result = new ArrayList<>();
    for (Subsystem subsystem : subsystems) {
      if (!serversFor(subsystem.id()).isEmpty()) {
        result.add(subsystem);
      }
    }
    return List.copyOf(result);
  }

  /** Every subsystem with the servers it is registered on. */
  public List<SubsystemServers> subsystemsWithServers() {
    List<SubsystemServers> result = new ArrayList<>(subsystems.size());
    for (Subsystem subsystem : subsystems) {
      result.add(new SubsystemServers(subsystem, serversFor(subsystem.id())));
    }
    return List.copyOf(result);
  }

  public List<SecurityServer> securityServers() {
    return securityServers;
  }

  /**
   * Lists the servers through which a member or subsystem is reachable.
   *
   * @param client member or subsystem identifier
   * @return matching servers in document order
   */
  public List<SecurityServer> serversFor(ClientId client) {
    Objects.requireNonNull(client, "client");
    List<SecurityServer> result = new ArrayList<>();
    for (SecurityServer server : securityServers) {
      if (server.serves(client)) {
        result.add(server);
      }
    }
    return List.copyOf(result);
  }

  /**
   * Resolves the address of the first registered server that serves {@code client} and has an address.
   *
   * @param client member or subsystem identifier
   * @return server address as published
   * @throws AddressResolutionException when no server with an address serves the client
   */
  public String resolveAddress(ClientId client) throws AddressResolutionException {
    for (SecurityServer server : serversFor(client)) {
      if (server.address().isPresent()) {
        return server.address().get();
      }
    }
    throw new AddressResolutionException("No security server address registered for " + client.toWire());
  }

  public List<GlobalGroup> globalGroups() {
    return globalGroups;
  }

  public List<CentralService> centralServices() {
    return centralServices;
  }
}
