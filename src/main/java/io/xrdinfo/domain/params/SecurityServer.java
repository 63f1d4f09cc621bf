package io.xrdinfo.domain.params;

import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.id.SecurityServerId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Security server with the clients registered on it.
 *
 * @param id server identifier
 * @param address host name or IP address, when registered
 * @param clients members and subsystems registered on the server, in document order
 */
public record SecurityServer(SecurityServerId id, Optional<String> address, List<ClientId> clients) {
  public SecurityServer {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(address, "address");
    clients = List.copyOf(clients);
  }

  /**
   * Reports whether {@code client} can be reached through this server.
   *
   * <p>Subsystems must be registered clients; members match as registered clients or as the server owner.</p>
   *
   * @param client member or subsystem identifier
   * @return {@code true} when the server serves the client
   */
  public boolean serves(ClientId client) {
    return clients.contains(client) || (!client.isSubsystem() && id.owner().equals(client));
  }
}
