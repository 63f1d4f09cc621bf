package io.xrdinfo.domain.params;

import java.util.List;

/**
 * Subsystem joined with the security servers it is registered on; {@code servers} is empty when unregistered.
 *
 * @param subsystem subsystem
 * @param servers servers in document order
 */
public record SubsystemServers(Subsystem subsystem, List<SecurityServer> servers) {
  public SubsystemServers {
    servers = List.copyOf(servers);
  }
}
