package io.xrdinfo.infrastructure.net;

import io.xrdinfo.domain.params.SecurityServer;
import io.xrdinfo.domain.params.SharedParams;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves security server addresses to IP literals.
 *
 * <p>Names that do not resolve are skipped. IP literals resolve to themselves without a DNS lookup.</p>
 *
 * @since 0.1.0
 */
public final class HostAddresses {
  private static final Logger log = LoggerFactory.getLogger(HostAddresses.class);

  private final Resolver resolver;

  public HostAddresses() {
    this(InetAddress::getAllByName);
  }

  HostAddresses(Resolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  /**
   * Resolves one host.
   *
   * @param host DNS name or IP literal
   * @return distinct IPv4 and IPv6 literals in resolver order; empty when the name is unknown
   */
  public List<String> addressIps(String host) {
    Objects.requireNonNull(host, "host");
    Set<String> ips = new LinkedHashSet<>();
    try {
      for (InetAddress address : resolver.resolve(host.trim())) {
        ips.add(address.getHostAddress());
      }
    } catch (UnknownHostException ex) {
      log.debug("Cannot resolve {}: {}", host, ex.getMessage());
    }
    return List.copyOf(ips);
  }

  /**
   * Resolves the address of every security server that publishes one.
   *
   * @param sharedParams verified shared parameters
   * @return distinct IP literals across all servers, in server order
   */
  public List<String> serverIps(SharedParams sharedParams) {
    Objects.requireNonNull(sharedParams, "sharedParams");
    Set<String> ips = new LinkedHashSet<>();
    for (SecurityServer server : sharedParams.securityServers()) {
      server.address().ifPresent(address -> ips.addAll(addressIps(address)));
    }
    return new ArrayList<>(ips);
  }

  /** Name lookup, replaceable in tests. */
  @FunctionalInterface
  interface Resolver {
    InetAddress[] resolve(String host) throws UnknownHostException;
  }
}
