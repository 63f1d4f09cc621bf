package io.xrdinfo.infrastructure.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.id.SecurityServerId;
import io.xrdinfo.domain.params.SecurityServer;
import io.xrdinfo.domain.params.SharedParams;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class HostAddressesTest {
  private static final ClientId OWNER = ClientId.parse("EE/GOV/70000001");

  private static InetAddress ip(String literal) {
    try {
      return InetAddress.getByName(literal);
    } catch (UnknownHostException ex) {
      throw new IllegalStateException(ex);
    }
  }

  private final Map<String, InetAddress[]> dns = Map.of(
      "ss1.example.test", new InetAddress[] {ip("192.0.2.10"), ip("2001:db8::10"), ip("192.0.2.10")},
      "ss2.example.test", new InetAddress[] {ip("192.0.2.20")},
      "alias.example.test", new InetAddress[] {ip("192.0.2.20")});

  private final HostAddresses addresses = new HostAddresses(host -> {
    InetAddress[] found = dns.get(host);
    if (found == null) {
      throw new UnknownHostException(host);
    }
    return found;
  });

  private static SecurityServer server(String code, String address) {
    return new SecurityServer(new SecurityServerId(OWNER, code), Optional.ofNullable(address), List.of());
  }

  @Test
  void resolvesDistinctAddresses() {
    assertEquals(List.of("192.0.2.10", "2001:db8:0:0:0:0:0:10"), addresses.addressIps("ss1.example.test"));
  }

  @Test
  void unknownHostGivesNoAddresses() {
    assertTrue(addresses.addressIps("gone.example.test").isEmpty());
  }

  @Test
  void serverIpsSkipsServersWithoutAddressAndDeduplicates() {
    SharedParams params = new SharedParams("EE", List.of(), List.of(), List.of(
        server("ss1", "ss1.example.test"),
        server("ss2", null),
        server("ss3", "ss2.example.test"),
        server("ss4", "alias.example.test"),
        server("ss5", "gone.example.test")), List.of(), List.of());

    assertEquals(List.of("192.0.2.10", "2001:db8:0:0:0:0:0:10", "192.0.2.20"), addresses.serverIps(params));
  }

  @Test
  void literalResolvesToItselfWithDefaultResolver() {
    assertEquals(List.of("127.0.0.1"), new HostAddresses().addressIps("127.0.0.1"));
  }
}
