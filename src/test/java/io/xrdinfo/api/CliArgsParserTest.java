package io.xrdinfo.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "client=EE/GOV/70000001/portal", "gateway= http://ss1 ", "tls.cert=/tmp/c.pem"});

    assertEquals(List.of("client", "gateway", "tls.cert"), List.copyOf(map.keySet()));
    assertEquals("http://ss1", map.get("gateway"));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"metricsHeaders=Authorization=Bearer x"});

    assertEquals("Authorization=Bearer x", map.get("metricsHeaders"));
  }

  @Test
  void laterDuplicateWins() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"timeout=5", "timeout=9"});

    assertEquals("9", map.get("timeout"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"anchor"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"1key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"client=a\u0007b"}));
  }
}
