package io.xrdinfo.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.xrdinfo.infrastructure.http.JdkHttpTransport;
import io.xrdinfo.testutil.FixtureServer;
import io.xrdinfo.testutil.GlobalConfFixtures;
import io.xrdinfo.testutil.GlobalConfFixtures.DirectoryBuilder;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class GlobalConfCliTest {
  @TempDir Path tempDir;

  private final byte[] shared = GlobalConfFixtures.resource("/globalconf/shared-params-v2.xml");
  private FixtureServer server;
  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() throws IOException {
    server = FixtureServer.start();
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    logger = (Logger) LoggerFactory.getLogger(CliSupport.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
    server.close();
  }

  private String anchorFile() throws IOException {
    Path anchor = tempDir.resolve("anchor.xml");
    Files.writeString(anchor, GlobalConfFixtures.anchorXml(server.uri("/internalconf")));
    return "anchor=" + anchor;
  }

  private void serve(DirectoryBuilder builder) {
    server.route("/internalconf", 200, builder.contentType(), builder.body());
    server.route("/V2/20240514/shared-params.xml", 200, "text/xml", shared);
  }

  private ExitCode run(String command, String... args) {
    return GlobalConfCli.run(command, args, JdkHttpTransport::new);
  }

  private List<String> lines() {
    return buffer.toString().lines().toList();
  }

  @Test
  void membersPrintsIdentifierAndName() throws IOException {
    serve(GlobalConfFixtures.directory().sharedParams(shared));

    assertEquals(ExitCode.SUCCESS, run("members", anchorFile()));

    assertEquals(List.of(
        "EE/GOV/70000001\tMinistry of Tests",
        "EE/COM/10000002\tExample & Sons"), lines());
  }

  @Test
  void membersFromSecurityServerVerificationConf() {
    server.route("/verificationconf", 200, "application/zip", GlobalConfFixtures.verificationConf(shared));

    assertEquals(ExitCode.SUCCESS, run("members", "securityServer=127.0.0.1:" + server.uri().getPort()));

    assertEquals(List.of(
        "EE/GOV/70000001\tMinistry of Tests",
        "EE/COM/10000002\tExample & Sons"), lines());
  }

  @Test
  void securityServerWithoutInstanceEntryIsRuntimeFailure() {
    server.route("/verificationconf", 200, "application/zip", GlobalConfFixtures.verificationConf(shared));

    assertEquals(ExitCode.RUNTIME_FAILURE,
        run("members", "securityServer=" + server.uri(), "instance=LV"));
  }

  @Test
  void registeredSubsystemsOnlyListsServerClients() throws IOException {
    serve(GlobalConfFixtures.directory().sharedParams(shared));

    assertEquals(ExitCode.SUCCESS, run("subsystems", anchorFile(), "--registered"));

    assertEquals(List.of(
        "EE/GOV/70000001/portal\t",
        "EE/COM/10000002/billing%2Fv2\t"), lines());
  }

  @Test
  void serversAndGroupsArePrinted() throws IOException {
    serve(GlobalConfFixtures.directory().sharedParams(shared));
    String anchor = anchorFile();

    assertEquals(ExitCode.SUCCESS, run("servers", anchor));
    assertEquals(List.of("EE/GOV/70000001/ss1\t127.0.0.1", "EE/COM/10000002/ss2\t"), lines());

    buffer.getBuffer().setLength(0);
    assertEquals(ExitCode.SUCCESS, run("groups", anchor, "--members"));
    assertEquals(List.of(
        "security-server-owners\tEE/GOV/70000001",
        "security-server-owners\tEE/COM/10000002"), lines());
  }

  @Test
  void serverIpsResolvesLiteralAddresses() throws IOException {
    serve(GlobalConfFixtures.directory().sharedParams(shared));

    assertEquals(ExitCode.SUCCESS, run("server-ips", anchorFile()));

    assertEquals(List.of("127.0.0.1"), lines());
  }

  @Test
  void yamlConfigSuppliesAnchor() throws IOException {
    serve(GlobalConfFixtures.directory().sharedParams(shared));
    Path anchor = tempDir.resolve("anchor.xml");
    Files.writeString(anchor, GlobalConfFixtures.anchorXml(server.uri("/internalconf")));
    Path yaml = tempDir.resolve("xrdinfo.yaml");
    Files.writeString(yaml, "common:\n  anchor: " + anchor + "\n  timeout: 3\n");

    assertEquals(ExitCode.SUCCESS, run("members", "config=" + yaml));
    assertEquals(2, lines().size());
  }

  @Test
  void missingAnchorIsInvalidArguments() {
    assertEquals(ExitCode.INVALID_ARGS, run("members"));
    assertTrue(buffer.toString().isEmpty());
  }

  @Test
  void unknownOptionIsInvalidArguments() throws IOException {
    assertEquals(ExitCode.INVALID_ARGS, run("members", anchorFile(), "gateway=http://ss1"));
  }

  @Test
  void unreadableAnchorIsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, run("members", "anchor=" + tempDir.resolve("absent.xml")));
  }

  @Test
  void rogueSignatureIsTrustFailure() throws IOException {
    serve(GlobalConfFixtures.directory().sharedParams(shared).signWith(GlobalConfFixtures.rogueKey()));

    assertEquals(ExitCode.TRUST_FAILURE, run("members", anchorFile()));
    assertTrue(buffer.toString().isEmpty());
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains("TRUST")));
  }

  @Test
  void unreachableSourceIsIoError() throws IOException {
    Path anchor = tempDir.resolve("anchor.xml");
    Files.writeString(anchor, GlobalConfFixtures.anchorXml(
        URI.create("http://127.0.0.1:" + FixtureServer.unusedPort() + "/internalconf")));

    assertEquals(ExitCode.IO_ERROR, run("members", "anchor=" + anchor, "timeout=2"));
  }
}
