package io.xrdinfo.application.globalconf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.xrdinfo.domain.conf.ConfigurationPart;
import io.xrdinfo.domain.error.AddressResolutionException;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.error.TrustException;
import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.params.CentralService;
import io.xrdinfo.domain.params.GlobalGroup;
import io.xrdinfo.domain.params.SecurityServer;
import io.xrdinfo.domain.params.SharedParams;
import io.xrdinfo.domain.params.Subsystem;
import io.xrdinfo.testutil.GlobalConfFixtures;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class SharedParamsParserTest {
  private static final ClientId PORTAL = ClientId.parse("EE/GOV/70000001/portal");
  private static final ClientId ARCHIVE = ClientId.parse("EE/GOV/70000001/archive");
  private static final ClientId BILLING = ClientId.subsystem("EE", "COM", "10000002", "billing/v2");

  private final SharedParamsParser parser = new SharedParamsParser();
  private Logger logger;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger(SharedParamsParser.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
  }

  private static VerifiedConfiguration verified(String resource, String version) {
    ConfigurationPart part = new ConfigurationPart(
        ConfigurationPart.SHARED_PARAMETERS, "EE", "/shared.xml", null, GlobalConfFixtures.SHA512,
        new byte[0], GlobalConfFixtures.resource(resource), false);
    return new VerifiedConfiguration("EE", URI.create("http://cs1.example.test/internalconf"), version,
        List.of(part));
  }

  private static List<String> wire(List<Subsystem> subsystems) {
    return subsystems.stream().map(s -> s.id().toWire()).collect(Collectors.toList());
  }

  @Test
  void parsesVersionTwoDocument() throws Exception {
    SharedParams params = parser.parse(verified("/globalconf/shared-params-v2.xml", "2"));

    assertEquals("EE", params.instanceIdentifier());
    assertEquals(2, params.members().size());
    assertEquals("Example & Sons", params.members().get(1).name());
    assertEquals(List.of("EE/GOV/70000001/portal", "EE/GOV/70000001/archive", "EE/COM/10000002/billing%2Fv2"),
        wire(params.subsystems()));
    assertTrue(params.subsystems().get(0).name().isEmpty());

    SecurityServer ss1 = params.securityServers().get(0);
    assertEquals("EE/GOV/70000001/ss1", ss1.id().toWire());
    assertEquals("127.0.0.1", ss1.address().orElseThrow());
    assertEquals(List.of(PORTAL, BILLING), ss1.clients());
    assertTrue(params.securityServers().get(1).address().isEmpty());

    GlobalGroup group = params.globalGroups().get(0);
    assertEquals("security-server-owners", group.groupCode());
    assertEquals("Security server owners", group.description());
    assertEquals(List.of(ClientId.parse("EE/GOV/70000001"), ClientId.parse("EE/COM/10000002")), group.members());

    List<CentralService> central = params.centralServices();
    assertEquals(2, central.size());
    assertEquals("EE/GOV/70000001/portal/getPerson/v1",
        central.get(0).implementingService().orElseThrow().toWire());
    assertTrue(central.get(1).implementingService().isEmpty());
  }

  @Test
  void unknownClientReferenceIsSkippedWithWarning() throws Exception {
    parser.parse(verified("/globalconf/shared-params-v2.xml", "2"));

    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.WARN
        && event.getFormattedMessage().contains("unknown-ref")));
  }

  @Test
  void derivedViews() throws Exception {
    SharedParams params = parser.parse(verified("/globalconf/shared-params-v2.xml", "2"));

    assertEquals(List.of("EE/GOV/70000001/portal", "EE/COM/10000002/billing%2Fv2"),
        wire(params.registeredSubsystems()));
    assertEquals("Ministry of Tests", params.subsystemsWithMemberName().get(1).memberName());
    assertTrue(params.subsystemsWithServers().get(1).servers().isEmpty());
    assertEquals("127.0.0.1", params.resolveAddress(BILLING));
    assertEquals(1, params.serversFor(ClientId.parse("EE/COM/10000002")).size());
    assertThrows(AddressResolutionException.class, () -> params.resolveAddress(ARCHIVE));
    assertThrows(AddressResolutionException.class, () -> params.resolveAddress(ClientId.parse("EE/COM/10000002")));
  }

  @Test
  void versionFourReadsSubsystemNamesAndNoCentralServices() throws Exception {
    SharedParams params = parser.parse(verified("/globalconf/shared-params-v4.xml", "4"));

    assertEquals("Citizen portal", params.subsystems().get(0).name().orElseThrow());
    assertTrue(params.centralServices().isEmpty());
    assertEquals("ss1.example.test", params.resolveAddress(PORTAL));
  }

  @Test
  void missingVersionIsReadAsVersionTwo() throws Exception {
    SharedParams params = parser.parse(verified("/globalconf/shared-params-v2.xml", null));

    assertEquals(2, params.centralServices().size());
  }

  @Test
  void ownerThatIsNotAMemberIsRejected() {
    assertThrows(FormatException.class, () -> parser.parse(verified("/globalconf/shared-params-bad-owner.xml", "2")));
  }

  @Test
  void foreignInstanceIsRejected() {
    assertThrows(TrustException.class, () -> parser.parse(verified("/globalconf/shared-params-foreign.xml", "2")));
  }

  @Test
  void missingSharedParametersPartIsRejected() {
    VerifiedConfiguration empty = new VerifiedConfiguration(
        "EE", URI.create("http://cs1.example.test/internalconf"), "2", List.of());

    assertThrows(FormatException.class, () -> parser.parse(empty));
  }

  @Test
  void malformedXmlIsRejected() {
    assertThrows(FormatException.class,
        () -> parser.parseDocument("<conf><member>".getBytes(StandardCharsets.UTF_8),
            SharedParamsSchema.V2));
  }
}
