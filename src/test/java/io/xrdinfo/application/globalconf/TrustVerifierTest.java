package io.xrdinfo.application.globalconf;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.xrdinfo.application.port.ClockPort;
import io.xrdinfo.domain.conf.ConfigurationAnchor;
import io.xrdinfo.domain.conf.ConfigurationDirectory;
import io.xrdinfo.domain.conf.ConfigurationPart;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.error.IntegrityException;
import io.xrdinfo.domain.error.TrustException;
import io.xrdinfo.testutil.GlobalConfFixtures;
import io.xrdinfo.testutil.GlobalConfFixtures.DirectoryBuilder;
import io.xrdinfo.testutil.GlobalConfFixtures.PartFixture;
import io.xrdinfo.testutil.RecordingMetricsPort;
import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class TrustVerifierTest {
  private static final Instant NOW = Instant.parse("2024-05-14T10:00:00Z");
  private static final ConfigurationAnchor ANCHOR =
      GlobalConfFixtures.anchor(URI.create("http://cs1.example.test/internalconf"));

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final TrustVerifier verifier = new TrustVerifier(ClockPort.fixed(NOW), metrics);
  private final byte[] shared = GlobalConfFixtures.resource("/globalconf/shared-params-v2.xml");

  private Logger logger;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger(TrustVerifier.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
  }

  private static DirectoryBuilder directory() {
    return GlobalConfFixtures.directory().expireDate(NOW.plusSeconds(600));
  }

  private static FetchedConfiguration fetched(DirectoryBuilder builder) throws FormatException {
    Map<String, byte[]> contents = new LinkedHashMap<>();
    for (PartFixture part : builder.parts()) {
      contents.put(part.location(), part.content());
    }
    return fetched(builder, contents);
  }

  private static FetchedConfiguration fetched(DirectoryBuilder builder, Map<String, byte[]> contents)
      throws FormatException {
    ConfigurationDirectory directory = new DirectoryParser().parse(builder.contentType(), builder.body());
    return new FetchedConfiguration(ANCHOR.sources().get(0), directory, contents);
  }

  @Test
  void verifiesSignatureAndDigests() throws Exception {
    DirectoryBuilder builder = directory()
        .sharedParams(shared)
        .privateParams(GlobalConfFixtures.resource("/globalconf/private-params.xml"));

    VerifiedConfiguration verified = verifier.verify(ANCHOR, fetched(builder));

    assertEquals("EE", verified.instanceIdentifier());
    assertEquals("2", verified.version().orElseThrow());
    assertEquals(2, verified.parts().size());
    ConfigurationPart part = verified.part(ConfigurationPart.SHARED_PARAMETERS).orElseThrow();
    assertArrayEquals(shared, part.rawBytes());
    assertEquals(NOW.plusSeconds(600), part.expiration().orElseThrow());
    assertFalse(part.stale());
    assertFalse(verified.hasStaleParts());
  }

  @Test
  void acceptsJcaAlgorithmNames() throws Exception {
    DirectoryBuilder builder = directory()
        .signatureAlgorithm("SHA512withRSA")
        .sharedParams(shared);

    assertEquals(1, verifier.verify(ANCHOR, fetched(builder)).parts().size());
  }

  @Test
  void alteredContentFailsIntegrity() throws Exception {
    DirectoryBuilder builder = directory().sharedParams(shared);
    byte[] altered = shared.clone();
    altered[altered.length / 2] ^= 0x01;

    IntegrityException ex = assertThrows(IntegrityException.class,
        () -> verifier.verify(ANCHOR, fetched(builder, Map.of("/V2/20240514/shared-params.xml", altered))));

    assertTrue(ex.getMessage().contains("SHARED-PARAMETERS"));
  }

  @Test
  void declaredDigestMismatchFailsIntegrity() {
    DirectoryBuilder builder = directory()
        .partWithDigest("SHARED-PARAMETERS", "/shared.xml", shared, GlobalConfFixtures.sha512(new byte[] {0}));

    assertThrows(IntegrityException.class, () -> verifier.verify(ANCHOR, fetched(builder)));
  }

  @Test
  void missingContentFailsIntegrity() {
    DirectoryBuilder builder = directory().sharedParams(shared);

    assertThrows(IntegrityException.class, () -> verifier.verify(ANCHOR, fetched(builder, Map.of())));
  }

  @Test
  void signatureFromUntrustedKeyFailsTrust() {
    DirectoryBuilder builder = directory().signWith(GlobalConfFixtures.rogueKey()).sharedParams(shared);

    assertThrows(TrustException.class, () -> verifier.verify(ANCHOR, fetched(builder)));
  }

  @Test
  void listingChangedAfterSigningFailsTrust() {
    DirectoryBuilder builder = directory().sharedParams(shared).tamperAfterSigning();

    assertThrows(TrustException.class, () -> verifier.verify(ANCHOR, fetched(builder)));
  }

  @Test
  void certificateHashSelectsTrustedCertificate() throws Exception {
    DirectoryBuilder builder = directory()
        .certificateHash(GlobalConfFixtures.signingCertificate())
        .sharedParams(shared);

    assertEquals(1, verifier.verify(ANCHOR, fetched(builder)).parts().size());
  }

  @Test
  void certificateHashOfUnknownCertificateFailsTrust() {
    DirectoryBuilder builder = directory()
        .certificateHash(GlobalConfFixtures.rogueCertificate())
        .sharedParams(shared);

    TrustException ex = assertThrows(TrustException.class, () -> verifier.verify(ANCHOR, fetched(builder)));
    assertTrue(ex.getMessage().contains("Verification-certificate-hash"));
  }

  @Test
  void unknownSignatureAlgorithmFailsTrust() {
    DirectoryBuilder builder = directory().signatureAlgorithm("urn:example:rot13").sharedParams(shared);

    assertThrows(TrustException.class, () -> verifier.verify(ANCHOR, fetched(builder)));
  }

  @Test
  void partOfForeignInstanceFailsTrust() {
    DirectoryBuilder builder = directory().part("SHARED-PARAMETERS", "FI", "/fi.xml", shared, null);

    TrustException ex = assertThrows(TrustException.class, () -> verifier.verify(ANCHOR, fetched(builder)));
    assertTrue(ex.getMessage().contains("FI"));
  }

  @Test
  void expiredPartIsReturnedAsStale() throws Exception {
    DirectoryBuilder builder = directory()
        .sharedParams(shared)
        .part("PRIVATE-PARAMETERS", "EE", "/private.xml", new byte[] {1, 2}, NOW.minusSeconds(1));

    VerifiedConfiguration verified = verifier.verify(ANCHOR, fetched(builder));

    assertTrue(verified.hasStaleParts());
    assertFalse(verified.part(ConfigurationPart.SHARED_PARAMETERS).orElseThrow().stale());
    assertTrue(verified.part(ConfigurationPart.PRIVATE_PARAMETERS).orElseThrow().stale());
    assertEquals(1, metrics.count("globalconf.part.stale"));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.WARN
        && event.getFormattedMessage().contains("PRIVATE-PARAMETERS")));
  }
}
