package io.xrdinfo.application.globalconf;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.xrdinfo.domain.conf.ConfigurationDirectory;
import io.xrdinfo.domain.conf.DirectoryEntry;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.testutil.GlobalConfFixtures;
import io.xrdinfo.testutil.GlobalConfFixtures.DirectoryBuilder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DirectoryParserTest {
  private final DirectoryParser parser = new DirectoryParser();

  @Test
  void parsesEntriesVersionAndSignature() throws FormatException {
    Instant expire = Instant.parse("2030-01-01T00:00:00Z");
    byte[] shared = GlobalConfFixtures.resource("/globalconf/shared-params-v2.xml");
    DirectoryBuilder builder = GlobalConfFixtures.directory()
        .expireDate(expire)
        .sharedParams(shared)
        .privateParams(GlobalConfFixtures.resource("/globalconf/private-params.xml"))
        .certificateHash(GlobalConfFixtures.signingCertificate());

    ConfigurationDirectory directory = parser.parse(builder.contentType(), builder.body());

    assertEquals(expire, directory.expireDate().orElseThrow());
    assertEquals("2", directory.version().orElseThrow());
    assertEquals(2, directory.entries().size());
    DirectoryEntry entry = directory.entries().get(0);
    assertEquals("SHARED-PARAMETERS", entry.contentIdentifier());
    assertEquals("EE", entry.declaredInstance().orElseThrow());
    assertEquals("/V2/20240514/shared-params.xml", entry.contentLocation());
    assertEquals(GlobalConfFixtures.SHA512, entry.digestAlgorithm());
    assertArrayEquals(GlobalConfFixtures.sha512(shared), entry.digest());
    assertEquals(GlobalConfFixtures.RSA_SHA512, directory.signature().algorithm());
    assertTrue(directory.signature().certificateHashValue().isPresent());
    assertEquals(GlobalConfFixtures.SHA512, directory.signature().certificateHashAlgorithm());
  }

  @Test
  void signedDataIsListingPartWithHeaders() throws FormatException {
    DirectoryBuilder builder = GlobalConfFixtures.directory().sharedParams(new byte[] {1});

    ConfigurationDirectory directory = parser.parse(builder.contentType(), builder.body());

    String signed = new String(directory.signedData(), StandardCharsets.UTF_8);
    assertTrue(signed.startsWith("Content-Type: multipart/mixed"));
    assertTrue(signed.endsWith("--"));
  }

  @Test
  void partExpiryOverridesDirectoryExpiry() throws FormatException {
    Instant partExpiry = Instant.parse("2020-01-01T00:00:00Z");
    DirectoryBuilder builder = GlobalConfFixtures.directory()
        .part("SHARED-PARAMETERS", null, "/shared.xml", new byte[] {1}, partExpiry);

    ConfigurationDirectory directory = parser.parse(builder.contentType(), builder.body());

    DirectoryEntry entry = directory.entries().get(0);
    assertTrue(entry.declaredInstance().isEmpty());
    assertEquals(partExpiry, directory.expirationOf(entry).orElseThrow());
  }

  @Test
  void readsContentTypeFromBodyWhenHeaderMissing() throws FormatException {
    DirectoryBuilder builder = GlobalConfFixtures.directory().sharedParams(new byte[] {1});
    byte[] prefix = ("Content-Type: " + builder.contentType() + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
    byte[] body = builder.body();
    byte[] combined = new byte[prefix.length + body.length];
    System.arraycopy(prefix, 0, combined, 0, prefix.length);
    System.arraycopy(body, 0, combined, prefix.length, body.length);

    assertEquals(1, parser.parse(null, combined).entries().size());
  }

  @Test
  void rejectsNonMultipart() {
    assertThrows(FormatException.class,
        () -> parser.parse("text/html", "<html></html>".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void rejectsDirectoryWithoutSignaturePart() {
    String body = "--o\r\nContent-Type: multipart/mixed; boundary=i\r\n\r\n--i\r\nVersion: 2\r\n\r\n--i--\r\n--o--\r\n";

    assertThrows(FormatException.class,
        () -> parser.parse("multipart/related; boundary=o", body.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void rejectsEntryWithoutHashAlgorithm() {
    String body = "--o\r\nContent-Type: multipart/mixed; boundary=i\r\n\r\n"
        + "--i\r\nContent-identifier: SHARED-PARAMETERS\r\nContent-location: /x\r\n\r\nAAAA\r\n--i--\r\n"
        + "--o\r\nSignature-algorithm-id: SHA512withRSA\r\n\r\nAAAA\r\n--o--\r\n";

    assertThrows(FormatException.class,
        () -> parser.parse("multipart/related; boundary=o", body.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void rejectsEntryWithoutContentIdentifier() {
    String body = "--o\r\nContent-Type: multipart/mixed; boundary=i\r\n\r\n"
        + "--i\r\nExpire-date: 2030-01-01T00:00:00Z\r\nVersion: 2\r\n\r\n"
        + "--i\r\nContent-location: /V2/shared-params.xml\r\n"
        + "Hash-algorithm-id: http://www.w3.org/2001/04/xmlenc#sha512\r\n\r\nAAAA\r\n--i--\r\n"
        + "--o\r\nSignature-algorithm-id: SHA512withRSA\r\n\r\nAAAA\r\n--o--\r\n";

    FormatException ex = assertThrows(FormatException.class,
        () -> parser.parse("multipart/related; boundary=o", body.getBytes(StandardCharsets.UTF_8)));
    assertTrue(ex.getMessage().contains("Content-identifier"));
  }

  @Test
  void rejectsMalformedExpireDate() {
    String body = "--o\r\nContent-Type: multipart/mixed; boundary=i\r\n\r\n"
        + "--i\r\nExpire-date: tomorrow\r\n\r\n--i--\r\n"
        + "--o\r\nSignature-algorithm-id: SHA512withRSA\r\n\r\nAAAA\r\n--o--\r\n";

    assertThrows(FormatException.class,
        () -> parser.parse("multipart/related; boundary=o", body.getBytes(StandardCharsets.UTF_8)));
  }
}
