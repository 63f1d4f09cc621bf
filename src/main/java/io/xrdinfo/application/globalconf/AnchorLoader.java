package io.xrdinfo.application.globalconf;

import io.xrdinfo.application.xml.XmlDocuments;
import io.xrdinfo.domain.conf.AnchorSource;
import io.xrdinfo.domain.conf.ConfigurationAnchor;
import io.xrdinfo.domain.error.FormatException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;

/**
 * Reads configuration anchor XML files.
 *
 * <p>An anchor names the instance and lists each source's {@code downloadURL} with one or more base64 DER
 * {@code verificationCert} elements.</p>
 *
 * @since 0.1.0
 */
public final class AnchorLoader {

  /**
   * Loads an anchor file.
   *
   * @param path anchor XML file
   * @return parsed anchor
   * @throws IOException when the file cannot be read
   * @throws FormatException when the anchor is malformed
   */
  public ConfigurationAnchor load(Path path) throws IOException, FormatException {
    return parse(Files.readAllBytes(path));
  }

  /**
   * Parses anchor XML.
   *
   * @param xml anchor document
   * @return parsed anchor
   * @throws FormatException when required elements are missing or a certificate or URL is invalid
   */
  public ConfigurationAnchor parse(byte[] xml) throws FormatException {
    Element root = XmlDocuments.parse(xml, "configuration anchor").getDocumentElement();
    String instance = XmlDocuments.requireChildText(root, "instanceIdentifier");
    Instant generatedAt = null;
    Optional<String> generated = XmlDocuments.childText(root, "generatedAt");
    if (generated.isPresent()) {
      try {
        generatedAt = OffsetDateTime.parse(generated.get()).toInstant();
      } catch (DateTimeParseException ex) {
        throw new FormatException("Malformed anchor generatedAt: " + generated.get(), ex);
      }
    }

    CertificateFactory factory = certificateFactory();
    List<AnchorSource> sources = new ArrayList<>();
    for (Element sourceElement : XmlDocuments.children(root, "source")) {
      String url = XmlDocuments.requireChildText(sourceElement, "downloadURL");
      List<X509Certificate> certs = new ArrayList<>();
      for (Element certElement : XmlDocuments.children(sourceElement, "verificationCert")) {
        certs.add(certificate(factory, certElement.getTextContent(), url));
      }
      if (certs.isEmpty()) {
        throw new FormatException("Anchor source " + url + " has no verificationCert");
      }
      sources.add(new AnchorSource(uri(url), certs));
    }
    if (sources.isEmpty()) {
      throw new FormatException("Anchor for " + instance + " lists no sources");
    }
    return new ConfigurationAnchor(instance, sources, generatedAt);
  }

  private static X509Certificate certificate(CertificateFactory factory, String base64, String url)
      throws FormatException {
    try {
      byte[] der = Base64.getMimeDecoder().decode(base64.trim());
      return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(der));
    } catch (IllegalArgumentException | CertificateException ex) {
      throw new FormatException("Invalid verificationCert for source " + url, ex);
    }
  }

  private static URI uri(String url) throws FormatException {
    try {
      URI uri = new URI(url);
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw new FormatException("Anchor downloadURL must be absolute: " + url);
      }
      return uri;
    } catch (URISyntaxException ex) {
      throw new FormatException("Invalid anchor downloadURL: " + url, ex);
    }
  }

  private static CertificateFactory certificateFactory() {
    try {
      return CertificateFactory.getInstance("X.509");
    } catch (CertificateException ex) {
      throw new IllegalStateException("X.509 certificate factory unavailable", ex);
    }
  }
}
