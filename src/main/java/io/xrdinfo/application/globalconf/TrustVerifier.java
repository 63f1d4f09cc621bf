package io.xrdinfo.application.globalconf;

import io.xrdinfo.application.port.ClockPort;
import io.xrdinfo.application.port.MetricsPort;
import io.xrdinfo.domain.conf.AnchorSource;
import io.xrdinfo.domain.conf.ConfigurationAnchor;
import io.xrdinfo.domain.conf.ConfigurationDirectory;
import io.xrdinfo.domain.conf.ConfigurationPart;
import io.xrdinfo.domain.conf.DirectoryEntry;
import io.xrdinfo.domain.conf.DirectorySignature;
import io.xrdinfo.domain.error.IntegrityException;
import io.xrdinfo.domain.error.TrustException;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.Signature;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Verifies a fetched configuration against its anchor.
 * <p><strong>Order of checks:</strong>
 * <ol>
 *   <li>The directory signature must verify with a certificate the anchor lists for the source it came from. When the
 *   signature names a certificate hash, only the matching certificate is tried.</li>
 *   <li>Every entry must belong to the anchor's instance.</li>
 *   <li>Every downloaded part must match its declared digest.</li>
 *   <li>Parts past their expiration are flagged stale; this never fails verification.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected ports.</p>
 * <p><strong>Observability:</strong> Logs stale parts at WARN and counts them as {@code globalconf.part.stale}.</p>
 *
 * @since 0.1.0
 */
public final class TrustVerifier {
  private static final Logger log = LoggerFactory.getLogger(TrustVerifier.class);

  private final ClockPort clock;
  private final MetricsPort metrics;

  public TrustVerifier(ClockPort clock, MetricsPort metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Verifies every part of {@code fetched}.
   *
   * @param anchor trust anchor
   * @param fetched unverified download
   * @return verified parts in directory order
   * @throws TrustException on a bad signature, unknown algorithm or foreign instance
   * @throws IntegrityException on a digest mismatch or missing part content
   */
  public VerifiedConfiguration verify(ConfigurationAnchor anchor, FetchedConfiguration fetched)
      throws TrustException, IntegrityException {
    Objects.requireNonNull(anchor, "anchor");
    ConfigurationDirectory directory = fetched.directory();
    verifySignature(fetched.source(), directory);

    String instance = anchor.instanceIdentifier();
    Instant now = clock.now();
    List<ConfigurationPart> parts = new ArrayList<>(directory.entries().size());
    for (DirectoryEntry entry : directory.entries()) {
      String declared = entry.declaredInstance().orElse(instance);
      if (!declared.equals(instance)) {
        throw new TrustException("Part " + entry.contentIdentifier() + " belongs to instance " + declared
            + ", anchor is for " + instance);
      }
      byte[] content = fetched.content(entry.contentLocation())
          .orElseThrow(() -> new IntegrityException("No content downloaded for " + entry.contentLocation()));
      verifyDigest(entry, content);

      Optional<Instant> expiration = directory.expirationOf(entry);
      boolean stale = expiration.isPresent() && now.isAfter(expiration.get());
      if (stale) {
        log.warn("Configuration part {} expired at {}", entry.contentIdentifier(), expiration.get());
        metrics.increment("globalconf.part.stale");
      }
      parts.add(new ConfigurationPart(
          entry.contentIdentifier(),
          declared,
          entry.contentLocation(),
          expiration.orElse(null),
          entry.digestAlgorithm(),
          entry.digest(),
          content,
          stale));
    }
    return new VerifiedConfiguration(
        instance, fetched.source().downloadUrl(), directory.version().orElse(null), parts);
  }

  private static void verifyDigest(DirectoryEntry entry, byte[] content) throws TrustException, IntegrityException {
    MessageDigest digest = CryptoAlgorithms.digest(entry.digestAlgorithm());
    byte[] actual = digest.digest(content);
    if (!MessageDigest.isEqual(actual, entry.digest())) {
      throw new IntegrityException("Digest mismatch for " + entry.contentIdentifier() + " at "
          + entry.contentLocation());
    }
  }

  private static void verifySignature(AnchorSource source, ConfigurationDirectory directory) throws TrustException {
    DirectorySignature signature = directory.signature();
    List<X509Certificate> candidates = candidates(source, signature);
    byte[] signedData = directory.signedData();
    GeneralSecurityException lastFailure = null;
    for (X509Certificate certificate : candidates) {
      Signature verifier = CryptoAlgorithms.signature(signature.algorithm());
      try {
        verifier.initVerify(certificate.getPublicKey());
        verifier.update(signedData);
        if (verifier.verify(signature.value())) {
          log.debug("Directory signature verified with {}", certificate.getSubjectX500Principal());
          return;
        }
      } catch (GeneralSecurityException ex) {
        lastFailure = ex;
        log.debug("Signature check with {} failed: {}", certificate.getSubjectX500Principal(), ex.getMessage());
      }
    }
    TrustException failure = new TrustException(
        "Directory signature does not verify with any certificate trusted for " + source.downloadUrl());
    if (lastFailure != null) {
      failure.addSuppressed(lastFailure);
    }
    throw failure;
  }

  private static List<X509Certificate> candidates(AnchorSource source, DirectorySignature signature)
      throws TrustException {
    Optional<byte[]> expectedHash = signature.certificateHashValue();
    if (expectedHash.isEmpty()) {
      return source.verificationCerts();
    }
    MessageDigest digest = CryptoAlgorithms.digest(signature.certificateHashAlgorithm());
    List<X509Certificate> matching = new ArrayList<>();
    for (X509Certificate certificate : source.verificationCerts()) {
      try {
        if (MessageDigest.isEqual(expectedHash.get(), digest.digest(certificate.getEncoded()))) {
          matching.add(certificate);
        }
      } catch (CertificateEncodingException ex) {
        throw new TrustException("Cannot encode anchor certificate " + certificate.getSubjectX500Principal(), ex);
      }
    }
    if (matching.isEmpty()) {
      throw new TrustException("Verification-certificate-hash matches no certificate trusted for "
          + source.downloadUrl());
    }
    return matching;
  }
}
