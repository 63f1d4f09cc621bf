package io.xrdinfo.config;

import io.xrdinfo.logging.Logs;
import java.nio.file.Path;
import java.util.Optional;

/**
 * TLS material used for mutual authentication with configuration sources and security servers.
 *
 * <p>Client credentials come either from a PKCS#12 key store or from a PEM certificate chain plus PKCS#8 PEM private
 * key. A PEM CA bundle, when present, replaces the JVM default trust store for server verification.</p>
 *
 * @param keyStore PKCS#12 key store, or {@code null}
 * @param keyStorePassword key store password, or {@code null}
 * @param certificate PEM client certificate chain, or {@code null}
 * @param privateKey PEM private key matching {@code certificate}, or {@code null}
 * @param caBundle PEM trust anchors for server certificates, or {@code null}
 * @since 0.1.0
 */
public record TlsSettings(
    Path keyStore,
    String keyStorePassword,
    Path certificate,
    Path privateKey,
    Path caBundle) {

  public TlsSettings {
    if (keyStore != null && (certificate != null || privateKey != null)) {
      throw new IllegalArgumentException("tls: use either a PKCS#12 key store or a PEM certificate and key, not both");
    }
    if ((certificate == null) != (privateKey == null)) {
      throw new IllegalArgumentException("tls: PEM certificate and private key must be supplied together");
    }
    if (keyStore == null && certificate == null && caBundle == null) {
      throw new IllegalArgumentException("tls: no key store, certificate or CA bundle configured");
    }
  }

  public static TlsSettings pkcs12(Path keyStore, String password) {
    return new TlsSettings(keyStore, password, null, null, null);
  }

  public static TlsSettings pem(Path certificate, Path privateKey) {
    return new TlsSettings(null, null, certificate, privateKey, null);
  }

  public static TlsSettings trustOnly(Path caBundle) {
    return new TlsSettings(null, null, null, null, caBundle);
  }

  public TlsSettings withCaBundle(Path bundle) {
    return new TlsSettings(keyStore, keyStorePassword, certificate, privateKey, bundle);
  }

  public boolean hasClientCredentials() {
    return keyStore != null || certificate != null;
  }

  public Optional<Path> ca() {
    return Optional.ofNullable(caBundle);
  }

  @Override
  public String toString() {
    return "TlsSettings[keyStore=" + keyStore
        + ", keyStorePassword=" + Logs.redact(keyStorePassword)
        + ", certificate=" + certificate
        + ", privateKey=" + privateKey
        + ", caBundle=" + caBundle + ']';
  }
}
