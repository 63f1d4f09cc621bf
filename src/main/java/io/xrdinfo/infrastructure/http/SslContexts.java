package io.xrdinfo.infrastructure.http;

import io.xrdinfo.config.TlsSettings;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.List;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;

/**
 * Builds {@link SSLContext}s from {@link TlsSettings}.
 *
 * <p>Client credentials come from a PKCS#12 key store or a PEM certificate and key pair. A CA bundle, when given,
 * replaces the JDK trust store; otherwise the JDK defaults apply.</p>
 */
public final class SslContexts {
  private static final char[] NO_PASSWORD = new char[0];
  private static final char[] IN_MEMORY_PASSWORD = "xrdinfo".toCharArray();

  private SslContexts() {}

  /**
   * Creates a TLS context.
   *
   * @param settings TLS material
   * @return initialised context
   * @throws IllegalArgumentException when the material cannot be read
   */
  public static SSLContext create(TlsSettings settings) {
    try {
      KeyManagerFactory keyManagers = null;
      if (settings.hasClientCredentials()) {
        keyManagers = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        if (settings.keyStore() != null) {
          char[] password = settings.keyStorePassword() == null
              ? NO_PASSWORD : settings.keyStorePassword().toCharArray();
          keyManagers.init(loadPkcs12(settings.keyStore(), password), password);
        } else {
          keyManagers.init(pemKeyStore(settings.certificate(), settings.privateKey()), IN_MEMORY_PASSWORD);
        }
      }
      TrustManagerFactory trustManagers = null;
      if (settings.ca().isPresent()) {
        trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        trustManagers.init(caStore(settings.ca().get()));
      }
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(
          keyManagers == null ? null : keyManagers.getKeyManagers(),
          trustManagers == null ? null : trustManagers.getTrustManagers(),
          null);
      return context;
    } catch (IOException | GeneralSecurityException ex) {
      throw new IllegalArgumentException("Cannot load TLS material " + settings + ": " + ex.getMessage(), ex);
    }
  }

  private static KeyStore loadPkcs12(Path path, char[] password) throws IOException, GeneralSecurityException {
    KeyStore store = KeyStore.getInstance("PKCS12");
    try (InputStream in = Files.newInputStream(path)) {
      store.load(in, password);
    }
    return store;
  }

  private static KeyStore pemKeyStore(Path certificate, Path privateKey)
      throws IOException, GeneralSecurityException {
    List<X509Certificate> chain = Pem.readCertificates(certificate);
    PrivateKey key = Pem.readPrivateKey(privateKey);
    KeyStore store = emptyStore();
    store.setKeyEntry("client", key, IN_MEMORY_PASSWORD, chain.toArray(new Certificate[0]));
    return store;
  }

  private static KeyStore caStore(Path bundle) throws IOException, GeneralSecurityException {
    KeyStore store = emptyStore();
    int index = 0;
    for (X509Certificate certificate : Pem.readCertificates(bundle)) {
      store.setCertificateEntry("ca-" + index++, certificate);
    }
    return store;
  }

  private static KeyStore emptyStore() throws IOException, GeneralSecurityException {
    KeyStore store = KeyStore.getInstance("PKCS12");
    store.load(null, null);
    return store;
  }
}
