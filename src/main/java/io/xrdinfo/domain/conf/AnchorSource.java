package io.xrdinfo.domain.conf;

import java.net.URI;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Objects;

/**
 * One trusted configuration source listed in an anchor.
 *
 * @param downloadUrl directory URL, for example {@code http://cs.example.test/internalconf}
 * @param verificationCerts certificates allowed to sign directories served from this source
 * @since 0.1.0
 */
public record AnchorSource(URI downloadUrl, List<X509Certificate> verificationCerts) {

  public AnchorSource {
    Objects.requireNonNull(downloadUrl, "downloadUrl");
    verificationCerts = List.copyOf(Objects.requireNonNull(verificationCerts, "verificationCerts"));
    if (verificationCerts.isEmpty()) {
      throw new IllegalArgumentException("source " + downloadUrl + " has no verification certificates");
    }
  }
}
