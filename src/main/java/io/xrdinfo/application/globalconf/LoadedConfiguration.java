package io.xrdinfo.application.globalconf;

import io.xrdinfo.domain.params.SharedParams;
import java.util.Objects;

/**
 * Result of a full configuration load: verified parts and the shared parameters parsed from them.
 *
 * @param configuration verified parts
 * @param sharedParams parsed shared parameters of the anchor's instance
 * @since 0.1.0
 */
public record LoadedConfiguration(VerifiedConfiguration configuration, SharedParams sharedParams) {
  public LoadedConfiguration {
    Objects.requireNonNull(configuration, "configuration");
    Objects.requireNonNull(sharedParams, "sharedParams");
  }

  /** Whether any verified part had expired at load time. */
  public boolean stale() {
    return configuration.hasStaleParts();
  }
}
