package io.xrdinfo.application.globalconf;

import io.xrdinfo.application.port.MetricsPort;
import io.xrdinfo.config.ClientSettings;
import io.xrdinfo.config.Verbosity;
import io.xrdinfo.domain.conf.ConfigurationAnchor;
import io.xrdinfo.domain.error.XrdInfoException;
import io.xrdinfo.domain.params.SharedParams;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads global configuration end to end: fetch, parse, verify, then parse shared parameters.
 * <p><strong>Guarantee:</strong> any failure aborts the whole load; nothing partially verified is returned.</p>
 * <p><strong>Observability:</strong> Logs one INFO summary per load and counts {@code globalconf.load.success}.</p>
 *
 * @since 0.1.0
 */
public final class GlobalConfLoader {
  private static final Logger log = LoggerFactory.getLogger(GlobalConfLoader.class);

  private final ConfigurationFetcher fetcher;
  private final TrustVerifier verifier;
  private final SharedParamsParser parser;
  private final ClientSettings settings;
  private final MetricsPort metrics;

  public GlobalConfLoader(
      ConfigurationFetcher fetcher,
      TrustVerifier verifier,
      SharedParamsParser parser,
      ClientSettings settings,
      MetricsPort metrics) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.verifier = Objects.requireNonNull(verifier, "verifier");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Loads and verifies the configuration named by {@code anchor}.
   *
   * @param anchor trust anchor
   * @return verified configuration and shared parameters
   * @throws XrdInfoException with kind NETWORK, TIMEOUT, FORMAT, INTEGRITY or TRUST
   */
  public LoadedConfiguration load(ConfigurationAnchor anchor) throws XrdInfoException {
    FetchedConfiguration fetched = fetcher.fetch(anchor);
    VerifiedConfiguration verified = verifier.verify(anchor, fetched);
    SharedParams params = parser.parse(verified);
    metrics.increment("globalconf.load.success");
    if (settings.verbosity().atLeast(Verbosity.NORMAL)) {
      log.info("Loaded configuration for {} from {}: {} parts, {} members, {} servers{}",
          verified.instanceIdentifier(), verified.source(), verified.parts().size(),
          params.members().size(), params.securityServers().size(),
          verified.hasStaleParts() ? " (stale)" : "");
    }
    return new LoadedConfiguration(verified, params);
  }
}
