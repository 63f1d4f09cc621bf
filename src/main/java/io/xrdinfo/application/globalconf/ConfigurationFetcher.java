package io.xrdinfo.application.globalconf;

import io.xrdinfo.application.port.HttpTransport;
import io.xrdinfo.application.port.HttpTransport.HttpCall;
import io.xrdinfo.application.port.HttpTransport.HttpReply;
import io.xrdinfo.application.port.MetricsPort;
import io.xrdinfo.config.ClientSettings;
import io.xrdinfo.config.Verbosity;
import io.xrdinfo.domain.conf.AnchorSource;
import io.xrdinfo.domain.conf.ConfigurationAnchor;
import io.xrdinfo.domain.conf.ConfigurationDirectory;
import io.xrdinfo.domain.conf.DirectoryEntry;
import io.xrdinfo.domain.error.ConnectionException;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.error.NetworkException;
import io.xrdinfo.domain.error.RequestTimeoutException;
import io.xrdinfo.domain.error.XrdInfoException;
import io.xrdinfo.logging.Logs;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Downloads the signed configuration directory and every part it lists.
 * <p><strong>Fallback:</strong> anchor sources are tried in order. A network failure or timeout on a source, whether
 * on the directory or on one of its parts, moves on to the next source. When every source fails, the last failure
 * is thrown with the earlier ones attached as suppressed exceptions. There is no other retry.</p>
 * <p><strong>Fatal errors:</strong> a directory that does not parse is a {@link FormatException} and stops the
 * fetch.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use when the injected transport is.</p>
 * <p><strong>Observability:</strong> Each failed source is logged at WARN and counted as
 * {@code globalconf.source.failure}.</p>
 *
 * @since 0.1.0
 */
public final class ConfigurationFetcher {
  private static final Logger log = LoggerFactory.getLogger(ConfigurationFetcher.class);
  private static final String DEFAULT_PATH = "/internalconf";
  private static final int MAX_LOGGED_BODY_BYTES = 512;

  private final HttpTransport transport;
  private final DirectoryParser parser;
  private final ClientSettings settings;
  private final MetricsPort metrics;

  public ConfigurationFetcher(
      HttpTransport transport, DirectoryParser parser, ClientSettings settings, MetricsPort metrics) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Downloads the configuration from the first source that answers.
   *
   * @param anchor trust anchor listing the sources
   * @return directory and part content from one source
   * @throws NetworkException when the last source tried failed at the network or HTTP level
   * @throws RequestTimeoutException when the last source tried timed out
   * @throws FormatException when a directory cannot be parsed
   */
  public FetchedConfiguration fetch(ConfigurationAnchor anchor)
      throws NetworkException, RequestTimeoutException, FormatException {
    List<XrdInfoException> failures = new ArrayList<>();
    for (AnchorSource source : anchor.sources()) {
      try {
        return fetchFrom(source);
      } catch (NetworkException | RequestTimeoutException ex) {
        failures.add(ex);
        metrics.increment("globalconf.source.failure");
        log.warn("Configuration source {} failed: {}", source.downloadUrl(), ex.getMessage());
      }
    }
    XrdInfoException last = failures.get(failures.size() - 1);
    for (XrdInfoException earlier : failures.subList(0, failures.size() - 1)) {
      last.addSuppressed(earlier);
    }
    if (last instanceof RequestTimeoutException timeout) {
      throw timeout;
    }
    throw (NetworkException) last;
  }

  private FetchedConfiguration fetchFrom(AnchorSource source)
      throws NetworkException, RequestTimeoutException, FormatException {
    URI directoryUri = withDefaultPath(source.downloadUrl());
    HttpReply reply = get(directoryUri);
    ConfigurationDirectory directory = parser.parse(reply.header("Content-Type").orElse(null), reply.body());
    if (settings.verbosity().atLeast(Verbosity.NORMAL)) {
      log.info("Downloaded configuration directory from {} ({} entries)", directoryUri,
          directory.entries().size());
    }

    Map<String, byte[]> contents = new LinkedHashMap<>();
    for (DirectoryEntry entry : directory.entries()) {
      String location = entry.contentLocation();
      if (contents.containsKey(location)) {
        continue;
      }
      HttpReply part = get(resolve(directoryUri, location));
      contents.put(location, part.body());
      if (settings.verbosity().atLeast(Verbosity.DEBUG)) {
        log.debug("Downloaded {} ({} bytes)", location, part.body().length);
      }
    }
    return new FetchedConfiguration(source, directory, contents);
  }

  private HttpReply get(URI uri) throws NetworkException, RequestTimeoutException {
    HttpReply reply;
    try {
      reply = transport.execute(HttpCall.get(uri, Map.of(), settings.timeout()));
    } catch (ConnectionException ex) {
      throw new NetworkException("Cannot reach " + uri + ": " + ex.getMessage(), ex);
    }
    if (!reply.isSuccess()) {
      String body = reply.bodyText();
      if (settings.verbosity().atLeast(Verbosity.DEBUG)) {
        log.debug("HTTP {} from {}: {}", reply.status(), uri, Logs.truncate(body, MAX_LOGGED_BODY_BYTES));
      }
      throw new NetworkException("HTTP " + reply.status() + " from " + uri + ": " + body, reply.status(), null);
    }
    return reply;
  }

  static URI withDefaultPath(URI uri) {
    return withDefaultPath(uri, DEFAULT_PATH);
  }

  /** Replaces an empty or {@code /} path with {@code defaultPath}. */
  static URI withDefaultPath(URI uri, String defaultPath) {
    String path = uri.getRawPath();
    if (path != null && !path.isEmpty() && !path.equals("/")) {
      return uri;
    }
    try {
      return new URI(uri.getScheme(), uri.getRawAuthority(), defaultPath, uri.getRawQuery(), null);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("Invalid configuration source URL: " + uri, ex);
    }
  }

  private static URI resolve(URI directoryUri, String location) throws FormatException {
    try {
      return directoryUri.resolve(location);
    } catch (IllegalArgumentException ex) {
      throw new FormatException("Invalid Content-location: " + location, ex);
    }
  }
}
