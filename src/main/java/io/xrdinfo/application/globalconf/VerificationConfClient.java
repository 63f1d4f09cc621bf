package io.xrdinfo.application.globalconf;

import io.xrdinfo.application.metadata.MetadataClient;
import io.xrdinfo.application.port.HttpTransport;
import io.xrdinfo.application.port.HttpTransport.HttpCall;
import io.xrdinfo.application.port.HttpTransport.HttpReply;
import io.xrdinfo.application.port.MetricsPort;
import io.xrdinfo.config.ClientSettings;
import io.xrdinfo.config.Verbosity;
import io.xrdinfo.domain.error.ConnectionException;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.error.NetworkException;
import io.xrdinfo.domain.error.RequestTimeoutException;
import io.xrdinfo.domain.error.TrustException;
import io.xrdinfo.domain.params.SharedParams;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads shared parameters from the verification configuration a security server publishes
 * at {@code /verificationconf}.
 * <p><strong>Trust:</strong> the security server has already verified this configuration against its own anchor, so
 * the archive is taken as is. Use {@link GlobalConfLoader} when the caller holds an anchor.</p>
 * <p><strong>Archive layout:</strong> {@code verificationconf/instance-identifier} names the server's own instance and
 * {@code verificationconf/<instance>/shared-params.xml} holds each instance's shared parameters.</p>
 * <p><strong>Observability:</strong> counts {@code verificationconf.load.success} and
 * {@code verificationconf.load.failure}.</p>
 *
 * @since 0.1.0
 */
public final class VerificationConfClient {
  private static final Logger log = LoggerFactory.getLogger(VerificationConfClient.class);
  static final String DEFAULT_PATH = "/verificationconf";
  static final String ROOT = "verificationconf/";
  static final String INSTANCE_IDENTIFIER = ROOT + "instance-identifier";
  private static final long MAX_ENTRY_BYTES = 16L * 1024 * 1024;

  private final HttpTransport transport;
  private final SharedParamsParser parser;
  private final ClientSettings settings;
  private final MetricsPort metrics;

  public VerificationConfClient(
      HttpTransport transport, SharedParamsParser parser, ClientSettings settings, MetricsPort metrics) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Downloads the verification configuration and parses one instance's shared parameters.
   *
   * @param securityServer server URL or bare host; an empty path becomes {@code /verificationconf}
   * @param instance instance to read, or empty for the server's own instance
   * @return shared parameters
   * @throws NetworkException when the server cannot be reached or answers with a non-success status
   * @throws RequestTimeoutException when the download times out
   * @throws FormatException when the archive or a required entry is missing or malformed
   * @throws TrustException when the document declares another instance than the one requested
   */
  public SharedParams load(String securityServer, Optional<String> instance)
      throws NetworkException, RequestTimeoutException, FormatException, TrustException {
    Objects.requireNonNull(instance, "instance");
    URI uri = ConfigurationFetcher.withDefaultPath(
        MetadataClient.gatewayUri(securityServer, settings.tls().isPresent()), DEFAULT_PATH);
    try {
      Map<String, byte[]> archive = unzip(download(uri));
      String ident = instance.isPresent() ? instance.get() : ownInstance(archive);
      if (ident.isEmpty() || ident.contains("/") || ident.equals("..")) {
        throw new FormatException("Invalid instance identifier '" + ident + "'");
      }
      String location = ROOT + ident + "/shared-params.xml";
      byte[] xml = archive.get(location);
      if (xml == null) {
        throw new FormatException("Verification configuration from " + uri + " has no " + location);
      }
      SharedParams params = parser.parseDocument(xml, SharedParamsSchema.forVersion(null));
      if (!params.instanceIdentifier().equals(ident)) {
        throw new TrustException("Shared parameters in " + location + " declare instance "
            + params.instanceIdentifier());
      }
      metrics.increment("verificationconf.load.success");
      if (settings.verbosity().atLeast(Verbosity.NORMAL)) {
        log.info("Loaded shared parameters for {} from {}: {} members, {} servers",
            ident, uri, params.members().size(), params.securityServers().size());
      }
      return params;
    } catch (NetworkException | RequestTimeoutException | FormatException | TrustException ex) {
      metrics.increment("verificationconf.load.failure");
      throw ex;
    }
  }

  private byte[] download(URI uri) throws NetworkException, RequestTimeoutException {
    HttpReply reply;
    try {
      reply = transport.execute(HttpCall.get(uri, Map.of(), settings.timeout()));
    } catch (ConnectionException ex) {
      throw new NetworkException("Cannot reach " + uri + ": " + ex.getMessage(), ex);
    }
    if (!reply.isSuccess()) {
      throw new NetworkException("HTTP " + reply.status() + " from " + uri + ": " + reply.bodyText(),
          reply.status(), null);
    }
    return reply.body();
  }

  private static String ownInstance(Map<String, byte[]> archive) throws FormatException {
    byte[] value = archive.get(INSTANCE_IDENTIFIER);
    if (value == null) {
      throw new FormatException("Verification configuration has no " + INSTANCE_IDENTIFIER);
    }
    return new String(value, StandardCharsets.UTF_8).trim();
  }

  static Map<String, byte[]> unzip(byte[] bytes) throws FormatException {
    Map<String, byte[]> entries = new HashMap<>();
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        if (entry.isDirectory()) {
          continue;
        }
        byte[] content = zip.readNBytes((int) MAX_ENTRY_BYTES + 1);
        if (content.length > MAX_ENTRY_BYTES) {
          throw new FormatException("Archive entry " + entry.getName() + " exceeds " + MAX_ENTRY_BYTES + " bytes");
        }
        entries.put(entry.getName(), content);
      }
    } catch (IOException ex) {
      throw new FormatException("Malformed verification configuration archive: " + ex.getMessage(), ex);
    }
    if (entries.isEmpty()) {
      throw new FormatException("Verification configuration is not a ZIP archive or is empty");
    }
    return entries;
  }
}
