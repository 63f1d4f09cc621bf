package io.xrdinfo.api;

import io.xrdinfo.application.globalconf.AnchorLoader;
import io.xrdinfo.application.globalconf.ConfigurationFetcher;
import io.xrdinfo.application.globalconf.DirectoryParser;
import io.xrdinfo.application.globalconf.GlobalConfLoader;
import io.xrdinfo.application.globalconf.SharedParamsParser;
import io.xrdinfo.application.globalconf.TrustVerifier;
import io.xrdinfo.application.port.HttpTransport;
import io.xrdinfo.application.port.MetricsPort;
import io.xrdinfo.config.ClientSettings;
import io.xrdinfo.config.TlsSettings;
import io.xrdinfo.config.Verbosity;
import io.xrdinfo.config.YamlConfigLoader;
import io.xrdinfo.domain.conf.ConfigurationAnchor;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.error.XrdInfoException;
import io.xrdinfo.infrastructure.time.SystemClockAdapter;
import io.xrdinfo.logging.LoggingConfigurator;
import io.xrdinfo.validation.Numbers;
import io.xrdinfo.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Option handling shared by all commands: YAML and {@code key=value} merging, client settings, anchor loading and
 * mapping of failures onto {@link ExitCode}s.
 */
final class CliSupport {
  private static final Logger log = LoggerFactory.getLogger(CliSupport.class);

  /** Options accepted by every command. */
  static final Set<String> COMMON_KEYS = Set.of(
      "config", "anchor", "timeout", "verbosity", "userId",
      "tls.keyStore", "tls.keyStorePassword", "tls.cert", "tls.key", "tls.ca",
      "metricsExporter", "otelEndpoint", "otelResourceAttributes");

  static final String COMMON_HELP = """
      Common options:
        anchor=PATH                 Configuration anchor XML
        timeout=SECONDS             Per-request timeout, 1-600 (default 5)
        verbosity=quiet|normal|debug  Request logging detail (default quiet)
        userId=ID                   SOAP userId header (default xrdinfo)
        tls.keyStore=PATH           PKCS#12 client key store
        tls.keyStorePassword=PASS   Key store password
        tls.cert=PATH tls.key=PATH  PEM client certificate and PKCS#8 key
        tls.ca=PATH                 PEM CA bundle replacing the JVM trust store
        config=PATH                 YAML file with a common and a per-command section
        metricsExporter=otlp|none   Export metrics over OTLP (default none)
        otelEndpoint=URL            OTLP endpoint
        otelResourceAttributes=K=V  Comma-separated resource attributes
        --verbose                   DEBUG logging
        --help                      Show this message""";

  private static final long MAX_TIMEOUT_SECONDS = 600;

  private CliSupport() {}

  /**
   * Merges YAML configuration (when {@code config=} is given) with command-line options, command-line values winning.
   *
   * @param command command name selecting the YAML section
   * @param args {@code key=value} arguments
   * @param commandKeys options accepted by the command on top of {@link #COMMON_KEYS}
   * @return effective options
   * @throws IllegalArgumentException on malformed or unknown options
   * @throws IOException when the YAML file cannot be read
   */
  static Map<String, String> options(String command, String[] args, Set<String> commandKeys) throws IOException {
    Map<String, String> cli = CliArgsParser.toMap(args);
    Map<String, String> effective = new LinkedHashMap<>();
    String configPath = cli.get("config");
    if (configPath != null && !configPath.isBlank()) {
      Path path = Path.of(configPath.trim());
      if (!Files.isRegularFile(path)) {
        throw new IllegalArgumentException("config file does not exist: " + path);
      }
      effective.putAll(YamlConfigLoader.load(path, command));
    }
    effective.putAll(cli);

    Set<String> allowed = new LinkedHashSet<>(COMMON_KEYS);
    allowed.addAll(commandKeys);
    for (String key : effective.keySet()) {
      if (!allowed.contains(key)) {
        throw new IllegalArgumentException("unknown option for " + command + ": " + key);
      }
    }
    return effective;
  }

  /**
   * Builds client settings from effective options.
   *
   * @param options effective options
   * @param verbose whether {@code --verbose} was given; forces {@link Verbosity#DEBUG}
   * @return settings
   * @throws IllegalArgumentException on invalid values
   */
  static ClientSettings settings(Map<String, String> options, boolean verbose) {
    ClientSettings settings = ClientSettings.defaults().withVerbosity(Verbosity.QUIET);
    String timeout = options.get("timeout");
    if (timeout != null) {
      settings = settings.withTimeout(
          Duration.ofSeconds(Numbers.parseInRange("timeout", timeout, 1, MAX_TIMEOUT_SECONDS)));
    }
    String verbosity = options.get("verbosity");
    if (verbose) {
      settings = settings.withVerbosity(Verbosity.DEBUG);
    } else if (verbosity != null) {
      settings = settings.withVerbosity(Verbosity.parse(verbosity));
    }
    String userId = options.get("userId");
    if (userId != null) {
      settings = settings.withUserId(userId);
    }
    TlsSettings tls = tls(options);
    if (tls != null) {
      settings = settings.withTls(tls);
    }
    if (settings.verbosity().atLeast(Verbosity.DEBUG)) {
      LoggingConfigurator.apply(Verbosity.DEBUG);
    }
    return settings;
  }

  private static TlsSettings tls(Map<String, String> options) {
    Path keyStore = path(options, "tls.keyStore");
    Path cert = path(options, "tls.cert");
    Path key = path(options, "tls.key");
    Path ca = path(options, "tls.ca");
    if (keyStore == null && cert == null && key == null && ca == null) {
      if (options.containsKey("tls.keyStorePassword")) {
        throw new IllegalArgumentException("tls.keyStorePassword requires tls.keyStore");
      }
      return null;
    }
    return new TlsSettings(keyStore, options.get("tls.keyStorePassword"), cert, key, ca);
  }

  private static Path path(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null) {
      return null;
    }
    Path path = Path.of(Strings.requireNonBlank(key, value));
    if (!Files.isReadable(path)) {
      throw new IllegalArgumentException(key + " is not a readable file: " + path);
    }
    return path;
  }

  /**
   * Loads the anchor named by {@code anchor=}.
   *
   * @throws IllegalArgumentException when the option is missing
   * @throws IOException when the file cannot be read
   * @throws FormatException when the file is not a valid anchor
   */
  static ConfigurationAnchor anchor(Map<String, String> options) throws IOException, FormatException {
    String value = options.get("anchor");
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("anchor=PATH is required");
    }
    return new AnchorLoader().load(Path.of(value.trim()));
  }

  static Optional<String> optional(Map<String, String> options, String key) {
    String value = options.get(key);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  static String required(Map<String, String> options, String key) {
    return optional(options, key).orElseThrow(() -> new IllegalArgumentException(key + "= is required"));
  }

  static GlobalConfLoader loader(HttpTransport transport, ClientSettings settings, MetricsPort metrics) {
    ConfigurationFetcher fetcher = new ConfigurationFetcher(transport, new DirectoryParser(), settings, metrics);
    TrustVerifier verifier = new TrustVerifier(new SystemClockAdapter(), metrics);
    return new GlobalConfLoader(fetcher, verifier, new SharedParamsParser(), settings, metrics);
  }

  /**
   * Maps a domain failure onto an exit code and logs it.
   *
   * @param command command that failed
   * @param ex failure
   * @return exit code
   */
  static ExitCode report(String command, XrdInfoException ex) {
    ExitCode code = switch (ex.kind()) {
      case NETWORK, TIMEOUT, CONNECTION, ADDRESS_RESOLUTION -> ExitCode.IO_ERROR;
      case INTEGRITY, TRUST -> ExitCode.TRUST_FAILURE;
      case PROTOCOL_FAULT -> ExitCode.REMOTE_FAULT;
      case FORMAT -> ExitCode.RUNTIME_FAILURE;
    };
    log.error("{} failed ({}): {}", command, ex.kind(), ex.getMessage());
    log.debug("{} failure detail", command, ex);
    return code;
  }

  /** Logs an unreadable anchor or configuration file. */
  static ExitCode reportConfig(String command, Exception ex) {
    log.error("{}: cannot read configuration: {}", command, ex.getMessage());
    log.debug("{} configuration failure detail", command, ex);
    return ExitCode.CONFIG_ERROR;
  }
}
