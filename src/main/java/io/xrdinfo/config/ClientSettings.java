package io.xrdinfo.config;

import io.xrdinfo.validation.Strings;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable per-client settings shared by the configuration fetcher and metadata client.
 * <p><strong>Why:</strong> The core reads nothing from implicit global state; every timeout, credential and verbosity
 * decision is passed in through this value.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param timeout per-call timeout applied to every HTTP request
 * @param tlsSettings TLS material, or {@code null} for plain HTTP and JVM default trust
 * @param verbosity request logging verbosity
 * @param userId value of the {@code userId} SOAP header
 * @since 0.1.0
 */
public record ClientSettings(Duration timeout, TlsSettings tlsSettings, Verbosity verbosity, String userId) {
  /** Default per-call timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
  /** Default {@code userId} header value. */
  public static final String DEFAULT_USER_ID = "xrdinfo";

  public ClientSettings {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive (was " + timeout + ")");
    }
    Objects.requireNonNull(verbosity, "verbosity");
    userId = Strings.requireNonBlank("userId", userId);
  }

  public static ClientSettings defaults() {
    return new ClientSettings(DEFAULT_TIMEOUT, null, Verbosity.NORMAL, DEFAULT_USER_ID);
  }

  public Optional<TlsSettings> tls() {
    return Optional.ofNullable(tlsSettings);
  }

  public ClientSettings withTimeout(Duration value) {
    return new ClientSettings(value, tlsSettings, verbosity, userId);
  }

  public ClientSettings withTls(TlsSettings value) {
    return new ClientSettings(timeout, value, verbosity, userId);
  }

  public ClientSettings withVerbosity(Verbosity value) {
    return new ClientSettings(timeout, tlsSettings, value, userId);
  }

  public ClientSettings withUserId(String value) {
    return new ClientSettings(timeout, tlsSettings, verbosity, value);
  }
}
