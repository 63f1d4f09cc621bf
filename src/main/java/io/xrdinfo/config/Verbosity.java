package io.xrdinfo.config;

import java.util.Locale;

/**
 * Logging verbosity of a client instance.
 *
 * <p>Controls how much a {@link io.xrdinfo.application.metadata.MetadataClient} or configuration loader logs about
 * individual requests. It is a per-instance setting and never changes global logger levels.</p>
 *
 * @since 0.1.0
 */
public enum Verbosity {
  /** Only warnings about degraded behaviour (source fallback, stale parts). */
  QUIET,
  /** Load and request summaries. */
  NORMAL,
  /** Request and response details, bounded by {@link io.xrdinfo.logging.Logs#truncate(String, int)}. */
  DEBUG;

  public boolean atLeast(Verbosity other) {
    return ordinal() >= other.ordinal();
  }

  /**
   * Parses a case-insensitive verbosity name.
   *
   * @param raw textual value such as {@code quiet} or {@code DEBUG}
   * @return matching verbosity
   * @throws IllegalArgumentException if the value is unknown
   */
  public static Verbosity parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("verbosity must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("verbosity must be one of quiet, normal, debug (was '" + raw + "')", ex);
    }
  }
}
