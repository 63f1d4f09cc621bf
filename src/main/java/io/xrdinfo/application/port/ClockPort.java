package io.xrdinfo.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying the current time to configuration verification.
 * <p><strong>Why:</strong> Staleness of configuration parts depends on wall-clock time; tests inject fixed clocks.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see io.xrdinfo.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;

  /**
   * Returns a clock frozen at {@code instant}.
   *
   * @param instant fixed time
   * @return fixed clock
   */
  static ClockPort fixed(Instant instant) {
    long millis = instant.toEpochMilli();
    return () -> millis;
  }
}
