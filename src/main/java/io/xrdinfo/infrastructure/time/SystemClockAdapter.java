package io.xrdinfo.infrastructure.time;

import io.xrdinfo.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
