package io.xrdinfo.api;

/**
 * <strong>What:</strong> Process exit codes of the {@code xrdinfo} commands.
 * <p><strong>Why:</strong> Scripts distinguish bad arguments, unreachable sources, rejected configuration and remote
 * faults without parsing log output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A source or gateway could not be reached, timed out, or had no address. */
  IO_ERROR(3),
  /** The anchor or YAML configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** A response could not be parsed, or another unexpected failure occurred. */
  RUNTIME_FAILURE(5),
  /** The security server answered with a fault. */
  REMOTE_FAULT(6),
  /** Global configuration failed signature, instance or digest verification. */
  TRUST_FAILURE(7);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
