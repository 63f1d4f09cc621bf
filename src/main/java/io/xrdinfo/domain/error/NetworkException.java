package io.xrdinfo.domain.error;

import java.util.OptionalInt;

/**
 * Raised when a configuration source cannot be reached or answers with a non-success status.
 *
 * <p>When the failure is an HTTP status the status code is retained and the remote body text is carried in the
 * message verbatim.</p>
 *
 * @since 0.1.0
 */
public class NetworkException extends XrdInfoException {
  private static final long serialVersionUID = 1L;

  private final int status;

  public NetworkException(String message) {
    this(message, -1, null);
  }

  public NetworkException(String message, Throwable cause) {
    this(message, -1, cause);
  }

  public NetworkException(String message, int status, Throwable cause) {
    super(ErrorKind.NETWORK, message, cause);
    this.status = status;
  }

  /**
   * Returns the HTTP status that caused the failure, when there was one.
   *
   * @return status code, or empty for connection-level failures
   */
  public OptionalInt status() {
    return status < 0 ? OptionalInt.empty() : OptionalInt.of(status);
  }
}
