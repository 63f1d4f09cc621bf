package io.xrdinfo.domain.error;

/**
 * Raised when a request exceeds its caller-supplied timeout.
 *
 * @since 0.1.0
 */
public class RequestTimeoutException extends XrdInfoException {
  private static final long serialVersionUID = 1L;

  public RequestTimeoutException(String message) {
    super(ErrorKind.TIMEOUT, message);
  }

  public RequestTimeoutException(String message, Throwable cause) {
    super(ErrorKind.TIMEOUT, message, cause);
  }
}
