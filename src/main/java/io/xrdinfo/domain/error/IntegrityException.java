package io.xrdinfo.domain.error;

/**
 * Raised when a configuration part's recomputed digest differs from the declared value.
 *
 * @since 0.1.0
 */
public class IntegrityException extends XrdInfoException {
  private static final long serialVersionUID = 1L;

  public IntegrityException(String message) {
    super(ErrorKind.INTEGRITY, message);
  }

  public IntegrityException(String message, Throwable cause) {
    super(ErrorKind.INTEGRITY, message, cause);
  }
}
