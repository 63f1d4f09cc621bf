package io.xrdinfo.domain.error;

/**
 * Raised when the directory signature, signing certificate or instance cannot be trusted.
 *
 * @since 0.1.0
 */
public class TrustException extends XrdInfoException {
  private static final long serialVersionUID = 1L;

  public TrustException(String message) {
    super(ErrorKind.TRUST, message);
  }

  public TrustException(String message, Throwable cause) {
    super(ErrorKind.TRUST, message, cause);
  }
}
