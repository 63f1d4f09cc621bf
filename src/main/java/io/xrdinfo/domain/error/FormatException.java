package io.xrdinfo.domain.error;

/**
 * Raised when a directory, shared-parameters document or gateway response cannot be parsed.
 *
 * @since 0.1.0
 */
public class FormatException extends XrdInfoException {
  private static final long serialVersionUID = 1L;

  public FormatException(String message) {
    super(ErrorKind.FORMAT, message);
  }

  public FormatException(String message, Throwable cause) {
    super(ErrorKind.FORMAT, message, cause);
  }
}
