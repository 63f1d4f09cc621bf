package io.xrdinfo.domain.error;

/**
 * Raised on transport or TLS failures while talking to a remote endpoint.
 *
 * @since 0.1.0
 */
public class ConnectionException extends XrdInfoException {
  private static final long serialVersionUID = 1L;

  public ConnectionException(String message) {
    super(ErrorKind.CONNECTION, message);
  }

  public ConnectionException(String message, Throwable cause) {
    super(ErrorKind.CONNECTION, message, cause);
  }
}
