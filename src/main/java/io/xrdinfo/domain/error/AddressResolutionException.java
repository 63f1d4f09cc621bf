package io.xrdinfo.domain.error;

/**
 * Raised when no security server address is registered for an identifier.
 *
 * @since 0.1.0
 */
public class AddressResolutionException extends XrdInfoException {
  private static final long serialVersionUID = 1L;

  public AddressResolutionException(String message) {
    super(ErrorKind.ADDRESS_RESOLUTION, message);
  }

  public AddressResolutionException(String message, Throwable cause) {
    super(ErrorKind.ADDRESS_RESOLUTION, message, cause);
  }
}
