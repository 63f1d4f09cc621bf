package io.xrdinfo.domain.error;

/**
 * Classifies failures surfaced by configuration loading and metadata requests.
 *
 * <p>Callers switch on the kind rather than on concrete exception types when mapping failures to
 * exit codes or metrics.</p>
 *
 * @since 0.1.0
 */
public enum ErrorKind {
  /** Remote endpoint unreachable or returned a non-success HTTP status. */
  NETWORK,
  /** Request exceeded its per-call timeout. */
  TIMEOUT,
  /** Response or document could not be parsed. */
  FORMAT,
  /** Recomputed digest does not match the declared digest. */
  INTEGRITY,
  /** Signature, certificate or instance could not be trusted. */
  TRUST,
  /** Remote gateway answered with a well-formed fault. */
  PROTOCOL_FAULT,
  /** No security server address is registered for the requested identifier. */
  ADDRESS_RESOLUTION,
  /** Transport or TLS handshake failure while talking to a gateway. */
  CONNECTION
}
