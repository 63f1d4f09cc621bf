package io.xrdinfo.domain.error;

import java.util.Objects;

/**
 * <strong>What:</strong> Base checked exception for every failure raised by the xrdinfo core.
 * <p><strong>Why:</strong> Configuration loads and metadata requests fail for remote reasons callers must handle
 * explicitly; a checked base forces that decision at the call site.</p>
 * <p><strong>Role:</strong> Domain error contract shared by application services and adapters.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 * @see ErrorKind
 */
public abstract class XrdInfoException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  protected XrdInfoException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  protected XrdInfoException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure classification.
   *
   * @return error kind; never {@code null}
   */
  public ErrorKind kind() {
    return kind;
  }
}
