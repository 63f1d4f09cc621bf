package io.xrdinfo.domain.error;

import io.xrdinfo.domain.metadata.ProtocolFault;
import java.util.Objects;

/**
 * Raised by the convenience metadata operations when the remote gateway answers with a fault.
 *
 * @since 0.1.0
 */
public class ProtocolFaultException extends XrdInfoException {
  private static final long serialVersionUID = 1L;

  private final transient ProtocolFault fault;

  public ProtocolFaultException(ProtocolFault fault) {
    super(ErrorKind.PROTOCOL_FAULT, Objects.requireNonNull(fault, "fault").describe());
    this.fault = fault;
  }

  /**
   * Returns the fault exactly as reported by the gateway.
   *
   * @return remote fault
   */
  public ProtocolFault fault() {
    return fault;
  }
}
