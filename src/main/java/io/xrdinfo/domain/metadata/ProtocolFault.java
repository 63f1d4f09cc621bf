package io.xrdinfo.domain.metadata;

/**
 * Fault reported by a security server.
 *
 * <p>SOAP faults carry {@code faultcode}/{@code faultstring}; REST errors carry {@code type}/{@code message}. Both
 * texts are kept exactly as the server sent them.</p>
 *
 * @param faultCode fault code or REST error type; empty when the server sent none
 * @param faultString fault text or REST error message; empty when the server sent none
 * @since 0.1.0
 */
public record ProtocolFault(String faultCode, String faultString) implements MetadataResponse {
  private static final String NOT_OPENAPI_SERVICE = "Invalid service type: REST";
  private static final String OPENAPI_READ_FAILURE = "Failed reading service description from";

  public ProtocolFault {
    faultCode = faultCode == null ? "" : faultCode;
    faultString = faultString == null ? "" : faultString;
  }

  /** Whether the service exists but has no OpenAPI description. */
  public boolean isNotOpenApiService() {
    return NOT_OPENAPI_SERVICE.equals(faultString);
  }

  /** Whether the providing server failed to read the service's OpenAPI description. */
  public boolean isOpenApiReadFailure() {
    return faultString.startsWith(OPENAPI_READ_FAILURE);
  }

  public String describe() {
    return faultCode.isEmpty() ? faultString : faultCode + ": " + faultString;
  }
}
