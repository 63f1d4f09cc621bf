package io.xrdinfo.domain.metadata;

/**
 * Metadata operations offered by security servers.
 *
 * @since 0.1.0
 */
public enum MetadataRequestType {
  LIST_METHODS("listMethods"),
  ALLOWED_METHODS("allowedMethods"),
  GET_WSDL("getWsdl"),
  GET_OPENAPI("getOpenAPI");

  private final String serviceCode;

  MetadataRequestType(String serviceCode) {
    this.serviceCode = serviceCode;
  }

  /** Service code used on the wire, for example {@code listMethods}. */
  public String serviceCode() {
    return serviceCode;
  }

  /** Whether the operation describes one service and therefore needs a service identifier. */
  public boolean requiresService() {
    return this == GET_WSDL || this == GET_OPENAPI;
  }
}
