package io.xrdinfo.domain.id;

/**
 * Values of the {@code id:objectType} attribute carried by identifiers in SOAP headers.
 */
public enum ObjectType {
  MEMBER,
  SUBSYSTEM,
  SERVICE,
  SERVER
}
