package io.xrdinfo.domain.metadata;

import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.id.ServiceId;
import java.util.Objects;
import java.util.Optional;

/**
 * One metadata request.
 *
 * <p>{@code getWsdl} is SOAP only and {@code getOpenApi} is REST only; both need a service whose provider is the
 * target. List operations need a subsystem target.</p>
 *
 * @param type operation
 * @param client calling member or subsystem
 * @param target providing subsystem
 * @param service described service, or {@code null} for list operations
 * @param protocol message protocol
 * @since 0.1.0
 */
public record MetadataRequest(
    MetadataRequestType type,
    ClientId client,
    ClientId target,
    ServiceId service,
    MetadataProtocol protocol) {

  public MetadataRequest {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(protocol, "protocol");
    if (!target.isSubsystem()) {
      throw new IllegalArgumentException("metadata target must be a subsystem: " + target);
    }
    if (type.requiresService()) {
      if (service == null) {
        throw new IllegalArgumentException(type.serviceCode() + " requires a service identifier");
      }
      if (!service.provider().equals(target)) {
        throw new IllegalArgumentException("service " + service + " is not provided by " + target);
      }
    }
    if (type == MetadataRequestType.GET_WSDL && protocol != MetadataProtocol.SOAP) {
      throw new IllegalArgumentException("getWsdl is only available over SOAP");
    }
    if (type == MetadataRequestType.GET_OPENAPI && protocol != MetadataProtocol.REST) {
      throw new IllegalArgumentException("getOpenApi is only available over REST");
    }
  }

  public static MetadataRequest listMethods(ClientId client, ClientId target, MetadataProtocol protocol) {
    return new MetadataRequest(MetadataRequestType.LIST_METHODS, client, target, null, protocol);
  }

  public static MetadataRequest allowedMethods(ClientId client, ClientId target, MetadataProtocol protocol) {
    return new MetadataRequest(MetadataRequestType.ALLOWED_METHODS, client, target, null, protocol);
  }

  public static MetadataRequest getWsdl(ClientId client, ServiceId service) {
    return new MetadataRequest(
        MetadataRequestType.GET_WSDL, client, service.provider(), service, MetadataProtocol.SOAP);
  }

  public static MetadataRequest getOpenApi(ClientId client, ServiceId service) {
    return new MetadataRequest(
        MetadataRequestType.GET_OPENAPI, client, service.provider(), service, MetadataProtocol.REST);
  }

  public Optional<ServiceId> serviceId() {
    return Optional.ofNullable(service);
  }
}
