package io.xrdinfo.application.metadata;

import io.xrdinfo.application.json.JsonSupport;
import io.xrdinfo.application.mime.MimePart;
import io.xrdinfo.application.port.HttpTransport;
import io.xrdinfo.application.port.HttpTransport.HttpCall;
import io.xrdinfo.application.port.HttpTransport.HttpReply;
import io.xrdinfo.application.port.MetricsPort;
import io.xrdinfo.config.ClientSettings;
import io.xrdinfo.config.Verbosity;
import io.xrdinfo.domain.error.AddressResolutionException;
import io.xrdinfo.domain.error.ConnectionException;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.error.ProtocolFaultException;
import io.xrdinfo.domain.error.RequestTimeoutException;
import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.id.Identifiers;
import io.xrdinfo.domain.id.ServiceId;
import io.xrdinfo.domain.metadata.MetadataProtocol;
import io.xrdinfo.domain.metadata.MetadataRequest;
import io.xrdinfo.domain.metadata.MetadataRequestType;
import io.xrdinfo.domain.metadata.MetadataResponse;
import io.xrdinfo.domain.metadata.OpenApiDocument;
import io.xrdinfo.domain.metadata.ProtocolFault;
import io.xrdinfo.domain.metadata.ServiceList;
import io.xrdinfo.domain.metadata.WsdlDocument;
import io.xrdinfo.domain.params.SharedParams;
import io.xrdinfo.logging.Logs;
import io.xrdinfo.validation.Strings;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Client for the metadata services of a security server gateway.
 * <p><strong>Why:</strong> {@code listMethods}, {@code allowedMethods}, {@code getWsdl} and {@code getOpenAPI} share
 * one build, send, receive and parse pipeline that differs only in the message protocol.</p>
 * <p><strong>Errors:</strong> an unparseable body is a {@link FormatException}; a well-formed remote error is returned
 * as {@link ProtocolFault}; transport and TLS failures are {@link ConnectionException}; timeouts are
 * {@link RequestTimeoutException}. One request is sent per call and nothing is retried.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use when the injected transport is.</p>
 * <p><strong>Observability:</strong> counts {@code metadata.request.success}, {@code metadata.request.fault} and
 * {@code metadata.request.failure}, and records {@code metadata.request.latencyMillis}. Log output follows the
 * {@link Verbosity} of the supplied settings.</p>
 *
 * @since 0.1.0
 */
public final class MetadataClient {
  private static final Logger log = LoggerFactory.getLogger(MetadataClient.class);
  private static final String SOAP_CONTENT_TYPE = "text/xml; charset=utf-8";
  private static final String REST_ACCEPT = "application/json";
  private static final String REST_PREFIX = "/r1/";
  private static final int MAX_LOGGED_BODY_BYTES = 1024;

  private final HttpTransport transport;
  private final ClientSettings settings;
  private final MetricsPort metrics;
  private final RestResponseParser restParser;
  private final Supplier<UUID> requestIds;

  public MetadataClient(HttpTransport transport, ClientSettings settings, MetricsPort metrics) {
    this(transport, settings, metrics, UUID::randomUUID);
  }

  MetadataClient(HttpTransport transport, ClientSettings settings, MetricsPort metrics, Supplier<UUID> requestIds) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.requestIds = Objects.requireNonNull(requestIds, "requestIds");
    this.restParser = new RestResponseParser(new JsonSupport());
  }

  /**
   * Sends a request to the security server registered for the request's target.
   *
   * @param sharedParams verified shared parameters used for addressing
   * @param request metadata request
   * @return parsed response, possibly a {@link ProtocolFault}
   * @throws AddressResolutionException when no server with an address serves the target
   * @throws FormatException when the response cannot be parsed
   * @throws ConnectionException on transport or TLS failure
   * @throws RequestTimeoutException when the call times out
   */
  public MetadataResponse execute(SharedParams sharedParams, MetadataRequest request)
      throws AddressResolutionException, FormatException, ConnectionException, RequestTimeoutException {
    Objects.requireNonNull(sharedParams, "sharedParams");
    Objects.requireNonNull(request, "request");
    String address = sharedParams.resolveAddress(request.target());
    return execute(address, request);
  }

  /**
   * Sends a request to an explicit gateway.
   *
   * @param gateway gateway URL, or a bare host name that gets a scheme added
   * @param request metadata request
   * @return parsed response, possibly a {@link ProtocolFault}
   * @throws FormatException when the response cannot be parsed
   * @throws ConnectionException on transport or TLS failure, or a non-success status without a readable error
   * @throws RequestTimeoutException when the call times out
   */
  public MetadataResponse execute(String gateway, MetadataRequest request)
      throws FormatException, ConnectionException, RequestTimeoutException {
    Objects.requireNonNull(request, "request");
    URI gatewayUri = gatewayUri(gateway, settings.tls().isPresent());
    long started = System.nanoTime();
    try {
      MetadataResponse response = request.protocol() == MetadataProtocol.SOAP
          ? executeSoap(gatewayUri, request)
          : executeRest(gatewayUri, request);
      if (response instanceof ProtocolFault fault) {
        metrics.increment("metadata.request.fault");
        if (settings.verbosity().atLeast(Verbosity.NORMAL)) {
          log.info("{} on {} returned fault: {}", request.type().serviceCode(), request.target(), fault.describe());
        }
      } else {
        metrics.increment("metadata.request.success");
      }
      return response;
    } catch (FormatException | ConnectionException | RequestTimeoutException ex) {
      metrics.increment("metadata.request.failure");
      if (settings.verbosity().atLeast(Verbosity.NORMAL)) {
        log.warn("{} on {} via {} failed: {}", request.type().serviceCode(), request.target(), gatewayUri,
            ex.getMessage());
      }
      throw ex;
    } finally {
      metrics.observe("metadata.request.latencyMillis", (System.nanoTime() - started) / 1_000_000L);
    }
  }

  /**
   * Lists the services the target provides.
   *
   * @throws ProtocolFaultException when the server answers with a fault
   */
  public List<ServiceId> listMethods(String gateway, ClientId client, ClientId target, MetadataProtocol protocol)
      throws FormatException, ConnectionException, RequestTimeoutException, ProtocolFaultException {
    return services(execute(gateway, MetadataRequest.listMethods(client, target, protocol)));
  }

  /**
   * Lists the services of the target that the client may call.
   *
   * @throws ProtocolFaultException when the server answers with a fault
   */
  public List<ServiceId> allowedMethods(String gateway, ClientId client, ClientId target, MetadataProtocol protocol)
      throws FormatException, ConnectionException, RequestTimeoutException, ProtocolFaultException {
    return services(execute(gateway, MetadataRequest.allowedMethods(client, target, protocol)));
  }

  /**
   * Downloads the WSDL describing a SOAP service.
   *
   * @return WSDL text as received
   * @throws ProtocolFaultException when the server answers with a fault
   */
  public String getWsdl(String gateway, ClientId client, ServiceId service)
      throws FormatException, ConnectionException, RequestTimeoutException, ProtocolFaultException {
    MetadataResponse response = execute(gateway, MetadataRequest.getWsdl(client, service));
    if (response instanceof WsdlDocument wsdl) {
      return wsdl.text();
    }
    throw faultOf(response);
  }

  /**
   * Downloads the OpenAPI description of a REST service.
   *
   * @return description text as received
   * @throws ProtocolFaultException when the server answers with an error
   */
  public String getOpenApi(String gateway, ClientId client, ServiceId service)
      throws FormatException, ConnectionException, RequestTimeoutException, ProtocolFaultException {
    MetadataResponse response = execute(gateway, MetadataRequest.getOpenApi(client, service));
    if (response instanceof OpenApiDocument document) {
      return document.text();
    }
    throw faultOf(response);
  }

  /**
   * Turns a gateway address into a URI, adding {@code https://} when TLS is configured and {@code http://}
   * otherwise.
   *
   * @param gateway URL or bare host
   * @param tls whether TLS material is configured
   * @return absolute http(s) URI
   */
  public static URI gatewayUri(String gateway, boolean tls) {
    String value = Strings.requireNonBlank("gateway", gateway);
    if (!value.contains("://")) {
      value = (tls ? "https://" : "http://") + value;
    }
    return Strings.requireHttpUrl("gateway", value);
  }

  static URI restUri(URI gateway, MetadataRequest request) {
    StringBuilder path = new StringBuilder(REST_PREFIX)
        .append(request.target().toWire())
        .append('/')
        .append(request.type().serviceCode());
    if (request.type() == MetadataRequestType.GET_OPENAPI) {
      path.append("?serviceCode=").append(Identifiers.encodeSegment(request.service().serviceCode()));
    }
    return gateway.resolve(path.toString());
  }

  private MetadataResponse executeSoap(URI gateway, MetadataRequest request)
      throws FormatException, ConnectionException, RequestTimeoutException {
    String envelope = SoapEnvelopes.build(request, settings.userId(), requestIds.get());
    if (settings.verbosity().atLeast(Verbosity.DEBUG)) {
      log.debug("SOAP request to {}:\n{}", gateway, envelope);
    }
    HttpReply reply = send(HttpCall.post(gateway, Map.of("Content-Type", SOAP_CONTENT_TYPE),
        envelope.getBytes(StandardCharsets.UTF_8), settings.timeout()));

    List<MimePart> parts = SoapResponseParser.parts(reply.header("Content-Type").orElse(null), reply.body());
    if (parts.isEmpty()) {
      if (!reply.isSuccess()) {
        throw unexpectedStatus(gateway, reply);
      }
      throw new FormatException("SOAP response has no body parts");
    }
    String soapText = new String(parts.get(0).body(), StandardCharsets.UTF_8);
    Optional<ProtocolFault> fault;
    try {
      fault = SoapResponseParser.fault(SoapResponseParser.envelope(soapText));
    } catch (FormatException ex) {
      if (!reply.isSuccess()) {
        throw unexpectedStatus(gateway, reply);
      }
      throw ex;
    }
    if (fault.isPresent()) {
      return fault.get();
    }
    if (!reply.isSuccess()) {
      throw unexpectedStatus(gateway, reply);
    }
    if (request.type() == MetadataRequestType.GET_WSDL) {
      if (parts.size() < 2) {
        throw new FormatException("getWsdl response has no WSDL attachment");
      }
      return new WsdlDocument(new String(parts.get(1).body(), StandardCharsets.UTF_8));
    }
    return SoapResponseParser.services(SoapResponseParser.envelope(soapText), request.type());
  }

  private MetadataResponse executeRest(URI gateway, MetadataRequest request)
      throws FormatException, ConnectionException, RequestTimeoutException {
    URI uri = restUri(gateway, request);
    if (settings.verbosity().atLeast(Verbosity.DEBUG)) {
      log.debug("REST request GET {} as {}", uri, request.client().toWire());
    }
    HttpReply reply = send(HttpCall.get(uri,
        Map.of("X-Road-Client", request.client().toWire(), "Accept", REST_ACCEPT), settings.timeout()));
    String body = reply.bodyText();
    if (!reply.isSuccess()) {
      Optional<ProtocolFault> fault = restParser.fault(body);
      if (fault.isPresent()) {
        return fault.get();
      }
      throw unexpectedStatus(uri, reply);
    }
    if (request.type() == MetadataRequestType.GET_OPENAPI) {
      return new OpenApiDocument(body);
    }
    return restParser.services(body);
  }

  private HttpReply send(HttpCall call) throws ConnectionException, RequestTimeoutException {
    HttpReply reply = transport.execute(call);
    if (settings.verbosity().atLeast(Verbosity.DEBUG)) {
      log.debug("HTTP {} from {}: {}", reply.status(), call.uri(), Logs.truncate(reply.body(), MAX_LOGGED_BODY_BYTES));
    }
    return reply;
  }

  private static ConnectionException unexpectedStatus(URI uri, HttpReply reply) {
    return new ConnectionException("HTTP " + reply.status() + " from " + uri + ": " + reply.bodyText());
  }

  private static List<ServiceId> services(MetadataResponse response) throws ProtocolFaultException {
    if (response instanceof ServiceList list) {
      return list.services();
    }
    throw faultOf(response);
  }

  private static ProtocolFaultException faultOf(MetadataResponse response) {
    if (response instanceof ProtocolFault fault) {
      return new ProtocolFaultException(fault);
    }
    throw new IllegalStateException("Unexpected metadata response " + response.getClass().getSimpleName());
  }
}
