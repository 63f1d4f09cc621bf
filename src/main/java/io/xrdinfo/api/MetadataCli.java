package io.xrdinfo.api;

import io.xrdinfo.application.metadata.MetadataClient;
import io.xrdinfo.application.metadata.WsdlOperationLister;
import io.xrdinfo.application.openapi.OpenApiDocumentLoader;
import io.xrdinfo.application.openapi.OpenApiEndpointLister;
import io.xrdinfo.application.port.HttpTransport;
import io.xrdinfo.application.port.MetricsPort;
import io.xrdinfo.config.ClientSettings;
import io.xrdinfo.domain.conf.ConfigurationAnchor;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.error.XrdInfoException;
import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.id.ServiceId;
import io.xrdinfo.domain.metadata.MetadataProtocol;
import io.xrdinfo.domain.metadata.MetadataRequest;
import io.xrdinfo.domain.metadata.MetadataResponse;
import io.xrdinfo.domain.metadata.OpenApiDocument;
import io.xrdinfo.domain.metadata.OpenApiEndpoint;
import io.xrdinfo.domain.metadata.ProtocolFault;
import io.xrdinfo.domain.metadata.ServiceList;
import io.xrdinfo.domain.metadata.WsdlDocument;
import io.xrdinfo.domain.metadata.WsdlOperation;
import io.xrdinfo.domain.params.SharedParams;
import io.xrdinfo.infrastructure.http.JdkHttpTransport;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commands that query security server metadata services: {@code methods}, {@code wsdl} and {@code openapi}.
 *
 * <p>Requests go to {@code gateway=} when given. Otherwise the configuration named by {@code anchor=} is loaded and
 * the request is sent to the server registered for the target subsystem.</p>
 *
 * @since 0.1.0
 */
final class MetadataCli {
  private static final Logger log = LoggerFactory.getLogger(MetadataCli.class);
  private static final Set<String> KEYS = Set.of("client", "target", "service", "protocol", "gateway");
  private static final String HELP_TEXT = """
      xrdinfo metadata queries

      Usage:
        xrdinfo methods client=ID target=ID [protocol=soap|rest] [--allowed] [gateway=URL|anchor=PATH]
        xrdinfo wsdl client=ID service=ID [--operations] [gateway=URL|anchor=PATH]
        xrdinfo openapi client=ID service=ID [--endpoints] [gateway=URL|anchor=PATH]

      Identifiers:
        client=INSTANCE/CLASS/CODE[/SUBSYSTEM]
        target=INSTANCE/CLASS/CODE/SUBSYSTEM
        service=INSTANCE/CLASS/CODE/SUBSYSTEM/SERVICE[/VERSION]

      Flags:
        --allowed     List the services the client may call instead of all services
        --operations  Print operation and version rows instead of the WSDL text
        --endpoints   Print method, path, operationId and summary rows instead of the OpenAPI text

      """ + CliSupport.COMMON_HELP;

  private MetadataCli() {}

  static ExitCode run(String command, String[] args) {
    return run(command, args, JdkHttpTransport::new);
  }

  static ExitCode run(String command, String[] args, Function<ClientSettings, HttpTransport> transports) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    Map<String, String> options;
    ClientSettings settings;
    MetadataRequest request;
    MetricsPort metrics;
    try {
      options = CliSupport.options(command, input.keyValueArgs(), KEYS);
      settings = CliSupport.settings(options, input.verbose());
      request = request(command, input, options);
      if (CliSupport.optional(options, "gateway").isEmpty() && CliSupport.optional(options, "anchor").isEmpty()) {
        throw new IllegalArgumentException("gateway=URL or anchor=PATH is required");
      }
      metrics = TelemetryConfigurator.configureMetrics(options);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", command, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      return CliSupport.reportConfig(command, ex);
    }

    try {
      HttpTransport transport = transports.apply(settings);
      MetadataClient client = new MetadataClient(transport, settings, metrics);
      Optional<String> gateway = CliSupport.optional(options, "gateway");
      MetadataResponse response;
      if (gateway.isPresent()) {
        response = client.execute(gateway.get(), request);
      } else {
        ConfigurationAnchor anchor;
        try {
          anchor = CliSupport.anchor(options);
        } catch (IOException | FormatException ex) {
          return CliSupport.reportConfig(command, ex);
        }
        SharedParams params = CliSupport.loader(transport, settings, metrics).load(anchor).sharedParams();
        response = client.execute(params, request);
      }
      return print(command, input, response);
    } catch (XrdInfoException ex) {
      return CliSupport.report(command, ex);
    } finally {
      TelemetryConfigurator.close(metrics);
    }
  }

  private static MetadataRequest request(String command, CliInput input, Map<String, String> options) {
    ClientId client = ClientId.parse(CliSupport.required(options, "client"));
    switch (command) {
      case "methods" -> {
        ClientId target = ClientId.parse(CliSupport.required(options, "target"));
        MetadataProtocol protocol = MetadataProtocol.parse(options.getOrDefault("protocol", "soap"));
        return input.hasFlag("--allowed")
            ? MetadataRequest.allowedMethods(client, target, protocol)
            : MetadataRequest.listMethods(client, target, protocol);
      }
      case "wsdl" -> {
        return MetadataRequest.getWsdl(client, ServiceId.parse(CliSupport.required(options, "service")));
      }
      case "openapi" -> {
        return MetadataRequest.getOpenApi(client, ServiceId.parse(CliSupport.required(options, "service")));
      }
      default -> throw new IllegalArgumentException("Unknown metadata command " + command);
    }
  }

  private static ExitCode print(String command, CliInput input, MetadataResponse response) throws FormatException {
    if (response instanceof ProtocolFault fault) {
      if (fault.isNotOpenApiService()) {
        log.error("{}: service has no OpenAPI description ({})", command, fault.faultString());
      } else if (fault.isOpenApiReadFailure()) {
        log.error("{}: security server could not read the service description: {}", command, fault.faultString());
      } else {
        log.error("{}: security server fault: {}", command, fault.describe());
      }
      return ExitCode.REMOTE_FAULT;
    }
    if (response instanceof ServiceList list) {
      for (ServiceId service : list.services()) {
        CliPrinter.println(service.toWire());
      }
    } else if (response instanceof WsdlDocument wsdl) {
      if (input.hasFlag("--operations")) {
        for (WsdlOperation operation : new WsdlOperationLister().list(wsdl.text())) {
          CliPrinter.printRow(operation.name(), operation.version().orElse(""));
        }
      } else {
        CliPrinter.println(wsdl.text());
      }
    } else if (response instanceof OpenApiDocument document) {
      if (input.hasFlag("--endpoints")) {
        Map<?, ?> parsed = new OpenApiDocumentLoader().load(document.text());
        for (OpenApiEndpoint endpoint : new OpenApiEndpointLister().list(parsed)) {
          CliPrinter.printRow(endpoint.method(), endpoint.path(), endpoint.operation().orElse(""), endpoint.summary());
        }
      } else {
        CliPrinter.println(document.text());
      }
    }
    return ExitCode.SUCCESS;
  }
}
