package io.xrdinfo.api;

import io.xrdinfo.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code xrdinfo} command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: xrdinfo <members|subsystems|servers|server-ips|groups|methods|wsdl|openapi> [options]";
  private static final String HELP_TEXT = """
      xrdinfo: global configuration and service metadata client

      Usage:
        xrdinfo <command> [key=value...] [flags]

      Commands:
        members     Members with names
        subsystems  Subsystems (--with-name, --registered, --with-servers)
        servers     Security servers with addresses
        server-ips  IP addresses of all security servers
        groups      Global groups (--members)
        methods     listMethods or allowedMethods of a subsystem
        wsdl        WSDL of a SOAP service
        openapi     OpenAPI description of a REST service

      Run xrdinfo <command> --help for the options of a command.
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    if (args == null || args.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);
    if (command.equals("--help") || command.equals("-h") || command.equals("help")) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (CliInput.parse(delegateArgs).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", command);
    }
    return switch (command) {
      case "members", "subsystems", "servers", "server-ips", "groups" -> GlobalConfCli.run(command, delegateArgs);
      case "methods", "wsdl", "openapi" -> MetadataCli.run(command, delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
