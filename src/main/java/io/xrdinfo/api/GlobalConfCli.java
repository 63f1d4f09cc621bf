package io.xrdinfo.api;

import io.xrdinfo.application.globalconf.LoadedConfiguration;
import io.xrdinfo.application.globalconf.SharedParamsParser;
import io.xrdinfo.application.globalconf.VerificationConfClient;
import io.xrdinfo.application.port.HttpTransport;
import io.xrdinfo.application.port.MetricsPort;
import io.xrdinfo.config.ClientSettings;
import io.xrdinfo.domain.conf.ConfigurationAnchor;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.error.XrdInfoException;
import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.params.GlobalGroup;
import io.xrdinfo.domain.params.Member;
import io.xrdinfo.domain.params.NamedSubsystem;
import io.xrdinfo.domain.params.SecurityServer;
import io.xrdinfo.domain.params.SharedParams;
import io.xrdinfo.domain.params.Subsystem;
import io.xrdinfo.domain.params.SubsystemServers;
import io.xrdinfo.infrastructure.http.JdkHttpTransport;
import io.xrdinfo.infrastructure.net.HostAddresses;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commands that print listings from verified shared parameters: {@code members}, {@code subsystems}, {@code servers},
 * {@code server-ips} and {@code groups}.
 *
 * @since 0.1.0
 */
final class GlobalConfCli {
  private static final Logger log = LoggerFactory.getLogger(GlobalConfCli.class);
  private static final String HELP_TEXT = """
      xrdinfo global configuration listings

      Usage:
        xrdinfo members anchor=PATH [options]
        xrdinfo subsystems anchor=PATH [--with-name|--registered|--with-servers] [options]
        xrdinfo servers anchor=PATH [options]
        xrdinfo server-ips anchor=PATH [options]
        xrdinfo groups anchor=PATH [--members] [options]

      Output is one tab-separated row per entry. Identifiers use the slash-separated,
      percent-encoded wire form, for example EE/GOV/70000001/portal.

      Without an anchor, securityServer=HOST[:PORT] reads the verification configuration
      the security server publishes at /verificationconf. instance=ID selects another
      instance than the server's own.

      """ + CliSupport.COMMON_HELP;

  private static final Set<String> KEYS = Set.of("securityServer", "instance");

  private GlobalConfCli() {}

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
    MetricsPort metrics;
    try {
      options = CliSupport.options(command, input.keyValueArgs(), KEYS);
      settings = CliSupport.settings(options, input.verbose());
      metrics = TelemetryConfigurator.configureMetrics(options);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", command, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      return CliSupport.reportConfig(command, ex);
    }

    try {
      Optional<String> securityServer = CliSupport.optional(options, "securityServer");
      if (securityServer.isPresent()) {
        SharedParams params = new VerificationConfClient(
            transports.apply(settings), new SharedParamsParser(), settings, metrics)
            .load(securityServer.get(), CliSupport.optional(options, "instance"));
        print(command, input, params);
        return ExitCode.SUCCESS;
      }
      ConfigurationAnchor anchor;
      try {
        anchor = CliSupport.anchor(options);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid {} arguments: {} (or securityServer=HOST)", command, ex.getMessage());
        return ExitCode.INVALID_ARGS;
      } catch (IOException | FormatException ex) {
        return CliSupport.reportConfig(command, ex);
      }
      LoadedConfiguration loaded =
          CliSupport.loader(transports.apply(settings), settings, metrics).load(anchor);
      if (loaded.stale()) {
        log.warn("Configuration of {} contains expired parts", anchor.instanceIdentifier());
      }
      print(command, input, loaded.sharedParams());
      return ExitCode.SUCCESS;
    } catch (XrdInfoException ex) {
      return CliSupport.report(command, ex);
    } finally {
      TelemetryConfigurator.close(metrics);
    }
  }

  private static void print(String command, CliInput input, SharedParams params) {
    switch (command) {
      case "members" -> {
        for (Member member : params.members()) {
          CliPrinter.printRow(member.id().toWire(), member.name());
        }
      }
      case "subsystems" -> printSubsystems(input, params);
      case "servers" -> {
        for (SecurityServer server : params.securityServers()) {
          CliPrinter.printRow(server.id().toWire(), server.address().orElse(""));
        }
      }
      case "server-ips" -> {
        for (String ip : new HostAddresses().serverIps(params)) {
          CliPrinter.println(ip);
        }
      }
      case "groups" -> {
        for (GlobalGroup group : params.globalGroups()) {
          if (input.hasFlag("--members")) {
            for (ClientId member : group.members()) {
              CliPrinter.printRow(group.groupCode(), member.toWire());
            }
          } else {
            CliPrinter.printRow(group.groupCode(), group.description());
          }
        }
      }
      default -> throw new IllegalArgumentException("Unknown listing " + command);
    }
  }

  private static void printSubsystems(CliInput input, SharedParams params) {
    if (input.hasFlag("--with-name")) {
      for (NamedSubsystem named : params.subsystemsWithMemberName()) {
        CliPrinter.printRow(named.subsystem().id().toWire(), named.memberName());
      }
    } else if (input.hasFlag("--with-servers")) {
      for (SubsystemServers entry : params.subsystemsWithServers()) {
        for (SecurityServer server : entry.servers()) {
          CliPrinter.printRow(entry.subsystem().id().toWire(), server.id().toWire(), server.address().orElse(""));
        }
      }
    } else {
      List<Subsystem> subsystems =
          input.hasFlag("--registered") ? params.registeredSubsystems() : params.subsystems();
      for (Subsystem subsystem : subsystems) {
        CliPrinter.printRow(subsystem.id().toWire(), subsystem.name().orElse(""));
      }
    }
  }
}
