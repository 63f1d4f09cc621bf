/**
 * Command-line entry points.
 * <p><strong>Role:</strong> Thin adapters that parse {@code key=value} options, wire the core with the JDK HTTP
 * transport, and print tab-separated results through {@link io.xrdinfo.api.CliPrinter}.</p>
 * <p><strong>Errors:</strong> Domain failures map onto {@link io.xrdinfo.api.ExitCode}s; stack traces are logged at
 * DEBUG only.</p>
 */
package io.xrdinfo.api;
