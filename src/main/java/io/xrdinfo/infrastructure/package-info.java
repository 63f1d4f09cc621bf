/**
 * Adapters implementing the application ports: JDK HTTP transport, OpenTelemetry metrics, system clock and DNS
 * lookups.
 */
package io.xrdinfo.infrastructure;
