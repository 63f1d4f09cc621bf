/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound remote payloads before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Security:</strong> Provides redaction helpers so key passwords never reach logs.
 *
 * @since 0.1.0
 */
package io.xrdinfo.logging;
