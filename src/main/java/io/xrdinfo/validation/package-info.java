/**
 * <strong>Purpose:</strong> Input validation helpers shared by identifiers, CLI parsing and configuration loading.
 * <p><strong>Concurrency:</strong> Stateless utilities; thread-safe.
 * <p><strong>Observability:</strong> Emits no logs; callers surface {@link java.lang.IllegalArgumentException}
 * messages to operators.
 *
 * @since 0.1.0
 */
package io.xrdinfo.validation;
