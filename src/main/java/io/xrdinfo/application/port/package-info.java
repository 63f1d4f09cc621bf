/**
 * <strong>Purpose:</strong> Ports through which application services reach time, metrics and HTTP.
 * <p><strong>Role:</strong> Implemented by adapters under {@code io.xrdinfo.infrastructure}; replaced by fakes in
 * tests.
 *
 * @since 0.1.0
 */
package io.xrdinfo.application.port;
