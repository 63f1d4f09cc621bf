/**
 * Checked exception hierarchy for configuration loading and metadata requests.
 * <p>Every exception exposes an {@link io.xrdinfo.domain.error.ErrorKind} and keeps remote-supplied detail text
 * verbatim in its message.</p>
 */
package io.xrdinfo.domain.error;
