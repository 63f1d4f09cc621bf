/**
 * <strong>Purpose:</strong> Values describing configuration anchors, signed directories and verified parts.
 * <p><strong>Concurrency:</strong> All types are immutable; byte arrays are copied on the way in and out.
 *
 * @since 0.1.0
 */
package io.xrdinfo.domain.conf;
