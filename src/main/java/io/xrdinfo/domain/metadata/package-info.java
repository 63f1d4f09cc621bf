/**
 * <strong>Purpose:</strong> Request and response types of the metadata protocol.
 * <p>{@link io.xrdinfo.domain.metadata.MetadataResponse} is sealed: the set of outcomes, including
 * {@link io.xrdinfo.domain.metadata.ProtocolFault}, is closed.
 *
 * @since 0.1.0
 */
package io.xrdinfo.domain.metadata;
