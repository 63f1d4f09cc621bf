package io.xrdinfo.domain.metadata;

/**
 * Result of a metadata request: a service list, a description document, or a remote fault.
 *
 * @since 0.1.0
 */
public sealed interface MetadataResponse
    permits ServiceList, WsdlDocument, OpenApiDocument, ProtocolFault {}
