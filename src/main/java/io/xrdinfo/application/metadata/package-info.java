/**
 * Metadata service client: SOAP envelopes, REST paths, response parsing and WSDL operation listing.
 */
package io.xrdinfo.application.metadata;
