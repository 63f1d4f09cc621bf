/**
 * HTTP transport on the JDK client, with TLS contexts built from PKCS#12 or PEM material.
 * <p><strong>Security:</strong> There is no mode that disables certificate validation.</p>
 */
package io.xrdinfo.infrastructure.http;
