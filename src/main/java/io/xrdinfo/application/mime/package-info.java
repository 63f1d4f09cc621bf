/**
 * Byte-exact multipart splitting and MIME header parsing for configuration directories and SOAP attachments.
 */
package io.xrdinfo.application.mime;
