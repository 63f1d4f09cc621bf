/**
 * Streaming JSON parsing into ordered maps and lists, built on jackson-core.
 */
package io.xrdinfo.application.json;
