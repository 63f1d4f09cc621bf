/**
 * OpenAPI description loading (JSON or YAML) and endpoint enumeration.
 */
package io.xrdinfo.application.openapi;
