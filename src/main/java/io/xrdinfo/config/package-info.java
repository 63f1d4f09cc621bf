/**
 * Immutable client settings and the YAML loader that supplies CLI defaults.
 * <p>The core consumes only explicit {@link io.xrdinfo.config.ClientSettings} values; YAML loading is an adapter
 * concern used by {@code io.xrdinfo.api}.</p>
 */
package io.xrdinfo.config;
