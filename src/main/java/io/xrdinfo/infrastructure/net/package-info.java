/**
 * DNS helpers for security server addresses.
 */
package io.xrdinfo.infrastructure.net;
