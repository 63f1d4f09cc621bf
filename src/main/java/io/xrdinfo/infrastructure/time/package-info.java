/**
 * Wall-clock adapter used when checking configuration part expiry.
 */
package io.xrdinfo.infrastructure.time;
