/**
 * Member, subsystem, service and security server identifiers and their percent-encoded wire form.
 */
package io.xrdinfo.domain.id;
