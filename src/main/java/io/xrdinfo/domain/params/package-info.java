/**
 * Typed records for members, subsystems, security servers, global groups and central services, and the
 * {@link io.xrdinfo.domain.params.SharedParams} indices built over them.
 */
package io.xrdinfo.domain.params;
