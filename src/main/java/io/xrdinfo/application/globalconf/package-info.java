/**
 * <strong>Purpose:</strong> Global configuration use cases: download from anchor sources, directory parsing, trust
 * verification and shared-parameters parsing.
 * <p><strong>Flow:</strong> {@link io.xrdinfo.application.globalconf.ConfigurationFetcher} to
 * {@link io.xrdinfo.application.globalconf.DirectoryParser} to
 * {@link io.xrdinfo.application.globalconf.TrustVerifier} to
 * {@link io.xrdinfo.application.globalconf.SharedParamsParser}, chained by
 * {@link io.xrdinfo.application.globalconf.GlobalConfLoader}.
 * <p><strong>Concurrency:</strong> Synchronous and blocking; results are immutable.
 *
 * @since 0.1.0
 */
package io.xrdinfo.application.globalconf;
