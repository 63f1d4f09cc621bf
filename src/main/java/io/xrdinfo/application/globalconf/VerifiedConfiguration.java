package io.xrdinfo.application.globalconf;

import io.xrdinfo.domain.conf.ConfigurationPart;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration parts whose digests and directory signature have been verified.
 *
 * <p>Only {@link TrustVerifier} creates instances, so holding one proves verification took place.</p>
 *
 * @since 0.1.0
 */
public final class VerifiedConfiguration {
  private final String instanceIdentifier;
  private final URI source;
  private final String version;
  private final List<ConfigurationPart> parts;

  VerifiedConfiguration(String instanceIdentifier, URI source, String version, List<ConfigurationPart> parts) {
    this.instanceIdentifier = Objects.requireNonNull(instanceIdentifier, "instanceIdentifier");
    this.source = Objects.requireNonNull(source, "source");
    this.version = version;
    this.parts = List.copyOf(parts);
  }

  public String instanceIdentifier() {
    return instanceIdentifier;
  }

  /** Source the configuration was downloaded from. */
  public URI source() {
    return source;
  }

  /** Directory format version, when declared. */
  public Optional<String> version() {
    return Optional.ofNullable(version);
  }

  public List<ConfigurationPart> parts() {
    return parts;
  }

  /**
   * Finds the first part with the given content identifier for this instance.
   *
   * @param contentIdentifier for example {@link ConfigurationPart#SHARED_PARAMETERS}
   * @return matching part
   */
  public Optional<ConfigurationPart> part(String contentIdentifier) {
    return parts.stream()
        .filter(p -> p.contentIdentifier().equals(contentIdentifier))
        .filter(p -> p.instanceId().equals(instanceIdentifier))
        .findFirst();
  }

  public boolean hasStaleParts() {
    return parts.stream().anyMatch(ConfigurationPart::stale);
  }
}
