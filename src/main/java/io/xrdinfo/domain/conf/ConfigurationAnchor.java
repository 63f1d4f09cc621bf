package io.xrdinfo.domain.conf;

import io.xrdinfo.validation.Strings;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Trust root for global configuration: the instance identifier plus the ordered list of
 * sources allowed to publish it.
 * <p><strong>Role:</strong> Immutable input to {@code ConfigurationFetcher} and {@code TrustVerifier}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @param instanceIdentifier federation instance the anchor belongs to
 * @param sources sources in the order they are tried; at least one
 * @param generatedAt anchor generation time, or {@code null} when unknown
 * @since 0.1.0
 */
public record ConfigurationAnchor(String instanceIdentifier, List<AnchorSource> sources, Instant generatedAt) {

  public ConfigurationAnchor {
    instanceIdentifier = Strings.requireNonBlank("instanceIdentifier", instanceIdentifier);
    sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("anchor must list at least one source");
    }
  }

  public Optional<Instant> generated() {
    return Optional.ofNullable(generatedAt);
  }
}
