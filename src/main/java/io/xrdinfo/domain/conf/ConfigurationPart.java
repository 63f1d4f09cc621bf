package io.xrdinfo.domain.conf;

import io.xrdinfo.validation.Strings;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A verified configuration part: directory metadata plus the downloaded content.
 *
 * <p>Instances are created only after digest and signature checks pass. {@code stale} reports that the expiration
 * time had passed at verification time; stale parts remain usable for offline work.</p>
 *
 * @param contentIdentifier part type, for example {@code SHARED-PARAMETERS}
 * @param instanceId instance the part belongs to
 * @param location content location relative to the source
 * @param expirationTime expiration time, or {@code null} when none was declared
 * @param digestAlgorithm declared digest algorithm identifier
 * @param digestValue declared and verified digest
 * @param rawBytes part content
 * @param stale whether the part had expired when verified
 * @since 0.1.0
 */
public record ConfigurationPart(
    String contentIdentifier,
    String instanceId,
    String location,
    Instant expirationTime,
    String digestAlgorithm,
    byte[] digestValue,
    byte[] rawBytes,
    boolean stale) {

  /** Content identifier of the shared parameters part. */
  public static final String SHARED_PARAMETERS = "SHARED-PARAMETERS";
  /** Content identifier of the private parameters part. */
  public static final String PRIVATE_PARAMETERS = "PRIVATE-PARAMETERS";

  public ConfigurationPart {
    Strings.requireNonBlank("contentIdentifier", contentIdentifier);
    Strings.requireNonBlank("instanceId", instanceId);
    Strings.requireNonBlank("location", location);
    digestValue = Objects.requireNonNull(digestValue, "digestValue").clone();
    rawBytes = Objects.requireNonNull(rawBytes, "rawBytes").clone();
  }

  public Optional<Instant> expiration() {
    return Optional.ofNullable(expirationTime);
  }

  @Override
  public byte[] digestValue() {
    return digestValue.clone();
  }

  @Override
  public byte[] rawBytes() {
    return rawBytes.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ConfigurationPart other
        && stale == other.stale
        && contentIdentifier.equals(other.contentIdentifier)
        && instanceId.equals(other.instanceId)
        && location.equals(other.location)
        && Objects.equals(expirationTime, other.expirationTime)
        && Objects.equals(digestAlgorithm, other.digestAlgorithm)
        && Arrays.equals(digestValue, other.digestValue)
        && Arrays.equals(rawBytes, other.rawBytes);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(contentIdentifier, instanceId, location, expirationTime, digestAlgorithm, stale);
    result = 31 * result + Arrays.hashCode(digestValue);
    return 31 * result + Arrays.hashCode(rawBytes);
  }

  @Override
  public String toString() {
    return "ConfigurationPart[" + contentIdentifier + ", instance=" + instanceId + ", location=" + location
        + ", bytes=" + rawBytes.length + ", stale=" + stale + ']';
  }
}
