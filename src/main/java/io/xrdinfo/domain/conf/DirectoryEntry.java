package io.xrdinfo.domain.conf;

import io.xrdinfo.validation.Strings;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * One row of the signed directory listing: where a part lives and which digest it must have.
 *
 * @param contentIdentifier part type, for example {@code SHARED-PARAMETERS}
 * @param instance instance declared by the row, or {@code null} when absent
 * @param contentLocation path of the part relative to the source
 * @param expireDate per-part expiration, or {@code null} to inherit the directory's
 * @param digestAlgorithm digest algorithm identifier
 * @param digest declared digest bytes
 * @since 0.1.0
 */
public record DirectoryEntry(
    String contentIdentifier,
    String instance,
    String contentLocation,
    Instant expireDate,
    String digestAlgorithm,
    byte[] digest) {

  public DirectoryEntry {
    contentIdentifier = Strings.requireNonBlank("Content-identifier", contentIdentifier);
    contentLocation = Strings.requireNonBlank("Content-location", contentLocation);
    digestAlgorithm = Strings.requireNonBlank("Hash-algorithm-id", digestAlgorithm);
    digest = Objects.requireNonNull(digest, "digest").clone();
  }

  public Optional<String> declaredInstance() {
    return Optional.ofNullable(instance);
  }

  @Override
  public byte[] digest() {
    return digest.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DirectoryEntry other
        && contentIdentifier.equals(other.contentIdentifier)
        && Objects.equals(instance, other.instance)
        && contentLocation.equals(other.contentLocation)
        && Objects.equals(expireDate, other.expireDate)
        && digestAlgorithm.equals(other.digestAlgorithm)
        && Arrays.equals(digest, other.digest);
  }

  @Override
  public int hashCode() {
    return Objects.hash(contentIdentifier, instance, contentLocation, expireDate, digestAlgorithm)
        * 31 + Arrays.hashCode(digest);
  }

  @Override
  public String toString() {
    return "DirectoryEntry[" + contentIdentifier + ", instance=" + instance + ", location=" + contentLocation + ']';
  }
}
