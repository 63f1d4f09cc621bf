package io.xrdinfo.domain.conf;

import io.xrdinfo.validation.Strings;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Detached signature over a configuration directory.
 *
 * @param algorithm signature algorithm identifier
 * @param value raw signature bytes
 * @param certificateHash hash of the signing certificate, or {@code null} when not declared
 * @param certificateHashAlgorithm algorithm of {@code certificateHash}, or {@code null}
 * @since 0.1.0
 */
public record DirectorySignature(
    String algorithm,
    byte[] value,
    byte[] certificateHash,
    String certificateHashAlgorithm) {

  public DirectorySignature {
    algorithm = Strings.requireNonBlank("Signature-algorithm-id", algorithm);
    value = Objects.requireNonNull(value, "value").clone();
    if ((certificateHash == null) != (certificateHashAlgorithm == null)) {
      throw new IllegalArgumentException("certificate hash and its algorithm must be declared together");
    }
    certificateHash = certificateHash == null ? null : certificateHash.clone();
  }

  @Override
  public byte[] value() {
    return value.clone();
  }

  public Optional<byte[]> certificateHashValue() {
    return Optional.ofNullable(certificateHash).map(byte[]::clone);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DirectorySignature other
        && algorithm.equals(other.algorithm)
        && Arrays.equals(value, other.value)
        && Arrays.equals(certificateHash, other.certificateHash)
        && Objects.equals(certificateHashAlgorithm, other.certificateHashAlgorithm);
  }

  @Override
  public int hashCode() {
    return Objects.hash(algorithm, certificateHashAlgorithm) * 31 + Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return "DirectorySignature[" + algorithm + ", certificateHashAlgorithm=" + certificateHashAlgorithm + ']';
  }
}
