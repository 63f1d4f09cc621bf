package io.xrdinfo.domain.conf;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed configuration directory: listing rows, directory-level defaults, the signature, and the exact bytes the
 * signature covers.
 *
 * @since 0.1.0
 */
public final class ConfigurationDirectory {
  private final Instant expireDate;
  private final String version;
  private final List<DirectoryEntry> entries;
  private final DirectorySignature signature;
  private final byte[] signedData;

  public ConfigurationDirectory(
      Instant expireDate,
      String version,
      List<DirectoryEntry> entries,
      DirectorySignature signature,
      byte[] signedData) {
    this.expireDate = expireDate;
    this.version = version;
    this.entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    this.signature = Objects.requireNonNull(signature, "signature");
    this.signedData = Objects.requireNonNull(signedData, "signedData").clone();
  }

  /** Directory-level expiration applied to entries that do not declare their own. */
  public Optional<Instant> expireDate() {
    return Optional.ofNullable(expireDate);
  }

  /** Configuration format version declared by the directory. */
  public Optional<String> version() {
    return Optional.ofNullable(version);
  }

  public List<DirectoryEntry> entries() {
    return entries;
  }

  public DirectorySignature signature() {
    return signature;
  }

  /** Bytes covered by the signature, exactly as received. */
  public byte[] signedData() {
    return signedData.clone();
  }

  /**
   * Returns the effective expiration of an entry.
   *
   * @param entry entry of this directory
   * @return per-entry expiration, falling back to the directory's
   */
  public Optional<Instant> expirationOf(DirectoryEntry entry) {
    return entry.expireDate() != null ? Optional.of(entry.expireDate()) : expireDate();
  }
}
