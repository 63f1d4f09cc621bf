package io.xrdinfo.application.globalconf;

import io.xrdinfo.domain.conf.AnchorSource;
import io.xrdinfo.domain.conf.ConfigurationDirectory;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Unverified download from one source: the parsed directory and the content of every listed part.
 *
 * <p>Nothing here is trusted yet; {@link TrustVerifier} turns it into a {@link VerifiedConfiguration}.</p>
 *
 * @since 0.1.0
 */
public final class FetchedConfiguration {
  private final AnchorSource source;
  private final ConfigurationDirectory directory;
  private final Map<String, byte[]> contents;

  /**
   * Creates a fetched configuration.
   *
   * @param source source the directory was downloaded from
   * @param directory parsed directory
   * @param contents part content keyed by {@code Content-location}
   */
  public FetchedConfiguration(AnchorSource source, ConfigurationDirectory directory, Map<String, byte[]> contents) {
    this.source = Objects.requireNonNull(source, "source");
    this.directory = Objects.requireNonNull(directory, "directory");
    Map<String, byte[]> copy = new LinkedHashMap<>();
    contents.forEach((location, bytes) -> copy.put(location, bytes.clone()));
    this.contents = copy;
  }

  public AnchorSource source() {
    return source;
  }

  public ConfigurationDirectory directory() {
    return directory;
  }

  /**
   * Returns the downloaded content of a part.
   *
   * @param location {@code Content-location} of the part
   * @return copy of the content, or empty when it was not downloaded
   */
  public Optional<byte[]> content(String location) {
    byte[] bytes = contents.get(location);
    return bytes == null ? Optional.empty() : Optional.of(bytes.clone());
  }
}
