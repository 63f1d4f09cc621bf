package io.xrdinfo.domain.id;

import io.xrdinfo.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Service identifier: a provider, service code and optional version.
 *
 * <p>Providers are normally subsystems. Member-level providers occur only in legacy {@code listMethods} answers and
 * have no parseable wire form, because five segments always denote a subsystem provider.</p>
 *
 * @param provider providing subsystem or, for legacy services, member
 * @param serviceCode service code
 * @param serviceVersion service version, or {@code null}
 * @since 0.1.0
 */
public record ServiceId(ClientId provider, String serviceCode, String serviceVersion) {

  public ServiceId {
    Objects.requireNonNull(provider, "provider");
    Strings.requireNonBlank("serviceCode", serviceCode);
    if (serviceVersion != null && serviceVersion.isEmpty()) {
      serviceVersion = null;
    }
  }

  public static ServiceId of(ClientId provider, String serviceCode) {
    return new ServiceId(provider, serviceCode, null);
  }

  /**
   * Parses {@code instance/class/code/subsystem/service[/version]}.
   *
   * @param wire encoded identifier with five or six segments
   * @return parsed identifier
   * @throws IllegalArgumentException on a wrong segment count
   */
  public static ServiceId parse(String wire) {
    List<String> parts = Identifiers.decode(Strings.requireNonBlank("service identifier", wire));
    if (parts.size() != 5 && parts.size() != 6) {
      throw new IllegalArgumentException(
          "service identifier must have 5 or 6 segments (was " + parts.size() + ")");
    }
    ClientId provider = ClientId.fromSegments(parts.subList(0, 4));
    return new ServiceId(provider, parts.get(4), parts.size() == 6 ? parts.get(5) : null);
  }

  public Optional<String> version() {
    return Optional.ofNullable(serviceVersion);
  }

  public List<String> segments() {
    List<String> segments = new ArrayList<>(provider.segments());
    segments.add(serviceCode);
    if (serviceVersion != null) {
      segments.add(serviceVersion);
    }
    return List.copyOf(segments);
  }

  public String toWire() {
    return Identifiers.encode(segments());
  }

  @Override
  public String toString() {
    return toWire();
  }
}
