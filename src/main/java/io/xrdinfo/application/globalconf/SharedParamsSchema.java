package io.xrdinfo.application.globalconf;

import io.xrdinfo.application.xml.XmlDocuments;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.id.ServiceId;
import io.xrdinfo.domain.params.CentralService;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Shared-parameters schema versions and the elements that differ between them.
 *
 * <p>Members, subsystems, servers and groups are read the same way in every version by {@link SharedParamsParser};
 * each constant only answers for the optional elements its version defines. V2 publishes central services; V4 adds
 * subsystem names.</p>
 */
enum SharedParamsSchema {
  V2 {
    @Override
    List<CentralService> centralServices(Element root) throws FormatException {
      List<CentralService> services = new ArrayList<>();
      for (Element element : XmlDocuments.children(root, "centralService")) {
        String code = XmlDocuments.requireChildText(element, "serviceCode");
        Optional<Element> implementing = XmlDocuments.child(element, "implementingService");
        services.add(new CentralService(code, implementing.isPresent()
            ? Optional.of(implementingService(implementing.get()))
            : Optional.empty()));
      }
      return services;
    }
  },
  V3,
  V4 {
    @Override
    Optional<String> subsystemName(Element subsystem) {
      return XmlDocuments.childText(subsystem, "name");
    }
  };

  private static final Logger log = LoggerFactory.getLogger(SharedParamsSchema.class);

  /** Display name of a subsystem element; only newer versions define one. */
  Optional<String> subsystemName(Element subsystem) {
    return Optional.empty();
  }

  /** Central services of the document; only older versions publish them. */
  List<CentralService> centralServices(Element root) throws FormatException {
    return List.of();
  }

  /**
   * Selects the schema for a directory version.
   *
   * @param version directory {@code Version} header, or {@code null} for directories that predate it
   * @return matching schema; the newest one for unknown versions
   */
  static SharedParamsSchema forVersion(String version) {
    if (version == null || version.isBlank()) {
      return V2;
    }
    return switch (version.trim()) {
      case "2" -> V2;
      case "3" -> V3;
      case "4" -> V4;
      default -> {
        log.warn("Unknown configuration version {}; reading shared parameters as {}", version, V4);
        yield V4;
      }
    };
  }

  private static ServiceId implementingService(Element element) throws FormatException {
    ClientId provider = SharedParamsParser.clientId(element);
    String serviceCode = XmlDocuments.requireChildText(element, "serviceCode");
    return new ServiceId(provider, serviceCode, XmlDocuments.childText(element, "serviceVersion").orElse(null));
  }
}
