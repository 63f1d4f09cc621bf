package io.xrdinfo.application.globalconf;

import io.xrdinfo.application.xml.XmlDocuments;
import io.xrdinfo.domain.conf.ConfigurationPart;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.error.TrustException;
import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.id.SecurityServerId;
import io.xrdinfo.domain.params.GlobalGroup;
import io.xrdinfo.domain.params.Member;
import io.xrdinfo.domain.params.SecurityServer;
import io.xrdinfo.domain.params.SharedParams;
import io.xrdinfo.domain.params.Subsystem;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * <strong>What:</strong> Builds {@link SharedParams} from the shared-parameters part of a verified configuration.
 * <p><strong>Trust:</strong> the public entry point accepts only a {@link VerifiedConfiguration}, so unverified bytes
 * never become queryable indices.</p>
 * <p><strong>Tolerance:</strong> optional elements may be absent in any schema version. Missing instance identifier,
 * member class, member code, subsystem code, server code or server owner are {@link FormatException}s, as is a server
 * owner that does not refer to a member. Unknown client references are skipped with a warning.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class SharedParamsParser {
  private static final Logger log = LoggerFactory.getLogger(SharedParamsParser.class);

  /**
   * Parses the shared parameters of the verified configuration's own instance.
   *
   * @param configuration verified configuration
   * @return shared parameter indices
   * @throws FormatException when the part is missing or malformed
   * @throws TrustException when the document declares another instance than the anchor
   */
  public SharedParams parse(VerifiedConfiguration configuration) throws FormatException, TrustException {
    ConfigurationPart part = configuration.part(ConfigurationPart.SHARED_PARAMETERS)
        .orElseThrow(() -> new FormatException("No " + ConfigurationPart.SHARED_PARAMETERS + " part for instance "
            + configuration.instanceIdentifier()));
    SharedParams params = parseDocument(
        part.rawBytes(), SharedParamsSchema.forVersion(configuration.version().orElse(null)));
    if (!params.instanceIdentifier().equals(configuration.instanceIdentifier())) {
      throw new TrustException("Shared parameters declare instance " + params.instanceIdentifier()
          + ", anchor is for " + configuration.instanceIdentifier());
    }
    return params;
  }

  SharedParams parseDocument(byte[] xml, SharedParamsSchema schema) throws FormatException {
    Element root = XmlDocuments.parse(xml, "shared parameters").getDocumentElement();
    String instance = XmlDocuments.requireChildText(root, "instanceIdentifier");

    Map<String, ClientId> byXmlId = new HashMap<>();
    List<Member> members = new ArrayList<>();
    List<Subsystem> subsystems = new ArrayList<>();
    for (Element memberElement : XmlDocuments.children(root, "member")) {
      Element classElement = XmlDocuments.child(memberElement, "memberClass")
          .orElseThrow(() -> new FormatException("Missing <memberClass> in <member>"));
      String memberClass = XmlDocuments.requireChildText(classElement, "code");
      String memberCode = XmlDocuments.requireChildText(memberElement, "memberCode");
      ClientId memberId = ClientId.member(instance, memberClass, memberCode);
      members.add(new Member(memberId, XmlDocuments.childText(memberElement, "name").orElse("")));
      register(byXmlId, memberElement, memberId);

      for (Element subsystemElement : XmlDocuments.children(memberElement, "subsystem")) {
        String subsystemCode = XmlDocuments.requireChildText(subsystemElement, "subsystemCode");
        ClientId subsystemId = ClientId.subsystem(instance, memberClass, memberCode, subsystemCode);
        subsystems.add(new Subsystem(subsystemId, schema.subsystemName(subsystemElement)));
        register(byXmlId, subsystemElement, subsystemId);
      }
    }

    List<SecurityServer> servers = new ArrayList<>();
    for (Element serverElement : XmlDocuments.children(root, "securityServer")) {
      String ownerRef = XmlDocuments.requireChildText(serverElement, "owner");
      ClientId owner = byXmlId.get(ownerRef);
      if (owner == null || owner.isSubsystem()) {
        throw new FormatException("Security server owner " + ownerRef + " is not a member");
      }
      String serverCode = XmlDocuments.requireChildText(serverElement, "serverCode");
      List<ClientId> clients = new ArrayList<>();
      for (Element clientElement : XmlDocuments.children(serverElement, "client")) {
        String ref = clientElement.getTextContent().trim();
        ClientId client = byXmlId.get(ref);
        if (client == null) {
          log.warn("Security server {} lists unknown client reference {}", serverCode, ref);
          continue;
        }
        clients.add(client);
      }
      Optional<String> address = XmlDocuments.childText(serverElement, "address");
      servers.add(new SecurityServer(new SecurityServerId(owner, serverCode), address, clients));
    }

    List<GlobalGroup> groups = new ArrayList<>();
    for (Element groupElement : XmlDocuments.children(root, "globalGroup")) {
      String code = XmlDocuments.requireChildText(groupElement, "groupCode");
      List<ClientId> groupMembers = new ArrayList<>();
      for (Element memberElement : XmlDocuments.children(groupElement, "groupMember")) {
        groupMembers.add(clientId(memberElement));
      }
      groups.add(new GlobalGroup(code, XmlDocuments.childText(groupElement, "description").orElse(""), groupMembers));
    }

    SharedParams params = new SharedParams(
        instance, members, subsystems, servers, groups, schema.centralServices(root));
    log.debug("Parsed shared parameters for {} ({}): {} members, {} subsystems, {} servers",
        instance, schema, members.size(), subsystems.size(), servers.size());
    return params;
  }

  /** Reads an identifier written as {@code id:xRoadInstance}, {@code id:memberClass}... children. */
  static ClientId clientId(Element element) throws FormatException {
    String instance = XmlDocuments.requireChildText(element, "xRoadInstance");
    String memberClass = XmlDocuments.requireChildText(element, "memberClass");
    String memberCode = XmlDocuments.requireChildText(element, "memberCode");
    Optional<String> subsystemCode = XmlDocuments.childText(element, "subsystemCode");
    return new ClientId(instance, memberClass, memberCode, subsystemCode.orElse(null));
  }

  private static void register(Map<String, ClientId> byXmlId, Element element, ClientId id) {
    String xmlId = element.getAttribute("id");
    if (!xmlId.isEmpty()) {
      byXmlId.put(xmlId, id);
    }
  }
}
