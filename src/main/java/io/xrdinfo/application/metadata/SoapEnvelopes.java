package io.xrdinfo.application.metadata;

import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.id.ObjectType;
import io.xrdinfo.domain.metadata.MetadataRequest;
import io.xrdinfo.domain.metadata.MetadataRequestType;
import java.util.UUID;

/**
 * Builds SOAP request envelopes for metadata services.
 *
 * <p>The header names the client, the meta-service on the target subsystem, the user, a random request id and
 * protocol version {@code 4.0}. Element text is XML-escaped.</p>
 */
final class SoapEnvelopes {
  static final String PROTOCOL_VERSION = "4.0";

  private SoapEnvelopes() {}

  static String build(MetadataRequest request, String userId, UUID requestId) {
    StringBuilder xml = new StringBuilder(1024);
    xml.append("<?xml version=\"1.0\" encoding=\"utf-8\"?>\n")
        .append("<SOAP-ENV:Envelope\n")
        .append("        xmlns:SOAP-ENV=\"http://schemas.xmlsoap.org/soap/envelope/\"\n")
        .append("        xmlns:xroad=\"http://x-road.eu/xsd/xroad.xsd\"\n")
        .append("        xmlns:id=\"http://x-road.eu/xsd/identifiers\">\n")
        .append("    <SOAP-ENV:Header>\n");
    appendClient(xml, request.client());
    appendService(xml, request.target(), request.type().serviceCode());
    element(xml, "        ", "xroad:userId", userId);
    element(xml, "        ", "xroad:id", requestId.toString());
    element(xml, "        ", "xroad:protocolVersion", PROTOCOL_VERSION);
    xml.append("    </SOAP-ENV:Header>\n")
        .append("    <SOAP-ENV:Body>\n");
    appendBody(xml, request);
    xml.append("    </SOAP-ENV:Body>\n")
        .append("</SOAP-ENV:Envelope>\n");
    return xml.toString();
  }

  private static void appendClient(StringBuilder xml, ClientId client) {
    xml.append("        <xroad:client id:objectType=\"").append(client.objectType()).append("\">\n");
    appendIdentifier(xml, client);
    xml.append("        </xroad:client>\n");
  }

  private static void appendService(StringBuilder xml, ClientId provider, String serviceCode) {
    xml.append("        <xroad:service id:objectType=\"").append(ObjectType.SERVICE).append("\">\n");
    appendIdentifier(xml, provider);
    element(xml, "            ", "id:serviceCode", serviceCode);
    xml.append("        </xroad:service>\n");
  }

  private static void appendIdentifier(StringBuilder xml, ClientId id) {
    String indent = "            ";
    element(xml, indent, "id:xRoadInstance", id.instance());
    element(xml, indent, "id:memberClass", id.memberClass());
    element(xml, indent, "id:memberCode", id.memberCode());
    if (id.isSubsystem()) {
      element(xml, indent, "id:subsystemCode", id.subsystemCode());
    }
  }

  private static void appendBody(StringBuilder xml, MetadataRequest request) {
    if (request.type() != MetadataRequestType.GET_WSDL) {
      xml.append("        <xroad:").append(request.type().serviceCode()).append("/>\n");
      return;
    }
    xml.append("        <xroad:getWsdl>\n");
    element(xml, "            ", "xroad:serviceCode", request.service().serviceCode());
    if (request.service().serviceVersion() != null) {
      element(xml, "            ", "xroad:serviceVersion", request.service().serviceVersion());
    }
    xml.append("        </xroad:getWsdl>\n");
  }

  private static void element(StringBuilder xml, String indent, String name, String text) {
    xml.append(indent).append('<').append(name).append('>');
    escape(xml, text);
    xml.append("</").append(name).append(">\n");
  }

  static void escape(StringBuilder xml, String text) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '&' -> xml.append("&amp;");
        case '<' -> xml.append("&lt;");
        case '>' -> xml.append("&gt;");
        case '"' -> xml.append("&quot;");
        case '\'' -> xml.append("&apos;");
        default -> xml.append(c);
      }
    }
  }
}
