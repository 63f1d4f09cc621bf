package io.xrdinfo.application.metadata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.xrdinfo.application.xml.XmlDocuments;
import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.id.ServiceId;
import io.xrdinfo.domain.metadata.MetadataProtocol;
import io.xrdinfo.domain.metadata.MetadataRequest;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

class SoapEnvelopesTest {
  private static final ClientId CLIENT = ClientId.parse("EE/COM/10000002");
  private static final ClientId TARGET = ClientId.parse("EE/GOV/70000001/portal");
  private static final UUID ID = UUID.fromString("3f1b8a34-58de-4c2c-a2b8-0c91b7b7f0aa");

  @Test
  void headerNamesClientServiceAndProtocolVersion() throws Exception {
    String xml = SoapEnvelopes.build(MetadataRequest.listMethods(CLIENT, TARGET, MetadataProtocol.SOAP), "alice", ID);

    Element root = XmlDocuments.parse(xml.getBytes(StandardCharsets.UTF_8), "envelope").getDocumentElement();
    Element client = XmlDocuments.descendants(root, "client").get(0);
    assertEquals("MEMBER", client.getAttributeNS("http://x-road.eu/xsd/identifiers", "objectType"));
    assertTrue(XmlDocuments.childText(client, "subsystemCode").isEmpty());
    Element service = XmlDocuments.descendants(root, "service").get(0);
    assertEquals("portal", XmlDocuments.childText(service, "subsystemCode").orElseThrow());
    assertEquals("listMethods", XmlDocuments.childText(service, "serviceCode").orElseThrow());
    assertEquals("alice", XmlDocuments.descendants(root, "userId").get(0).getTextContent());
    assertEquals(ID.toString(), XmlDocuments.descendants(root, "id").get(0).getTextContent());
    assertEquals("4.0", XmlDocuments.descendants(root, "protocolVersion").get(0).getTextContent());
    assertEquals(1, XmlDocuments.descendants(root, "listMethods").size());
  }

  @Test
  void getWsdlBodyCarriesServiceCodeAndOptionalVersion() {
    String versioned = SoapEnvelopes.build(
        MetadataRequest.getWsdl(CLIENT, ServiceId.parse("EE/GOV/70000001/portal/getPerson/v1")), "u", ID);
    String plain = SoapEnvelopes.build(
        MetadataRequest.getWsdl(CLIENT, ServiceId.parse("EE/GOV/70000001/portal/getPerson")), "u", ID);

    assertTrue(versioned.contains("<xroad:serviceVersion>v1</xroad:serviceVersion>"));
    assertFalse(plain.contains("serviceVersion"));
    assertTrue(plain.contains("<id:serviceCode>getWsdl</id:serviceCode>"));
  }

  @Test
  void textIsEscaped() {
    String xml = SoapEnvelopes.build(
        MetadataRequest.allowedMethods(ClientId.parse("EE/COM/A%26B"), TARGET, MetadataProtocol.SOAP), "<o'k>", ID);

    assertTrue(xml.contains("<id:memberCode>A&amp;B</id:memberCode>"));
    assertTrue(xml.contains("<xroad:userId>&lt;o&apos;k&gt;</xroad:userId>"));
  }
}
