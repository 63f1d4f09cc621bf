package io.xrdinfo.application.metadata;

import io.xrdinfo.application.mime.MimeHeaders;
import io.xrdinfo.application.mime.MimePart;
import io.xrdinfo.application.mime.MultipartReader;
import io.xrdinfo.application.xml.XmlDocuments;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.id.ClientId;
import io.xrdinfo.domain.id.ServiceId;
import io.xrdinfo.domain.metadata.MetadataRequestType;
import io.xrdinfo.domain.metadata.ProtocolFault;
import io.xrdinfo.domain.metadata.ServiceList;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.w3c.dom.Element;

/**
 * Reads SOAP responses of metadata services.
 *
 * <p>Gateways may wrap the envelope in a MIME multipart body, so the envelope is located by searching for the outermost
 * {@code Envelope} element, whatever its prefix.</p>
 */
final class SoapResponseParser {
  private static final Pattern ENVELOPE =
      Pattern.compile("<((?:[A-Za-z_][\\w.-]*:)?)Envelope\\b.*</\\1Envelope>", Pattern.DOTALL);

  private SoapResponseParser() {}

  /**
   * Extracts and parses the SOAP envelope from a response body.
   *
   * @param text response text, possibly MIME-wrapped
   * @return envelope root element
   * @throws FormatException when no well-formed envelope is present
   */
  static Element envelope(String text) throws FormatException {
    Matcher matcher = ENVELOPE.matcher(text);
    if (!matcher.find()) {
      throw new FormatException("SOAP envelope was not found in response");
    }
    return XmlDocuments.parse(matcher.group().getBytes(StandardCharsets.UTF_8), "SOAP response")
        .getDocumentElement();
  }

  /**
   * Converts a SOAP fault into a {@link ProtocolFault}, keeping the server's texts verbatim.
   *
   * @param envelope envelope root
   * @return fault, or empty when the body carries none
   */
  static Optional<ProtocolFault> fault(Element envelope) {
    List<Element> faults = XmlDocuments.descendants(envelope, "Fault");
    Element scope = faults.isEmpty() ? envelope : faults.get(0);
    List<Element> strings = XmlDocuments.descendants(scope, "faultstring");
    if (faults.isEmpty() && strings.isEmpty()) {
      return Optional.empty();
    }
    List<Element> codes = XmlDocuments.descendants(scope, "faultcode");
    String code = codes.isEmpty() ? "" : codes.get(0).getTextContent().trim();
    String message = strings.isEmpty() ? "" : strings.get(0).getTextContent();
    return Optional.of(new ProtocolFault(code, message));
  }

  /**
   * Reads the services listed in a {@code listMethodsResponse} or {@code allowedMethodsResponse}.
   *
   * @param envelope envelope root
   * @param type list operation
   * @return services in response order
   * @throws FormatException when a service lacks a required identifier element
   */
  static ServiceList services(Element envelope, MetadataRequestType type) throws FormatException {
    List<Element> responses = XmlDocuments.descendants(envelope, type.serviceCode() + "Response");
    if (responses.isEmpty()) {
      throw new FormatException("SOAP response has no " + type.serviceCode() + "Response element");
    }
    List<ServiceId> services = new ArrayList<>();
    for (Element service : XmlDocuments.children(responses.get(0), "service")) {
      String instance = XmlDocuments.requireChildText(service, "xRoadInstance");
      String memberClass = XmlDocuments.requireChildText(service, "memberClass");
      String memberCode = XmlDocuments.requireChildText(service, "memberCode");
      String subsystemCode = XmlDocuments.childText(service, "subsystemCode").orElse(null);
      String serviceCode = XmlDocuments.requireChildText(service, "serviceCode");
      String version = XmlDocuments.childText(service, "serviceVersion").orElse(null);
      ClientId provider = new ClientId(instance, memberClass, memberCode, subsystemCode);
      services.add(new ServiceId(provider, serviceCode, version));
    }
    return new ServiceList(services);
  }

  /**
   * Splits a {@code getWsdl} response into the SOAP envelope part and the WSDL attachment.
   *
   * @param contentType response {@code Content-Type}, or {@code null}
   * @param body response body
   * @return parts in order; a single part when the response is not multipart
   * @throws FormatException when a declared multipart body is malformed
   */
  static List<MimePart> parts(String contentType, byte[] body) throws FormatException {
    Optional<String> boundary = Optional.empty();
    if (contentType != null
        && MimeHeaders.mainValue(contentType).toLowerCase(Locale.ROOT).startsWith("multipart/")) {
      boundary = MimeHeaders.parameter(contentType, "boundary");
    }
    if (boundary.isEmpty()) {
      boundary = leadingBoundary(body);
    }
    if (boundary.isEmpty()) {
      return List.of(new MimePart(MimeHeaders.empty(), body, body));
    }
    return MultipartReader.split(body, boundary.get());
  }

  private static Optional<String> leadingBoundary(byte[] body) {
    String head = new String(body, 0, Math.min(body.length, 256), StandardCharsets.US_ASCII).stripLeading();
    if (!head.startsWith("--")) {
      return Optional.empty();
    }
    int end = head.indexOf('\n');
    String line = (end < 0 ? head : head.substring(0, end)).trim();
    return line.length() > 2 ? Optional.of(line.substring(2)) : Optional.empty();
  }
}
