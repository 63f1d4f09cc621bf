package io.xrdinfo.application.xml;

import io.xrdinfo.domain.error.FormatException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Namespace-aware DOM parsing with external entities and DOCTYPE declarations disabled, plus small lookups by local
 * name.
 *
 * <p>Lookups ignore namespaces: shared parameters are namespaced in some schema versions and not in others, and
 * gateways choose their own SOAP prefixes.</p>
 *
 * @since 0.1.0
 */
public final class XmlDocuments {
  private static final Logger log = LoggerFactory.getLogger(XmlDocuments.class);

  private static final ErrorHandler STRICT = new ErrorHandler() {
    @Override
    public void warning(SAXParseException ex) {
      log.debug("XML parser warning at line {}: {}", ex.getLineNumber(), ex.getMessage());
    }

    @Override
    public void error(SAXParseException ex) throws SAXException {
      throw ex;
    }

    @Override
    public void fatalError(SAXParseException ex) throws SAXException {
      throw ex;
    }
  };

  private XmlDocuments() {
    // Utility
  }

  /**
   * Parses a document.
   *
   * @param bytes XML bytes
   * @param what description used in error messages, for example {@code "shared parameters"}
   * @return parsed document
   * @throws FormatException when the bytes are not well-formed XML
   */
  public static Document parse(byte[] bytes, String what) throws FormatException {
    try {
      DocumentBuilder builder = newFactory().newDocumentBuilder();
      builder.setErrorHandler(STRICT);
      return builder.parse(new ByteArrayInputStream(bytes));
    } catch (SAXException | IOException ex) {
      throw new FormatException("Malformed " + what + " XML: " + ex.getMessage(), ex);
    } catch (ParserConfigurationException ex) {
      throw new IllegalStateException("XML parser configuration rejected", ex);
    }
  }

  private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
    factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
    factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    factory.setXIncludeAware(false);
    factory.setExpandEntityReferences(false);
    return factory;
  }

  /** Direct child elements with the given local name, in document order. */
  public static List<Element> children(Element parent, String localName) {
    List<Element> result = new ArrayList<>();
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node instanceof Element element && localName.equals(localName(element))) {
        result.add(element);
      }
    }
    return result;
  }

  /** First direct child element with the given local name. */
  public static Optional<Element> child(Element parent, String localName) {
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node instanceof Element element && localName.equals(localName(element))) {
        return Optional.of(element);
      }
    }
    return Optional.empty();
  }

  /** Trimmed text of the first direct child with the given local name; empty when missing or blank. */
  public static Optional<String> childText(Element parent, String localName) {
    return child(parent, localName)
        .map(element -> element.getTextContent().trim())
        .filter(text -> !text.isEmpty());
  }

  /**
   * Trimmed text of a required child element.
   *
   * @throws FormatException when the child is missing or blank
   */
  public static String requireChildText(Element parent, String localName) throws FormatException {
    Optional<String> text = childText(parent, localName);
    if (text.isEmpty()) {
      throw new FormatException("Missing <" + localName + "> in <" + localName(parent) + ">");
    }
    return text.get();
  }

  /** All descendant elements with the given local name, in document order. */
  public static List<Element> descendants(Element root, String localName) {
    NodeList nodes = root.getElementsByTagNameNS("*", localName);
    List<Element> result = new ArrayList<>(nodes.getLength());
    for (int i = 0; i < nodes.getLength(); i++) {
      result.add((Element) nodes.item(i));
    }
    return result;
  }

  /** Local name of an element, falling back to the qualified name for documents parsed without namespaces. */
  public static String localName(Element element) {
    String local = element.getLocalName();
    if (local != null) {
      return local;
    }
    String name = element.getTagName();
    int colon = name.indexOf(':');
    return colon < 0 ? name : name.substring(colon + 1);
  }
}
