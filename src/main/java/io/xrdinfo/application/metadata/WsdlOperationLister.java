package io.xrdinfo.application.metadata;

import io.xrdinfo.application.xml.XmlDocuments;
import io.xrdinfo.domain.error.FormatException;
import io.xrdinfo.domain.metadata.WsdlOperation;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.w3c.dom.Element;

/**
 * Lists the operations bound in a WSDL document together with their {@code version} element.
 */
public final class WsdlOperationLister {

  /**
   * Lists {@code binding/operation} entries in document order.
   *
   * @param wsdl WSDL text
   * @return operations; empty when the document binds none
   * @throws FormatException when the text is not well-formed XML
   */
  public List<WsdlOperation> list(String wsdl) throws FormatException {
    Objects.requireNonNull(wsdl, "wsdl");
    Element root = XmlDocuments.parse(wsdl.getBytes(StandardCharsets.UTF_8), "WSDL").getDocumentElement();
    List<WsdlOperation> operations = new ArrayList<>();
    for (Element binding : XmlDocuments.descendants(root, "binding")) {
      for (Element operation : XmlDocuments.children(binding, "operation")) {
        String name = operation.getAttribute("name");
        if (name.isEmpty()) {
          continue;
        }
        Optional<String> version = XmlDocuments.childText(operation, "version");
        operations.add(new WsdlOperation(name, version));
      }
    }
    return List.copyOf(operations);
  }
}
