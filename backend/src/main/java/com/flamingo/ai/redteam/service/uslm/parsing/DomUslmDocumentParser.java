package com.flamingo.ai.redteam.service.uslm.parsing;

import com.flamingo.ai.redteam.config.RedTeamConfig;
import com.flamingo.ai.redteam.exception.MalformedDocumentException;
import com.flamingo.ai.redteam.service.uslm.model.DocumentInspection;
import com.flamingo.ai.redteam.service.uslm.model.DocumentType;
import com.flamingo.ai.redteam.service.uslm.model.ElementType;
import com.flamingo.ai.redteam.service.uslm.model.UslmDocument;
import com.flamingo.ai.redteam.service.uslm.model.UslmElement;
import com.flamingo.ai.redteam.service.uslm.model.UslmReference;
import com.flamingo.ai.redteam.service.uslm.model.ValidationResult;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * {@link UslmDocumentParser} backed by the JDK DOM parser.
 *
 * <p>The markup is parsed without namespace awareness and every tag is compared by its local name,
 * so {@code <uslm:section>} and {@code <section>} are treated alike. The tree walk then:
 *
 * <ul>
 *   <li>turns hierarchy tags ({@code title} ... {@code subitem}) and structural wrappers ({@code
 *       main}, {@code body}, ...) into {@link UslmElement}s
 *   <li>reads {@code <num>}, {@code <heading>} and {@code <content>} as plain text
 *   <li>collects every {@code <ref href>} into its innermost element and into the document-level
 *       list, in pre-order
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DomUslmDocumentParser implements UslmDocumentParser {

  private static final String REF_TAG = "ref";
  private static final String HREF_ATTR = "href";
  private static final String IDENTIFIER_ATTR = "identifier";

  private static final Set<String> STRUCTURAL_WRAPPERS =
      Set.of("main", "body", "legisBody", "level", "division");

  private final RedTeamConfig config;

  @Override
  public UslmDocument parse(String xml) {
    return buildDocument(parseDom(xml));
  }

  @Override
  public ValidationResult validate(String xml) {
    try {
      return validateDom(parseDom(xml));
    } catch (MalformedDocumentException e) {
      return parseErrorResult(e);
    }
  }

  @Override
  public DocumentInspection inspect(String xml) {
    Document dom;
    try {
      dom = parseDom(xml);
    } catch (MalformedDocumentException e) {
      return DocumentInspection.failed(parseErrorResult(e), e.getMessage());
    }
    return DocumentInspection.parsed(buildDocument(dom), validateDom(dom));
  }

  // ---- private helpers ----

  private UslmDocument buildDocument(Document dom) {
    Element rootEl = findRoot(dom.getDocumentElement());
    if (rootEl == null) {
      log.warn(
          "No lawDoc/bill/resolution root found (document element <{}>), returning empty document",
          localName(dom.getDocumentElement()));
      return UslmDocument.unknown();
    }

    DocumentType docType =
        DocumentType.fromTagName(localName(rootEl)).orElse(DocumentType.UNKNOWN);
    List<UslmReference> references = new ArrayList<>();
    UslmElement root = buildElement(rootEl, references);

    log.debug(
        "Parsed {} {} with {} references",
        docType.getTagName(),
        root.identifier(),
        references.size());
    return new UslmDocument(docType, root.identifier(), root, references);
  }

  private ValidationResult validateDom(Document dom) {
    List<String> errors = new ArrayList<>();
    Element rootEl = findRoot(dom.getDocumentElement());
    if (rootEl == null) {
      errors.add("Missing root element: expected one of lawDoc, bill, resolution");
    }
    Element namespaceHolder = rootEl != null ? rootEl : dom.getDocumentElement();
    String expected = config.getParsing().getExpectedNamespace();
    if (!declaresNamespace(namespaceHolder, expected)) {
      errors.add(
          "Missing or invalid USLM namespace declaration: expected a namespace containing '"
              + expected
              + "'");
    }
    return ValidationResult.of(errors);
  }

  private static ValidationResult parseErrorResult(MalformedDocumentException e) {
    return ValidationResult.of(List.of("XML parse error: " + e.getMessage()));
  }

  private Document parseDom(String xml) {
    if (xml == null || xml.isBlank()) {
      throw new MalformedDocumentException("Document is empty");
    }
    try {
      DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
      dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      dbf.setNamespaceAware(false);
      DocumentBuilder builder = dbf.newDocumentBuilder();
      builder.setErrorHandler(new FailFastErrorHandler());
      Document dom = builder.parse(new InputSource(new StringReader(xml)));
      dom.getDocumentElement().normalize();
      return dom;
    } catch (SAXException | IOException e) {
      log.debug("Failed to tokenize USLM document: {}", e.getMessage());
      throw new MalformedDocumentException(e.getMessage(), e);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser is not configurable", e);
    }
  }

  /** Returns the first lawDoc/bill/resolution element in pre-order, or {@code null}. */
  private Element findRoot(Element el) {
    if (DocumentType.fromTagName(localName(el)).isPresent()) {
      return el;
    }
    for (Element child : childElements(el)) {
      Element found = findRoot(child);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  private UslmElement buildElement(Element el, List<UslmReference> documentRefs) {
    List<UslmElement> children = new ArrayList<>();
    List<UslmReference> refs = new ArrayList<>();
    scan(el, children, refs, documentRefs);
    return new UslmElement(
        classify(el),
        el.getAttribute(IDENTIFIER_ATTR),
        childText(el, "num"),
        childText(el, "heading"),
        childText(el, "content"),
        children,
        refs);
  }

  /**
   * Walks the subtree below {@code el}, stopping at nested structural elements, which are built
   * recursively and own the references inside them.
   */
  private void scan(
      Element el,
      List<UslmElement> children,
      List<UslmReference> refs,
      List<UslmReference> documentRefs) {
    for (Element child : childElements(el)) {
      String name = localName(child);
      if (REF_TAG.equals(name)) {
        String href = child.getAttribute(HREF_ATTR);
        if (href.isBlank()) {
          log.debug("Skipping <ref> without href: '{}'", child.getTextContent().trim());
          continue;
        }
        UslmReference reference = UslmReference.of(href.trim(), child.getTextContent().trim());
        refs.add(reference);
        documentRefs.add(reference);
      } else if (isStructural(name)) {
        children.add(buildElement(child, documentRefs));
      } else {
        scan(child, children, refs, documentRefs);
      }
    }
  }

  /** The first hierarchy level, in hierarchy order, that appears among the child tag names. */
  private ElementType classify(Element el) {
    Set<String> childNames = new HashSet<>();
    for (Element child : childElements(el)) {
      childNames.add(localName(child));
    }
    for (ElementType type : ElementType.hierarchy()) {
      if (childNames.contains(type.getTagName())) {
        return type;
      }
    }
    return ElementType.UNKNOWN;
  }

  private boolean isStructural(String name) {
    return ElementType.fromTagName(name).isPresent() || STRUCTURAL_WRAPPERS.contains(name);
  }

  private String childText(Element el, String name) {
    for (Element child : childElements(el)) {
      if (name.equals(localName(child))) {
        return child.getTextContent().trim();
      }
    }
    return null;
  }

  /** Checks the element and its ancestors for a namespace declaration matching {@code expected}. */
  private boolean declaresNamespace(Element el, String expected) {
    Node current = el;
    while (current != null && current.getNodeType() == Node.ELEMENT_NODE) {
      NamedNodeMap attributes = current.getAttributes();
      for (int i = 0; i < attributes.getLength(); i++) {
        Attr attr = (Attr) attributes.item(i);
        String attrName = attr.getName();
        if (("xmlns".equals(attrName) || attrName.startsWith("xmlns:"))
            && attr.getValue().contains(expected)) {
          return true;
        }
      }
      current = current.getParentNode();
    }
    return false;
  }

  private static List<Element> childElements(Element el) {
    List<Element> elements = new ArrayList<>();
    NodeList children = el.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() == Node.ELEMENT_NODE) {
        elements.add((Element) child);
      }
    }
    return elements;
  }

  private static String localName(Element el) {
    String name = el.getTagName();
    int colon = name.indexOf(':');
    return colon < 0 ? name : name.substring(colon + 1);
  }

  private static class FailFastErrorHandler implements ErrorHandler {

    @Override
    public void warning(SAXParseException e) {
      log.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
    }

    @Override
    public void error(SAXParseException e) throws SAXException {
      throw e;
    }

    @Override
    public void fatalError(SAXParseException e) throws SAXException {
      throw e;
    }
  }
}
