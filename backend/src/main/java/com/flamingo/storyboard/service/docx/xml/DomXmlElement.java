package com.flamingo.storyboard.service.docx.xml;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/** {@link XmlElement} backed by a W3C DOM element from a namespace-aware parse. */
final class DomXmlElement implements XmlElement {

  private final Element element;
  private final String namespace;

  DomXmlElement(Element element, String namespace) {
    this.element = element;
    this.namespace = namespace;
  }

  @Override
  public String localName() {
    String localName = element.getLocalName();
    return localName != null ? localName : element.getTagName();
  }

  @Override
  public boolean inNamespace() {
    return namespace.equals(element.getNamespaceURI());
  }

  @Override
  public Optional<XmlElement> child(String localName) {
    for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (matches(node, localName)) {
        return Optional.of(wrap((Element) node));
      }
    }
    return Optional.empty();
  }

  @Override
  public List<XmlElement> children() {
    List<XmlElement> children = new ArrayList<>();
    for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node.getNodeType() == Node.ELEMENT_NODE) {
        children.add(wrap((Element) node));
      }
    }
    return children;
  }

  @Override
  public List<XmlElement> descendants(String localName) {
    NodeList nodes = element.getElementsByTagNameNS(namespace, localName);
    List<XmlElement> result = new ArrayList<>(nodes.getLength());
    for (int i = 0; i < nodes.getLength(); i++) {
      result.add(wrap((Element) nodes.item(i)));
    }
    return result;
  }

  @Override
  public Optional<String> attribute(String localName) {
    if (!element.hasAttributeNS(namespace, localName)) {
      return Optional.empty();
    }
    return Optional.of(element.getAttributeNS(namespace, localName));
  }

  @Override
  public String text() {
    String text = element.getTextContent();
    return text != null ? text : "";
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof DomXmlElement that && element == that.element;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(element);
  }

  @Override
  public String toString() {
    return "XmlElement{" + localName() + "}";
  }

  private boolean matches(Node node, String localName) {
    return node.getNodeType() == Node.ELEMENT_NODE
        && namespace.equals(node.getNamespaceURI())
        && localName.equals(node.getLocalName());
  }

  private DomXmlElement wrap(Element child) {
    return new DomXmlElement(child, namespace);
  }
}
