package com.flamingo.storyboard.service.docx.xml;

import java.util.List;
import java.util.Optional;

/**
 * Read-only, namespace-qualified view of an element in a parsed XML tree.
 *
 * <p>All lookups by local name are resolved against the single namespace the tree was parsed for.
 * Children and attributes in any other namespace are reported as absent, never as an error.
 */
public interface XmlElement {

  /** Local name of this element, without prefix. */
  String localName();

  /** Returns {@code true} if this element belongs to the tree's namespace. */
  boolean inNamespace();

  /** Returns {@code true} if this element is in the tree's namespace and has the given name. */
  default boolean is(String localName) {
    return inNamespace() && localName().equals(localName);
  }

  /** First direct child element with the given local name. */
  Optional<XmlElement> child(String localName);

  /** All direct child elements, in document order, regardless of namespace. */
  List<XmlElement> children();

  /** All descendant elements with the given local name, in document order. */
  List<XmlElement> descendants(String localName);

  /** Value of the namespace-qualified attribute with the given local name. */
  Optional<String> attribute(String localName);

  /** Concatenated text of this element and all its descendants. */
  String text();
}
