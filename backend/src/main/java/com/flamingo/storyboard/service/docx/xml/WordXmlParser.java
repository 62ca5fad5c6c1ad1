package com.flamingo.storyboard.service.docx.xml;

import com.flamingo.storyboard.domain.enums.ImportErrorKind;
import com.flamingo.storyboard.exception.DocxConversionException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses a document part into a namespace-aware {@link XmlElement} tree.
 *
 * <p>DOCTYPE declarations and external entities are rejected. A fresh {@link DocumentBuilder} is
 * created per call, so one instance can serve concurrent imports.
 */
@Component
@Slf4j
public class WordXmlParser {

  private static final ErrorHandler FAIL_ON_ERROR =
      new ErrorHandler() {
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
      };

  /**
   * Parses {@code xml} and returns its root element.
   *
   * @param xml bytes of the XML document; the encoding is taken from the XML declaration
   * @param namespace namespace URI all element and attribute lookups resolve against
   * @return the root element
   * @throws DocxConversionException with {@link ImportErrorKind#MALFORMED_XML} if the content is
   *     not well-formed
   */
  public XmlElement parse(byte[] xml, String namespace) {
    try {
      Document dom = newDocumentBuilder().parse(new ByteArrayInputStream(xml));
      return new DomXmlElement(dom.getDocumentElement(), namespace);
    } catch (SAXException e) {
      throw new DocxConversionException(
          ImportErrorKind.MALFORMED_XML, "Document part is not well-formed: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new DocxConversionException(
          ImportErrorKind.MALFORMED_XML, "Failed to read document part: " + e.getMessage(), e);
    }
  }

  private DocumentBuilder newDocumentBuilder() {
    try {
      DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
      dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      dbf.setNamespaceAware(true);
      dbf.setXIncludeAware(false);
      dbf.setExpandEntityReferences(false);
      DocumentBuilder builder = dbf.newDocumentBuilder();
      builder.setErrorHandler(FAIL_ON_ERROR);
      return builder;
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser does not support secure processing", e);
    }
  }
}
