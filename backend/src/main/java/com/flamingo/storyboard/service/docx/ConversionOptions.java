package com.flamingo.storyboard.service.docx;

import java.util.Objects;

/**
 * Immutable settings for a single DOCX conversion.
 *
 * <p>The converter keeps no constants of its own: the namespace used for every element and
 * attribute lookup and the path of the main document part are handed in with each call.
 *
 * @param wordNamespace namespace URI of the WordprocessingML vocabulary
 * @param mainDocumentPart package entry path holding the document body
 */
public record ConversionOptions(String wordNamespace, String mainDocumentPart) {

  public static final String WORDPROCESSINGML_NAMESPACE =
      "http://schemas.openxmlformats.org/wordprocessingml/2006/main";

  public static final String DEFAULT_MAIN_DOCUMENT_PART = "word/document.xml";

  public ConversionOptions {
    Objects.requireNonNull(wordNamespace, "wordNamespace");
    Objects.requireNonNull(mainDocumentPart, "mainDocumentPart");
  }

  /** Options for standard WordprocessingML packages. */
  public static ConversionOptions defaults() {
    return new ConversionOptions(WORDPROCESSINGML_NAMESPACE, DEFAULT_MAIN_DOCUMENT_PART);
  }
}
