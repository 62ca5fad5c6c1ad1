package com.flamingo.storyboard.domain.enums;

/** Classifies why a single uploaded package could not be converted into a chapter. */
public enum ImportErrorKind {
  /** The bytes are not a readable compressed package. */
  CORRUPT_ARCHIVE("The file is not a valid DOCX package"),

  /** The package opens but has no main document part. */
  MISSING_DOCUMENT_PART("The DOCX package has no document body"),

  /** The main document part is not well-formed XML. */
  MALFORMED_XML("The DOCX document body is not valid XML"),

  /** The uploaded file content could not be read. */
  UNREADABLE_UPLOAD("Failed to read file content"),

  /** Any other failure while converting the package. */
  UNEXPECTED_ERROR("Failed to import document");

  private final String userMessage;

  ImportErrorKind(String userMessage) {
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
