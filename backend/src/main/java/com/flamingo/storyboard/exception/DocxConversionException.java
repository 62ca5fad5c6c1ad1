package com.flamingo.storyboard.exception;

import com.flamingo.storyboard.domain.enums.ImportErrorKind;

/** Exception thrown when a DOCX package cannot be converted into a chapter document. */
public class DocxConversionException extends RuntimeException {

  private final ImportErrorKind kind;
  private final String userMessage;

  public DocxConversionException(ImportErrorKind kind, String message) {
    super(message);
    this.kind = kind;
    this.userMessage = kind.getUserMessage();
  }

  public DocxConversionException(ImportErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.userMessage = kind.getUserMessage();
  }

  public ImportErrorKind getKind() {
    return kind;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
