package com.flamingo.storyboard.exception;

/** Exception thrown when an import request is rejected before any file is converted. */
public class InvalidImportRequestException extends RuntimeException {

  public InvalidImportRequestException(String message) {
    super(message);
  }
}
