package com.flamingo.storyboard.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String IMPORT_REQUEST_INVALID = "IMPORT_001";
  public static final String IMPORT_FILES_MISSING = "IMPORT_002";
  public static final String UPLOAD_TOO_LARGE = "IMPORT_003";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
