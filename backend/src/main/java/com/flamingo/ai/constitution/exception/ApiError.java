package com.flamingo.ai.constitution.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String CONTENT_NOT_FOUND = "CONTENT_001";
  public static final String SOURCE_UNAVAILABLE = "CONTENT_002";
  public static final String INVALID_QUERY = "SEARCH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** Error kind the failure was classified as, when it came from the domain. */
  private final ErrorKind kind;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
