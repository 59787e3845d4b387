package com.flamingo.ai.scopetree.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  public static final String SOURCE_READ_ERROR = "SOURCE_001";
  public static final String UNSUPPORTED_SOURCE = "SOURCE_002";
  public static final String BUILD_ERROR = "BUILD_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Short id that ties the response to its log line. */
  private final String errorId;

  private final String code;

  private final String message;

  /** Technical details, omitted for client errors. */
  private final String details;

  private final Instant timestamp;

  private final String path;
}
