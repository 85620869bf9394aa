package com.flamingo.ai.chatsearch.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String BACKEND_UNAVAILABLE = "SEARCH_002";
  public static final String INVALID_QUERY = "SEARCH_003";
  public static final String VECTORIZER_UNAVAILABLE = "SEARCH_004";
  public static final String MISSING_FIELD = "INDEX_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  private final String message;

  /** Name of the offending document field, for {@link #MISSING_FIELD}. */
  private final String field;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
