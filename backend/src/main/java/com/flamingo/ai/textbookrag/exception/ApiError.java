package com.flamingo.ai.textbookrag.exception;

import java.time.Instant;
import lombok.Builder;

/**
 * Error body returned by every REST endpoint.
 *
 * @param errorId short id that also appears in the server log
 * @param status HTTP status code
 * @param code machine-readable error code, one of the constants below
 * @param message message safe to show to API clients
 * @param path request path that failed
 * @param timestamp when the error was produced
 */
@Builder
public record ApiError(
    String errorId, int status, String code, String message, String path, Instant timestamp) {

  public static final String DOCUMENT_NOT_FOUND = "INDEX_001";
  public static final String DOCUMENT_PROCESSING_ERROR = "INDEX_002";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String VALIDATION_ERROR = "REQUEST_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";
}
