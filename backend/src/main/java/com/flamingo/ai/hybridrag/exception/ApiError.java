package com.flamingo.ai.hybridrag.exception;

import java.time.Instant;
import lombok.Builder;

/**
 * Error body returned by every failing endpoint.
 *
 * @param errorId short id repeated in the server log line
 * @param code machine-readable code, one of the constants below
 * @param message text safe to show to the caller
 * @param timestamp when the error was handled
 * @param path request path that failed
 */
@Builder
public record ApiError(
    String errorId, String code, String message, Instant timestamp, String path) {

  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String MALFORMED_REQUEST = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";
}
