package com.gentoro.claimgraph.exception;

import java.util.Map;

/**
 * Input validation failure: request parameters out of range, or derivative sets that do not
 * satisfy their size constraints after cleaning.
 */
public class ValidationException extends ClaimGraphException {
  public ValidationException(String message) {
    super(ClaimGraphErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(ClaimGraphErrorCode.INVALID_ARGUMENT, message, context);
  }

  public ValidationException(String message, Throwable cause) {
    super(ClaimGraphErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
