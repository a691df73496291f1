package com.gentoro.claimgraph.exception;

/**
 * Canonical error codes for claim graph builds. Codes are stable and end up in the payload of the
 * terminal {@code error} event and in per-node verification failures.
 */
public enum ClaimGraphErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  CANCELLED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  UPSTREAM_ERROR,
  ILLEGAL_STATE,
}
