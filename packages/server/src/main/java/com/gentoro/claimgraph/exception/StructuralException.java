package com.gentoro.claimgraph.exception;

/**
 * The data handed to a graph stage cannot form a graph: no valid nodes, or embedding vectors of
 * different lengths.
 */
public class StructuralException extends ClaimGraphException {
  public StructuralException(String message) {
    super(ClaimGraphErrorCode.FAILED_PRECONDITION, message);
  }

  public StructuralException(String message, Throwable cause) {
    super(ClaimGraphErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
