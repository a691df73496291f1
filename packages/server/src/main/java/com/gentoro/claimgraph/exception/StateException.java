package com.gentoro.claimgraph.exception;

/** Illegal status transition, or mutation of a node that was already sealed. */
public class StateException extends ClaimGraphException {
  public StateException(String message) {
    super(ClaimGraphErrorCode.ILLEGAL_STATE, message);
  }
}
