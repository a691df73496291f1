package com.gentoro.claimgraph.exception;

/** Errors while serializing or deserializing JSON payloads. */
public class SerializationException extends ClaimGraphException {
  public SerializationException(String message) {
    super(ClaimGraphErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(ClaimGraphErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
