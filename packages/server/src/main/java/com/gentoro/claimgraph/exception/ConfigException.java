package com.gentoro.claimgraph.exception;

/** Configuration is missing or invalid. */
public class ConfigException extends ClaimGraphException {
  public ConfigException(String message) {
    super(ClaimGraphErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ClaimGraphErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
