package com.gentoro.claimgraph.exception;

import java.util.Map;

/** An external collaborator (LLM, embedder, search API) failed after exhausting its retries. */
public class UpstreamException extends ClaimGraphException {
  public UpstreamException(String message) {
    super(ClaimGraphErrorCode.UPSTREAM_ERROR, message);
  }

  public UpstreamException(String message, Throwable cause) {
    super(ClaimGraphErrorCode.UPSTREAM_ERROR, message, cause);
  }

  public UpstreamException(String message, Map<String, ?> context, Throwable cause) {
    super(ClaimGraphErrorCode.UPSTREAM_ERROR, message, context, cause);
  }
}
