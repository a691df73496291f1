package com.gentoro.claimgraph.events;

import java.util.Objects;

/**
 * Writes every event as a JSON line to the application log under the {@code
 * [claimgraph.event]} prefix. A transport-agnostic consumer that only needs the log can render
 * progress from these lines.
 *
 * <pre>
 * [claimgraph.event] {"event":"claim_verifying","data":{"nodeId":"claim-1a2b","label":"..."}}
 * </pre>
 */
public class LoggingEventSink implements EventSink {
  private final org.slf4j.Logger log;

  public LoggingEventSink(org.slf4j.Logger logger) {
    this.log = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void emit(GraphEvent event) {
    if (event.type() == GraphEventType.ERROR) {
      log.warn("[claimgraph.event] {}", event.toJson());
    } else {
      log.info("[claimgraph.event] {}", event.toJson());
    }
  }
}
