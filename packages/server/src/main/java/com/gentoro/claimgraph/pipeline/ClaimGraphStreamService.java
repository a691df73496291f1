package com.gentoro.claimgraph.pipeline;

import com.gentoro.claimgraph.events.BufferingEventSink;
import com.gentoro.claimgraph.events.EventSink;
import com.gentoro.claimgraph.events.GraphEvent;
import com.gentoro.claimgraph.exception.ErrorDetails;
import com.gentoro.claimgraph.exception.ExceptionUtil;
import com.gentoro.claimgraph.model.ClaimGraph;
import com.gentoro.claimgraph.model.GraphRequest;
import java.util.Objects;
import java.util.Optional;

/**
 * Streaming entry point. Events of a build are buffered and delivered only once the build is
 * over: on success the whole log followed by {@code graph_complete}, on failure a single {@code
 * error} event and nothing else.
 */
public class ClaimGraphStreamService {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(ClaimGraphStreamService.class);

  private final ClaimGraphBuilder builder;
  private final PipelineSettings settings;

  public ClaimGraphStreamService(ClaimGraphBuilder builder, PipelineSettings settings) {
    this.builder = Objects.requireNonNull(builder, "builder");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /** @return the graph, or empty when the build failed and an error event was emitted */
  public Optional<ClaimGraph> stream(GraphRequest request, EventSink downstream) {
    BufferingEventSink buffer = new BufferingEventSink();
    ClaimGraph graph;
    try {
      graph =
          builder.buildFromWorldview(
              request.worldview(),
              request.k(),
              settings.derivativeSets(),
              request.topN(),
              request.threshold(),
              buffer);
    } catch (RuntimeException e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      log.error(
          "Claim graph build failed ({}): {} at {}",
          details.code,
          details.message,
          ExceptionUtil.formatCompactStackTrace(ExceptionUtil.unwrap(e), 5));
      downstream.emit(GraphEvent.error(details));
      return Optional.empty();
    }

    log.debug("Replaying {} buffered event(s)", buffer.size());
    buffer.replayTo(downstream);
    downstream.emit(GraphEvent.graphComplete(graph));
    return Optional.of(graph);
  }
}
