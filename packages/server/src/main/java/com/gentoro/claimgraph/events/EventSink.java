package com.gentoro.claimgraph.events;

/**
 * Receiver of build progress events.
 *
 * <p>This decouples the pipeline stages (producers of events) from the transport that delivers
 * them. Stages emit from worker threads, so implementations must be thread-safe, lightweight and
 * non-blocking.
 */
@FunctionalInterface
public interface EventSink {

  void emit(GraphEvent event);
}
