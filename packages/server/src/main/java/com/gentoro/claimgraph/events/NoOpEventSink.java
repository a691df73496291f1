package com.gentoro.claimgraph.events;

/** Discards every event. Used when nobody observes the build. */
public class NoOpEventSink implements EventSink {
  @Override
  public void emit(GraphEvent event) {}
}
