package com.gentoro.claimgraph.events;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, append-only log of events. The order is the order in which emitting workers reached
 * the sink. The log is replayed to the real consumer once the build is over.
 */
public class BufferingEventSink implements EventSink {
  private final List<GraphEvent> events = new ArrayList<>();

  @Override
  public synchronized void emit(GraphEvent event) {
    events.add(event);
  }

  public synchronized List<GraphEvent> events() {
    return List.copyOf(events);
  }

  public synchronized int size() {
    return events.size();
  }

  /** Deliver every buffered event, in log order. */
  public void replayTo(EventSink downstream) {
    for (GraphEvent event : events()) {
      downstream.emit(event);
    }
  }
}
