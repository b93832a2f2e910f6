/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.storage;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.plan.PlanNode;

/** {@link LiveSource} fed programmatically through {@link #emit}. */
@Log4j2
public class InMemoryLiveSource implements LiveSource {

  private final Map<String, List<Consumer<StreamEvent>>> listeners = new ConcurrentHashMap<>();

  @Override
  public AutoCloseable subscribe(PlanNode sourceNode, Consumer<StreamEvent> listener) {
    String streamId = sourceNode.getStreamId();
    listeners.computeIfAbsent(streamId, k -> new CopyOnWriteArrayList<>()).add(listener);
    log.debug("Subscribed to stream {}", streamId);
    return () -> listeners.getOrDefault(streamId, List.of()).remove(listener);
  }

  /** Delivers an event to every current subscriber of its stream. */
  public void emit(String streamId, long timestampMillis, List<Object> values) {
    StreamEvent event = new StreamEvent(streamId, timestampMillis, values);
    for (Consumer<StreamEvent> listener : listeners.getOrDefault(streamId, List.of())) {
      listener.accept(event);
    }
  }

  /** Returns the number of active subscriptions on a stream. */
  public int subscriberCount(String streamId) {
    return listeners.getOrDefault(streamId, List.of()).size();
  }
}
