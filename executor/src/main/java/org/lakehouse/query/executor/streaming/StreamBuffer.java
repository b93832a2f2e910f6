/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.streaming;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.Getter;
import org.lakehouse.query.execution.storage.StreamEvent;

/**
 * Recent events of one stream, ordered by timestamp. Holds only events within {@code
 * windowMillis} of the current time; inserting evicts older ones. When full, the oldest event is
 * dropped to make room, so sustained overload loses data rather than blocking the source.
 *
 * <p>Once {@link #indexBy keyed}, the buffer also keeps its events bucketed by key, each bucket
 * ordered by timestamp, so a join probe visits only the events that can match. Events with a null
 * key are buffered but not indexed.
 *
 * <p>Not thread-safe; owned by the streaming event loop.
 */
public class StreamBuffer {

  @Getter private final String streamId;
  private final int capacity;
  private final long windowMillis;
  private final Deque<StreamEvent> events = new ArrayDeque<>();
  private final Map<List<Object>, Deque<StreamEvent>> byKey = new HashMap<>();
  private Function<StreamEvent, List<Object>> keyOf;

  @Getter private long droppedEvents;
  @Getter private long rejectedEvents;

  public StreamBuffer(String streamId, int capacity, long windowMillis) {
    Preconditions.checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    Preconditions.checkArgument(windowMillis > 0, "window must be positive: %s", windowMillis);
    this.streamId = streamId;
    this.capacity = capacity;
    this.windowMillis = windowMillis;
  }

  /**
   * Inserts an event observed at {@code nowMillis}.
   *
   * @return false if the event is already older than the window and was not inserted
   */
  public boolean add(StreamEvent event, long nowMillis) {
    evictExpired(nowMillis);
    if (event.timestampMillis() < nowMillis - windowMillis) {
      rejectedEvents++;
      return false;
    }
    if (events.size() >= capacity) {
      unindex(events.pollFirst());
      droppedEvents++;
    }
    insertOrdered(events, event);
    if (keyOf != null) {
      List<Object> key = keyOf.apply(event);
      if (key != null) {
        insertOrdered(byKey.computeIfAbsent(key, k -> new ArrayDeque<>()), event);
      }
    }
    return true;
  }

  /**
   * Buckets the buffered events, and every event added from now on, by the key the function
   * extracts. A null key leaves an event out of the index.
   */
  public void indexBy(Function<StreamEvent, List<Object>> keyFunction) {
    this.keyOf = keyFunction;
    byKey.clear();
    for (StreamEvent event : events) {
      List<Object> key = keyFunction.apply(event);
      if (key != null) {
        byKey.computeIfAbsent(key, k -> new ArrayDeque<>()).addLast(event);
      }
    }
  }

  /** Returns the buffered events with a key, oldest first. Requires {@link #indexBy}. */
  public Iterator<StreamEvent> iteratorWithKey(List<Object> key) {
    Preconditions.checkState(keyOf != null, "stream buffer %s is not indexed", streamId);
    Deque<StreamEvent> bucket = byKey.get(key);
    return bucket == null ? Collections.emptyIterator() : bucket.iterator();
  }

  /** Copies the buffered events with a key, oldest first. Requires {@link #indexBy}. */
  public List<StreamEvent> eventsWithKey(List<Object> key) {
    return ImmutableList.copyOf(iteratorWithKey(key));
  }

  /** Number of distinct indexed keys. */
  public int keyCount() {
    return byKey.size();
  }

  /** Removes events older than {@code nowMillis - windowMillis}; returns how many. */
  public int evictExpired(long nowMillis) {
    long horizon = nowMillis - windowMillis;
    int evicted = 0;
    while (!events.isEmpty() && events.peekFirst().timestampMillis() < horizon) {
      unindex(events.pollFirst());
      evicted++;
    }
    return evicted;
  }

  private void unindex(StreamEvent event) {
    if (keyOf == null) {
      return;
    }
    List<Object> key = keyOf.apply(event);
    Deque<StreamEvent> bucket = key == null ? null : byKey.get(key);
    if (bucket == null) {
      return;
    }
    if (bucket.peekFirst() == event) {
      bucket.pollFirst();
    } else {
      bucket.removeFirstOccurrence(event);
    }
    if (bucket.isEmpty()) {
      byKey.remove(key);
    }
  }

  private static void insertOrdered(Deque<StreamEvent> deque, StreamEvent event) {
    if (deque.isEmpty() || deque.peekLast().timestampMillis() <= event.timestampMillis()) {
      deque.addLast(event);
      return;
    }
    Deque<StreamEvent> newer = new ArrayDeque<>();
    while (!deque.isEmpty() && deque.peekLast().timestampMillis() > event.timestampMillis()) {
      newer.addFirst(deque.pollLast());
    }
    deque.addLast(event);
    deque.addAll(newer);
  }

  /** Returns the buffered events, oldest first. */
  public List<StreamEvent> events() {
    return ImmutableList.copyOf(events);
  }

  public Iterator<StreamEvent> iterator() {
    return events.iterator();
  }

  public int size() {
    return events.size();
  }

  public StreamEvent oldest() {
    return events.peekFirst();
  }
}
