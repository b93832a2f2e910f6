/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.storage;

import java.util.function.Consumer;
import org.lakehouse.query.execution.plan.PlanNode;

/** Unbounded event source backing STREAM_SOURCE leaves. */
public interface LiveSource {

  /**
   * Starts delivering events of the source node's stream to the listener. The listener may be
   * called from any thread and must not block.
   *
   * @param sourceNode a STREAM_SOURCE node
   * @param listener receives each event
   * @return handle that stops delivery when closed
   */
  AutoCloseable subscribe(PlanNode sourceNode, Consumer<StreamEvent> listener);
}
