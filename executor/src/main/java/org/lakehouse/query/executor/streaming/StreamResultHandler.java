/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.streaming;

import java.util.List;

/** Receives the rows a streaming query emits. Called on the event loop; must not block. */
@FunctionalInterface
public interface StreamResultHandler {

  /**
   * @param operatorId the operator that produced the rows
   * @param rows rows in the output layout of the plan root
   */
  void onRows(String operatorId, List<List<Object>> rows);
}
