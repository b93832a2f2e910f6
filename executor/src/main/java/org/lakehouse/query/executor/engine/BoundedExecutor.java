/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.engine;

import org.lakehouse.query.execution.pipeline.PageSink;

/** Executes a bounded plan to completion, delivering its rows to a sink. */
@FunctionalInterface
public interface BoundedExecutor {

  /**
   * @throws org.lakehouse.query.execution.error.QueryExecutionException on failure or cancellation
   */
  void execute(ExecutionContext context, PageSink sink);
}
