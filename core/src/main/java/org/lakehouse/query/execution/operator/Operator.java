/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import org.lakehouse.query.execution.page.Page;

/**
 * One stage of a pipeline. The {@link org.lakehouse.query.execution.pipeline.PipelineDriver}
 * pushes upstream pages in while {@link #needsInput()} holds and pulls results out with {@link
 * #getOutput()}. Once the upstream is exhausted it calls {@link #finish()} and keeps pulling until
 * {@link #isFinished()}.
 *
 * <p>Operators are single-threaded; a partition owns its own operator instances. The driver only
 * checkpoints or checks for cancellation between calls, never inside one.
 */
public interface Operator extends AutoCloseable {

  boolean needsInput();

  /**
   * Accepts one upstream page.
   *
   * @throws IllegalStateException if called while {@link #needsInput()} is false
   */
  void addInput(Page page);

  /** Next output page, or null when nothing is ready. Null does not mean finished. */
  Page getOutput();

  boolean isFinished();

  /** No more input follows. Blocking operators (sort, aggregation, join build) emit from here. */
  void finish();

  OperatorContext getContext();

  @Override
  default void close() {}
}
