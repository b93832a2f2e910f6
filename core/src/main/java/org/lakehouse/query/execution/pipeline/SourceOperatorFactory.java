/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.pipeline;

import org.lakehouse.query.execution.operator.OperatorContext;
import org.lakehouse.query.execution.operator.SourceOperator;

/** Factory for the source operator at the head of a pipeline. */
@FunctionalInterface
public interface SourceOperatorFactory {

  /**
   * Creates a new source operator instance.
   *
   * @param context the runtime context of the pipeline
   * @param startPosition offset of the first row to produce, non-zero when resuming
   * @return a new source operator instance
   */
  SourceOperator createOperator(OperatorContext context, long startPosition);
}
