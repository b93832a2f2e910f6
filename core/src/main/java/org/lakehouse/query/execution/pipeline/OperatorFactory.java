/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.pipeline;

import org.lakehouse.query.execution.operator.Operator;
import org.lakehouse.query.execution.operator.OperatorContext;

/**
 * Factory for creating {@link Operator} instances. Each factory creates operators for a specific
 * pipeline position (e.g., filter, project, aggregation). The pipeline uses factories so that a
 * restarted or partitioned pipeline gets fresh operator instances.
 */
@FunctionalInterface
public interface OperatorFactory {

  /**
   * Creates a new operator instance.
   *
   * @param context the runtime context of the pipeline
   * @return a new operator instance
   */
  Operator createOperator(OperatorContext context);
}
