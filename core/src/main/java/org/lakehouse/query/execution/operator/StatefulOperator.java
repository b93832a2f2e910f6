/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import org.lakehouse.query.execution.fault.snapshot.OperatorState;

/**
 * Operator whose intermediate state survives a restart. The pipeline snapshots the state of every
 * stateful operator together with the source position at checkpoint time.
 */
public interface StatefulOperator extends Operator {

  /** Captures the operator's state. Only called between pages. */
  OperatorState snapshotState();

  /**
   * Replaces the operator's state with a previously captured one.
   *
   * @throws org.lakehouse.query.execution.error.CheckpointException if the state has an
   *     unsupported type or schema version
   */
  void restoreState(OperatorState state);
}
