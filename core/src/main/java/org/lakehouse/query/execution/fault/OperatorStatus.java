/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault;

/** Lifecycle of an operator under the fault-tolerant shell. */
public enum OperatorStatus {
  RUNNING,
  RETRYING,
  RECOVERING,
  FAILED,
  COMPLETED
}
