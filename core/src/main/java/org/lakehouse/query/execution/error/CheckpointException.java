/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.error;

/** Checkpoint storage read or write failure. */
public class CheckpointException extends QueryExecutionException {

  public CheckpointException(String operatorId, String message) {
    super(ErrorKind.CHECKPOINT, operatorId, message);
  }

  public CheckpointException(String operatorId, String message, Throwable cause) {
    super(ErrorKind.CHECKPOINT, operatorId, message, cause);
  }
}
