/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.error;

/**
 * A recoverable operator failure. The fault-tolerant shell retries the operator from its last
 * checkpoint when this is thrown.
 */
public class TransientOperatorException extends QueryExecutionException {

  public TransientOperatorException(String operatorId, String message) {
    super(ErrorKind.TRANSIENT, operatorId, message);
  }

  public TransientOperatorException(String operatorId, String message, Throwable cause) {
    super(ErrorKind.TRANSIENT, operatorId, message, cause);
  }
}
