/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.error;

/** Operator failure that aborts the query. */
public class FatalOperatorException extends QueryExecutionException {

  public FatalOperatorException(String operatorId, String message) {
    super(ErrorKind.FATAL, operatorId, message);
  }

  public FatalOperatorException(String operatorId, String message, Throwable cause) {
    super(ErrorKind.FATAL, operatorId, message, cause);
  }
}
