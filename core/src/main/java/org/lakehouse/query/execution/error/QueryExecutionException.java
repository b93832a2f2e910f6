/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.error;

import lombok.Getter;

/** Base class of all failures raised by the execution core. */
@Getter
public class QueryExecutionException extends RuntimeException {

  private final ErrorKind errorKind;

  /** Id of the operator that raised the failure, null when not attributable to one operator. */
  private final String operatorId;

  public QueryExecutionException(ErrorKind errorKind, String operatorId, String message) {
    super(message);
    this.errorKind = errorKind;
    this.operatorId = operatorId;
  }

  public QueryExecutionException(
      ErrorKind errorKind, String operatorId, String message, Throwable cause) {
    super(message, cause);
    this.errorKind = errorKind;
    this.operatorId = operatorId;
  }
}
