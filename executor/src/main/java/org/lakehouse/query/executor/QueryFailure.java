/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.lakehouse.query.execution.error.ErrorKind;
import org.lakehouse.query.execution.error.QueryExecutionException;

/** Why a query failed, as reported to its caller. */
@Getter
@ToString
@RequiredArgsConstructor
public class QueryFailure {

  /** Operator that failed, null if the failure is not tied to one. */
  private final String operatorId;

  private final ErrorKind errorKind;
  private final String message;

  public static QueryFailure of(QueryExecutionException e) {
    return new QueryFailure(e.getOperatorId(), e.getErrorKind(), e.getMessage());
  }

  public static QueryFailure of(RuntimeException e) {
    if (e instanceof QueryExecutionException) {
      return of((QueryExecutionException) e);
    }
    return new QueryFailure(null, ErrorKind.FATAL, String.valueOf(e.getMessage()));
  }
}
