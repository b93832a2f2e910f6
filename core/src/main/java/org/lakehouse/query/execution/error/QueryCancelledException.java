/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.error;

/** Raised at an operator step boundary once the query's cancellation token is set. */
public class QueryCancelledException extends QueryExecutionException {

  public QueryCancelledException(String operatorId) {
    super(ErrorKind.CANCELLED, operatorId, "Query cancelled");
  }
}
