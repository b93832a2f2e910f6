/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import lombok.Getter;

/**
 * Runtime context available to operators during execution. Provides the owning query, operator
 * identity, page sizing and cancellation.
 */
@Getter
public class OperatorContext {

  private final String queryId;
  private final String operatorId;
  private final int pageSize;
  private final CancellationToken cancellationToken;

  public OperatorContext(
      String queryId, String operatorId, int pageSize, CancellationToken cancellationToken) {
    this.queryId = queryId;
    this.operatorId = operatorId;
    this.pageSize = pageSize;
    this.cancellationToken = cancellationToken;
  }

  /** Returns a context for another operator of the same query. */
  public OperatorContext forOperator(String otherOperatorId) {
    return new OperatorContext(queryId, otherOperatorId, pageSize, cancellationToken);
  }

  /** Returns true if the query has been cancelled. */
  public boolean isCancelled() {
    return cancellationToken.isCancelled();
  }

  /** Throws {@code QueryCancelledException} if the query has been cancelled. */
  public void checkCancelled() {
    cancellationToken.throwIfCancelled(operatorId);
  }

  /** Creates a default context for testing. */
  public static OperatorContext createDefault(String operatorId) {
    return new OperatorContext("default-query", operatorId, 1024, new CancellationToken());
  }
}
