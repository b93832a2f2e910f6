/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor;

import lombok.Getter;

/** Thrown to a caller consuming the results of a failed query. Carries no stack trace. */
public class QueryFailedException extends RuntimeException {

  @Getter private final QueryFailure failure;

  public QueryFailedException(String queryId, QueryFailure failure) {
    super(
        "Query "
            + queryId
            + " failed"
            + (failure.getOperatorId() == null ? "" : " in operator " + failure.getOperatorId())
            + " ["
            + failure.getErrorKind()
            + "]: "
            + failure.getMessage(),
        null,
        false,
        false);
    this.failure = failure;
  }
}
