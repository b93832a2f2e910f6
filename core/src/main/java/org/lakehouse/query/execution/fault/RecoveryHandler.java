/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault;

import org.lakehouse.query.execution.error.QueryExecutionException;

/**
 * Called when an operator exhausted its retries. A handler may repair the environment (reconnect
 * a storage client, reassign a shard); the shell then runs the operator again from its latest
 * checkpoint with a fresh retry budget. A handler that throws ends the recovery.
 */
@FunctionalInterface
public interface RecoveryHandler {

  void onRecovery(String queryId, String operatorId, QueryExecutionException cause);
}
