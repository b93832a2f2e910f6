/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.bridge;

/** One handler per {@link ExecutionStrategy}. */
public interface StrategyVisitor<R> {

  R visitSerial();

  R visitParallel();

  R visitStreaming();

  R visitCached();

  R visitAdaptive();
}
