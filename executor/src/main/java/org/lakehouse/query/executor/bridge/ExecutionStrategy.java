/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.bridge;

/**
 * How a submitted plan is executed. Chosen once per submission by the {@link StrategyBridge}.
 * Dispatch goes through {@link #accept(StrategyVisitor)}, so adding a strategy fails compilation
 * until every visitor handles it.
 */
public enum ExecutionStrategy {
  SERIAL {
    @Override
    public <R> R accept(StrategyVisitor<R> visitor) {
      return visitor.visitSerial();
    }
  },
  PARALLEL {
    @Override
    public <R> R accept(StrategyVisitor<R> visitor) {
      return visitor.visitParallel();
    }
  },
  STREAMING {
    @Override
    public <R> R accept(StrategyVisitor<R> visitor) {
      return visitor.visitStreaming();
    }
  },
  CACHED {
    @Override
    public <R> R accept(StrategyVisitor<R> visitor) {
      return visitor.visitCached();
    }
  },
  ADAPTIVE {
    @Override
    public <R> R accept(StrategyVisitor<R> visitor) {
      return visitor.visitAdaptive();
    }
  };

  public abstract <R> R accept(StrategyVisitor<R> visitor);
}
