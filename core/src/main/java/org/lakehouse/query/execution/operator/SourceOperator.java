/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import org.lakehouse.query.execution.page.Page;

/**
 * A source operator that produces pages without upstream input: a storage scan or a replay of
 * materialized rows. Sources address their rows by offset so a checkpointed pipeline can resume at
 * {@link #getPosition()}.
 */
public interface SourceOperator extends Operator {

  /** Returns the offset of the next row this source will produce, counted from its start. */
  long getPosition();

  /** Source operators never accept input from upstream. */
  @Override
  default boolean needsInput() {
    return false;
  }

  /** Source operators never accept input from upstream. */
  @Override
  default void addInput(Page page) {
    throw new UnsupportedOperationException("Source operators do not accept input");
  }

  /** Sources finish on their own. */
  @Override
  default void finish() {}
}
