/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.plan;

/** Equi-join variants. Null keys never match. */
public enum JoinType {
  INNER,
  LEFT,
  RIGHT,
  FULL,
  /** Left rows with at least one match, left columns only. */
  SEMI,
  /** Left rows without a match, left columns only. */
  ANTI;

  /** Returns true if the output carries only the left side's columns. */
  public boolean projectsLeftOnly() {
    return this == SEMI || this == ANTI;
  }

  /** Returns true if unmatched build (right) rows are emitted padded with nulls. */
  public boolean emitsUnmatchedRight() {
    return this == RIGHT || this == FULL;
  }

  /** Returns true if unmatched probe (left) rows are emitted padded with nulls. */
  public boolean emitsUnmatchedLeft() {
    return this == LEFT || this == FULL;
  }
}
