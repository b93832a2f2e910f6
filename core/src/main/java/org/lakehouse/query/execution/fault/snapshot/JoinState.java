/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault.snapshot;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Positions of build rows already matched by a RIGHT or FULL hash join. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class JoinState implements OperatorState {

  public static final int VERSION = 1;

  private int version = VERSION;

  private List<Integer> matchedBuildRows;

  public JoinState(List<Integer> matchedBuildRows) {
    this.matchedBuildRows = matchedBuildRows;
  }
}
