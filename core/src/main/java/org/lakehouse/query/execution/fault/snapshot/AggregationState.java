/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault.snapshot;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** State of a hash aggregation: every group seen so far with its partial aggregates. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class AggregationState implements OperatorState {

  public static final int VERSION = 1;

  private int version = VERSION;

  private List<GroupState> groups;

  public AggregationState(List<GroupState> groups) {
    this.groups = groups;
  }
}
