/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault.snapshot;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial aggregates of one group: the group key and one state list per aggregate call. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class GroupState {

  private List<Object> key;

  private List<List<Object>> accumulators;
}
