/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault.snapshot;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Rows buffered by a sort operator that has not yet seen all of its input. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class SortState implements OperatorState {

  public static final int VERSION = 1;

  private int version = VERSION;

  private List<List<Object>> rows;

  public SortState(List<List<Object>> rows) {
    this.rows = rows;
  }
}
