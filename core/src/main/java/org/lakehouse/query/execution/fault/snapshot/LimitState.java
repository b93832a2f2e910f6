/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault.snapshot;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Rows already passed by a limit operator. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class LimitState implements OperatorState {

  public static final int VERSION = 1;

  private int version = VERSION;

  private long emittedRows;

  public LimitState(long emittedRows) {
    this.emittedRows = emittedRows;
  }
}
