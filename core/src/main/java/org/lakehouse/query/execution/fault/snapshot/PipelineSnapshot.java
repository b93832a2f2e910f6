/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault.snapshot;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Consistent snapshot of a resumable task taken between pages: how far its source got, how many
 * output rows it had committed downstream, and the state of every stateful operator keyed by
 * operator id.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PipelineSnapshot {

  public static final int VERSION = 1;

  private int version = VERSION;

  /** Offset of the next source row to read on resume. */
  private long position;

  /** Rows delivered downstream up to this snapshot. */
  private long outputRows;

  private Map<String, OperatorState> operators = new LinkedHashMap<>();

  public PipelineSnapshot(long position, long outputRows, Map<String, OperatorState> operators) {
    this.position = position;
    this.outputRows = outputRows;
    this.operators = operators;
  }
}
