/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault.snapshot;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Open windows of a streaming windowed aggregation and the time up to which windows closed. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class WindowAggregationState implements OperatorState {

  public static final int VERSION = 1;

  private int version = VERSION;

  /** Windows ending at or before this time have been emitted. */
  private long closedUpToMillis;

  private List<WindowState> windows;

  public WindowAggregationState(long closedUpToMillis, List<WindowState> windows) {
    this.closedUpToMillis = closedUpToMillis;
    this.windows = windows;
  }

  /** Groups of one open window. */
  @Data
  @AllArgsConstructor
  @NoArgsConstructor
  public static class WindowState {

    private long startMillis;

    private List<GroupState> groups;
  }
}
