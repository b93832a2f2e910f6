/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.lakehouse.query.execution.error.ErrorKind;

/** Failures recorded for one operator within the detector's sliding window. */
@Getter
@ToString
@AllArgsConstructor
public class FailureRecord {

  private final String operatorId;
  private final long lastFailureMillis;
  private final ErrorKind errorKind;

  /** Failures inside the window, without a success in between. */
  private final int consecutiveFailures;
}
