/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.monitor;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** One finding of the {@link PerformanceAnalyzer}, with a message meant for operators. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Recommendation {

  private final RecommendationKind kind;
  private final String message;

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
