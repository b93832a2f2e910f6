/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.monitor;

/** What a performance recommendation is about. */
public enum RecommendationKind {
  LOW_THROUGHPUT,
  LOW_CACHE_HIT_RATIO,
  CONSIDER_PARALLEL,
  UNDERESTIMATED_INPUT,
  STREAM_BUFFER_OVERFLOW,
  LATE_EVENTS
}
