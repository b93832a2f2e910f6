/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.plan;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;

/**
 * Index chosen by the optimizer for a scan leaf. The execution core passes it through to the
 * storage engine untouched.
 *
 * @param indexName name of the index
 * @param kind index family
 * @param parameters index-specific access parameters (probe vector, time range, bounding box...)
 */
public record IndexAccessPath(String indexName, IndexKind kind, Map<String, Object> parameters) {

  /** Families of index supported by the lake storage engines. */
  public enum IndexKind {
    BTREE,
    VECTOR,
    TIME_SERIES,
    SPATIAL
  }

  public IndexAccessPath {
    parameters = parameters == null ? Map.of() : ImmutableSortedMap.copyOf(parameters);
  }

  @Override
  public String toString() {
    return kind + ":" + indexName + parameters;
  }
}
