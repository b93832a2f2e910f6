/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Key extraction and hash partitioning shared by joins and aggregations. The build and probe sides
 * of a partitioned join must route keys through the same {@link #partitionOf} so equal keys land in
 * the same partition.
 */
public final class RowKeys {

  private RowKeys() {}

  /**
   * Extracts the join key of a row. Returns null if any key column is null; null keys never match.
   */
  public static List<Object> joinKey(List<Object> row, int[] keyIndices) {
    Object[] key = new Object[keyIndices.length];
    for (int i = 0; i < keyIndices.length; i++) {
      Object value = normalize(row.get(keyIndices[i]));
      if (value == null) {
        return null;
      }
      key[i] = value;
    }
    return Arrays.asList(key);
  }

  /** Extracts the grouping key of a row. Null values group together. */
  public static List<Object> groupKey(List<Object> row, int[] keyIndices) {
    Object[] key = new Object[keyIndices.length];
    for (int i = 0; i < keyIndices.length; i++) {
      key[i] = normalize(row.get(keyIndices[i]));
    }
    return Arrays.asList(key);
  }

  /**
   * Normalizes a key value for consistent hash/equals behavior. Converts all integer numeric types
   * to Long and Float to Double.
   */
  public static Object normalize(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float) {
      return ((Float) value).doubleValue();
    }
    return value;
  }

  /** Normalizes every value of a key restored from a checkpoint. */
  public static List<Object> normalizeAll(List<Object> key) {
    List<Object> normalized = new ArrayList<>(key.size());
    for (Object value : key) {
      normalized.add(normalize(value));
    }
    return normalized;
  }

  /** Returns the partition owning a key. A null key is owned by partition 0. */
  public static int partitionOf(List<Object> key, int partitions) {
    if (key == null) {
      return 0;
    }
    return Math.floorMod(key.hashCode(), partitions);
  }

  /** Resolves column names to positions in a column list. */
  public static int[] indicesOf(List<String> columns, List<String> names) {
    int[] indices = new int[names.size()];
    for (int i = 0; i < indices.length; i++) {
      indices[i] = columns.indexOf(names.get(i));
      if (indices[i] < 0) {
        throw new IllegalArgumentException("Unknown column " + names.get(i) + " in " + columns);
      }
    }
    return indices;
  }
}
