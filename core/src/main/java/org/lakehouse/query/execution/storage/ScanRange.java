/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.storage;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/**
 * Half-open interval {@code [start, end)} of row offsets within a scan leaf's output. Range
 * partitioning of scans and checkpoint resume both address rows by offset.
 */
public record ScanRange(long start, long end) {

  public ScanRange {
    Preconditions.checkArgument(start >= 0 && start <= end, "invalid range [%s, %s)", start, end);
  }

  public static ScanRange all(long rowCount) {
    return new ScanRange(0, rowCount);
  }

  public long size() {
    return end - start;
  }

  /** Returns the sub-range starting {@code offset} rows into this range. */
  public ScanRange skip(long offset) {
    return new ScanRange(Math.min(end, start + offset), end);
  }

  /**
   * Splits this range into {@code parts} contiguous, disjoint ranges whose sizes differ by at most
   * one row. Earlier ranges take the remainder.
   */
  public List<ScanRange> split(int parts) {
    Preconditions.checkArgument(parts > 0, "parts must be positive: %s", parts);
    List<ScanRange> ranges = new ArrayList<>(parts);
    long base = size() / parts;
    long remainder = size() % parts;
    long cursor = start;
    for (int i = 0; i < parts; i++) {
      long length = base + (i < remainder ? 1 : 0);
      ranges.add(new ScanRange(cursor, cursor + length));
      cursor += length;
    }
    return ranges;
  }
}
