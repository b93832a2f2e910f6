/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ScanRangeTest {

  @Test
  void should_split_evenly_into_disjoint_ranges() {
    List<ScanRange> ranges = ScanRange.all(10_000).split(4);

    assertEquals(
        List.of(
            new ScanRange(0, 2500),
            new ScanRange(2500, 5000),
            new ScanRange(5000, 7500),
            new ScanRange(7500, 10_000)),
        ranges);
  }

  @Test
  void should_give_remainder_to_earlier_ranges() {
    List<ScanRange> ranges = new ScanRange(10, 20).split(3);

    assertEquals(
        List.of(new ScanRange(10, 14), new ScanRange(14, 17), new ScanRange(17, 20)), ranges);
  }

  @Test
  void should_return_empty_ranges_when_parts_exceed_rows() {
    List<ScanRange> ranges = ScanRange.all(2).split(4);

    assertEquals(4, ranges.size());
    assertEquals(2, ranges.stream().mapToLong(ScanRange::size).sum());
    assertEquals(0, ranges.get(3).size());
  }

  @Test
  void should_skip_within_bounds() {
    ScanRange range = new ScanRange(100, 200);

    assertEquals(new ScanRange(150, 200), range.skip(50));
    assertEquals(new ScanRange(200, 200), range.skip(500));
  }

  @Test
  void should_reject_inverted_range() {
    assertThrows(IllegalArgumentException.class, () -> new ScanRange(5, 4));
    assertThrows(IllegalArgumentException.class, () -> ScanRange.all(5).split(0));
  }
}
