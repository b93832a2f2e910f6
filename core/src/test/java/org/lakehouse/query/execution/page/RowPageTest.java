/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.page;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RowPageTest {

  @Test
  void should_access_values_by_position_and_channel() {
    Object[][] data = {
      {"Alice", 30, 1000.0},
      {"Bob", null, 2000.0}
    };
    RowPage page = new RowPage(data, 3);

    assertEquals(2, page.getPositionCount());
    assertEquals(3, page.getChannelCount());
    assertEquals("Alice", page.getValue(0, 0));
    assertEquals(2000.0, page.getValue(1, 2));
    assertNull(page.getValue(1, 1));
  }

  @Test
  void should_return_region_of_rows() {
    Object[][] data = {{"Alice", 30}, {"Bob", 25}, {"Charlie", 35}, {"Diana", 28}};
    RowPage page = new RowPage(data, 2);

    Page region = page.getRegion(1, 2);

    assertEquals(2, region.getPositionCount());
    assertEquals("Bob", region.getValue(0, 0));
    assertEquals("Charlie", region.getValue(1, 0));
  }

  @Test
  void should_copy_rows_when_built_from_lists() {
    List<Object> first = Arrays.asList("Alice", 30);
    RowPage page = RowPage.fromRows(List.of(first, List.of("Bob", 25)), 2);

    first.set(0, "changed");

    assertEquals("Alice", page.getValue(0, 0));
    assertEquals(List.of(List.of("Alice", 30), List.of("Bob", 25)), page.toRows());
  }

  @Test
  void should_reject_rows_with_wrong_width() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> RowPage.fromRows(List.of(List.of("Alice", 30), List.of("Bob")), 2));

    assertEquals("Row 1 has 1 values, expected 2", e.getMessage());
  }

  @Test
  void should_create_empty_page() {
    Page empty = Page.empty(3);

    assertEquals(0, empty.getPositionCount());
    assertEquals(3, empty.getChannelCount());
  }

  @Test
  void should_throw_on_invalid_position_or_channel() {
    RowPage page = new RowPage(new Object[][] {{"Alice", 30}}, 2);

    assertThrows(IndexOutOfBoundsException.class, () -> page.getValue(-1, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getValue(1, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getValue(0, 2));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getRow(1));
  }

  @Test
  void should_throw_on_invalid_region() {
    RowPage page = new RowPage(new Object[][] {{"Alice"}, {"Bob"}}, 1);

    assertThrows(IndexOutOfBoundsException.class, () -> page.getRegion(1, 3));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getRegion(-1, 1));
  }
}
