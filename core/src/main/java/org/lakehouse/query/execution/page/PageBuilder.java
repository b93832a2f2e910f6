/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.page;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates rows into {@link Page}s. Rows are appended whole with {@link #appendRow(List)}; the
 * builder reports {@link #isFull()} once the configured page size is reached so operators can
 * flush a page and keep going.
 */
public class PageBuilder {

  private final int channelCount;
  private final int pageSize;
  private final List<Object[]> rows;

  public PageBuilder(int channelCount, int pageSize) {
    if (channelCount < 0) {
      throw new IllegalArgumentException("channelCount must be non-negative: " + channelCount);
    }
    if (pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
    }
    this.channelCount = channelCount;
    this.pageSize = pageSize;
    this.rows = new ArrayList<>();
  }

  /** Appends one row. The row must have exactly {@code channelCount} values. */
  public void appendRow(List<Object> row) {
    if (row.size() != channelCount) {
      throw new IllegalArgumentException(
          "Row has " + row.size() + " values, expected " + channelCount);
    }
    rows.add(row.toArray());
  }

  /** Returns the number of rows added so far. */
  public int getRowCount() {
    return rows.size();
  }

  /** Returns true if no rows have been added. */
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** Returns true once the builder holds a full page. */
  public boolean isFull() {
    return rows.size() >= pageSize;
  }

  /** Builds a Page from all committed rows and resets the builder. */
  public Page build() {
    Object[][] data = rows.toArray(new Object[0][]);
    rows.clear();
    return new RowPage(data, channelCount);
  }

  /** Splits the given rows into pages of at most {@code pageSize} rows. */
  public static List<Page> paginate(List<List<Object>> rows, int channelCount, int pageSize) {
    PageBuilder builder = new PageBuilder(channelCount, pageSize);
    List<Page> pages = new ArrayList<>();
    for (List<Object> row : rows) {
      builder.appendRow(row);
      if (builder.isFull()) {
        pages.add(builder.build());
      }
    }
    if (!builder.isEmpty()) {
      pages.add(builder.build());
    }
    return pages;
  }
}
