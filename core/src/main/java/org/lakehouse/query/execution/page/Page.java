/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.page;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A batch of rows flowing between operators. Pages are the unit of hand-off between operators,
 * pipelines and partition channels; a page is never mutated after it is built.
 */
public interface Page {

  /** Returns the number of rows in this page. */
  int getPositionCount();

  /** Returns the number of columns in this page. */
  int getChannelCount();

  /**
   * Returns the value at the given row and column position.
   *
   * @param position the row index (0-based)
   * @param channel the column index (0-based)
   * @return the value, or null if the cell is null
   */
  Object getValue(int position, int channel);

  /**
   * Returns a sub-region of this page.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new Page representing the sub-region
   */
  Page getRegion(int positionOffset, int length);

  /** Returns a copy of one row as a list. */
  default List<Object> getRow(int position) {
    Object[] row = new Object[getChannelCount()];
    for (int channel = 0; channel < row.length; channel++) {
      row[channel] = getValue(position, channel);
    }
    return Arrays.asList(row);
  }

  /** Copies every row of the page into lists. */
  default List<List<Object>> toRows() {
    List<List<Object>> rows = new ArrayList<>(getPositionCount());
    for (int position = 0; position < getPositionCount(); position++) {
      rows.add(getRow(position));
    }
    return rows;
  }

  /** Returns an empty page with zero rows and the given number of columns. */
  static Page empty(int channelCount) {
    return new RowPage(new Object[0][channelCount], channelCount);
  }
}
