/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.page;

import java.util.Arrays;
import java.util.List;

/**
 * Row-based {@link Page} implementation. Each row is an Object array where the index corresponds
 * to the column (channel) position.
 */
public class RowPage implements Page {

  private final Object[][] rows;
  private final int channelCount;

  /**
   * Creates a RowPage from pre-built row data.
   *
   * @param rows 2D array where rows[i][j] is the value at row i, column j
   * @param channelCount the number of columns
   */
  public RowPage(Object[][] rows, int channelCount) {
    this.rows = rows;
    this.channelCount = channelCount;
  }

  /** Builds a page holding a copy of the given rows. */
  public static RowPage fromRows(List<List<Object>> rows, int channelCount) {
    Object[][] data = new Object[rows.size()][];
    for (int i = 0; i < data.length; i++) {
      List<Object> row = rows.get(i);
      if (row.size() != channelCount) {
        throw new IllegalArgumentException(
            "Row " + i + " has " + row.size() + " values, expected " + channelCount);
      }
      data[i] = row.toArray();
    }
    return new RowPage(data, channelCount);
  }

  @Override
  public int getPositionCount() {
    return rows.length;
  }

  @Override
  public int getChannelCount() {
    return channelCount;
  }

  @Override
  public Object getValue(int position, int channel) {
    if (position < 0 || position >= rows.length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + rows.length + ")");
    }
    if (channel < 0 || channel >= channelCount) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + channelCount + ")");
    }
    return rows[position][channel];
  }

  @Override
  public List<Object> getRow(int position) {
    if (position < 0 || position >= rows.length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + rows.length + ")");
    }
    return Arrays.asList(Arrays.copyOf(rows[position], channelCount));
  }

  @Override
  public Page getRegion(int positionOffset, int length) {
    if (positionOffset < 0 || length < 0 || positionOffset + length > rows.length) {
      throw new IndexOutOfBoundsException(
          "Region ["
              + positionOffset
              + ", "
              + (positionOffset + length)
              + ") out of range [0, "
              + rows.length
              + ")");
    }
    return new RowPage(
        Arrays.copyOfRange(rows, positionOffset, positionOffset + length), channelCount);
  }
}
