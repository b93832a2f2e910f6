/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import java.util.List;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.page.PageBuilder;

/** Source operator replaying rows already materialized in memory, such as a join input. */
public class RowsSourceOperator implements SourceOperator {

  private final List<List<Object>> rows;
  private final int channelCount;
  private final OperatorContext context;
  private long position;

  public RowsSourceOperator(
      List<List<Object>> rows, int channelCount, long startPosition, OperatorContext context) {
    this.rows = rows;
    this.channelCount = channelCount;
    this.position = Math.min(startPosition, rows.size());
    this.context = context;
  }

  @Override
  public long getPosition() {
    return position;
  }

  @Override
  public Page getOutput() {
    if (isFinished()) {
      return null;
    }
    context.checkCancelled();
    PageBuilder builder = new PageBuilder(channelCount, context.getPageSize());
    while (!builder.isFull() && position < rows.size()) {
      builder.appendRow(rows.get((int) position++));
    }
    return builder.build();
  }

  @Override
  public boolean isFinished() {
    return position >= rows.size();
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }
}
