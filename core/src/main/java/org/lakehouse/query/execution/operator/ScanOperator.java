/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import java.util.ArrayList;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.page.PageBuilder;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.storage.RowCursor;
import org.lakehouse.query.execution.storage.ScanRange;
import org.lakehouse.query.execution.storage.StorageEngine;

/**
 * Source operator that reads one range of a scan leaf from a {@link StorageEngine}, one page per
 * {@link #getOutput()} call. Storage failures propagate unchanged so the fault-tolerant shell can
 * classify them.
 */
@Log4j2
public class ScanOperator implements SourceOperator {

  private final StorageEngine storage;
  private final PlanNode scanNode;
  private final ScanRange range;
  private final OperatorContext context;

  private RowCursor cursor;
  private long position;
  private boolean finished;

  /**
   * @param range rows of the scan this operator owns
   * @param startPosition offset into {@code range} to resume from
   */
  public ScanOperator(
      StorageEngine storage,
      PlanNode scanNode,
      ScanRange range,
      long startPosition,
      OperatorContext context) {
    this.storage = storage;
    this.scanNode = scanNode;
    this.range = range;
    this.position = startPosition;
    this.context = context;
    this.finished = startPosition >= range.size();
  }

  @Override
  public long getPosition() {
    return position;
  }

  @Override
  public Page getOutput() {
    if (finished) {
      return null;
    }
    context.checkCancelled();
    if (cursor == null) {
      log.debug("Scanning {} rows {} from offset {}", scanNode, range, position);
      cursor = storage.scan(scanNode, range.skip(position));
    }
    int channels = scanNode.getOutputColumns().size();
    PageBuilder builder = new PageBuilder(channels, context.getPageSize());
    while (!builder.isFull() && cursor.hasNext()) {
      builder.appendRow(new ArrayList<>(cursor.next()));
    }
    position += builder.getRowCount();
    if (!cursor.hasNext()) {
      finished = true;
      close();
    }
    return builder.isEmpty() ? null : builder.build();
  }

  @Override
  public boolean isFinished() {
    return finished;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {
    if (cursor != null) {
      cursor.close();
      cursor = null;
    }
  }

}
