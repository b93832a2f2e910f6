/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.lakehouse.query.execution.page.Page;

/** Sink materializing every row it receives. Thread-safe. */
public class CollectingSink implements PageSink {

  private final List<List<Object>> rows = Collections.synchronizedList(new ArrayList<>());

  @Override
  public void accept(Page page) {
    rows.addAll(page.toRows());
  }

  /** Returns a copy of the rows received so far. */
  public List<List<Object>> getRows() {
    synchronized (rows) {
      return new ArrayList<>(rows);
    }
  }
}
