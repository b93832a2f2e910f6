/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import java.util.List;
import org.lakehouse.query.execution.pipeline.CollectingSink;
import org.lakehouse.query.execution.pipeline.PipelineDriver;

/** Drives rows through a single operator in pages. */
final class OperatorHarness {

  private OperatorHarness() {}

  static List<List<Object>> run(
      List<List<Object>> input, int channels, int pageSize, Operator operator) {
    return run(source(input, channels, pageSize), operator);
  }

  static List<List<Object>> run(RowsSourceOperator source, Operator operator) {
    CollectingSink sink = new CollectingSink();
    new PipelineDriver(source, List.of(operator), sink).run(rows -> {});
    return sink.getRows();
  }

  static RowsSourceOperator source(List<List<Object>> input, int channels, int pageSize) {
    return new RowsSourceOperator(input, channels, 0, context("source", pageSize));
  }

  static OperatorContext context(String operatorId, int pageSize) {
    return new OperatorContext("test-query", operatorId, pageSize, new CancellationToken());
  }
}
