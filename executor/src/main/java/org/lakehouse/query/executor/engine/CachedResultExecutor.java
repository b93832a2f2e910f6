/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.engine;

import java.util.List;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.page.PageBuilder;
import org.lakehouse.query.execution.pipeline.PageSink;

/** Replays the cached result attached to a CACHED plan. */
public class CachedResultExecutor implements BoundedExecutor {

  @Override
  public void execute(ExecutionContext context, PageSink sink) {
    context.getProgressTracker().setPhase("cache");
    List<List<Object>> rows = context.getPlan().getCachedResult();
    int channels = context.getPlan().getRoot().getOutputColumns().size();
    for (Page page : PageBuilder.paginate(rows, channels, context.getSettings().getPageSize())) {
      context.getCancellationToken().throwIfCancelled(context.getQueryId());
      sink.accept(page);
    }
  }
}
