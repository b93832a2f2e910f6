/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.pipeline;

import org.lakehouse.query.execution.page.Page;

/** Receives the output pages of a pipeline. */
@FunctionalInterface
public interface PageSink {

  void accept(Page page);
}
