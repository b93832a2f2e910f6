/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.progress;

/** Receives progress notifications. Invoked on execution threads; must not block. */
@FunctionalInterface
public interface ProgressHandler {

  void onProgress(ProgressSnapshot snapshot);
}
