/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.error;

/** Classification of execution failures as reported to callers. */
public enum ErrorKind {
  /** Invalid settings or plan detected at submission. No execution starts. */
  CONFIGURATION,

  /** Failure that is retried locally with backoff. */
  TRANSIENT,

  /** Retry budget exhausted or unrecoverable failure. Aborts the query. */
  FATAL,

  /** Checkpoint storage failure. Best-effort on write, fatal on strict recovery reads. */
  CHECKPOINT,

  /** Query was cancelled. Not a real error, surfaces as CANCELLED status. */
  CANCELLED,

  /** The submitting identity may not read a table or stream of the plan. Raised at submission. */
  ACCESS_DENIED
}
