/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.bridge;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.lakehouse.query.executor.security.SecurityIdentity;

/** Caller-supplied facts about the runtime that refine strategy selection. */
@Getter
@Builder(toBuilder = true)
@ToString
public class RuntimeHints {

  /** Hardware concurrency available to this query. */
  @Builder.Default
  private final int availableProcessors = Runtime.getRuntime().availableProcessors();

  /** Skip the result cache lookup for this submission. */
  @Builder.Default private final boolean bypassCache = false;

  /**
   * Strategy to use for a bounded plan instead of the size-based rules. Ignored for unbounded
   * plans, which always stream, and when it is STREAMING or CACHED.
   */
  private final ExecutionStrategy preferredStrategy;

  /** Who submits the query. Required when the service enforces a security policy. */
  private final SecurityIdentity identity;

  public static RuntimeHints defaults() {
    return RuntimeHints.builder().build();
  }
}
