/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.lakehouse.query.execution.plan.PlanFingerprint;

/** Cache of complete query results keyed by plan fingerprint. Implementations are thread-safe. */
public interface ResultCache {

  /** Returns the cached rows of an equivalent plan, if present and not expired. */
  Optional<List<List<Object>>> get(PlanFingerprint fingerprint);

  /** Caches the rows of a plan for the given time. */
  void put(PlanFingerprint fingerprint, List<List<Object>> rows, Duration ttl);

  void invalidate(PlanFingerprint fingerprint);
}
