/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.plan;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;

/** Stable identity of a logically equivalent plan, used as the result cache key. */
public record PlanFingerprint(String value) {

  /** Computes the SHA-256 fingerprint of the plan's canonical rendering. */
  public static PlanFingerprint of(PlanNode plan) {
    return new PlanFingerprint(
        Hashing.sha256().hashString(plan.explain(), StandardCharsets.UTF_8).toString());
  }

  @Override
  public String toString() {
    return value.substring(0, Math.min(12, value.length()));
  }
}
