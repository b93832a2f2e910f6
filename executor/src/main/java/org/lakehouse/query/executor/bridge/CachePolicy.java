/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.bridge;

import java.time.Duration;
import lombok.Getter;
import lombok.ToString;

/** Whether and for how long the result of a plan is written to the result cache. */
@Getter
@ToString
public class CachePolicy {

  private static final CachePolicy DISABLED = new CachePolicy(false, Duration.ZERO, 0);

  private final boolean writeThrough;
  private final Duration ttl;
  private final int maxRows;

  private CachePolicy(boolean writeThrough, Duration ttl, int maxRows) {
    this.writeThrough = writeThrough;
    this.ttl = ttl;
    this.maxRows = maxRows;
  }

  public static CachePolicy writeThrough(Duration ttl, int maxRows) {
    return new CachePolicy(true, ttl, maxRows);
  }

  public static CachePolicy disabled() {
    return DISABLED;
  }
}
