/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.plan.PlanFingerprint;

/**
 * {@link ResultCache} on a size-bounded Guava cache. Every entry carries its own expiry, checked on
 * read, since the time to live depends on the plan.
 */
@Log4j2
public class InMemoryResultCache implements ResultCache {

  private final Cache<PlanFingerprint, Entry> cache;
  private final Clock clock;

  public InMemoryResultCache(long maximumEntries, Clock clock) {
    this.cache = CacheBuilder.newBuilder().maximumSize(maximumEntries).build();
    this.clock = clock;
  }

  @Override
  public Optional<List<List<Object>>> get(PlanFingerprint fingerprint) {
    Entry entry = cache.getIfPresent(fingerprint);
    if (entry == null) {
      return Optional.empty();
    }
    if (clock.millis() >= entry.expiresAtMillis) {
      cache.invalidate(fingerprint);
      log.debug("Cached result {} expired", fingerprint);
      return Optional.empty();
    }
    return Optional.of(entry.rows);
  }

  @Override
  public void put(PlanFingerprint fingerprint, List<List<Object>> rows, Duration ttl) {
    List<List<Object>> copy = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    cache.put(
        fingerprint,
        new Entry(Collections.unmodifiableList(copy), clock.millis() + ttl.toMillis()));
  }

  @Override
  public void invalidate(PlanFingerprint fingerprint) {
    cache.invalidate(fingerprint);
  }

  private static final class Entry {
    private final List<List<Object>> rows;
    private final long expiresAtMillis;

    private Entry(List<List<Object>> rows, long expiresAtMillis) {
      this.rows = rows;
      this.expiresAtMillis = expiresAtMillis;
    }
  }
}
