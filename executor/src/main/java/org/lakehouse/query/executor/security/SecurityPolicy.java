/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.security;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Classification of tables, streams and columns. A resource may also require one of a set of roles.
 * Anything not listed is public.
 */
@Getter
@Builder
@ToString
public class SecurityPolicy {

  /** Level needed to read a table or stream at all, by table name or stream id. */
  @Singular private final Map<String, AccessLevel> resourceLevels;

  /** Level needed to see a column's values unmasked, by column name. */
  @Singular private final Map<String, AccessLevel> columnLevels;

  /** Roles of which the identity needs at least one, by table name or stream id. */
  @Singular private final Map<String, Set<String>> requiredRoles;

  public Optional<AccessLevel> resourceLevel(String resource) {
    return Optional.ofNullable(resourceLevels.get(resource));
  }

  public Optional<AccessLevel> columnLevel(String column) {
    return Optional.ofNullable(columnLevels.get(column));
  }

  public Set<String> rolesFor(String resource) {
    return requiredRoles.getOrDefault(resource, Set.of());
  }
}
