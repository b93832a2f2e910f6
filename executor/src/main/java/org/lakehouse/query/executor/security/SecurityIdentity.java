/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.security;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import lombok.Getter;
import lombok.ToString;

/** Who submits a query: user, roles and clearance. Each identity gets its own session id. */
@Getter
@ToString
public class SecurityIdentity {

  private final String userId;
  private final Set<String> roles;
  private final AccessLevel accessLevel;
  private final String sessionId;

  private SecurityIdentity(String userId, Set<String> roles, AccessLevel accessLevel) {
    this.userId = userId;
    this.roles = Set.copyOf(roles);
    this.accessLevel = accessLevel;
    this.sessionId =
        Hashing.sha256()
            .hashString(userId + ":" + System.nanoTime(), StandardCharsets.UTF_8)
            .toString();
  }

  public static SecurityIdentity of(String userId, Set<String> roles, AccessLevel accessLevel) {
    return new SecurityIdentity(userId, roles, accessLevel);
  }
}
