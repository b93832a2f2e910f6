/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.security;

import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import org.lakehouse.query.execution.error.AccessDeniedException;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.plan.PlanNodeType;

/**
 * Enforces a {@link SecurityPolicy} on submitted plans. Tables and streams the identity may not
 * read reject the whole plan; classified columns it may not see are masked in the scanned rows.
 * Every decision goes to the {@link AuditLog}.
 */
public class QueryAuthorizer {

  private static final String READ = "read";

  @Getter private final SecurityPolicy policy;
  private final AuditLog auditLog;

  public QueryAuthorizer(SecurityPolicy policy) {
    this(policy, new AuditLog());
  }

  public QueryAuthorizer(SecurityPolicy policy, AuditLog auditLog) {
    this.policy = policy;
    this.auditLog = auditLog;
  }

  /** True if the identity may read the table or stream. The decision is audited. */
  public boolean checkAccess(SecurityIdentity identity, String resource) {
    Optional<AccessLevel> required = policy.resourceLevel(resource);
    if (required.isPresent() && !identity.getAccessLevel().covers(required.get())) {
      auditLog.logViolation(
          identity,
          resource,
          READ,
          "access level " + identity.getAccessLevel() + " below " + required.get());
      return false;
    }
    Set<String> roles = policy.rolesFor(resource);
    if (!roles.isEmpty() && Collections.disjoint(roles, identity.getRoles())) {
      auditLog.logViolation(identity, resource, READ, "missing one of roles " + roles);
      return false;
    }
    auditLog.logAccess(identity, resource, READ);
    return true;
  }

  /**
   * Checks every table and stream the plan reads.
   *
   * @throws AccessDeniedException on the first resource the identity may not read, or when no
   *     identity is given
   */
  public void authorize(SecurityIdentity identity, PlanNode plan) {
    if (identity == null) {
      throw new AccessDeniedException(null, "Query submitted without an identity");
    }
    for (String resource : resourcesOf(plan)) {
      if (!checkAccess(identity, resource)) {
        throw new AccessDeniedException(
            resource, "User " + identity.getUserId() + " may not read " + resource);
      }
    }
  }

  /** Positions in a scan's output columns whose values the identity may not see. */
  public List<Integer> maskedPositions(SecurityIdentity identity, PlanNode scanNode) {
    List<String> columns = scanNode.getOutputColumns();
    List<Integer> positions = new ArrayList<>();
    for (int i = 0; i < columns.size(); i++) {
      Optional<AccessLevel> required = policy.columnLevel(columns.get(i));
      if (required.isPresent() && !identity.getAccessLevel().covers(required.get())) {
        positions.add(i);
      }
    }
    return positions;
  }

  /** True if any scan of the plan has a column the identity only sees masked. */
  public boolean masksAny(SecurityIdentity identity, PlanNode plan) {
    boolean[] masked = {false};
    plan.forEach(
        node -> {
          if (isScan(node) && !maskedPositions(identity, node).isEmpty()) {
            masked[0] = true;
          }
        });
    return masked[0];
  }

  /**
   * Hides a value. Strings keep their length as asterisks; other values become null so that
   * aggregates skip them.
   */
  public static Object mask(Object value) {
    if (value instanceof String) {
      return Strings.repeat("*", ((String) value).length());
    }
    return null;
  }

  private static List<String> resourcesOf(PlanNode plan) {
    List<String> resources = new ArrayList<>();
    plan.forEach(
        node -> {
          if (isScan(node)) {
            resources.add(node.getTable());
          } else if (node.getType() == PlanNodeType.STREAM_SOURCE) {
            resources.add(node.getStreamId());
          }
        });
    return resources;
  }

  static boolean isScan(PlanNode node) {
    return node.getType() == PlanNodeType.TABLE_SCAN || node.getType() == PlanNodeType.INDEX_SCAN;
  }
}
