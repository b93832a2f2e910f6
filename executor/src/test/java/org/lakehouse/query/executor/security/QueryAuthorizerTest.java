/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lakehouse.query.execution.error.AccessDeniedException;
import org.lakehouse.query.execution.plan.JoinType;
import org.lakehouse.query.execution.plan.PlanNode;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryAuthorizerTest {

  private static final SecurityPolicy POLICY =
      SecurityPolicy.builder()
          .resourceLevel("payments", AccessLevel.CONFIDENTIAL)
          .requiredRole("payroll", Set.of("hr", "finance"))
          .columnLevel("ssn", AccessLevel.RESTRICTED)
          .build();

  private static final SecurityIdentity ANALYST =
      SecurityIdentity.of("ana", Set.of("finance"), AccessLevel.INTERNAL);

  @Mock private AuditLog auditLog;

  @Test
  void should_deny_a_table_above_the_identity_clearance_and_audit_it() {
    // Given
    QueryAuthorizer authorizer = new QueryAuthorizer(POLICY, auditLog);

    // When
    boolean allowed = authorizer.checkAccess(ANALYST, "payments");

    // Then
    assertFalse(allowed);
    verify(auditLog).logViolation(eq(ANALYST), eq("payments"), eq("read"), contains("INTERNAL"));
    verify(auditLog, never()).logAccess(ANALYST, "payments", "read");
  }

  @Test
  void should_require_one_of_the_listed_roles() {
    // Given
    QueryAuthorizer authorizer = new QueryAuthorizer(POLICY, auditLog);
    SecurityIdentity engineer = SecurityIdentity.of("eve", Set.of("eng"), AccessLevel.RESTRICTED);

    // Then
    assertTrue(authorizer.checkAccess(ANALYST, "payroll"));
    assertFalse(authorizer.checkAccess(engineer, "payroll"));
    verify(auditLog).logAccess(ANALYST, "payroll", "read");
    verify(auditLog).logViolation(eq(engineer), eq("payroll"), eq("read"), anyString());
  }

  @Test
  void should_treat_unlisted_resources_as_public() {
    QueryAuthorizer authorizer = new QueryAuthorizer(POLICY, auditLog);

    assertTrue(
        authorizer.checkAccess(SecurityIdentity.of("x", Set.of(), AccessLevel.PUBLIC), "orders"));
  }

  @Test
  void should_reject_a_plan_joining_a_denied_table() {
    // Given
    QueryAuthorizer authorizer = new QueryAuthorizer(POLICY, auditLog);
    PlanNode plan =
        PlanNode.hashJoin(
            "join",
            PlanNode.tableScan("o", "orders", List.of("id", "amount"), 10),
            PlanNode.tableScan("p", "payments", List.of("order_id", "card"), 10),
            JoinType.INNER,
            List.of("id"),
            List.of("order_id"),
            10);

    // When
    AccessDeniedException e =
        assertThrows(AccessDeniedException.class, () -> authorizer.authorize(ANALYST, plan));

    // Then
    assertEquals("payments", e.getResource());
    verify(auditLog).logAccess(ANALYST, "orders", "read");
  }

  @Test
  void should_reject_a_plan_without_identity() {
    QueryAuthorizer authorizer = new QueryAuthorizer(POLICY, auditLog);
    PlanNode plan = PlanNode.tableScan("o", "orders", List.of("id"), 10);

    AccessDeniedException e =
        assertThrows(AccessDeniedException.class, () -> authorizer.authorize(null, plan));

    assertNull(e.getResource());
  }

  @Test
  void should_find_masked_columns_of_a_scan() {
    // Given
    QueryAuthorizer authorizer = new QueryAuthorizer(POLICY, auditLog);
    PlanNode people = PlanNode.tableScan("s", "people", List.of("name", "ssn", "age"), 10);
    SecurityIdentity officer = SecurityIdentity.of("oz", Set.of(), AccessLevel.RESTRICTED);

    // Then
    assertEquals(List.of(1), authorizer.maskedPositions(ANALYST, people));
    assertTrue(authorizer.masksAny(ANALYST, PlanNode.limit("l", people, 5)));
    assertFalse(authorizer.masksAny(officer, people));
  }

  @Test
  void should_mask_strings_by_length_and_hide_other_values() {
    assertEquals("*****", QueryAuthorizer.mask("12345"));
    assertNull(QueryAuthorizer.mask(42));
    assertNull(QueryAuthorizer.mask(null));
  }
}
