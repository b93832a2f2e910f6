/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.security;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Access decisions, written to the {@value #LOGGER_NAME} logger. */
public class AuditLog {

  public static final String LOGGER_NAME = "org.lakehouse.query.audit";

  private static final Logger LOG = LogManager.getLogger(LOGGER_NAME);

  public void logAccess(SecurityIdentity identity, String resource, String operation) {
    LOG.info(
        "Access: user={} session={} resource={} operation={}",
        identity.getUserId(),
        identity.getSessionId(),
        resource,
        operation);
  }

  public void logViolation(
      SecurityIdentity identity, String resource, String operation, String reason) {
    LOG.warn(
        "Violation: user={} session={} resource={} operation={} reason={}",
        identity.getUserId(),
        identity.getSessionId(),
        resource,
        operation,
        reason);
  }
}
