/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.error;

import lombok.Getter;

/** The submitting identity may not read a resource the plan scans. */
@Getter
public class AccessDeniedException extends QueryExecutionException {

  /** Table or stream that was refused, null when no identity was given at all. */
  private final String resource;

  public AccessDeniedException(String resource, String message) {
    super(ErrorKind.ACCESS_DENIED, null, message);
    this.resource = resource;
  }
}
