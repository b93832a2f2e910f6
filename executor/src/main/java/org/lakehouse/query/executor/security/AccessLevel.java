/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.security;

/** Clearance levels, from least to most restricted. */
public enum AccessLevel {
  PUBLIC,
  INTERNAL,
  CONFIDENTIAL,
  RESTRICTED;

  /** True if holding this level grants access to data classified at {@code required}. */
  public boolean covers(AccessLevel required) {
    return compareTo(required) >= 0;
  }
}
