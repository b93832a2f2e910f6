/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.error;

/** Invalid resource configuration or plan shape, raised at submission. */
public class ConfigurationException extends QueryExecutionException {

  public ConfigurationException(String message) {
    super(ErrorKind.CONFIGURATION, null, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ErrorKind.CONFIGURATION, null, message, cause);
  }
}
