/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.storage;

import java.util.Iterator;
import java.util.List;

/** Forward-only iterator over rows produced by a storage engine scan. */
public interface RowCursor extends Iterator<List<Object>>, AutoCloseable {

  /** Releases storage resources held by the cursor. */
  @Override
  default void close() {}

  /** Wraps an iterator that holds no resources. */
  static RowCursor of(Iterator<List<Object>> iterator) {
    return new RowCursor() {
      @Override
      public boolean hasNext() {
        return iterator.hasNext();
      }

      @Override
      public List<Object> next() {
        return iterator.next();
      }
    };
  }
}
