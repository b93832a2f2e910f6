/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.security;

import java.util.ArrayList;
import java.util.List;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.storage.RowCursor;
import org.lakehouse.query.execution.storage.ScanRange;
import org.lakehouse.query.execution.storage.StorageEngine;

/** Storage engine view of one identity: columns it may not see come back masked. */
public class MaskingStorageEngine implements StorageEngine {

  private final StorageEngine delegate;
  private final QueryAuthorizer authorizer;
  private final SecurityIdentity identity;

  public MaskingStorageEngine(
      StorageEngine delegate, QueryAuthorizer authorizer, SecurityIdentity identity) {
    this.delegate = delegate;
    this.authorizer = authorizer;
    this.identity = identity;
  }

  @Override
  public long rowCount(PlanNode scanNode) {
    return delegate.rowCount(scanNode);
  }

  @Override
  public RowCursor scan(PlanNode scanNode, ScanRange range) {
    RowCursor cursor = delegate.scan(scanNode, range);
    List<Integer> masked = authorizer.maskedPositions(identity, scanNode);
    if (masked.isEmpty()) {
      return cursor;
    }
    return new RowCursor() {
      @Override
      public boolean hasNext() {
        return cursor.hasNext();
      }

      @Override
      public List<Object> next() {
        List<Object> row = new ArrayList<>(cursor.next());
        for (int position : masked) {
          row.set(position, QueryAuthorizer.mask(row.get(position)));
        }
        return row;
      }

      @Override
      public void close() {
        cursor.close();
      }
    };
  }
}
