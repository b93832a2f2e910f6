/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.lakehouse.query.execution.error.QueryCancelledException;

/**
 * Cooperative cancellation flag. Operators and drivers check it between steps; work that does not
 * check it runs to completion. A child token is cancelled when either it or its parent is.
 */
public class CancellationToken {

  private final CancellationToken parent;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final CountDownLatch cancelledLatch = new CountDownLatch(1);

  public CancellationToken() {
    this(null);
  }

  private CancellationToken(CancellationToken parent) {
    this.parent = parent;
  }

  /** Creates a token that can be cancelled on its own and follows this token's cancellation. */
  public CancellationToken child() {
    return new CancellationToken(this);
  }

  /** Requests cancellation. Returns true if this call changed the state. */
  public boolean cancel() {
    boolean changed = cancelled.compareAndSet(false, true);
    cancelledLatch.countDown();
    return changed;
  }

  /**
   * Waits up to the timeout for this token to be cancelled directly. Cancellation of a parent is
   * only observed through {@link #isCancelled()}.
   *
   * @return true if the token is cancelled
   */
  public boolean awaitCancellation(long timeout, TimeUnit unit) throws InterruptedException {
    cancelledLatch.await(timeout, unit);
    return isCancelled();
  }

  public boolean isCancelled() {
    return cancelled.get() || (parent != null && parent.isCancelled());
  }

  /**
   * Throws if cancellation was requested.
   *
   * @param operatorId operator checking the token, reported in the exception
   */
  public void throwIfCancelled(String operatorId) {
    if (isCancelled()) {
      throw new QueryCancelledException(operatorId);
    }
  }
}
