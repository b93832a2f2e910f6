/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lakehouse.query.execution.config.ExecutionSettings;
import org.lakehouse.query.execution.error.CheckpointException;
import org.lakehouse.query.execution.error.ErrorKind;
import org.lakehouse.query.execution.error.FatalOperatorException;
import org.lakehouse.query.execution.error.QueryCancelledException;
import org.lakehouse.query.execution.error.TransientOperatorException;
import org.lakehouse.query.execution.fault.snapshot.PipelineSnapshot;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FaultTolerantShellTest {

  private static final String QUERY = "q1";
  private static final String OPERATOR = "scan";

  @Mock private RecoveryHandler recoveryHandler;
  @Mock private CheckpointStore brokenStore;

  private final InMemoryCheckpointStore store = new InMemoryCheckpointStore(1);

  @Test
  void should_retry_transient_failure_from_latest_checkpoint() {
    // Given: the first attempt checkpoints at position 100 and then fails
    FaultTolerantShell shell = shell(settings().build(), store);
    List<Long> startPositions = new ArrayList<>();
    ResumableTask task =
        task(
            (restoreFrom, checkpointer) -> {
              startPositions.add(restoreFrom == null ? 0 : restoreFrom.getPosition());
              if (startPositions.size() == 1) {
                checkpointer.write(new PipelineSnapshot(100, 40, Map.of()));
                throw new TransientOperatorException(OPERATOR, "connection reset");
              }
            });

    // When
    shell.execute(task);

    // Then
    assertEquals(List.of(0L, 100L), startPositions);
    assertEquals(1, shell.getRetries());
    assertEquals(1, shell.getCheckpointsWritten());
    assertEquals(
        List.of(
            OperatorStatus.RUNNING,
            OperatorStatus.RETRYING,
            OperatorStatus.RUNNING,
            OperatorStatus.COMPLETED),
        shell.getStatusHistory(OPERATOR));
    assertTrue(store.latest(QUERY, OPERATOR).isEmpty());
  }

  @Test
  void should_fail_after_retries_are_exhausted() {
    // Given
    FaultTolerantShell shell = shell(settings().maxRetries(2).build(), store);
    AtomicInteger attempts = new AtomicInteger();

    // When
    FatalOperatorException e =
        assertThrows(
            FatalOperatorException.class,
            () ->
                shell.execute(
                    task(
                        (restoreFrom, checkpointer) -> {
                          attempts.incrementAndGet();
                          throw new TransientOperatorException(OPERATOR, "timeout");
                        })));

    // Then
    assertEquals(3, attempts.get());
    assertEquals(OPERATOR, e.getOperatorId());
    assertEquals("Retries exhausted after 3 attempts: timeout", e.getMessage());
    assertEquals(OperatorStatus.FAILED, shell.getStatus(OPERATOR).orElseThrow());
  }

  @Test
  void should_not_retry_fatal_failure() {
    FaultTolerantShell shell = shell(settings().build(), store);
    AtomicInteger attempts = new AtomicInteger();
    FatalOperatorException fatal = new FatalOperatorException(OPERATOR, "corrupt file");

    FatalOperatorException e =
        assertThrows(
            FatalOperatorException.class,
            () ->
                shell.execute(
                    task(
                        (restoreFrom, checkpointer) -> {
                          attempts.incrementAndGet();
                          throw fatal;
                        })));

    assertSame(fatal, e);
    assertEquals(1, attempts.get());
    assertEquals(0, shell.getRetries());
  }

  @Test
  void should_wrap_unexpected_exception_as_fatal() {
    FaultTolerantShell shell = shell(settings().build(), store);
    IllegalStateException bug = new IllegalStateException("bug");

    FatalOperatorException e =
        assertThrows(
            FatalOperatorException.class,
            () ->
                shell.execute(
                    task(
                        (restoreFrom, checkpointer) -> {
                          throw bug;
                        })));

    assertSame(bug, e.getCause());
    assertEquals(ErrorKind.FATAL, e.getErrorKind());
    FailureRecord record = shell.getFailureDetector().getRecord(OPERATOR).orElseThrow();
    assertEquals(ErrorKind.FATAL, record.getErrorKind());
    assertEquals(1, record.getConsecutiveFailures());
  }

  @Test
  void should_stop_retrying_once_failure_threshold_is_reached() {
    // Given: plenty of retries but only two failures tolerated in the window
    FaultTolerantShell shell =
        shell(settings().maxRetries(10).failureThreshold(2).build(), store);
    AtomicInteger attempts = new AtomicInteger();

    // When
    FatalOperatorException e =
        assertThrows(
            FatalOperatorException.class,
            () ->
                shell.execute(
                    task(
                        (restoreFrom, checkpointer) -> {
                          attempts.incrementAndGet();
                          throw new TransientOperatorException(OPERATOR, "flaky");
                        })));

    // Then
    assertEquals(2, attempts.get());
    assertTrue(e.getMessage().startsWith("Operator failed 2 times within"));
    assertTrue(shell.getFailureDetector().isPermanentlyFailed(OPERATOR));
  }

  @Test
  void should_invoke_recovery_handler_when_retries_are_exhausted() {
    // Given
    FaultTolerantShell shell = shell(settings().maxRetries(0).maxRecoveries(1).build(), store);
    shell.registerRecoveryHandler(recoveryHandler);
    AtomicInteger attempts = new AtomicInteger();

    // When
    shell.execute(
        task(
            (restoreFrom, checkpointer) -> {
              if (attempts.incrementAndGet() == 1) {
                throw new TransientOperatorException(OPERATOR, "node lost");
              }
            }));

    // Then
    verify(recoveryHandler).onRecovery(eq(QUERY), eq(OPERATOR), any());
    assertEquals(2, attempts.get());
    assertEquals(1, shell.getRecoveries());
    assertTrue(shell.getStatusHistory(OPERATOR).contains(OperatorStatus.RECOVERING));
    assertEquals(OperatorStatus.COMPLETED, shell.getStatus(OPERATOR).orElseThrow());
  }

  @Test
  void should_restart_from_beginning_when_checkpoint_is_unreadable() {
    // Given
    when(brokenStore.latest(QUERY, OPERATOR))
        .thenThrow(new CheckpointException(OPERATOR, "Malformed checkpoint"));
    FaultTolerantShell shell = shell(settings().build(), brokenStore);
    List<PipelineSnapshot> restored = new ArrayList<>();

    // When
    shell.execute(task((restoreFrom, checkpointer) -> restored.add(restoreFrom)));

    // Then
    assertEquals(1, restored.size());
    assertNull(restored.get(0));
  }

  @Test
  void should_fail_on_unreadable_checkpoint_in_strict_mode() {
    when(brokenStore.latest(QUERY, OPERATOR))
        .thenThrow(new CheckpointException(OPERATOR, "Malformed checkpoint"));
    FaultTolerantShell shell =
        shell(settings().strictCheckpointRecovery(true).build(), brokenStore);

    CheckpointException e =
        assertThrows(
            CheckpointException.class,
            () -> shell.execute(task((restoreFrom, checkpointer) -> {})));

    assertEquals(ErrorKind.CHECKPOINT, e.getErrorKind());
    assertEquals(OperatorStatus.FAILED, shell.getStatus(OPERATOR).orElseThrow());
  }

  @Test
  void should_clear_checkpoints_and_propagate_cancellation() {
    FaultTolerantShell shell = shell(settings().build(), brokenStore);

    assertThrows(
        QueryCancelledException.class,
        () ->
            shell.execute(
                task(
                    (restoreFrom, checkpointer) -> {
                      throw new QueryCancelledException(OPERATOR);
                    })));

    verify(brokenStore).clear(QUERY, OPERATOR);
    assertEquals(0, shell.getRetries());
  }

  private static ExecutionSettings.ExecutionSettingsBuilder settings() {
    return ExecutionSettings.defaults().toBuilder().initialBackoffMillis(10);
  }

  private static FaultTolerantShell shell(ExecutionSettings settings, CheckpointStore store) {
    return FaultTolerantShell.forQuery(QUERY, settings, store, Clock.systemUTC());
  }

  private static ResumableTask task(Body body) {
    return new ResumableTask() {
      @Override
      public String getTaskId() {
        return OPERATOR;
      }

      @Override
      public void run(PipelineSnapshot restoreFrom, Checkpointer checkpointer) {
        body.run(restoreFrom, checkpointer);
      }
    };
  }

  @FunctionalInterface
  private interface Body {
    void run(PipelineSnapshot restoreFrom, Checkpointer checkpointer);
  }
}
