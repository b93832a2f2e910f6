/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.error.CheckpointException;
import org.lakehouse.query.execution.fault.snapshot.CheckpointRecord;
import org.lakehouse.query.execution.fault.snapshot.SnapshotCodec;

/**
 * Stores the latest checkpoint of each operator as a JSON file under {@code
 * <root>/<queryId>/<operatorId>.checkpoint}. Writes go to a temporary file that is atomically
 * moved into place, so a reader sees either the previous or the new checkpoint.
 */
@Log4j2
public class FileCheckpointStore implements CheckpointStore {

  private static final String SUFFIX = ".checkpoint";

  private final Path root;

  public FileCheckpointStore(Path root) {
    this.root = root;
  }

  @Override
  public void write(CheckpointRecord record) {
    byte[] encoded = SnapshotCodec.encode(record);
    Path target = fileOf(record.getQueryId(), record.getOperatorId());
    Path temp = null;
    try {
      Files.createDirectories(target.getParent());
      temp = Files.createTempFile(target.getParent(), "checkpoint", ".tmp");
      Files.write(temp, encoded);
      Files.move(
          temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      deleteQuietly(temp, e);
      throw new CheckpointException(
          record.getOperatorId(), "Failed to write checkpoint to " + target, e);
    }
  }

  private static void deleteQuietly(Path temp, IOException cause) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      cause.addSuppressed(e);
    }
  }

  @Override
  public Optional<CheckpointRecord> latest(String queryId, String operatorId) {
    Path file = fileOf(queryId, operatorId);
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(file);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new CheckpointException(operatorId, "Failed to read checkpoint " + file, e);
    }
    return Optional.of(SnapshotCodec.decode(operatorId, bytes));
  }

  /** Only the latest checkpoint is kept on disk. */
  @Override
  public List<CheckpointRecord> history(String queryId, String operatorId) {
    return latest(queryId, operatorId).map(List::of).orElse(List.of());
  }

  @Override
  public void clear(String queryId, String operatorId) {
    try {
      Files.deleteIfExists(fileOf(queryId, operatorId));
    } catch (IOException e) {
      log.warn("Failed to delete checkpoint of {} for query {}", operatorId, queryId, e);
    }
  }

  @Override
  public void clearQuery(String queryId) {
    Path directory = root.resolve(sanitize(queryId));
    if (!Files.exists(directory)) {
      return;
    }
    try {
      MoreFiles.deleteRecursively(directory, RecursiveDeleteOption.ALLOW_INSECURE);
    } catch (IOException e) {
      log.warn("Failed to delete checkpoints of query {}", queryId, e);
    }
  }

  private Path fileOf(String queryId, String operatorId) {
    return root.resolve(sanitize(queryId)).resolve(sanitize(operatorId) + SUFFIX);
  }

  /**
   * Maps an id to a safe file name. Letters, digits and '-' are kept; every other character,
   * '_' included, becomes '_' followed by its four-digit hex code, so distinct ids such as {@code
   * scan#p2} and {@code scan_p2} never share a file.
   */
  static String sanitize(String id) {
    StringBuilder name = new StringBuilder(id.length());
    for (int i = 0; i < id.length(); i++) {
      char c = id.charAt(i);
      if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-') {
        name.append(c);
      } else {
        name.append('_').append(String.format("%04x", (int) c));
      }
    }
    return name.toString();
  }
}
