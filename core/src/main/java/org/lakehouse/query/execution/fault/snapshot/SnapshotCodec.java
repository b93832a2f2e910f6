/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.lakehouse.query.execution.error.CheckpointException;

/**
 * JSON encoding of checkpoint records. Integral numbers decode as {@code Long} so restored keys and
 * accumulator states compare equal to live ones.
 */
public final class SnapshotCodec {

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.USE_LONG_FOR_INTS, true)
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private SnapshotCodec() {}

  /**
   * Serializes a checkpoint record.
   *
   * @throws CheckpointException if the state cannot be serialized
   */
  public static byte[] encode(CheckpointRecord record) {
    try {
      return MAPPER.writeValueAsBytes(record);
    } catch (JsonProcessingException e) {
      throw new CheckpointException(
          record.getOperatorId(), "Failed to encode checkpoint: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Deserializes a checkpoint record and checks the snapshot schema version.
   *
   * @throws CheckpointException if the bytes are malformed or written by an unsupported version
   */
  public static CheckpointRecord decode(String operatorId, byte[] bytes) {
    CheckpointRecord record;
    try {
      record = MAPPER.readValue(bytes, CheckpointRecord.class);
    } catch (IOException e) {
      throw new CheckpointException(operatorId, "Malformed checkpoint: " + e.getMessage(), e);
    }
    if (record.getSnapshot() == null) {
      throw new CheckpointException(operatorId, "Checkpoint has no snapshot");
    }
    if (record.getSnapshot().getVersion() != PipelineSnapshot.VERSION) {
      throw new CheckpointException(
          operatorId,
          "Unsupported snapshot version "
              + record.getSnapshot().getVersion()
              + ", expected "
              + PipelineSnapshot.VERSION);
    }
    return record;
  }
}
