/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault.snapshot;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.lakehouse.query.execution.error.CheckpointException;

/**
 * Serializable state of one stateful operator. Each operator type has its own schema, tagged by
 * {@code type} and carrying a schema {@code version} that is checked on restore.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = AggregationState.class, name = "aggregation"),
  @JsonSubTypes.Type(value = LimitState.class, name = "limit"),
  @JsonSubTypes.Type(value = SortState.class, name = "sort"),
  @JsonSubTypes.Type(value = JoinState.class, name = "join"),
  @JsonSubTypes.Type(value = WindowAggregationState.class, name = "window-aggregation")
})
public interface OperatorState {

  /** Schema version the state was written with. */
  int getVersion();

  /**
   * Casts a restored state to the type an operator expects and checks its schema version.
   *
   * @throws CheckpointException on a type or version mismatch
   */
  static <T extends OperatorState> T require(
      OperatorState state, Class<T> type, int supportedVersion, String operatorId) {
    if (!type.isInstance(state)) {
      throw new CheckpointException(
          operatorId,
          "Expected "
              + type.getSimpleName()
              + " but checkpoint holds "
              + (state == null ? "nothing" : state.getClass().getSimpleName()));
    }
    if (state.getVersion() != supportedVersion) {
      throw new CheckpointException(
          operatorId,
          "Unsupported "
              + type.getSimpleName()
              + " schema version "
              + state.getVersion()
              + ", expected "
              + supportedVersion);
    }
    return type.cast(state);
  }
}
