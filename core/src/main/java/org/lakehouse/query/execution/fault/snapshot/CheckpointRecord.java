/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault.snapshot;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One checkpoint of one operator of one query. Sequence numbers increase monotonically per
 * (query, operator); a newer record supersedes older ones.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class CheckpointRecord {

  private String queryId;

  private String operatorId;

  private long sequence;

  private long timestampMillis;

  private PipelineSnapshot snapshot;
}
