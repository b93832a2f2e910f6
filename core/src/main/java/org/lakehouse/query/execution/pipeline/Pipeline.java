/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.pipeline;

import java.util.Collections;
import java.util.List;

/**
 * An ordered chain of operator factories. The first element is a {@link SourceOperatorFactory}
 * (reads from storage or replays materialized rows), followed by zero or more intermediate {@link
 * OperatorFactory} instances (filter, project, join probe, aggregate, etc.).
 */
public class Pipeline {

  private final String pipelineId;
  private final SourceOperatorFactory sourceFactory;
  private final List<OperatorFactory> operatorFactories;
  private final int outputChannels;

  /**
   * Creates a pipeline.
   *
   * @param pipelineId unique identifier, also the id checkpoints and failures are recorded under
   * @param sourceFactory the source operator factory (first in chain)
   * @param operatorFactories ordered list of intermediate operator factories
   * @param outputChannels number of columns the last operator produces
   */
  public Pipeline(
      String pipelineId,
      SourceOperatorFactory sourceFactory,
      List<OperatorFactory> operatorFactories,
      int outputChannels) {
    this.pipelineId = pipelineId;
    this.sourceFactory = sourceFactory;
    this.operatorFactories = Collections.unmodifiableList(operatorFactories);
    this.outputChannels = outputChannels;
  }

  public String getPipelineId() {
    return pipelineId;
  }

  public SourceOperatorFactory getSourceFactory() {
    return sourceFactory;
  }

  public List<OperatorFactory> getOperatorFactories() {
    return operatorFactories;
  }

  public int getOutputChannels() {
    return outputChannels;
  }

  /** Returns the total number of operators (source + intermediates). */
  public int getOperatorCount() {
    return 1 + operatorFactories.size();
  }
}
