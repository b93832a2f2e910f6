/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lakehouse.query.execution.error.ConfigurationException;

/**
 * Resource and behaviour settings of the execution core. Instances are immutable; use {@link
 * #toBuilder()} to derive a variant. Settings are checked by {@link #validate()} when a plan is
 * submitted.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutionSettings {

  private static final Logger LOG = LogManager.getLogger();

  // Strategy selection
  @Builder.Default private final int maxParallelism = Runtime.getRuntime().availableProcessors();
  @Builder.Default private final long parallelRowThreshold = 100_000L;
  @Builder.Default private final boolean adaptiveEnabled = true;

  // Worker pools
  @Builder.Default private final int maxIoThreads = 16;
  @Builder.Default private final int maxWorkerThreads = 64;
  @Builder.Default private final long poolShutdownTimeoutMillis = 5_000L;
  @Builder.Default private final int pageSize = 1024;
  @Builder.Default private final int channelCapacity = 16;

  // Checkpointing
  @Builder.Default private final long checkpointIntervalRows = 1_000L;
  @Builder.Default private final long checkpointIntervalMillis = 30_000L;
  @Builder.Default private final int checkpointRetention = 1;
  @Builder.Default private final boolean strictCheckpointRecovery = false;

  // Retry and failure detection
  @Builder.Default private final int maxRetries = 3;
  @Builder.Default private final long initialBackoffMillis = 100L;
  @Builder.Default private final double backoffMultiplier = 2.0;
  @Builder.Default private final int failureThreshold = 5;
  @Builder.Default private final long failureWindowMillis = 300_000L;
  @Builder.Default private final int maxRecoveries = 1;

  // Streaming
  @Builder.Default private final long latencyBudgetMillis = 1_000L;
  @Builder.Default private final int streamBufferCapacity = 10_000;
  @Builder.Default private final int offloadThreshold = 5_000;

  // Result cache
  @Builder.Default private final boolean cacheEnabled = true;
  @Builder.Default private final long cacheTtlSeconds = 1_800L;
  @Builder.Default private final long complexCacheTtlSeconds = 3_600L;
  @Builder.Default private final int maxCachedRows = 100_000;

  // Progress reporting cadence
  @Builder.Default private final long progressIntervalRows = 1_000L;
  @Builder.Default private final long progressIntervalMillis = 1_000L;

  // Admission. A memory limit of 0 disables the memory check.
  @Builder.Default private final int maxConcurrentQueries = 10;
  @Builder.Default private final long maxMemoryBytes = 0L;

  // Performance recommendations
  @Builder.Default private final long minRowsPerSecond = 1_000L;
  @Builder.Default private final double minCacheHitRatio = 0.8;

  /** Returns settings with every value at its default. */
  public static ExecutionSettings defaults() {
    return ExecutionSettings.builder().build();
  }

  /**
   * Reads settings from a JSON document. Keys that are absent keep their defaults, unknown keys are
   * ignored.
   *
   * @param inputStream JSON source
   * @return validated settings
   * @throws ConfigurationException if the document is malformed or a value is out of range
   */
  public static ExecutionSettings fromJson(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    ExecutionSettings settings;
    try {
      settings = objectMapper.readValue(inputStream, ExecutionSettings.class);
    } catch (IOException e) {
      LOG.error("Execution settings document is malformed");
      throw new ConfigurationException("Malformed execution settings: " + e.getMessage(), e);
    }
    settings.validate();
    return settings;
  }

  /**
   * Checks every value is usable.
   *
   * @throws ConfigurationException listing all invalid values
   */
  public void validate() {
    List<String> errors = new ArrayList<>();
    requirePositive(errors, "maxParallelism", maxParallelism);
    requirePositive(errors, "parallelRowThreshold", parallelRowThreshold);
    requirePositive(errors, "maxIoThreads", maxIoThreads);
    requirePositive(errors, "maxWorkerThreads", maxWorkerThreads);
    requirePositive(errors, "poolShutdownTimeoutMillis", poolShutdownTimeoutMillis);
    requirePositive(errors, "pageSize", pageSize);
    requirePositive(errors, "channelCapacity", channelCapacity);
    requirePositive(errors, "checkpointIntervalRows", checkpointIntervalRows);
    requirePositive(errors, "checkpointIntervalMillis", checkpointIntervalMillis);
    requirePositive(errors, "checkpointRetention", checkpointRetention);
    if (maxRetries < 0) {
      errors.add("maxRetries must be non-negative: " + maxRetries);
    }
    requirePositive(errors, "initialBackoffMillis", initialBackoffMillis);
    if (backoffMultiplier < 1.0) {
      errors.add("backoffMultiplier must be at least 1.0: " + backoffMultiplier);
    }
    requirePositive(errors, "failureThreshold", failureThreshold);
    requirePositive(errors, "failureWindowMillis", failureWindowMillis);
    if (maxRecoveries < 0) {
      errors.add("maxRecoveries must be non-negative: " + maxRecoveries);
    }
    requirePositive(errors, "latencyBudgetMillis", latencyBudgetMillis);
    requirePositive(errors, "streamBufferCapacity", streamBufferCapacity);
    requirePositive(errors, "offloadThreshold", offloadThreshold);
    requirePositive(errors, "cacheTtlSeconds", cacheTtlSeconds);
    requirePositive(errors, "complexCacheTtlSeconds", complexCacheTtlSeconds);
    if (maxCachedRows < 0) {
      errors.add("maxCachedRows must be non-negative: " + maxCachedRows);
    }
    requirePositive(errors, "progressIntervalRows", progressIntervalRows);
    requirePositive(errors, "progressIntervalMillis", progressIntervalMillis);
    requirePositive(errors, "maxConcurrentQueries", maxConcurrentQueries);
    if (maxMemoryBytes < 0) {
      errors.add("maxMemoryBytes must be non-negative: " + maxMemoryBytes);
    }
    requirePositive(errors, "minRowsPerSecond", minRowsPerSecond);
    if (minCacheHitRatio < 0.0 || minCacheHitRatio > 1.0) {
      errors.add("minCacheHitRatio must be between 0 and 1: " + minCacheHitRatio);
    }
    if (!errors.isEmpty()) {
      throw new ConfigurationException(
          "Invalid execution settings: " + String.join(", ", errors));
    }
  }

  private static void requirePositive(List<String> errors, String name, long value) {
    if (value <= 0) {
      errors.add(name + " must be positive: " + value);
    }
  }
}
