/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lakehouse.query.execution.error.ConfigurationException;
import org.lakehouse.query.execution.error.ErrorKind;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExecutionSettingsTest {

  @Test
  void should_accept_defaults() {
    ExecutionSettings settings = ExecutionSettings.defaults();

    assertDoesNotThrow(settings::validate);
    assertEquals(1024, settings.getPageSize());
    assertEquals(3, settings.getMaxRetries());
    assertEquals(100_000L, settings.getParallelRowThreshold());
  }

  @Test
  void should_list_every_invalid_value() {
    // Given
    ExecutionSettings settings =
        ExecutionSettings.builder().pageSize(0).maxRetries(-1).backoffMultiplier(0.5).build();

    // When
    ConfigurationException e = assertThrows(ConfigurationException.class, settings::validate);

    // Then
    assertEquals(ErrorKind.CONFIGURATION, e.getErrorKind());
    assertTrue(e.getMessage().contains("pageSize"));
    assertTrue(e.getMessage().contains("maxRetries"));
    assertTrue(e.getMessage().contains("backoffMultiplier"));
  }

  @Test
  void should_read_json_and_keep_defaults_for_absent_keys() {
    // Given: one known key and one unknown key
    String json = "{\"pageSize\": 50, \"checkpointIntervalRows\": 100, \"unknown\": true}";

    // When
    ExecutionSettings settings =
        ExecutionSettings.fromJson(
            new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

    // Then
    assertEquals(50, settings.getPageSize());
    assertEquals(100L, settings.getCheckpointIntervalRows());
    assertEquals(16, settings.getChannelCapacity());
  }

  @Test
  void should_reject_malformed_json() {
    assertThrows(
        ConfigurationException.class,
        () ->
            ExecutionSettings.fromJson(
                new ByteArrayInputStream("{pageSize".getBytes(StandardCharsets.UTF_8))));
  }

  @Test
  void should_reject_out_of_range_json_values() {
    assertThrows(
        ConfigurationException.class,
        () ->
            ExecutionSettings.fromJson(
                new ByteArrayInputStream(
                    "{\"maxParallelism\": 0}".getBytes(StandardCharsets.UTF_8))));
  }

  @Test
  void should_reject_admission_and_analysis_limits_out_of_range() {
    // Given
    ExecutionSettings settings =
        ExecutionSettings.builder()
            .maxConcurrentQueries(0)
            .maxMemoryBytes(-1)
            .minCacheHitRatio(1.5)
            .build();

    // When
    ConfigurationException e = assertThrows(ConfigurationException.class, settings::validate);

    // Then
    assertTrue(e.getMessage().contains("maxConcurrentQueries"));
    assertTrue(e.getMessage().contains("maxMemoryBytes"));
    assertTrue(e.getMessage().contains("minCacheHitRatio"));
    assertEquals(10, ExecutionSettings.defaults().getMaxConcurrentQueries());
  }
}
