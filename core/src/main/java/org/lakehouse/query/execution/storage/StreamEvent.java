/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.storage;

import java.util.List;

/**
 * One event of a live stream.
 *
 * @param streamId the stream the event belongs to
 * @param timestampMillis event time in epoch milliseconds
 * @param values column values in the stream source's output order
 */
public record StreamEvent(String streamId, long timestampMillis, List<Object> values) {}
