/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.source;

import com.linkedin.anomalyagent.common.AnomalyAgentConfigurable;
import com.linkedin.anomalyagent.exception.MetricNotFoundException;
import com.linkedin.anomalyagent.exception.TimeSeriesSourceException;
import com.linkedin.anomalyagent.model.Series;


/**
 * The metrics store the series are pulled from.
 */
public interface TimeSeriesSource extends AnomalyAgentConfigurable, AutoCloseable {

  /**
   * Get the samples of a metric over a time range. The call blocks until the store answers.
   *
   * @param query The metric name or query understood by the store.
   * @param startMs Start of the range, inclusive, in epoch milliseconds.
   * @param endMs End of the range, inclusive, in epoch milliseconds.
   * @param stepMs Resolution of the samples in milliseconds.
   * @return The series of the metric, possibly empty.
   * @throws MetricNotFoundException If the store has no series for the query.
   * @throws TimeSeriesSourceException If the store cannot be queried.
   */
  Series fetchRange(String query, long startMs, long endMs, long stepMs)
      throws MetricNotFoundException, TimeSeriesSourceException;

  @Override
  default void close() throws Exception {
  }
}
