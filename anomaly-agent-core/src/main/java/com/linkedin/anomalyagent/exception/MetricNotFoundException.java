/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.exception;

/**
 * Thrown when a range query succeeds but matches no series.
 */
public class MetricNotFoundException extends AnomalyAgentException {

  public MetricNotFoundException(String metricName) {
    super(String.format("No series found for metric %s.", metricName));
  }
}
