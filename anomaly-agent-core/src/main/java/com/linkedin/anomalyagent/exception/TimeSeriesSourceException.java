/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.exception;

/**
 * Thrown when the metrics store cannot serve a range query, e.g. it is unreachable or answers with an error.
 */
public class TimeSeriesSourceException extends AnomalyAgentException {

  public TimeSeriesSourceException(String message, Throwable cause) {
    super(message, cause);
  }

  public TimeSeriesSourceException(String message) {
    super(message);
  }
}
