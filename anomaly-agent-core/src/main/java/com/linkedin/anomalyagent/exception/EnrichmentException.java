/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.exception;

public class EnrichmentException extends AnomalyAgentException {

  public EnrichmentException(String message, Throwable cause) {
    super(message, cause);
  }

  public EnrichmentException(String message) {
    super(message);
  }
}
