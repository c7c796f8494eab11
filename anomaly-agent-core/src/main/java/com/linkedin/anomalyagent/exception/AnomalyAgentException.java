/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.exception;

public class AnomalyAgentException extends Exception {

  public AnomalyAgentException(String message, Throwable cause) {
    super(message, cause);
  }

  public AnomalyAgentException(String message) {
    super(message);
  }

  public AnomalyAgentException(Throwable cause) {
    super(cause);
  }
}
