/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.model;

public enum AnomalyKind {
  SPIKE, DROP, STATISTICAL_OUTLIER, THRESHOLD_BREACH, PATTERN_ANOMALY;

  public String lowerCaseName() {
    return name().toLowerCase();
  }
}
