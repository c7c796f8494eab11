/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.model;

/**
 * Severity of an anomaly, ordered from the least to the most important.
 */
public enum Severity {
  LOW, MEDIUM, HIGH, CRITICAL;

  public boolean isAtLeast(Severity other) {
    return compareTo(other) >= 0;
  }

  public String lowerCaseName() {
    return name().toLowerCase();
  }
}
