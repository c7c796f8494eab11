/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.model;

/**
 * The kind of a metric as declared in the metric definitions. Informational only, detectors do not branch on it.
 */
public enum SeriesKind {
  COUNTER, GAUGE, HISTOGRAM, SUMMARY;

  /**
   * @param name Case-insensitive kind name, null defaults to {@link #GAUGE}.
   * @return The matching kind.
   */
  public static SeriesKind forName(String name) {
    if (name == null) {
      return GAUGE;
    }
    for (SeriesKind kind : values()) {
      if (kind.name().equalsIgnoreCase(name)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown series kind " + name);
  }

  public String lowerCaseName() {
    return name().toLowerCase();
  }
}
