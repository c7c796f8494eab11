/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single observation of a metric.
 */
public class Sample {
  private final long _timestampMs;
  private final double _value;
  private final Map<String, String> _labels;

  public Sample(long timestampMs, double value) {
    this(timestampMs, value, Collections.emptyMap());
  }

  public Sample(long timestampMs, double value, Map<String, String> labels) {
    _timestampMs = timestampMs;
    _value = value;
    _labels = labels == null || labels.isEmpty() ? Collections.emptyMap()
                                                 : Collections.unmodifiableMap(new HashMap<>(labels));
  }

  public long timestampMs() {
    return _timestampMs;
  }

  public double value() {
    return _value;
  }

  public Map<String, String> labels() {
    return _labels;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Sample sample = (Sample) o;
    return _timestampMs == sample._timestampMs && Double.compare(sample._value, _value) == 0
           && _labels.equals(sample._labels);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_timestampMs, _value, _labels);
  }

  @Override
  public String toString() {
    return "Sample{_timestampMs=" + _timestampMs + ", _value=" + _value + ", _labels=" + _labels + '}';
  }
}
