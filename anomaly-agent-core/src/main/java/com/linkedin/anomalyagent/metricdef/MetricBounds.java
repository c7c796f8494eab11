/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.metricdef;

import java.util.Objects;

/**
 * The static bounds configured for a metric. Every bound is optional, a {@code null} bound is not checked.
 * Upper bounds ({@code critical}, {@code warning}, {@code max}, {@code max_rate}) are breached when the value reaches
 * them, lower bounds ({@code min}, {@code min_rate}) when the value falls below them.
 */
public class MetricBounds {
  private final Double _warning;
  private final Double _critical;
  private final Double _min;
  private final Double _max;
  private final Double _maxRate;
  private final Double _minRate;

  public MetricBounds(Double warning, Double critical, Double min, Double max, Double maxRate, Double minRate) {
    _warning = warning;
    _critical = critical;
    _min = min;
    _max = max;
    _maxRate = maxRate;
    _minRate = minRate;
  }

  public Double warning() {
    return _warning;
  }

  public Double critical() {
    return _critical;
  }

  public Double min() {
    return _min;
  }

  public Double max() {
    return _max;
  }

  public Double maxRate() {
    return _maxRate;
  }

  public Double minRate() {
    return _minRate;
  }

  /**
   * @return {@code true} if no bound is set.
   */
  public boolean isEmpty() {
    return _warning == null && _critical == null && _min == null && _max == null && _maxRate == null && _minRate == null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MetricBounds that = (MetricBounds) o;
    return Objects.equals(_warning, that._warning) && Objects.equals(_critical, that._critical)
           && Objects.equals(_min, that._min) && Objects.equals(_max, that._max)
           && Objects.equals(_maxRate, that._maxRate) && Objects.equals(_minRate, that._minRate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_warning, _critical, _min, _max, _maxRate, _minRate);
  }

  @Override
  public String toString() {
    return "MetricBounds{warning=" + _warning + ", critical=" + _critical + ", min=" + _min + ", max=" + _max
           + ", max_rate=" + _maxRate + ", min_rate=" + _minRate + '}';
  }
}
