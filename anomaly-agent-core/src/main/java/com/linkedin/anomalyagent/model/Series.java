/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.linkedin.anomalyagent.common.utils.Utils.validateNotNull;

/**
 * The samples of one metric over one collection window. Samples keep the order in which they were returned by the
 * metrics store, which is the chronological order. Timestamps are neither required to be unique nor evenly spaced.
 * <p>
 * A series is immutable. Detectors address samples by position and report anomalies by the sample timestamp.
 */
public class Series {
  private final String _name;
  private final SeriesKind _kind;
  private final String _unit;
  private final List<Sample> _samples;

  public Series(String name, SeriesKind kind, List<Sample> samples) {
    this(name, kind, "", samples);
  }

  public Series(String name, SeriesKind kind, String unit, List<Sample> samples) {
    _name = validateNotNull(name, "Series name cannot be null.");
    _kind = kind == null ? SeriesKind.GAUGE : kind;
    _unit = unit == null ? "" : unit;
    _samples = Collections.unmodifiableList(new ArrayList<>(validateNotNull(samples, "Samples cannot be null.")));
  }

  /**
   * @return The metric name, i.e. the query that produced this series.
   */
  public String name() {
    return _name;
  }

  public SeriesKind kind() {
    return _kind;
  }

  public String unit() {
    return _unit;
  }

  public List<Sample> samples() {
    return _samples;
  }

  public Sample sample(int index) {
    return _samples.get(index);
  }

  public int size() {
    return _samples.size();
  }

  public boolean isEmpty() {
    return _samples.isEmpty();
  }

  /**
   * @return A new array with the values of the samples, in sample order.
   */
  public double[] values() {
    double[] values = new double[_samples.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = _samples.get(i).value();
    }
    return values;
  }

  /**
   * @param unit Unit of the metric.
   * @return A series with the same samples and the given unit.
   */
  public Series withUnit(String unit) {
    return new Series(_name, _kind, unit, _samples);
  }

  @Override
  public String toString() {
    return "Series{_name=" + _name + ", _kind=" + _kind + ", _unit=" + _unit + ", _samples=" + _samples.size() + '}';
  }
}
