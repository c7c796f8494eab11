/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.metricdef;

import com.linkedin.anomalyagent.model.SeriesKind;
import java.util.Collections;
import java.util.List;

import static com.linkedin.anomalyagent.AnomalyAgentUtils.ensureValidString;

/**
 * A metric watched by the agent.
 */
public class MetricDefinition {
  private final String _name;
  private final SeriesKind _kind;
  private final String _unit;
  private final List<String> _detectors;
  private final MetricBounds _bounds;

  /**
   * @param name The query sent to the metrics store.
   * @param kind Kind of the metric.
   * @param unit Unit of the metric, may be empty.
   * @param detectors Names of the detectors to run on this metric, empty to run all enabled detectors.
   * @param bounds Static bounds of the metric, or {@code null}.
   */
  public MetricDefinition(String name, SeriesKind kind, String unit, List<String> detectors, MetricBounds bounds) {
    ensureValidString("Metric name", name);
    _name = name;
    _kind = kind == null ? SeriesKind.GAUGE : kind;
    _unit = unit == null ? "" : unit;
    _detectors = detectors == null ? Collections.emptyList() : List.copyOf(detectors);
    _bounds = bounds;
  }

  public String name() {
    return _name;
  }

  public SeriesKind kind() {
    return _kind;
  }

  public String unit() {
    return _unit;
  }

  public List<String> detectors() {
    return _detectors;
  }

  /**
   * @param detectorName Name of a detector.
   * @return {@code true} if the given detector should run on this metric.
   */
  public boolean runsDetector(String detectorName) {
    return _detectors.isEmpty() || _detectors.contains(detectorName);
  }

  public MetricBounds bounds() {
    return _bounds;
  }

  @Override
  public String toString() {
    return "MetricDefinition{name=" + _name + ", kind=" + _kind + ", unit=" + _unit + ", detectors=" + _detectors
           + ", bounds=" + _bounds + '}';
  }
}
