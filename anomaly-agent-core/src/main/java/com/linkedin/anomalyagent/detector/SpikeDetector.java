/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.AnomalyKind;
import com.linkedin.anomalyagent.model.Sample;
import com.linkedin.anomalyagent.model.Series;
import com.linkedin.anomalyagent.model.Severity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalyagent.detector.SpikeDetectorConfig.SPIKE_DETECTOR_ENABLED_CONFIG;
import static com.linkedin.anomalyagent.detector.SpikeDetectorConfig.SPIKE_MIN_CHANGE_PERCENT_CONFIG;
import static com.linkedin.anomalyagent.detector.SpikeDetectorConfig.SPIKE_SENSITIVITY_CONFIG;


/**
 * Reports every pair of consecutive samples whose percent change reaches <code>spike.min.change.percent</code>.
 * An increase is a {@link AnomalyKind#SPIKE}, a decrease a {@link AnomalyKind#DROP}. A change from zero to a non-zero
 * value counts as +100%, two zero samples in a row are ignored.
 */
public class SpikeDetector extends AbstractDetector {
  private static final Logger LOG = LoggerFactory.getLogger(SpikeDetector.class);
  public static final String NAME = "spike_detector";
  public static final String PERCENT_CHANGE = "percent_change";
  public static final String PREVIOUS_VALUE = "previous_value";
  public static final String CHANGE_MAGNITUDE = "change_magnitude";
  private double _minChangePercent;
  private double _sensitivity;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<Anomaly> detect(Series series) {
    if (series.size() < 2) {
      LOG.debug("Skip spike detection for {}, it has {} sample(s).", series.name(), series.size());
      return Collections.emptyList();
    }
    List<Anomaly> anomalies = new ArrayList<>();
    for (int i = 1; i < series.size(); i++) {
      Sample previous = series.sample(i - 1);
      Sample current = series.sample(i);
      Double percentChange = percentChange(previous.value(), current.value());
      if (percentChange == null || Math.abs(percentChange) < _minChangePercent) {
        continue;
      }
      double absChange = Math.abs(percentChange);
      AnomalyKind kind = percentChange > 0 ? AnomalyKind.SPIKE : AnomalyKind.DROP;
      double confidence = Math.min(absChange / 100.0, 1.0) * _sensitivity;

      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put(PERCENT_CHANGE, percentChange);
      metadata.put(PREVIOUS_VALUE, previous.value());
      metadata.put(CHANGE_MAGNITUDE, current.value() - previous.value());
      String description = String.format("%s of %.1f%% (%s -> %s)", kind == AnomalyKind.SPIKE ? "Spike" : "Drop",
                                         absChange, previous.value(), current.value());
      anomalies.add(newAnomaly(series, current, kind, severityFor(absChange), confidence, previous.value(),
                               description, metadata));
    }
    return anomalies;
  }

  /**
   * @param previous Previous value.
   * @param current Current value.
   * @return The percent change from the previous to the current value, or {@code null} if both are zero.
   */
  static Double percentChange(double previous, double current) {
    if (previous == 0.0) {
      return current == 0.0 ? null : 100.0;
    }
    return (current - previous) / previous * 100.0;
  }

  static Severity severityFor(double absPercentChange) {
    if (absPercentChange >= 200.0) {
      return Severity.CRITICAL;
    } else if (absPercentChange >= 100.0) {
      return Severity.HIGH;
    } else if (absPercentChange >= 75.0) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    SpikeDetectorConfig config = new SpikeDetectorConfig(configs);
    _enabled = config.getBoolean(SPIKE_DETECTOR_ENABLED_CONFIG);
    _minChangePercent = config.getDouble(SPIKE_MIN_CHANGE_PERCENT_CONFIG);
    _sensitivity = config.getDouble(SPIKE_SENSITIVITY_CONFIG);
  }
}
