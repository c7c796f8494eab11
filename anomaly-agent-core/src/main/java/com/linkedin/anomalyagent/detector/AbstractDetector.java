/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.AnomalyKind;
import com.linkedin.anomalyagent.model.Sample;
import com.linkedin.anomalyagent.model.Series;
import com.linkedin.anomalyagent.model.Severity;
import java.util.Map;


/**
 * The base of the built-in detectors. It holds the enabled flag and creates the anomalies on behalf of the subclasses.
 */
public abstract class AbstractDetector implements Detector {
  protected boolean _enabled = true;

  @Override
  public boolean isEnabled() {
    return _enabled;
  }

  /**
   * Create an anomaly for the given sample of the given series.
   *
   * @param series The series the sample belongs to.
   * @param sample The anomalous sample.
   * @param kind Kind of the anomaly.
   * @param severity Severity of the anomaly.
   * @param confidence Confidence of the detection, within [0.0, 1.0].
   * @param expectedValue The normal value, or {@code null}.
   * @param description Human readable description.
   * @param metadata Detector specific evidence.
   * @return A new anomaly.
   */
  protected Anomaly newAnomaly(Series series,
                               Sample sample,
                               AnomalyKind kind,
                               Severity severity,
                               double confidence,
                               Double expectedValue,
                               String description,
                               Map<String, Object> metadata) {
    return new Anomaly(series.name(), name(), kind, severity, confidence, sample.value(), expectedValue,
                       sample.timestampMs(), description, metadata, sample.labels());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{name=" + name() + ", enabled=" + _enabled + '}';
  }
}
