/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static com.linkedin.anomalyagent.common.utils.Utils.validateNotNull;

/**
 * A detected abnormal observation of a metric, independent of the detector that found it.
 * <p>
 * Anomalies are immutable. The only way to attach more information to an anomaly is {@link #withMetadata(Map)}, which
 * is used by the enrichment stage and keeps the {@link #id()} of the original anomaly.
 */
public class Anomaly {
  private final String _id;
  private final String _metricName;
  private final String _detectorName;
  private final AnomalyKind _kind;
  private final Severity _severity;
  private final double _confidence;
  private final double _value;
  private final Double _expectedValue;
  private final long _timestampMs;
  private final Long _startTimeMs;
  private final Long _endTimeMs;
  private final String _description;
  private final Map<String, Object> _metadata;
  private final Map<String, String> _labels;

  /**
   * @param metricName Name of the metric the anomalous sample belongs to.
   * @param detectorName Name of the detector that found the anomaly.
   * @param kind Kind of the anomaly.
   * @param severity Severity of the anomaly.
   * @param confidence Confidence of the detector, within [0.0, 1.0].
   * @param value The observed value.
   * @param expectedValue The value that would have been normal, or {@code null} if it cannot be computed.
   * @param timestampMs Timestamp of the anomalous sample.
   * @param description Human readable description.
   * @param metadata Detector specific evidence, may be {@code null}.
   * @param labels Labels of the anomalous sample, may be {@code null}.
   */
  public Anomaly(String metricName,
                 String detectorName,
                 AnomalyKind kind,
                 Severity severity,
                 double confidence,
                 double value,
                 Double expectedValue,
                 long timestampMs,
                 String description,
                 Map<String, ?> metadata,
                 Map<String, String> labels) {
    this(UUID.randomUUID().toString(), metricName, detectorName, kind, severity, confidence, value, expectedValue,
         timestampMs, null, null, description, metadata, labels);
  }

  private Anomaly(String id,
                  String metricName,
                  String detectorName,
                  AnomalyKind kind,
                  Severity severity,
                  double confidence,
                  double value,
                  Double expectedValue,
                  long timestampMs,
                  Long startTimeMs,
                  Long endTimeMs,
                  String description,
                  Map<String, ?> metadata,
                  Map<String, String> labels) {
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException(String.format("Confidence must be within [0.0, 1.0], got %f from detector %s.",
                                                       confidence, detectorName));
    }
    _id = id;
    _metricName = validateNotNull(metricName, "Metric name cannot be null.");
    _detectorName = validateNotNull(detectorName, "Detector name cannot be null.");
    _kind = validateNotNull(kind, "Anomaly kind cannot be null.");
    _severity = validateNotNull(severity, "Severity cannot be null.");
    _confidence = confidence;
    _value = value;
    _expectedValue = expectedValue;
    _timestampMs = timestampMs;
    _startTimeMs = startTimeMs;
    _endTimeMs = endTimeMs;
    _description = description == null ? "" : description;
    _metadata = metadata == null ? Collections.emptyMap()
                                 : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(metadata));
    _labels = labels == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(labels));
  }

  /**
   * @param startTimeMs Start of the anomalous period.
   * @param endTimeMs End of the anomalous period.
   * @return A copy of this anomaly, with the same id, covering the given period.
   */
  public Anomaly withPeriod(long startTimeMs, long endTimeMs) {
    return new Anomaly(_id, _metricName, _detectorName, _kind, _severity, _confidence, _value, _expectedValue,
                       _timestampMs, startTimeMs, endTimeMs, _description, _metadata, _labels);
  }

  /**
   * @param additionalMetadata Entries to add to the metadata; existing keys are overwritten.
   * @return A copy of this anomaly, with the same id and the merged metadata.
   */
  public Anomaly withMetadata(Map<String, ?> additionalMetadata) {
    Map<String, Object> merged = new LinkedHashMap<>(_metadata);
    merged.putAll(additionalMetadata);
    return new Anomaly(_id, _metricName, _detectorName, _kind, _severity, _confidence, _value, _expectedValue,
                       _timestampMs, _startTimeMs, _endTimeMs, _description, merged, _labels);
  }

  public String id() {
    return _id;
  }

  public String metricName() {
    return _metricName;
  }

  public String detectorName() {
    return _detectorName;
  }

  public AnomalyKind kind() {
    return _kind;
  }

  public Severity severity() {
    return _severity;
  }

  public double confidence() {
    return _confidence;
  }

  public double value() {
    return _value;
  }

  /**
   * @return The expected value, or {@code null} if the detector cannot tell what would have been normal.
   */
  public Double expectedValue() {
    return _expectedValue;
  }

  /**
   * @return The percent difference between the observed and the expected value, or {@code null} if there is no
   * expected value or it is zero.
   */
  public Double deviation() {
    if (_expectedValue == null || _expectedValue == 0.0) {
      return null;
    }
    return (_value - _expectedValue) / _expectedValue * 100.0;
  }

  public long timestampMs() {
    return _timestampMs;
  }

  public long startTimeMs() {
    return _startTimeMs == null ? _timestampMs : _startTimeMs;
  }

  public long endTimeMs() {
    return _endTimeMs == null ? _timestampMs : _endTimeMs;
  }

  public String description() {
    return _description;
  }

  public Map<String, Object> metadata() {
    return _metadata;
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
    return _id.equals(((Anomaly) o)._id);
  }

  @Override
  public int hashCode() {
    return _id.hashCode();
  }

  @Override
  public String toString() {
    return String.format("Anomaly{id=%s, metric=%s, detector=%s, kind=%s, severity=%s, confidence=%.2f, value=%s, "
                         + "expected=%s, timestamp=%d}", _id, _metricName, _detectorName, _kind, _severity, _confidence,
                         _value, _expectedValue, _timestampMs);
  }
}
