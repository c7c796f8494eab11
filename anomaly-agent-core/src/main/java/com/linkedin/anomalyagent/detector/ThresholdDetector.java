/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.metricdef.MetricBounds;
import com.linkedin.anomalyagent.metricdef.MetricCatalog;
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

import static com.linkedin.anomalyagent.common.utils.Utils.validateNotNull;
import static com.linkedin.anomalyagent.detector.ThresholdDetectorConfig.THRESHOLD_DETECTOR_ENABLED_CONFIG;
import static com.linkedin.anomalyagent.metricdef.MetricCatalog.METRIC_CATALOG_OBJECT_CONFIG;


/**
 * Checks every sample of a series against the static bounds of its metric. The bounds are checked in the order of
 * {@link BoundType} and the first breached bound is reported, so a sample above both the critical and the warning
 * bound is a single critical breach. Metrics without bounds are not checked.
 */
public class ThresholdDetector extends AbstractDetector {
  private static final Logger LOG = LoggerFactory.getLogger(ThresholdDetector.class);
  public static final String NAME = "threshold_detector";
  public static final String THRESHOLD_TYPE = "threshold_type";
  public static final String THRESHOLD_VALUE = "threshold_value";
  public static final String THRESHOLD = "threshold";
  public static final String EXCESS = "excess";
  public static final String EXCESS_PERCENT = "excess_percent";
  private MetricCatalog _catalog;

  /**
   * The bounds, in the order they are checked.
   */
  public enum BoundType {
    CRITICAL("critical", Severity.CRITICAL, true),
    WARNING("warning", Severity.HIGH, true),
    MAX("max", Severity.HIGH, true),
    MIN("min", Severity.MEDIUM, false),
    MAX_RATE("max_rate", Severity.HIGH, true),
    MIN_RATE("min_rate", Severity.MEDIUM, false);

    private final String _key;
    private final Severity _severity;
    private final boolean _upper;

    BoundType(String key, Severity severity, boolean upper) {
      _key = key;
      _severity = severity;
      _upper = upper;
    }

    public String key() {
      return _key;
    }

    public Severity severity() {
      return _severity;
    }

    public boolean isUpper() {
      return _upper;
    }

    Double boundOf(MetricBounds bounds) {
      switch (this) {
        case CRITICAL:
          return bounds.critical();
        case WARNING:
          return bounds.warning();
        case MAX:
          return bounds.max();
        case MIN:
          return bounds.min();
        case MAX_RATE:
          return bounds.maxRate();
        case MIN_RATE:
          return bounds.minRate();
        default:
          throw new IllegalStateException("Unknown bound type " + this);
      }
    }

    boolean isBreachedBy(double value, double bound) {
      return _upper ? value >= bound : value < bound;
    }
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<Anomaly> detect(Series series) {
    if (series.isEmpty()) {
      return Collections.emptyList();
    }
    MetricBounds bounds = _catalog.boundsFor(series.name());
    if (bounds == null) {
      LOG.debug("No bounds configured for metric {}.", series.name());
      return Collections.emptyList();
    }
    List<Anomaly> anomalies = new ArrayList<>();
    for (Sample sample : series.samples()) {
      for (BoundType type : BoundType.values()) {
        Double bound = type.boundOf(bounds);
        if (bound != null && type.isBreachedBy(sample.value(), bound)) {
          anomalies.add(breach(series, sample, type, bound));
          break;
        }
      }
    }
    return anomalies;
  }

  private Anomaly breach(Series series, Sample sample, BoundType type, double bound) {
    double excess = type.isUpper() ? sample.value() - bound : bound - sample.value();
    double excessPercent = bound == 0.0 ? 0.0 : excess / bound * 100.0;
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(THRESHOLD_TYPE, type.key());
    metadata.put(THRESHOLD_VALUE, bound);
    metadata.put(THRESHOLD, bound);
    metadata.put(EXCESS, excess);
    metadata.put(EXCESS_PERCENT, excessPercent);
    String description = String.format("Value %s %s the %s threshold %s", sample.value(),
                                       type.isUpper() ? "reached" : "fell below", type.key(), bound);
    return newAnomaly(series, sample, AnomalyKind.THRESHOLD_BREACH, type.severity(), 1.0, bound, description, metadata);
  }

  @Override
  public void configure(Map<String, ?> configs) {
    ThresholdDetectorConfig config = new ThresholdDetectorConfig(configs);
    _enabled = config.getBoolean(THRESHOLD_DETECTOR_ENABLED_CONFIG);
    _catalog = (MetricCatalog) validateNotNull(configs.get(METRIC_CATALOG_OBJECT_CONFIG),
                                               () -> String.format("Missing %s when creating the threshold detector.",
                                                                   METRIC_CATALOG_OBJECT_CONFIG));
  }
}
