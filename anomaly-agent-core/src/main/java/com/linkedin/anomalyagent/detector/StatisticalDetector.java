/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.AnomalyKind;
import com.linkedin.anomalyagent.model.Series;
import com.linkedin.anomalyagent.model.Severity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalyagent.detector.StatisticalDetectorConfig.STATISTICAL_DETECTOR_ENABLED_CONFIG;
import static com.linkedin.anomalyagent.detector.StatisticalDetectorConfig.STATISTICAL_IQR_MULTIPLIER_CONFIG;
import static com.linkedin.anomalyagent.detector.StatisticalDetectorConfig.STATISTICAL_MIN_SAMPLES_CONFIG;
import static com.linkedin.anomalyagent.detector.StatisticalDetectorConfig.STATISTICAL_ZSCORE_THRESHOLD_CONFIG;


/**
 * Finds the outliers of a series with two independent tests over all its samples:
 * <ul>
 *   <li>Z-score: distance to the mean in population standard deviations.</li>
 *   <li>IQR: distance outside of <code>[Q1 - k * IQR, Q3 + k * IQR]</code>, quartiles being computed with linear
 *   interpolation between the closest ranks.</li>
 * </ul>
 * A sample flagged by both tests is reported once, with the finding of the highest confidence.
 */
public class StatisticalDetector extends AbstractDetector {
  private static final Logger LOG = LoggerFactory.getLogger(StatisticalDetector.class);
  public static final String NAME = "statistical_detector";
  public static final String DETECTION_METHOD = "detection_method";
  public static final String Z_SCORE_METHOD = "z_score";
  public static final String IQR_METHOD = "iqr";
  private int _minSamples;
  private double _zScoreThreshold;
  private double _iqrMultiplier;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<Anomaly> detect(Series series) {
    if (series.size() < _minSamples) {
      LOG.debug("Skip statistical detection for {}, it has {} sample(s) while {} are needed.",
                series.name(), series.size(), _minSamples);
      return Collections.emptyList();
    }
    double[] values = series.values();
    List<Anomaly> candidates = new ArrayList<>(zScoreOutliers(series, values));
    candidates.addAll(iqrOutliers(series, values));
    return deduplicate(candidates);
  }

  List<Anomaly> zScoreOutliers(Series series, double[] values) {
    double mean = StatUtils.mean(values);
    double std = Math.sqrt(StatUtils.populationVariance(values, mean));
    if (std == 0.0) {
      return Collections.emptyList();
    }
    List<Anomaly> anomalies = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      double zScore = Math.abs(values[i] - mean) / std;
      if (zScore <= _zScoreThreshold) {
        continue;
      }
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("z_score", zScore);
      metadata.put("mean", mean);
      metadata.put("std", std);
      metadata.put(DETECTION_METHOD, Z_SCORE_METHOD);
      String description = String.format("Value %s is %.2f standard deviations away from the mean %.2f",
                                         values[i], zScore, mean);
      anomalies.add(newAnomaly(series, series.sample(i), AnomalyKind.STATISTICAL_OUTLIER, zScoreSeverity(zScore),
                               Math.min(zScore / 5.0, 1.0), mean, description, metadata));
    }
    return anomalies;
  }

  List<Anomaly> iqrOutliers(Series series, double[] values) {
    Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
    percentile.setData(values);
    double q1 = percentile.evaluate(25.0);
    double q3 = percentile.evaluate(75.0);
    double iqr = q3 - q1;
    if (iqr == 0.0) {
      return Collections.emptyList();
    }
    double median = percentile.evaluate(50.0);
    double lowerBound = q1 - _iqrMultiplier * iqr;
    double upperBound = q3 + _iqrMultiplier * iqr;

    List<Anomaly> anomalies = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      double value = values[i];
      if (value >= lowerBound && value <= upperBound) {
        continue;
      }
      double distance = value < lowerBound ? lowerBound - value : value - upperBound;
      double normalizedDistance = distance / iqr;
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("q1", q1);
      metadata.put("q3", q3);
      metadata.put("iqr", iqr);
      metadata.put("lower_bound", lowerBound);
      metadata.put("upper_bound", upperBound);
      metadata.put(DETECTION_METHOD, IQR_METHOD);
      String description = String.format("Value %s is outside of the interquartile bounds [%.2f, %.2f]",
                                         value, lowerBound, upperBound);
      anomalies.add(newAnomaly(series, series.sample(i), AnomalyKind.STATISTICAL_OUTLIER,
                               iqrSeverity(normalizedDistance), Math.min(normalizedDistance / 2.0, 1.0), median,
                               description, metadata));
    }
    return anomalies;
  }

  /**
   * Keep a single anomaly per sample timestamp, the one with the highest confidence. On a tie the first one, i.e. the
   * Z-score finding, is kept. The result follows the order in which the timestamps first appear.
   *
   * @param candidates Findings of both tests.
   * @return Deduplicated findings.
   */
  static List<Anomaly> deduplicate(List<Anomaly> candidates) {
    Map<Long, Anomaly> bestByTimestamp = new LinkedHashMap<>();
    for (Anomaly candidate : candidates) {
      Anomaly best = bestByTimestamp.get(candidate.timestampMs());
      if (best == null || candidate.confidence() > best.confidence()) {
        bestByTimestamp.put(candidate.timestampMs(), candidate);
      }
    }
    return new ArrayList<>(bestByTimestamp.values());
  }

  static Severity zScoreSeverity(double zScore) {
    if (zScore >= 5.0) {
      return Severity.CRITICAL;
    } else if (zScore >= 4.0) {
      return Severity.HIGH;
    } else if (zScore >= 3.5) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  static Severity iqrSeverity(double normalizedDistance) {
    if (normalizedDistance >= 3.0) {
      return Severity.CRITICAL;
    } else if (normalizedDistance >= 2.0) {
      return Severity.HIGH;
    } else if (normalizedDistance >= 1.0) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    StatisticalDetectorConfig config = new StatisticalDetectorConfig(configs);
    _enabled = config.getBoolean(STATISTICAL_DETECTOR_ENABLED_CONFIG);
    _minSamples = config.getInt(STATISTICAL_MIN_SAMPLES_CONFIG);
    _zScoreThreshold = config.getDouble(STATISTICAL_ZSCORE_THRESHOLD_CONFIG);
    _iqrMultiplier = config.getDouble(STATISTICAL_IQR_MULTIPLIER_CONFIG);
  }
}
