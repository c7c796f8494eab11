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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalyagent.detector.PatternDetectorConfig.PATTERN_DETECTOR_ENABLED_CONFIG;
import static com.linkedin.anomalyagent.detector.PatternDetectorConfig.PATTERN_DEVIATION_THRESHOLD_CONFIG;
import static com.linkedin.anomalyagent.detector.PatternDetectorConfig.PATTERN_TREND_NEIGHBORHOOD_SIZE_CONFIG;
import static com.linkedin.anomalyagent.detector.PatternDetectorConfig.PATTERN_WINDOW_SIZE_CONFIG;


/**
 * Finds changes in the shape of a series:
 * <ul>
 *   <li>Trend reversals: sign flips of the smoothed gradient where the mean gradient before the flip and after it have
 *   opposite signs (a peak or a trough).</li>
 *   <li>Moving average deviations: samples far from the mean of the preceding window, in standard deviations of that
 *   window.</li>
 * </ul>
 * Both findings are independent and may be reported for the same sample.
 */
public class PatternDetector extends AbstractDetector {
  private static final Logger LOG = LoggerFactory.getLogger(PatternDetector.class);
  public static final String NAME = "pattern_detector";
  public static final String DETECTION_METHOD = "detection_method";
  public static final String TREND_CHANGE_METHOD = "trend_change";
  public static final String MOVING_AVERAGE_METHOD = "moving_average";
  public static final String PEAK = "peak";
  public static final String TROUGH = "trough";
  private int _windowSize;
  private double _deviationThreshold;
  private int _neighborhoodSize;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<Anomaly> detect(Series series) {
    if (series.size() < 2 * _windowSize) {
      LOG.debug("Skip pattern detection for {}, it has {} sample(s) while {} are needed.",
                series.name(), series.size(), 2 * _windowSize);
      return Collections.emptyList();
    }
    double[] values = series.values();
    List<Anomaly> anomalies = new ArrayList<>(trendReversals(series, values));
    anomalies.addAll(movingAverageDeviations(series, values));
    return anomalies;
  }

  List<Anomaly> trendReversals(Series series, double[] values) {
    double[] gradient = gradient(values);
    int smoothingWidth = _windowSize / 2;
    double[] smoothed = movingAverage(gradient, smoothingWidth);
    // A flip between smoothed values i and i + 1 is reported on sample i + offset.
    int offset = smoothingWidth / 2 + 1;
    double gradientStd = Math.sqrt(StatUtils.populationVariance(gradient));

    List<Anomaly> anomalies = new ArrayList<>();
    for (int i = 0; i + 1 < smoothed.length; i++) {
      if (Math.signum(smoothed[i + 1]) == Math.signum(smoothed[i])) {
        continue;
      }
      int index = i + offset;
      if (index >= values.length) {
        continue;
      }
      double before = StatUtils.mean(gradient, Math.max(0, index - _neighborhoodSize),
                                     index - Math.max(0, index - _neighborhoodSize));
      double after = StatUtils.mean(gradient, index, Math.min(gradient.length, index + _neighborhoodSize) - index);
      String trendType;
      if (before > 0 && after < 0) {
        trendType = PEAK;
      } else if (before < 0 && after > 0) {
        trendType = TROUGH;
      } else {
        continue;
      }
      double confidence = gradientStd == 0.0 ? 0.0 : Math.min(Math.abs(after - before) / gradientStd, 1.0);
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("trend_before", before);
      metadata.put("trend_after", after);
      metadata.put("trend_type", trendType);
      metadata.put(DETECTION_METHOD, TREND_CHANGE_METHOD);
      String description = String.format("Trend reversal (%s): slope went from %.4f to %.4f", trendType, before, after);
      anomalies.add(newAnomaly(series, series.sample(index), AnomalyKind.PATTERN_ANOMALY, Severity.MEDIUM, confidence,
                               null, description, metadata));
    }
    return anomalies;
  }

  List<Anomaly> movingAverageDeviations(Series series, double[] values) {
    List<Anomaly> anomalies = new ArrayList<>();
    for (int i = _windowSize; i < values.length; i++) {
      double movingAverage = StatUtils.mean(values, i - _windowSize, _windowSize);
      double movingStd = Math.sqrt(StatUtils.populationVariance(values, movingAverage, i - _windowSize, _windowSize));
      if (movingStd == 0.0) {
        continue;
      }
      double deviation = Math.abs(values[i] - movingAverage) / movingStd;
      if (deviation <= _deviationThreshold) {
        continue;
      }
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("deviation_sigma", deviation);
      metadata.put("moving_average", movingAverage);
      metadata.put("moving_std", movingStd);
      metadata.put(DETECTION_METHOD, MOVING_AVERAGE_METHOD);
      String description = String.format("Value %s deviates %.2f standard deviations from the moving average %.2f",
                                         values[i], deviation, movingAverage);
      anomalies.add(newAnomaly(series, series.sample(i), AnomalyKind.PATTERN_ANOMALY, deviationSeverity(deviation),
                               Math.min(deviation / 5.0, 1.0), movingAverage, description, metadata));
    }
    return anomalies;
  }

  /**
   * Central differences in the interior, one-sided differences at both ends.
   *
   * @param values At least two values.
   * @return The gradient, of the same length as the values.
   */
  static double[] gradient(double[] values) {
    int n = values.length;
    double[] gradient = new double[n];
    gradient[0] = values[1] - values[0];
    gradient[n - 1] = values[n - 1] - values[n - 2];
    for (int i = 1; i < n - 1; i++) {
      gradient[i] = (values[i + 1] - values[i - 1]) / 2.0;
    }
    return gradient;
  }

  /**
   * @param values Values to smooth.
   * @param width Width of the window.
   * @return The means of every full window of the values, i.e. <code>values.length - width + 1</code> means.
   */
  static double[] movingAverage(double[] values, int width) {
    if (width > values.length) {
      return new double[0];
    }
    double[] averages = new double[values.length - width + 1];
    for (int i = 0; i < averages.length; i++) {
      averages[i] = StatUtils.mean(values, i, width);
    }
    return averages;
  }

  static Severity deviationSeverity(double deviation) {
    if (deviation >= 4.0) {
      return Severity.HIGH;
    } else if (deviation >= 3.0) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    PatternDetectorConfig config = new PatternDetectorConfig(configs);
    _enabled = config.getBoolean(PATTERN_DETECTOR_ENABLED_CONFIG);
    _windowSize = config.getInt(PATTERN_WINDOW_SIZE_CONFIG);
    _deviationThreshold = config.getDouble(PATTERN_DEVIATION_THRESHOLD_CONFIG);
    _neighborhoodSize = config.getInt(PATTERN_TREND_NEIGHBORHOOD_SIZE_CONFIG);
  }
}
