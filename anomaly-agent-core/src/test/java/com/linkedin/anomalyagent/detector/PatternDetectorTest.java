/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.Severity;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.Test;

import static com.linkedin.anomalyagent.AnomalyAgentUnitTestUtils.series;
import static com.linkedin.anomalyagent.AnomalyAgentUnitTestUtils.timestampOf;
import static com.linkedin.anomalyagent.detector.PatternDetector.DETECTION_METHOD;
import static com.linkedin.anomalyagent.detector.PatternDetector.MOVING_AVERAGE_METHOD;
import static com.linkedin.anomalyagent.detector.PatternDetector.TREND_CHANGE_METHOD;
import static com.linkedin.anomalyagent.detector.PatternDetectorConfig.PATTERN_WINDOW_SIZE_CONFIG;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class PatternDetectorTest {
  private static final double EPSILON = 1e-9;

  private static PatternDetector patternDetector(int windowSize) {
    PatternDetector detector = new PatternDetector();
    detector.configure(Map.of(PATTERN_WINDOW_SIZE_CONFIG, Integer.toString(windowSize)));
    return detector;
  }

  private static List<Anomaly> byMethod(List<Anomaly> anomalies, String method) {
    return anomalies.stream().filter(a -> method.equals(a.metadata().get(DETECTION_METHOD))).collect(Collectors.toList());
  }

  @Test
  public void testMovingAverageDeviation() {
    List<Anomaly> anomalies = patternDetector(4).detect(series("latency", 10, 11, 10, 11, 10, 11, 10, 11, 30, 11));
    List<Anomaly> deviations = byMethod(anomalies, MOVING_AVERAGE_METHOD);
    assertEquals(1, deviations.size());
    Anomaly deviation = deviations.get(0);
    assertEquals(timestampOf(8), deviation.timestampMs());
    assertEquals(10.5, deviation.expectedValue(), EPSILON);
    assertEquals(39.0, (Double) deviation.metadata().get("deviation_sigma"), EPSILON);
    assertEquals(Severity.HIGH, deviation.severity());
    assertEquals(1.0, deviation.confidence(), EPSILON);
  }

  @Test
  public void testTrendReversal() {
    double[] values = new double[20];
    for (int i = 0; i < values.length; i++) {
      values[i] = i <= 10 ? i : 20 - i;
    }
    List<Anomaly> reversals = byMethod(patternDetector(4).detect(series("queue_depth", values)), TREND_CHANGE_METHOD);
    assertEquals(1, reversals.size());
    Anomaly reversal = reversals.get(0);
    assertEquals(timestampOf(11), reversal.timestampMs());
    assertEquals(PatternDetector.PEAK, reversal.metadata().get("trend_type"));
    assertEquals(Severity.MEDIUM, reversal.severity());
    assertEquals(null, reversal.expectedValue());
    assertEquals(1.0, reversal.confidence(), EPSILON);
  }

  @Test
  public void testMovingAverageSeverityBands() {
    assertEquals(Severity.HIGH, PatternDetector.deviationSeverity(4.0));
    assertEquals(Severity.MEDIUM, PatternDetector.deviationSeverity(3.99));
    assertEquals(Severity.MEDIUM, PatternDetector.deviationSeverity(3.0));
    assertEquals(Severity.LOW, PatternDetector.deviationSeverity(2.99));

    // Window [10, 12, 10, 12]: mean 11, standard deviation 1.
    List<Anomaly> medium = byMethod(patternDetector(4).detect(series("latency", 10, 12, 10, 12, 14.5, 12, 10, 12)),
                                    MOVING_AVERAGE_METHOD);
    assertEquals(timestampOf(4), medium.get(0).timestampMs());
    assertEquals(3.5, (Double) medium.get(0).metadata().get("deviation_sigma"), EPSILON);
    assertEquals(Severity.MEDIUM, medium.get(0).severity());
    assertEquals(0.7, medium.get(0).confidence(), EPSILON);
  }

  @Test
  public void testFlipsFromOrToFlatAreIgnored() {
    double[] flatThenRising = new double[20];
    double[] risingThenFlat = new double[20];
    for (int i = 0; i < 20; i++) {
      flatThenRising[i] = i < 10 ? 5 : i - 4;
      risingThenFlat[i] = Math.min(i, 9);
    }
    PatternDetector detector = patternDetector(4);
    assertTrue(byMethod(detector.detect(series("queue_depth", flatThenRising)), TREND_CHANGE_METHOD).isEmpty());
    assertTrue(byMethod(detector.detect(series("queue_depth", risingThenFlat)), TREND_CHANGE_METHOD).isEmpty());
  }

  @Test
  public void testInsufficientData() {
    double[] values = new double[47];
    for (int i = 0; i < values.length; i++) {
      values[i] = i % 5 == 0 ? 100 : 1;
    }
    assertTrue(patternDetector(24).detect(series("latency", values)).isEmpty());
  }

  @Test
  public void testConstantSeries() {
    double[] values = new double[60];
    Arrays.fill(values, 42.0);
    assertTrue(patternDetector(24).detect(series("constant", values)).isEmpty());
  }

  @Test
  public void testGradient() {
    assertArrayEquals(new double[]{1.0, 1.5, 2.5, 3.0}, PatternDetector.gradient(new double[]{0, 1, 3, 6}), EPSILON);
    assertArrayEquals(new double[]{1.5, 3.5}, PatternDetector.movingAverage(new double[]{1, 2, 5}, 2), EPSILON);
    assertEquals(0, PatternDetector.movingAverage(new double[]{1}, 2).length);
  }
}
