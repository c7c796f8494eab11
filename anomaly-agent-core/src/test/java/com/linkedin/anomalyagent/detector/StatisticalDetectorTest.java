/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.AnomalyKind;
import com.linkedin.anomalyagent.model.Severity;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.anomalyagent.AnomalyAgentUnitTestUtils.series;
import static com.linkedin.anomalyagent.AnomalyAgentUnitTestUtils.timestampOf;
import static com.linkedin.anomalyagent.detector.StatisticalDetector.DETECTION_METHOD;
import static com.linkedin.anomalyagent.detector.StatisticalDetector.IQR_METHOD;
import static com.linkedin.anomalyagent.detector.StatisticalDetector.Z_SCORE_METHOD;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class StatisticalDetectorTest {
  private static final double EPSILON = 1e-9;
  private StatisticalDetector _detector;

  @Before
  public void setUp() {
    _detector = new StatisticalDetector();
    _detector.configure(Collections.emptyMap());
  }

  @Test
  public void testSingleOutlier() {
    List<Anomaly> anomalies = _detector.detect(series("latency", 50, 51, 49, 50, 52, 51, 50, 49, 51, 500));
    assertEquals(1, anomalies.size());
    Anomaly anomaly = anomalies.get(0);
    assertEquals(AnomalyKind.STATISTICAL_OUTLIER, anomaly.kind());
    assertEquals(timestampOf(9), anomaly.timestampMs());
    assertEquals(500.0, anomaly.value(), EPSILON);
    // With 10 samples no z-score can exceed 3, the IQR test reports it.
    assertEquals(IQR_METHOD, anomaly.metadata().get(DETECTION_METHOD));
    assertEquals(50.0, (Double) anomaly.metadata().get("q1"), EPSILON);
    assertEquals(51.0, (Double) anomaly.metadata().get("q3"), EPSILON);
    // The median is the expected value.
    assertEquals(50.5, anomaly.expectedValue(), EPSILON);
    assertEquals(Severity.CRITICAL, anomaly.severity());
    assertEquals(1.0, anomaly.confidence(), EPSILON);
  }

  @Test
  public void testOutlierFlaggedByBothTestsIsReportedOnce() {
    double[] values = new double[30];
    for (int i = 0; i < 29; i++) {
      values[i] = i % 2 == 0 ? 10 : 11;
    }
    values[29] = 100;
    List<Anomaly> zScore = _detector.zScoreOutliers(series("latency", values), values);
    List<Anomaly> iqr = _detector.iqrOutliers(series("latency", values), values);
    assertEquals(1, zScore.size());
    assertEquals(1, iqr.size());

    List<Anomaly> anomalies = _detector.detect(series("latency", values));
    assertEquals(1, anomalies.size());
    assertEquals(timestampOf(29), anomalies.get(0).timestampMs());
    // Both tests are fully confident, the z-score finding comes first.
    assertEquals(Z_SCORE_METHOD, anomalies.get(0).metadata().get(DETECTION_METHOD));
    assertEquals(Severity.CRITICAL, anomalies.get(0).severity());
  }

  @Test
  public void testDeduplicationKeepsHighestConfidence() {
    Anomaly low = anomaly(1000L, 0.4);
    Anomaly high = anomaly(1000L, 0.9);
    Anomaly other = anomaly(2000L, 0.1);
    List<Anomaly> deduplicated = StatisticalDetector.deduplicate(Arrays.asList(low, other, high));
    assertEquals(2, deduplicated.size());
    assertSame(high, deduplicated.get(0));
    assertSame(other, deduplicated.get(1));

    Anomaly tie = anomaly(1000L, 0.4);
    assertSame(low, StatisticalDetector.deduplicate(Arrays.asList(low, tie)).get(0));
  }

  @Test
  public void testDegenerateSeries() {
    assertTrue(_detector.detect(series("constant", 5, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5)).isEmpty());
    assertTrue(_detector.detect(series("two-levels", 5, 5, 5, 5, 5, 6, 6, 6, 6, 6)).isEmpty());
  }

  @Test
  public void testInsufficientData() {
    assertTrue(_detector.detect(series("latency", 50, 51, 49, 50, 52, 51, 50, 49, 500)).isEmpty());
  }

  @Test
  public void testSeverityBands() {
    assertEquals(Severity.CRITICAL, StatisticalDetector.zScoreSeverity(5.0));
    assertEquals(Severity.HIGH, StatisticalDetector.zScoreSeverity(4.0));
    assertEquals(Severity.MEDIUM, StatisticalDetector.zScoreSeverity(3.5));
    assertEquals(Severity.LOW, StatisticalDetector.zScoreSeverity(3.1));
    assertEquals(Severity.CRITICAL, StatisticalDetector.iqrSeverity(3.0));
    assertEquals(Severity.HIGH, StatisticalDetector.iqrSeverity(2.0));
    assertEquals(Severity.MEDIUM, StatisticalDetector.iqrSeverity(1.0));
    assertEquals(Severity.LOW, StatisticalDetector.iqrSeverity(0.5));
  }

  private static Anomaly anomaly(long timestampMs, double confidence) {
    return new Anomaly("latency", StatisticalDetector.NAME, AnomalyKind.STATISTICAL_OUTLIER, Severity.LOW, confidence,
                       1.0, null, timestampMs, "", null, null);
  }
}
