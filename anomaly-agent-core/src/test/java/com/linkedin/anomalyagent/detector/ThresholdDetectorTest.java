/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.metricdef.MetricBounds;
import com.linkedin.anomalyagent.metricdef.MetricCatalog;
import com.linkedin.anomalyagent.metricdef.MetricDefinition;
import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.AnomalyKind;
import com.linkedin.anomalyagent.model.Severity;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static com.linkedin.anomalyagent.AnomalyAgentUnitTestUtils.series;
import static com.linkedin.anomalyagent.AnomalyAgentUnitTestUtils.timestampOf;
import static com.linkedin.anomalyagent.detector.ThresholdDetector.EXCESS;
import static com.linkedin.anomalyagent.detector.ThresholdDetector.THRESHOLD_TYPE;
import static com.linkedin.anomalyagent.detector.ThresholdDetector.THRESHOLD_VALUE;
import static com.linkedin.anomalyagent.metricdef.MetricCatalog.METRIC_CATALOG_OBJECT_CONFIG;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class ThresholdDetectorTest {
  private static final double EPSILON = 1e-9;

  private static ThresholdDetector thresholdDetector(MetricCatalog catalog) {
    ThresholdDetector detector = new ThresholdDetector();
    detector.configure(Collections.singletonMap(METRIC_CATALOG_OBJECT_CONFIG, catalog));
    return detector;
  }

  private static MetricBounds upperBounds(Double warning, Double critical) {
    return new MetricBounds(warning, critical, null, null, null, null);
  }

  @Test
  public void testMostSevereBoundWins() {
    MetricCatalog catalog = new MetricCatalog(
        List.of(new MetricDefinition("cpu_usage", null, "percent", null, upperBounds(70.0, 90.0))),
        Collections.emptyMap());
    List<Anomaly> anomalies = thresholdDetector(catalog).detect(series("cpu_usage", 50, 95, 75, 69.9));

    assertEquals(2, anomalies.size());
    Anomaly critical = anomalies.get(0);
    assertEquals(AnomalyKind.THRESHOLD_BREACH, critical.kind());
    assertEquals(Severity.CRITICAL, critical.severity());
    assertEquals(timestampOf(1), critical.timestampMs());
    assertEquals("critical", critical.metadata().get(THRESHOLD_TYPE));
    assertEquals(90.0, (Double) critical.metadata().get(THRESHOLD_VALUE), EPSILON);
    assertEquals(5.0, (Double) critical.metadata().get(EXCESS), EPSILON);
    assertEquals(90.0, critical.expectedValue(), EPSILON);
    assertEquals(1.0, critical.confidence(), EPSILON);

    Anomaly warning = anomalies.get(1);
    assertEquals(Severity.HIGH, warning.severity());
    assertEquals("warning", warning.metadata().get(THRESHOLD_TYPE));
    assertEquals(timestampOf(2), warning.timestampMs());
  }

  @Test
  public void testUpperBoundIsInclusive() {
    MetricCatalog catalog = new MetricCatalog(Collections.emptyList(), Map.of("cpu_usage", upperBounds(70.0, 90.0)));
    List<Anomaly> anomalies = thresholdDetector(catalog).detect(series("cpu_usage", 70.0, 90.0));
    assertEquals(2, anomalies.size());
    assertEquals(Severity.HIGH, anomalies.get(0).severity());
    assertEquals(Severity.CRITICAL, anomalies.get(1).severity());
    assertEquals(0.0, (Double) anomalies.get(1).metadata().get(EXCESS), EPSILON);
  }

  @Test
  public void testLowerBounds() {
    MetricBounds bounds = new MetricBounds(null, null, 10.0, null, null, 0.0);
    MetricCatalog catalog = new MetricCatalog(Collections.emptyList(), Map.of("free_memory", bounds));
    List<Anomaly> anomalies = thresholdDetector(catalog).detect(series("free_memory", 10.0, 9.0, -1.0));
    assertEquals(2, anomalies.size());
    assertEquals("min", anomalies.get(0).metadata().get(THRESHOLD_TYPE));
    assertEquals(Severity.MEDIUM, anomalies.get(0).severity());
    assertEquals(1.0, (Double) anomalies.get(0).metadata().get(EXCESS), EPSILON);
    // The min bound is checked before the min rate bound.
    assertEquals("min", anomalies.get(1).metadata().get(THRESHOLD_TYPE));
  }

  @Test
  public void testZeroBound() {
    MetricBounds bounds = new MetricBounds(null, 0.0, null, null, null, null);
    MetricCatalog catalog = new MetricCatalog(Collections.emptyList(), Map.of("errors", bounds));
    List<Anomaly> anomalies = thresholdDetector(catalog).detect(series("errors", 3.0));
    assertEquals(1, anomalies.size());
    assertEquals(0.0, (Double) anomalies.get(0).metadata().get(ThresholdDetector.EXCESS_PERCENT), EPSILON);
    assertEquals(null, anomalies.get(0).deviation());
  }

  @Test
  public void testExactKeyBeforeWildcard() {
    Map<String, MetricBounds> sharedBounds = new LinkedHashMap<>();
    sharedBounds.put("node_*_bytes", upperBounds(null, 1000.0));
    sharedBounds.put("node_disk_bytes", upperBounds(null, 10.0));
    MetricCatalog catalog = new MetricCatalog(Collections.emptyList(), sharedBounds);
    ThresholdDetector detector = thresholdDetector(catalog);

    assertEquals(1, detector.detect(series("node_disk_bytes", 100.0)).size());
    assertTrue(detector.detect(series("node_network_bytes", 100.0)).isEmpty());
    assertEquals(1, detector.detect(series("node_network_bytes", 1000.0)).size());
  }

  @Test
  public void testMetricWithoutBounds() {
    MetricCatalog catalog = new MetricCatalog(Collections.emptyList(), Map.of("cpu_usage", upperBounds(70.0, 90.0)));
    assertTrue(thresholdDetector(catalog).detect(series("memory_usage", 1e9)).isEmpty());
    assertTrue(thresholdDetector(catalog).detect(series("cpu_usage")).isEmpty());
  }

  @Test
  public void testCatalogIsRequired() {
    ThresholdDetector detector = new ThresholdDetector();
    assertThrows(IllegalArgumentException.class, () -> detector.configure(Collections.emptyMap()));
  }
}
