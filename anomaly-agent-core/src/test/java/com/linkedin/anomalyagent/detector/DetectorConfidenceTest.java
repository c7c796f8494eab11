/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.metricdef.MetricBounds;
import com.linkedin.anomalyagent.metricdef.MetricCatalog;
import com.linkedin.anomalyagent.metricdef.MetricDefinition;
import com.linkedin.anomalyagent.model.Anomaly;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.Test;

import static com.linkedin.anomalyagent.AnomalyAgentUnitTestUtils.series;
import static com.linkedin.anomalyagent.detector.PatternDetectorConfig.PATTERN_WINDOW_SIZE_CONFIG;
import static com.linkedin.anomalyagent.metricdef.MetricCatalog.METRIC_CATALOG_OBJECT_CONFIG;
import static org.junit.Assert.assertTrue;

/**
 * Every detector reports confidences within [0.0, 1.0], whatever the shape of the series.
 */
public class DetectorConfidenceTest {
  private static final String METRIC = "node_load";
  private static final int NUM_SERIES = 200;

  private static List<Detector> detectors() {
    SpikeDetector spike = new SpikeDetector();
    spike.configure(Collections.emptyMap());
    StatisticalDetector statistical = new StatisticalDetector();
    statistical.configure(Collections.emptyMap());
    MetricCatalog catalog = new MetricCatalog(
        List.of(new MetricDefinition(METRIC, null, "", null, new MetricBounds(50.0, 80.0, -10.0, 100.0, 5.0, -5.0))),
        Collections.emptyMap());
    ThresholdDetector threshold = new ThresholdDetector();
    threshold.configure(Collections.singletonMap(METRIC_CATALOG_OBJECT_CONFIG, catalog));
    PatternDetector pattern = new PatternDetector();
    pattern.configure(Map.of(PATTERN_WINDOW_SIZE_CONFIG, "6"));
    return List.of(spike, statistical, threshold, pattern);
  }

  private static double[] randomValues(Random random) {
    double[] values = new double[12 + random.nextInt(60)];
    double level = random.nextInt(100);
    for (int i = 0; i < values.length; i++) {
      switch (random.nextInt(6)) {
        case 0:
          values[i] = level * (1 + 10 * random.nextDouble());
          break;
        case 1:
          values[i] = 0.0;
          break;
        case 2:
          values[i] = -level * random.nextDouble();
          break;
        default:
          values[i] = level + random.nextGaussian();
      }
    }
    return values;
  }

  @Test
  public void testConfidenceIsBounded() {
    Random random = new Random(42L);
    List<Detector> detectors = detectors();
    int numAnomalies = 0;
    for (int s = 0; s < NUM_SERIES; s++) {
      double[] values = randomValues(random);
      for (Detector detector : detectors) {
        for (Anomaly anomaly : detector.detect(series(METRIC, values))) {
          numAnomalies++;
          assertTrue(anomaly.toString(), anomaly.confidence() >= 0.0 && anomaly.confidence() <= 1.0);
        }
      }
    }
    assertTrue(numAnomalies > 0);
  }
}
