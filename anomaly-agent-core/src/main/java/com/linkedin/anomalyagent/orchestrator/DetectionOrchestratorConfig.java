/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.orchestrator;

import com.linkedin.anomalyagent.common.config.ConfigDef;
import com.linkedin.anomalyagent.detector.PatternDetector;
import com.linkedin.anomalyagent.detector.PatternDetectorConfig;
import com.linkedin.anomalyagent.detector.SpikeDetector;
import com.linkedin.anomalyagent.detector.SpikeDetectorConfig;
import com.linkedin.anomalyagent.detector.StatisticalDetector;
import com.linkedin.anomalyagent.detector.StatisticalDetectorConfig;
import com.linkedin.anomalyagent.detector.ThresholdDetector;
import com.linkedin.anomalyagent.detector.ThresholdDetectorConfig;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

import static com.linkedin.anomalyagent.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep the configs of a detection cycle and of the built-in detectors.
 */
public final class DetectionOrchestratorConfig {

  /**
   * <code>lookback.window.ms</code>
   */
  public static final String LOOKBACK_WINDOW_MS_CONFIG = "lookback.window.ms";
  public static final long DEFAULT_LOOKBACK_WINDOW_MS = TimeUnit.HOURS.toMillis(1);
  public static final String LOOKBACK_WINDOW_MS_DOC = "The length of the time range, ending at the start of a cycle, "
      + "that is fetched for every metric.";

  /**
   * <code>query.step.ms</code>
   */
  public static final String QUERY_STEP_MS_CONFIG = "query.step.ms";
  public static final long DEFAULT_QUERY_STEP_MS = TimeUnit.MINUTES.toMillis(1);
  public static final String QUERY_STEP_MS_DOC = "The resolution of the series fetched from the metrics store.";

  /**
   * <code>source.fetch.timeout.ms</code>
   */
  public static final String SOURCE_FETCH_TIMEOUT_MS_CONFIG = "source.fetch.timeout.ms";
  public static final long DEFAULT_SOURCE_FETCH_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(30);
  public static final String SOURCE_FETCH_TIMEOUT_MS_DOC = "The maximum time to wait for the series of one metric. "
      + "A metric whose series is not received in time is skipped for the cycle.";

  /**
   * <code>enrichment.timeout.ms</code>
   */
  public static final String ENRICHMENT_TIMEOUT_MS_CONFIG = "enrichment.timeout.ms";
  public static final long DEFAULT_ENRICHMENT_TIMEOUT_MS = TimeUnit.MINUTES.toMillis(2);
  public static final String ENRICHMENT_TIMEOUT_MS_DOC = "The maximum time to wait for the enrichment of the anomalies "
      + "of a cycle. The anomalies are kept unenriched if the enricher does not answer in time.";

  /**
   * <code>detector.classes</code>
   */
  public static final String DETECTOR_CLASSES_CONFIG = "detector.classes";
  public static final String DEFAULT_DETECTOR_CLASSES = new StringJoiner(",").add(SpikeDetector.class.getName())
                                                                             .add(StatisticalDetector.class.getName())
                                                                             .add(ThresholdDetector.class.getName())
                                                                             .add(PatternDetector.class.getName())
                                                                             .toString();
  public static final String DETECTOR_CLASSES_DOC = "The detectors run on every metric, in this order. Each class must "
      + "implement com.linkedin.anomalyagent.detector.Detector and have a public no-argument constructor.";

  private DetectionOrchestratorConfig() {
  }

  /**
   * Define configs for the detection cycle and the built-in detectors.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the detection cycle and the built-in detectors.
   */
  public static ConfigDef define(ConfigDef configDef) {
    configDef.define(LOOKBACK_WINDOW_MS_CONFIG,
                     ConfigDef.Type.LONG,
                     DEFAULT_LOOKBACK_WINDOW_MS,
                     atLeast(1),
                     ConfigDef.Importance.HIGH,
                     LOOKBACK_WINDOW_MS_DOC)
             .define(QUERY_STEP_MS_CONFIG,
                     ConfigDef.Type.LONG,
                     DEFAULT_QUERY_STEP_MS,
                     atLeast(1),
                     ConfigDef.Importance.MEDIUM,
                     QUERY_STEP_MS_DOC)
             .define(SOURCE_FETCH_TIMEOUT_MS_CONFIG,
                     ConfigDef.Type.LONG,
                     DEFAULT_SOURCE_FETCH_TIMEOUT_MS,
                     atLeast(1),
                     ConfigDef.Importance.MEDIUM,
                     SOURCE_FETCH_TIMEOUT_MS_DOC)
             .define(ENRICHMENT_TIMEOUT_MS_CONFIG,
                     ConfigDef.Type.LONG,
                     DEFAULT_ENRICHMENT_TIMEOUT_MS,
                     atLeast(1),
                     ConfigDef.Importance.LOW,
                     ENRICHMENT_TIMEOUT_MS_DOC)
             .define(DETECTOR_CLASSES_CONFIG,
                     ConfigDef.Type.LIST,
                     DEFAULT_DETECTOR_CLASSES,
                     ConfigDef.Importance.HIGH,
                     DETECTOR_CLASSES_DOC);
    SpikeDetectorConfig.define(configDef);
    StatisticalDetectorConfig.define(configDef);
    ThresholdDetectorConfig.define(configDef);
    return PatternDetectorConfig.define(configDef);
  }
}
