/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.config.constants;

import com.linkedin.anomalyagent.common.config.ConfigDef;
import com.linkedin.anomalyagent.enricher.LlmAnomalyEnricher;
import com.linkedin.anomalyagent.source.prometheus.PrometheusTimeSeriesSource;
import java.util.concurrent.TimeUnit;

import static com.linkedin.anomalyagent.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep the configs of the agent service loop and its plugins.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class AgentConfig {

  /**
   * <code>agent.name</code>
   */
  public static final String AGENT_NAME_CONFIG = "agent.name";
  public static final String DEFAULT_AGENT_NAME = "metrics-agent";
  public static final String AGENT_NAME_DOC = "The name the agent reports itself with to the orchestrator and on the "
      + "health endpoint.";

  /**
   * <code>check.interval.ms</code>
   */
  public static final String CHECK_INTERVAL_MS_CONFIG = "check.interval.ms";
  public static final long DEFAULT_CHECK_INTERVAL_MS = TimeUnit.MINUTES.toMillis(1);
  public static final String CHECK_INTERVAL_MS_DOC = "The interval in milliseconds between the starts of two detection "
      + "cycles.";

  /**
   * <code>metrics.config.file</code>
   */
  public static final String METRICS_CONFIG_FILE_CONFIG = "metrics.config.file";
  public static final String DEFAULT_METRICS_CONFIG_FILE = "config/metrics.json";
  public static final String METRICS_CONFIG_FILE_DOC = "The JSON file declaring the watched metrics and their "
      + "thresholds.";

  /**
   * <code>time.series.source.class</code>
   */
  public static final String TIME_SERIES_SOURCE_CLASS_CONFIG = "time.series.source.class";
  public static final Class<?> DEFAULT_TIME_SERIES_SOURCE_CLASS = PrometheusTimeSeriesSource.class;
  public static final String TIME_SERIES_SOURCE_CLASS_DOC = "The class implementing "
      + "com.linkedin.anomalyagent.source.TimeSeriesSource used to fetch the series of the watched metrics.";

  /**
   * <code>anomaly.enricher.class</code>
   */
  public static final String ANOMALY_ENRICHER_CLASS_CONFIG = "anomaly.enricher.class";
  public static final Class<?> DEFAULT_ANOMALY_ENRICHER_CLASS = LlmAnomalyEnricher.class;
  public static final String ANOMALY_ENRICHER_CLASS_DOC = "The class implementing "
      + "com.linkedin.anomalyagent.enricher.AnomalyEnricher applied to the anomalies of every cycle.";

  private AgentConfig() {
  }

  /**
   * Define configs for the agent.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the agent.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(AGENT_NAME_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_AGENT_NAME,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.MEDIUM,
                            AGENT_NAME_DOC)
                    .define(CHECK_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_CHECK_INTERVAL_MS,
                            atLeast(1),
                            ConfigDef.Importance.HIGH,
                            CHECK_INTERVAL_MS_DOC)
                    .define(METRICS_CONFIG_FILE_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_METRICS_CONFIG_FILE,
                            ConfigDef.Importance.HIGH,
                            METRICS_CONFIG_FILE_DOC)
                    .define(TIME_SERIES_SOURCE_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_TIME_SERIES_SOURCE_CLASS,
                            ConfigDef.Importance.MEDIUM,
                            TIME_SERIES_SOURCE_CLASS_DOC)
                    .define(ANOMALY_ENRICHER_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_ANOMALY_ENRICHER_CLASS,
                            ConfigDef.Importance.LOW,
                            ANOMALY_ENRICHER_CLASS_DOC);
  }
}
