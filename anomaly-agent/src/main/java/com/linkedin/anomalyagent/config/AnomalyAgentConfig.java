/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.config;

import com.linkedin.anomalyagent.common.config.AbstractConfig;
import com.linkedin.anomalyagent.common.config.ConfigDef;
import com.linkedin.anomalyagent.common.config.ConfigException;
import com.linkedin.anomalyagent.config.constants.AgentConfig;
import com.linkedin.anomalyagent.config.constants.LlmConfig;
import com.linkedin.anomalyagent.config.constants.OrchestratorSinkConfig;
import com.linkedin.anomalyagent.config.constants.PrometheusConfig;
import com.linkedin.anomalyagent.config.constants.WebServerConfig;
import com.linkedin.anomalyagent.orchestrator.DetectionOrchestratorConfig;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;


/**
 * The configuration class of the Anomaly Agent.
 *
 * To avoid having a huge monolithic class that mixes unrelated configs, config names, their defaults, and definitions
 * reside in the relevant classes under {@link com.linkedin.anomalyagent.config.constants} and in
 * {@link DetectionOrchestratorConfig} for the detection cycle and the built-in detectors.
 */
public class AnomalyAgentConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  static {
    CONFIG = WebServerConfig.define(OrchestratorSinkConfig.define(LlmConfig.define(PrometheusConfig.define(
        AgentConfig.define(DetectionOrchestratorConfig.define(new ConfigDef()))))));
  }

  public AnomalyAgentConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public AnomalyAgentConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckIntervals();
  }

  /**
   * @return The definition of every config of the agent.
   */
  public static ConfigDef definition() {
    return new ConfigDef(CONFIG);
  }

  /**
   * Read the agent configuration from a properties file.
   *
   * @param propertiesFile Path of the properties file.
   * @return The configuration.
   */
  public static AnomalyAgentConfig readConfig(String propertiesFile) throws IOException {
    Properties props = new Properties();
    try (InputStream propStream = new FileInputStream(propertiesFile)) {
      props.load(propStream);
    }
    return new AnomalyAgentConfig(props);
  }

  /**
   * Sanity check that the detection window holds at least one step, and that the fetch of a metric cannot outlast the
   * interval between two cycles.
   */
  private void sanityCheckIntervals() {
    long lookbackWindowMs = getLong(DetectionOrchestratorConfig.LOOKBACK_WINDOW_MS_CONFIG);
    long queryStepMs = getLong(DetectionOrchestratorConfig.QUERY_STEP_MS_CONFIG);
    if (lookbackWindowMs < queryStepMs) {
      throw new ConfigException(String.format("Attempt to configure %s (%d) smaller than %s (%d).",
                                              DetectionOrchestratorConfig.LOOKBACK_WINDOW_MS_CONFIG, lookbackWindowMs,
                                              DetectionOrchestratorConfig.QUERY_STEP_MS_CONFIG, queryStepMs));
    }
    long checkIntervalMs = getLong(AgentConfig.CHECK_INTERVAL_MS_CONFIG);
    long fetchTimeoutMs = getLong(DetectionOrchestratorConfig.SOURCE_FETCH_TIMEOUT_MS_CONFIG);
    if (fetchTimeoutMs > checkIntervalMs) {
      throw new ConfigException(String.format("Attempt to configure %s (%d) larger than %s (%d).",
                                              DetectionOrchestratorConfig.SOURCE_FETCH_TIMEOUT_MS_CONFIG,
                                              fetchTimeoutMs, AgentConfig.CHECK_INTERVAL_MS_CONFIG, checkIntervalMs));
    }
  }
}
