/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.config.constants;

import com.linkedin.anomalyagent.common.config.ConfigDef;
import java.util.concurrent.TimeUnit;

import static com.linkedin.anomalyagent.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep the configs of the downstream orchestrator the anomaly records are posted to.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class OrchestratorSinkConfig {

  /**
   * <code>orchestrator.enabled</code>
   */
  public static final String ORCHESTRATOR_ENABLED_CONFIG = "orchestrator.enabled";
  public static final boolean DEFAULT_ORCHESTRATOR_ENABLED = true;
  public static final String ORCHESTRATOR_ENABLED_DOC = "Whether the anomaly records of every cycle are posted to the "
      + "orchestrator.";

  /**
   * <code>orchestrator.endpoint</code>
   */
  public static final String ORCHESTRATOR_ENDPOINT_CONFIG = "orchestrator.endpoint";
  public static final String DEFAULT_ORCHESTRATOR_ENDPOINT = "http://localhost:8000/api/anomalies";
  public static final String ORCHESTRATOR_ENDPOINT_DOC = "The URL the anomaly batches are posted to as JSON.";

  /**
   * <code>orchestrator.timeout.ms</code>
   */
  public static final String ORCHESTRATOR_TIMEOUT_MS_CONFIG = "orchestrator.timeout.ms";
  public static final int DEFAULT_ORCHESTRATOR_TIMEOUT_MS = (int) TimeUnit.SECONDS.toMillis(10);
  public static final String ORCHESTRATOR_TIMEOUT_MS_DOC = "The connect and socket timeout in milliseconds of a post "
      + "to the orchestrator.";

  private OrchestratorSinkConfig() {
  }

  /**
   * Define configs for the orchestrator sink.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the orchestrator sink.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(ORCHESTRATOR_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_ORCHESTRATOR_ENABLED,
                            ConfigDef.Importance.MEDIUM,
                            ORCHESTRATOR_ENABLED_DOC)
                    .define(ORCHESTRATOR_ENDPOINT_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_ORCHESTRATOR_ENDPOINT,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.HIGH,
                            ORCHESTRATOR_ENDPOINT_DOC)
                    .define(ORCHESTRATOR_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ORCHESTRATOR_TIMEOUT_MS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            ORCHESTRATOR_TIMEOUT_MS_DOC);
  }
}
