/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.config.constants;

import com.linkedin.anomalyagent.common.config.ConfigDef;
import java.util.concurrent.TimeUnit;

import static com.linkedin.anomalyagent.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep the configs of the Prometheus time series source.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class PrometheusConfig {

  /**
   * <code>prometheus.server.endpoint</code>
   */
  public static final String PROMETHEUS_SERVER_ENDPOINT_CONFIG = "prometheus.server.endpoint";
  public static final String DEFAULT_PROMETHEUS_SERVER_ENDPOINT = "http://localhost:9090";
  public static final String PROMETHEUS_SERVER_ENDPOINT_DOC = "The HTTP endpoint of the Prometheus server, as "
      + "schema://host:port.";

  /**
   * <code>prometheus.query.timeout.ms</code>
   */
  public static final String PROMETHEUS_QUERY_TIMEOUT_MS_CONFIG = "prometheus.query.timeout.ms";
  public static final int DEFAULT_PROMETHEUS_QUERY_TIMEOUT_MS = (int) TimeUnit.SECONDS.toMillis(30);
  public static final String PROMETHEUS_QUERY_TIMEOUT_MS_DOC = "The connect and socket timeout in milliseconds of a "
      + "query_range call.";

  private PrometheusConfig() {
  }

  /**
   * Define configs for the Prometheus source.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the Prometheus source.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(PROMETHEUS_SERVER_ENDPOINT_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_PROMETHEUS_SERVER_ENDPOINT,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.HIGH,
                            PROMETHEUS_SERVER_ENDPOINT_DOC)
                    .define(PROMETHEUS_QUERY_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_PROMETHEUS_QUERY_TIMEOUT_MS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            PROMETHEUS_QUERY_TIMEOUT_MS_DOC);
  }
}
