/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.config.constants;

import com.linkedin.anomalyagent.common.config.ConfigDef;

import static com.linkedin.anomalyagent.common.config.ConfigDef.Range.between;


/**
 * A class to keep the Anomaly Agent Web Server configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class WebServerConfig {

  /**
   * <code>webserver.enabled</code>
   */
  public static final String WEBSERVER_ENABLED_CONFIG = "webserver.enabled";
  public static final boolean DEFAULT_WEBSERVER_ENABLED = true;
  public static final String WEBSERVER_ENABLED_DOC = "Whether the HTTP API is started next to the detection loop.";

  /**
   * <code>webserver.http.port</code>
   */
  public static final String WEBSERVER_HTTP_PORT_CONFIG = "webserver.http.port";
  public static final int DEFAULT_WEBSERVER_HTTP_PORT = 8080;
  public static final String WEBSERVER_HTTP_PORT_DOC = "Anomaly Agent Webserver bind port.";

  /**
   * <code>webserver.http.address</code>
   */
  public static final String WEBSERVER_HTTP_ADDRESS_CONFIG = "webserver.http.address";
  public static final String DEFAULT_WEBSERVER_HTTP_ADDRESS = "0.0.0.0";
  public static final String WEBSERVER_HTTP_ADDRESS_DOC = "Anomaly Agent Webserver bind ip address.";

  private WebServerConfig() {
  }

  /**
   * Define configs for Web Server.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Web Server.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(WEBSERVER_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_WEBSERVER_ENABLED,
                            ConfigDef.Importance.MEDIUM,
                            WEBSERVER_ENABLED_DOC)
                    .define(WEBSERVER_HTTP_PORT_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_WEBSERVER_HTTP_PORT,
                            between(0, 65535),
                            ConfigDef.Importance.HIGH,
                            WEBSERVER_HTTP_PORT_DOC)
                    .define(WEBSERVER_HTTP_ADDRESS_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_WEBSERVER_HTTP_ADDRESS,
                            ConfigDef.Importance.HIGH,
                            WEBSERVER_HTTP_ADDRESS_DOC);
  }
}
