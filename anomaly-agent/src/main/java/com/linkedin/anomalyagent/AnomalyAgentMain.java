/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent;

import com.linkedin.anomalyagent.config.AnomalyAgentConfig;
import com.linkedin.anomalyagent.config.constants.WebServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalyagent.config.AnomalyAgentConfig.readConfig;

/**
 * The main class to run the anomaly agent.
 */
public final class AnomalyAgentMain {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyAgentMain.class);

  private AnomalyAgentMain() { }

  /**
   * The main function to run the anomaly agent.
   * @param args Arguments passed while starting the agent.
   */
  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      throw new IllegalArgumentException(
              String.format("USAGE: java %s anomaly-agent.properties [port] [ipaddress|hostname]",
                      AnomalyAgentMain.class.getSimpleName()));
    }

    Thread.setDefaultUncaughtExceptionHandler((t, e) -> LOG.error("Uncaught exception on thread {}", t, e));

    AnomalyAgentConfig config = readConfig(args[0]);
    AnomalyAgentApp app;
    if (config.getBoolean(WebServerConfig.WEBSERVER_ENABLED_CONFIG)) {
      app = new AnomalyAgentServletApp(config, parsePort(args, config), parseHostname(args, config));
    } else {
      app = new AnomalyAgentApp(config);
    }
    app.registerShutdownHook();
    app.start();
  }

  private static Integer parsePort(String[] args, AnomalyAgentConfig config) {
    if (args.length > 1) {
      return Integer.parseInt(args[1]);
    } else {
      return config.getInt(WebServerConfig.WEBSERVER_HTTP_PORT_CONFIG);
    }
  }

  private static String parseHostname(String[] args, AnomalyAgentConfig config) {
    if (args.length > 2) {
      return args[2];
    } else {
      return config.getString(WebServerConfig.WEBSERVER_HTTP_ADDRESS_CONFIG);
    }
  }
}
