/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import com.linkedin.anomalyagent.config.AnomalyAgentConfig;
import com.linkedin.anomalyagent.exception.AnomalyAgentException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Runs the anomaly agent without the HTTP API.
 */
public class AnomalyAgentApp {
  protected static final Logger LOG = LoggerFactory.getLogger(AnomalyAgentApp.class);
  protected static final String METRIC_DOMAIN = "anomaly.agent";

  protected final AnomalyAgentConfig _config;
  protected final AnomalyAgent _anomalyAgent;
  protected final JmxReporter _jmxReporter;
  protected final MetricRegistry _metricRegistry;

  public AnomalyAgentApp(AnomalyAgentConfig config) throws AnomalyAgentException {
    _config = config;
    _metricRegistry = new MetricRegistry();
    _jmxReporter = JmxReporter.forRegistry(_metricRegistry).inDomain(METRIC_DOMAIN).build();
    _jmxReporter.start();
    _anomalyAgent = new AnomalyAgent(config, _metricRegistry, Clock.systemUTC());
  }

  public AnomalyAgent anomalyAgent() {
    return _anomalyAgent;
  }

  public void start() throws Exception {
    _anomalyAgent.startUp();
    printStartupInfo();
  }

  void registerShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::stop));
  }

  /**
   * Stops the anomaly agent.
   */
  public void stop() {
    _anomalyAgent.shutdown();
    _jmxReporter.close();
  }

  /**
   * @return The URL of the HTTP API, or {@code null} if it is not served.
   */
  public String serverUrl() {
    return null;
  }

  protected void printStartupInfo() {
    System.out.println(">> ********************************************* <<");
    System.out.println(">> Application directory            : " + System.getProperty("user.dir"));
    System.out.println(">> Agent name                       : " + _anomalyAgent.agentName());
    System.out.println(">> Watched metrics                  : " + _anomalyAgent.catalog().metricNames());
    System.out.println(">> Detectors                        : " + _anomalyAgent.detectorNames());
    System.out.println(">> HTTP API available on            : " + serverUrl());
    System.out.println(">> ********************************************* <<");
  }
}
