/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent;

import com.linkedin.anomalyagent.config.AnomalyAgentConfig;
import com.linkedin.anomalyagent.exception.AnomalyAgentException;
import com.linkedin.anomalyagent.servlet.AnomalyAgentServlet;
import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;


/**
 * Runs the anomaly agent and serves its HTTP API with Jetty.
 */
public class AnomalyAgentServletApp extends AnomalyAgentApp {
  static final String API_URL_PREFIX = "/*";
  private final Server _server;

  public AnomalyAgentServletApp(AnomalyAgentConfig config, Integer port, String hostname)
      throws AnomalyAgentException {
    super(config);
    _server = new Server();
    _server.setConnectors(new Connector[]{setupHttpConnector(hostname, port)});
    ServletContextHandler contextHandler = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
    contextHandler.setContextPath("/");
    _server.setHandler(contextHandler);

    AnomalyAgentServlet servlet = new AnomalyAgentServlet(_anomalyAgent, _metricRegistry);
    contextHandler.addServlet(new ServletHolder(servlet), API_URL_PREFIX);
  }

  protected ServerConnector setupHttpConnector(String hostname, int port) {
    ServerConnector serverConnector = new ServerConnector(_server);
    serverConnector.setHost(hostname);
    serverConnector.setPort(port);
    return serverConnector;
  }

  @Override
  public void start() throws Exception {
    _server.start();
    super.start();
  }

  @Override
  public void stop() {
    try {
      _server.stop();
    } catch (Exception e) {
      LOG.warn("Failed to stop the HTTP server.", e);
    }
    super.stop();
  }

  @Override
  public String serverUrl() {
    return _server.getURI() == null ? null : _server.getURI().toString();
  }
}
