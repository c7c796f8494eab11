/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.servlet;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.gson.Gson;
import com.linkedin.anomalyagent.AnomalyAgent;
import com.linkedin.anomalyagent.detector.Detector;
import com.linkedin.anomalyagent.metricdef.MetricDefinition;
import com.linkedin.anomalyagent.sink.AnomalyRecord;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalyagent.AnomalyAgentUtils.utcDateFor;


/**
 * The servlet of the anomaly agent HTTP API. Every response is a JSON document, unknown values are left out.
 * <ul>
 *   <li><code>GET /health</code>: the status of the agent and the time of its latest cycle.</li>
 *   <li><code>GET /anomalies</code>: the anomalies of the latest cycle.</li>
 *   <li><code>GET /detectors</code>: the configured detectors.</li>
 *   <li><code>GET /metrics</code>: the watched metrics.</li>
 *   <li><code>POST /analyze</code>: runs a detection cycle now and returns its anomalies.</li>
 * </ul>
 */
public class AnomalyAgentServlet extends HttpServlet {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyAgentServlet.class);
  private static final long serialVersionUID = 1L;
  private static final String METRIC_GROUP = "AnomalyAgentServlet";
  static final String GET_METHOD = "GET";
  static final String POST_METHOD = "POST";
  static final String HEALTHY = "healthy";
  private static final Gson GSON = new Gson();
  private final transient AnomalyAgent _agent;
  private final transient Map<AnomalyAgentEndPoint, Meter> _requestMeter = new EnumMap<>(AnomalyAgentEndPoint.class);
  private final transient Map<AnomalyAgentEndPoint, Timer> _successfulRequestExecutionTimer =
      new EnumMap<>(AnomalyAgentEndPoint.class);

  public AnomalyAgentServlet(AnomalyAgent agent, MetricRegistry dropwizardMetricRegistry) {
    _agent = agent;
    for (AnomalyAgentEndPoint endpoint : AnomalyAgentEndPoint.cachedValues()) {
      _requestMeter.put(endpoint, dropwizardMetricRegistry.meter(
          MetricRegistry.name(METRIC_GROUP, endpoint.name().toLowerCase() + "-request-rate")));
      _successfulRequestExecutionTimer.put(endpoint, dropwizardMetricRegistry.timer(
          MetricRegistry.name(METRIC_GROUP, endpoint.name().toLowerCase() + "-successful-request-execution-timer")));
    }
  }

  @Override
  protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
    doGetOrPost(request, response, GET_METHOD);
  }

  @Override
  protected void doPost(HttpServletRequest request, HttpServletResponse response) throws IOException {
    doGetOrPost(request, response, POST_METHOD);
  }

  private void doGetOrPost(HttpServletRequest request, HttpServletResponse response, String method)
      throws IOException {
    AnomalyAgentEndPoint endPoint = AnomalyAgentEndPoint.forPath(request.getPathInfo());
    if (endPoint == null) {
      writeError(response, HttpServletResponse.SC_NOT_FOUND,
                 String.format("Unrecognized endpoint in request '%s'. Supported GET endpoints: %s, "
                               + "supported POST endpoints: %s.", request.getPathInfo(),
                               AnomalyAgentEndPoint.getEndpoints(), AnomalyAgentEndPoint.postEndpoints()));
      return;
    }
    List<AnomalyAgentEndPoint> supported = GET_METHOD.equals(method) ? AnomalyAgentEndPoint.getEndpoints()
                                                                     : AnomalyAgentEndPoint.postEndpoints();
    if (!supported.contains(endPoint)) {
      writeError(response, HttpServletResponse.SC_METHOD_NOT_ALLOWED,
                 String.format("Endpoint %s does not support %s requests.", endPoint, method));
      return;
    }
    _requestMeter.get(endPoint).mark();
    Timer.Context requestTimer = _successfulRequestExecutionTimer.get(endPoint).time();
    try {
      writeResponse(response, HttpServletResponse.SC_OK, handle(endPoint));
      requestTimer.stop();
    } catch (RuntimeException e) {
      LOG.error("Failed to handle {} {}.", method, endPoint.path(), e);
      writeError(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, e.getMessage());
    }
  }

  private Map<String, Object> handle(AnomalyAgentEndPoint endPoint) {
    switch (endPoint) {
      case HEALTH:
        return health();
      case ANOMALIES:
        return anomalies(_agent.latestRecords());
      case DETECTORS:
        return detectors();
      case METRICS:
        return metrics();
      case ANALYZE:
        return anomalies(_agent.runDetection());
      default:
        throw new IllegalStateException("Unsupported endpoint " + endPoint);
    }
  }

  private Map<String, Object> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", HEALTHY);
    health.put("agent", _agent.agentName());
    health.put("state", _agent.orchestrator().state().toString());
    long lastCycleTimeMs = _agent.lastCycleTimeMs();
    health.put("last_cycle_time", lastCycleTimeMs < 0 ? null : utcDateFor(lastCycleTimeMs));
    return health;
  }

  private static Map<String, Object> anomalies(List<AnomalyRecord> records) {
    Map<String, Object> anomalies = new LinkedHashMap<>();
    anomalies.put("count", records.size());
    anomalies.put("anomalies", records);
    return anomalies;
  }

  private Map<String, Object> detectors() {
    List<Map<String, Object>> detectors = new ArrayList<>();
    for (Detector detector : _agent.orchestrator().detectors()) {
      Map<String, Object> detectorInfo = new LinkedHashMap<>();
      detectorInfo.put("name", detector.name());
      detectorInfo.put("enabled", detector.isEnabled());
      detectorInfo.put("class", detector.getClass().getSimpleName());
      detectors.add(detectorInfo);
    }
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("total_detectors", detectors.size());
    result.put("detectors", detectors);
    return result;
  }

  private Map<String, Object> metrics() {
    List<Map<String, Object>> metrics = new ArrayList<>();
    for (MetricDefinition metric : _agent.catalog().metrics()) {
      Map<String, Object> metricInfo = new LinkedHashMap<>();
      metricInfo.put("name", metric.name());
      metricInfo.put("type", metric.kind().lowerCaseName());
      metricInfo.put("unit", metric.unit());
      metricInfo.put("detectors", metric.detectors());
      metrics.add(metricInfo);
    }
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("total_metrics", metrics.size());
    result.put("metrics", metrics);
    return result;
  }

  private static void writeError(HttpServletResponse response, int responseCode, String message) throws IOException {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("error", message);
    writeResponse(response, responseCode, error);
  }

  private static void writeResponse(HttpServletResponse response, int responseCode, Object body) throws IOException {
    response.setStatus(responseCode);
    response.setContentType("application/json");
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    PrintWriter writer = response.getWriter();
    writer.write(GSON.toJson(body));
    writer.flush();
  }
}
