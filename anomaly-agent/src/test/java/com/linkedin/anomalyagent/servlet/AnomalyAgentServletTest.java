/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.servlet;

import com.codahale.metrics.MetricRegistry;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.linkedin.anomalyagent.AnomalyAgent;
import com.linkedin.anomalyagent.detector.Detector;
import com.linkedin.anomalyagent.detector.SpikeDetector;
import com.linkedin.anomalyagent.detector.ThresholdDetector;
import com.linkedin.anomalyagent.metricdef.MetricCatalog;
import com.linkedin.anomalyagent.metricdef.MetricDefinition;
import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.AnomalyKind;
import com.linkedin.anomalyagent.model.SeriesKind;
import com.linkedin.anomalyagent.model.Severity;
import com.linkedin.anomalyagent.orchestrator.DetectionOrchestrator;
import com.linkedin.anomalyagent.sink.AnomalyRecord;
import com.linkedin.anomalyagent.sink.AnomalyRecordFactory;
import com.linkedin.anomalyagent.source.TimeSeriesSource;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.easymock.EasyMock;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Unit test for {@link AnomalyAgentServlet}.
 */
public class AnomalyAgentServletTest {
  private static final long CYCLE_TIME_MS = 1700000000000L;
  private static final MetricCatalog CATALOG = new MetricCatalog(
      Collections.singletonList(new MetricDefinition("node_cpu_usage_percent", SeriesKind.GAUGE, "percent",
                                                     Collections.singletonList(SpikeDetector.NAME), null)),
      Collections.emptyMap());

  private AnomalyAgent _agent;
  private DetectionOrchestrator _orchestrator;
  private MetricRegistry _metricRegistry;
  private AnomalyAgentServlet _servlet;
  private StringWriter _responseBody;

  @Before
  public void setUp() {
    SpikeDetector spikeDetector = new SpikeDetector();
    spikeDetector.configure(Collections.emptyMap());
    ThresholdDetector thresholdDetector = new ThresholdDetector();
    thresholdDetector.configure(Map.of(MetricCatalog.METRIC_CATALOG_OBJECT_CONFIG, CATALOG,
                                       "threshold.detector.enabled", "false"));
    List<Detector> detectors = Arrays.asList(spikeDetector, thresholdDetector);
    _orchestrator = new DetectionOrchestrator(EasyMock.mock(TimeSeriesSource.class), detectors, null, CATALOG,
                                              3600000L, 60000L, 1000L, 1000L, new MetricRegistry(),
                                              Clock.systemUTC());
    _agent = EasyMock.mock(AnomalyAgent.class);
    _metricRegistry = new MetricRegistry();
    _servlet = new AnomalyAgentServlet(_agent, _metricRegistry);
    _responseBody = new StringWriter();
  }

  @After
  public void tearDown() {
    _orchestrator.shutdown();
  }

  private static List<AnomalyRecord> records() {
    return new AnomalyRecordFactory(CATALOG, 3600000L).toRecords(Collections.singletonList(
        new Anomaly("node_cpu_usage_percent", SpikeDetector.NAME, AnomalyKind.SPIKE, Severity.CRITICAL, 0.8, 300.0,
                    100.0, CYCLE_TIME_MS, "Value increased by 200.0%", null, null)));
  }

  private HttpServletRequest request(String path) {
    HttpServletRequest request = EasyMock.mock(HttpServletRequest.class);
    expect(request.getPathInfo()).andReturn(path).anyTimes();
    replay(request);
    return request;
  }

  private HttpServletResponse response(int expectedStatus) throws IOException {
    HttpServletResponse response = EasyMock.mock(HttpServletResponse.class);
    response.setStatus(expectedStatus);
    response.setContentType("application/json");
    response.setCharacterEncoding("UTF-8");
    expect(response.getWriter()).andReturn(new PrintWriter(_responseBody));
    replay(response);
    return response;
  }

  private JsonObject responseJson() {
    return JsonParser.parseString(_responseBody.toString()).getAsJsonObject();
  }

  @Test
  public void testHealth() throws IOException {
    expect(_agent.agentName()).andReturn("test-agent");
    expect(_agent.orchestrator()).andReturn(_orchestrator);
    expect(_agent.lastCycleTimeMs()).andReturn(CYCLE_TIME_MS);
    replay(_agent);
    HttpServletResponse response = response(HttpServletResponse.SC_OK);

    _servlet.doGet(request("/health"), response);

    JsonObject health = responseJson();
    assertEquals(AnomalyAgentServlet.HEALTHY, health.get("status").getAsString());
    assertEquals("test-agent", health.get("agent").getAsString());
    assertEquals("IDLE", health.get("state").getAsString());
    assertEquals("2023-11-14T22:13:20Z", health.get("last_cycle_time").getAsString());
    assertEquals(1, _metricRegistry.meter("AnomalyAgentServlet.health-request-rate").getCount());
    verify(_agent, response);
  }

  @Test
  public void testAnomalies() throws IOException {
    expect(_agent.latestRecords()).andReturn(records());
    replay(_agent);
    HttpServletResponse response = response(HttpServletResponse.SC_OK);

    _servlet.doGet(request("/anomalies"), response);

    JsonObject anomalies = responseJson();
    assertEquals(1, anomalies.get("count").getAsInt());
    assertEquals("critical", anomalies.getAsJsonArray("anomalies").get(0).getAsJsonObject().get("severity")
                                      .getAsString());
    verify(_agent, response);
  }

  @Test
  public void testAnalyzeRunsDetection() throws IOException {
    expect(_agent.runDetection()).andReturn(records());
    replay(_agent);
    HttpServletResponse response = response(HttpServletResponse.SC_OK);

    _servlet.doPost(request("/analyze"), response);

    assertEquals(1, responseJson().get("count").getAsInt());
    verify(_agent, response);
  }

  @Test
  public void testDetectorsAndMetrics() throws IOException {
    expect(_agent.orchestrator()).andReturn(_orchestrator);
    expect(_agent.catalog()).andReturn(CATALOG);
    replay(_agent);

    _servlet.doGet(request("/detectors"), response(HttpServletResponse.SC_OK));
    JsonObject detectors = responseJson();
    assertEquals(2, detectors.get("total_detectors").getAsInt());
    JsonObject threshold = detectors.getAsJsonArray("detectors").get(1).getAsJsonObject();
    assertEquals(ThresholdDetector.NAME, threshold.get("name").getAsString());
    assertFalse(threshold.get("enabled").getAsBoolean());

    _responseBody.getBuffer().setLength(0);
    _servlet.doGet(request("/metrics"), response(HttpServletResponse.SC_OK));
    JsonObject metrics = responseJson();
    assertEquals(1, metrics.get("total_metrics").getAsInt());
    JsonObject cpu = metrics.getAsJsonArray("metrics").get(0).getAsJsonObject();
    assertEquals("gauge", cpu.get("type").getAsString());
    assertEquals(SpikeDetector.NAME, cpu.getAsJsonArray("detectors").get(0).getAsString());
    verify(_agent);
  }

  @Test
  public void testUnknownEndpoint() throws IOException {
    replay(_agent);
    HttpServletResponse response = response(HttpServletResponse.SC_NOT_FOUND);

    _servlet.doGet(request("/rebalance"), response);

    assertTrue(responseJson().has("error"));
    verify(response);
  }

  @Test
  public void testWrongMethod() throws IOException {
    replay(_agent);
    HttpServletResponse getAnalyze = response(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
    _servlet.doGet(request("/analyze"), getAnalyze);
    verify(getAnalyze);

    HttpServletResponse postHealth = response(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
    _servlet.doPost(request("/health"), postHealth);
    verify(postHealth, _agent);
  }

  @Test
  public void testFailedAnalysisIsServerError() throws IOException {
    expect(_agent.runDetection()).andThrow(new IllegalStateException("boom"));
    replay(_agent);
    HttpServletResponse response = response(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);

    _servlet.doPost(request("/analyze"), response);

    assertEquals("boom", responseJson().get("error").getAsString());
    verify(response);
  }
}
