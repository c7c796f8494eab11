/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.sink;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.linkedin.anomalyagent.config.AnomalyAgentConfig;
import com.linkedin.anomalyagent.detector.SpikeDetector;
import com.linkedin.anomalyagent.metricdef.MetricCatalog;
import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.AnomalyKind;
import com.linkedin.anomalyagent.model.Severity;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import javax.servlet.http.HttpServletResponse;
import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.HttpHost;
import org.apache.http.localserver.LocalServerTestBase;
import org.apache.http.util.EntityUtils;
import org.junit.After;
import org.junit.Test;

import static com.linkedin.anomalyagent.config.constants.AgentConfig.AGENT_NAME_CONFIG;
import static com.linkedin.anomalyagent.config.constants.OrchestratorSinkConfig.ORCHESTRATOR_ENABLED_CONFIG;
import static com.linkedin.anomalyagent.config.constants.OrchestratorSinkConfig.ORCHESTRATOR_ENDPOINT_CONFIG;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class HttpAnomalySinkTest extends LocalServerTestBase {
  private static final String ANOMALIES_PATH = "/api/anomalies";
  private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1700000000000L), ZoneOffset.UTC);
  private final List<HttpAnomalySink> _sinks = new ArrayList<>();

  @After
  public void closeSinks() throws IOException {
    for (HttpAnomalySink sink : _sinks) {
      sink.close();
    }
  }

  private static AnomalyAgentConfig config(String endpoint, boolean enabled) {
    Properties props = new Properties();
    props.setProperty(AGENT_NAME_CONFIG, "test-agent");
    props.setProperty(ORCHESTRATOR_ENDPOINT_CONFIG, endpoint);
    props.setProperty(ORCHESTRATOR_ENABLED_CONFIG, Boolean.toString(enabled));
    return new AnomalyAgentConfig(props, false);
  }

  private HttpAnomalySink sink(String endpoint, boolean enabled) {
    HttpAnomalySink sink = new HttpAnomalySink(config(endpoint, enabled), CLOCK);
    _sinks.add(sink);
    return sink;
  }

  private static List<AnomalyRecord> records() {
    AnomalyRecordFactory factory = new AnomalyRecordFactory(MetricCatalog.empty(), 3600000L);
    return factory.toRecords(List.of(
        new Anomaly("node_cpu_usage_percent", SpikeDetector.NAME, AnomalyKind.SPIKE, Severity.CRITICAL, 0.8, 300.0,
                    100.0, 1700000240000L, "Value increased by 200.0%", null, null),
        new Anomaly("node_cpu_usage_percent", SpikeDetector.NAME, AnomalyKind.DROP, Severity.LOW, 0.53, 100.0,
                    300.0, 1700000300000L, "Value decreased by 66.7%", null, null)));
  }

  @Test
  public void testPublishPostsBatch() throws Exception {
    AtomicReference<String> body = new AtomicReference<>();
    AtomicReference<String> contentType = new AtomicReference<>();
    this.serverBootstrap.registerHandler(ANOMALIES_PATH, (request, response, context) -> {
      body.set(EntityUtils.toString(((HttpEntityEnclosingRequest) request).getEntity()));
      contentType.set(request.getFirstHeader("Content-Type").getValue());
      response.setStatusCode(HttpServletResponse.SC_OK);
    });
    HttpHost httpHost = this.start();

    assertTrue(sink(httpHost.toURI() + ANOMALIES_PATH, true).publish(records()));

    assertTrue(contentType.get(), contentType.get().startsWith("application/json"));
    JsonObject batch = JsonParser.parseString(body.get()).getAsJsonObject();
    assertEquals("test-agent", batch.get("agent").getAsString());
    assertEquals("2023-11-14T22:13:20Z", batch.get("timestamp").getAsString());
    assertEquals(2, batch.getAsJsonArray("anomalies").size());
    JsonObject first = batch.getAsJsonArray("anomalies").get(0).getAsJsonObject();
    assertEquals("critical", first.get("severity").getAsString());
    assertEquals("metrics", first.get("source").getAsString());
  }

  @Test
  public void testRejectedBatchIsDropped() throws Exception {
    AtomicInteger numRequests = new AtomicInteger();
    this.serverBootstrap.registerHandler(ANOMALIES_PATH, (request, response, context) -> {
      numRequests.incrementAndGet();
      response.setStatusCode(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
    });
    HttpHost httpHost = this.start();

    assertFalse(sink(httpHost.toURI() + ANOMALIES_PATH, true).publish(records()));
    // No retries.
    assertEquals(1, numRequests.get());
  }

  @Test
  public void testNothingSentWhenDisabledOrEmpty() throws Exception {
    AtomicInteger numRequests = new AtomicInteger();
    this.serverBootstrap.registerHandler(ANOMALIES_PATH, (request, response, context) -> {
      numRequests.incrementAndGet();
      response.setStatusCode(HttpServletResponse.SC_OK);
    });
    HttpHost httpHost = this.start();

    HttpAnomalySink disabledSink = sink(httpHost.toURI() + ANOMALIES_PATH, false);
    assertFalse(disabledSink.isEnabled());
    assertFalse(disabledSink.publish(records()));
    assertFalse(sink(httpHost.toURI() + ANOMALIES_PATH, true).publish(Collections.emptyList()));
    assertEquals(0, numRequests.get());
  }

  @Test
  public void testUnreachableOrchestratorIsLogged() {
    HttpAnomalySink sink = new HttpAnomalySink(config("http://localhost:8000/api/anomalies", true), CLOCK) {
      @Override
      protected int send(String body) throws IOException {
        throw new IOException("Connection refused");
      }
    };
    _sinks.add(sink);

    assertFalse(sink.publish(records()));
  }
}
