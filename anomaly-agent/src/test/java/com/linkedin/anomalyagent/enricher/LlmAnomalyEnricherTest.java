/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.enricher;

import com.linkedin.anomalyagent.exception.EnrichmentException;
import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.AnomalyKind;
import com.linkedin.anomalyagent.model.Severity;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import javax.servlet.http.HttpServletResponse;
import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpHost;
import org.apache.http.entity.StringEntity;
import org.apache.http.localserver.LocalServerTestBase;
import org.apache.http.util.EntityUtils;
import org.junit.After;
import org.junit.Test;

import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_API_KEY_CONFIG;
import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_API_URL_CONFIG;
import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_ENABLED_CONFIG;
import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_MODEL_CONFIG;
import static com.linkedin.anomalyagent.enricher.LlmAnomalyEnricher.LLM_ANALYSIS;
import static com.linkedin.anomalyagent.enricher.LlmAnomalyEnricher.LLM_ERROR;
import static com.linkedin.anomalyagent.enricher.LlmAnomalyEnricher.LLM_MODEL;
import static com.linkedin.anomalyagent.enricher.LlmAnomalyEnricher.LLM_VALIDATION;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class LlmAnomalyEnricherTest extends LocalServerTestBase {
  private static final String COMPLETIONS_PATH = "/openai/v1/chat/completions";
  private static final String API_KEY = "test-api-key";
  private static final String MODEL = "test-model";
  private static final String ANALYSIS = "Yes, the CPU usage tripled within a minute.";
  private LlmAnomalyEnricher _enricher;

  @After
  public void closeEnricher() throws Exception {
    if (_enricher != null) {
      _enricher.close();
    }
  }

  private static List<Anomaly> anomalies() {
    return Arrays.asList(
        new Anomaly("node_cpu_usage_percent", "spike_detector", AnomalyKind.SPIKE, Severity.CRITICAL, 0.8, 300.0, 100.0,
                    1700000240000L, "Value increased by 200.0% (from 100.00 to 300.00)", null, null),
        new Anomaly("node_memory_usage_percent", "threshold_detector", AnomalyKind.THRESHOLD_BREACH, Severity.HIGH,
                    1.0, 96.0, null, 1700000300000L, "", null, null));
  }

  private LlmAnomalyEnricher enricher(HttpHost httpHost, String environmentApiKey, Map<String, Object> configs) {
    LlmAnomalyEnricher enricher = new LlmAnomalyEnricher() {
      @Override
      protected String environmentApiKey() {
        return environmentApiKey;
      }
    };
    Map<String, Object> allConfigs = new HashMap<>(configs);
    allConfigs.put(LLM_MODEL_CONFIG, MODEL);
    if (httpHost != null) {
      allConfigs.put(LLM_API_URL_CONFIG, httpHost.toURI() + COMPLETIONS_PATH);
    }
    enricher.configure(allConfigs);
    _enricher = enricher;
    return enricher;
  }

  @Test
  public void testEnrichAttachesAnalysis() throws Exception {
    AtomicReference<String> authorization = new AtomicReference<>();
    AtomicReference<String> requestBody = new AtomicReference<>();
    this.serverBootstrap.registerHandler(COMPLETIONS_PATH, (request, response, context) -> {
      authorization.set(request.getFirstHeader(HttpHeaders.AUTHORIZATION).getValue());
      requestBody.set(EntityUtils.toString(((HttpEntityEnclosingRequest) request).getEntity()));
      response.setStatusCode(HttpServletResponse.SC_OK);
      response.setEntity(new StringEntity("{\"id\": \"chatcmpl-1\", \"choices\": [{\"index\": 0, \"message\": "
                                          + "{\"role\": \"assistant\", \"content\": \"" + ANALYSIS + "\"}}]}",
                                          StandardCharsets.UTF_8));
    });
    LlmAnomalyEnricher enricher = enricher(this.start(), null, Map.of(LLM_API_KEY_CONFIG, API_KEY));
    assertTrue(enricher.isEnabled());

    List<Anomaly> anomalies = anomalies();
    List<Anomaly> enriched = enricher.enrich(anomalies);

    assertEquals(anomalies.size(), enriched.size());
    for (int i = 0; i < anomalies.size(); i++) {
      Anomaly anomaly = enriched.get(i);
      assertEquals(anomalies.get(i).id(), anomaly.id());
      assertEquals(true, anomaly.metadata().get(LLM_VALIDATION));
      assertEquals(ANALYSIS, anomaly.metadata().get(LLM_ANALYSIS));
      assertEquals(MODEL, anomaly.metadata().get(LLM_MODEL));
    }
    assertEquals("Bearer " + API_KEY, authorization.get());
    assertTrue(requestBody.get(), requestBody.get().contains("\"model\":\"" + MODEL + "\""));
    assertTrue(requestBody.get(), requestBody.get().contains("\"max_tokens\":500"));
    assertTrue(requestBody.get(), requestBody.get().contains("\"top_p\":0.9"));
    assertTrue(requestBody.get(), requestBody.get().contains("node_memory_usage_percent"));
  }

  @Test
  public void testFailedAnalysisIsRecordedPerAnomaly() throws Exception {
    this.serverBootstrap.registerHandler(COMPLETIONS_PATH, (request, response, context) -> {
      response.setStatusCode(HttpServletResponse.SC_SERVICE_UNAVAILABLE);
      response.setEntity(new StringEntity("{\"error\": {\"message\": \"over capacity\"}}", StandardCharsets.UTF_8));
    });
    LlmAnomalyEnricher enricher = enricher(this.start(), API_KEY, Map.of());

    List<Anomaly> enriched = enricher.enrich(anomalies());

    assertEquals(2, enriched.size());
    for (Anomaly anomaly : enriched) {
      assertEquals(false, anomaly.metadata().get(LLM_VALIDATION));
      assertNotNull(anomaly.metadata().get(LLM_ERROR));
      assertTrue(anomaly.metadata().get(LLM_ERROR).toString().contains("503"));
      assertFalse(anomaly.metadata().containsKey(LLM_ANALYSIS));
    }
  }

  @Test
  public void testInterruptedEnrichmentStops() throws Exception {
    AtomicInteger numRequests = new AtomicInteger();
    this.serverBootstrap.registerHandler(COMPLETIONS_PATH, (request, response, context) -> {
      numRequests.incrementAndGet();
      response.setStatusCode(HttpServletResponse.SC_OK);
    });
    LlmAnomalyEnricher enricher = enricher(this.start(), API_KEY, Map.of());

    Thread.currentThread().interrupt();
    try {
      assertThrows(EnrichmentException.class, () -> enricher.enrich(anomalies()));
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
    assertEquals(0, numRequests.get());
  }

  @Test
  public void testCompletionWithoutContentIsAFailure() throws Exception {
    this.serverBootstrap.registerHandler(COMPLETIONS_PATH, (request, response, context) -> {
      response.setStatusCode(HttpServletResponse.SC_OK);
      response.setEntity(new StringEntity("{\"choices\": []}", StandardCharsets.UTF_8));
    });
    LlmAnomalyEnricher enricher = enricher(this.start(), API_KEY, Map.of());

    List<Anomaly> enriched = enricher.enrich(anomalies().subList(0, 1));

    assertEquals(false, enriched.get(0).metadata().get(LLM_VALIDATION));
  }

  @Test
  public void testDisabledByConfiguration() {
    LlmAnomalyEnricher enricher = enricher(null, API_KEY, Map.of(LLM_ENABLED_CONFIG, "false"));

    assertFalse(enricher.isEnabled());
    assertThrows(EnrichmentException.class, () -> enricher.enrich(anomalies()));
  }

  @Test
  public void testDisabledWithoutApiKey() {
    assertFalse(enricher(null, null, Map.of()).isEnabled());
    assertFalse(enricher(null, "", Map.of()).isEnabled());
  }

  @Test
  public void testApiKeyFromEnvironment() {
    assertTrue(enricher(null, API_KEY, Map.of()).isEnabled());
  }

  @Test
  public void testValidationPromptDescribesAnomaly() {
    String prompt = LlmAnomalyEnricher.validationPrompt(anomalies().get(1));

    assertTrue(prompt, prompt.contains("- Metric: node_memory_usage_percent"));
    assertTrue(prompt, prompt.contains("- Type: threshold_breach"));
    assertTrue(prompt, prompt.contains("- Expected value: N/A"));
    assertTrue(prompt, prompt.contains("- Severity: high"));
  }
}
