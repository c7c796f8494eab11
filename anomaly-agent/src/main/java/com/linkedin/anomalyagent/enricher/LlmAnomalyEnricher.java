/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.enricher;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.linkedin.anomalyagent.common.config.AbstractConfig;
import com.linkedin.anomalyagent.common.config.ConfigDef;
import com.linkedin.anomalyagent.common.config.types.Password;
import com.linkedin.anomalyagent.config.constants.LlmConfig;
import com.linkedin.anomalyagent.exception.EnrichmentException;
import com.linkedin.anomalyagent.model.Anomaly;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.io.IOUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_API_KEY_CONFIG;
import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_API_KEY_ENV;
import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_API_URL_CONFIG;
import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_ENABLED_CONFIG;
import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_MAX_TOKENS_CONFIG;
import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_MODEL_CONFIG;
import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_REQUEST_TIMEOUT_MS_CONFIG;
import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_TEMPERATURE_CONFIG;
import static com.linkedin.anomalyagent.config.constants.LlmConfig.LLM_TOP_P_CONFIG;


/**
 * An enricher that asks a large language model, through an OpenAI compatible chat completions endpoint, to validate
 * each anomaly of a cycle and describe its potential impact.
 * <p>
 * The analysis of each anomaly is attached to its metadata:
 * <ul>
 *   <li>{@link #LLM_VALIDATION}: {@code true} if the model answered, {@code false} otherwise.</li>
 *   <li>{@link #LLM_ANALYSIS} and {@link #LLM_MODEL}: the answer and the model that gave it.</li>
 *   <li>{@link #LLM_ERROR}: the reason the model could not be asked.</li>
 * </ul>
 * A failure to analyze one anomaly does not prevent the analysis of the others. The enricher is disabled when
 * {@link LlmConfig#LLM_ENABLED_CONFIG} is false, or when no API key is configured nor found in the
 * {@value LlmConfig#LLM_API_KEY_ENV} environment variable.
 */
public class LlmAnomalyEnricher implements AnomalyEnricher {
  private static final Logger LOG = LoggerFactory.getLogger(LlmAnomalyEnricher.class);
  private static final ConfigDef CONFIG = LlmConfig.define(new ConfigDef());
  private static final Gson GSON = new Gson();
  public static final String LLM_VALIDATION = "llm_validation";
  public static final String LLM_ANALYSIS = "llm_analysis";
  public static final String LLM_MODEL = "llm_model";
  public static final String LLM_ERROR = "llm_error";
  static final String SYSTEM_PROMPT = "You are an expert in metrics and monitoring.";
  private boolean _enabled;
  private String _apiUrl;
  private String _apiKey;
  private String _model;
  private double _temperature;
  private int _maxTokens;
  private double _topP;
  private CloseableHttpClient _httpClient;

  @Override
  public void configure(Map<String, ?> configs) {
    AbstractConfig config = new AbstractConfig(CONFIG, configs);
    _apiUrl = config.getString(LLM_API_URL_CONFIG);
    _model = config.getString(LLM_MODEL_CONFIG);
    _temperature = config.getDouble(LLM_TEMPERATURE_CONFIG);
    _maxTokens = config.getInt(LLM_MAX_TOKENS_CONFIG);
    _topP = config.getDouble(LLM_TOP_P_CONFIG);
    Password apiKey = config.getPassword(LLM_API_KEY_CONFIG);
    _apiKey = apiKey != null ? apiKey.value() : environmentApiKey();
    if (!config.getBoolean(LLM_ENABLED_CONFIG)) {
      LOG.info("LLM enrichment is disabled by configuration.");
      _enabled = false;
    } else if (_apiKey == null || _apiKey.isEmpty()) {
      LOG.warn("No API key configured in {} nor in the {} environment variable, LLM enrichment is disabled.",
               LLM_API_KEY_CONFIG, LLM_API_KEY_ENV);
      _enabled = false;
    } else {
      int timeoutMs = config.getInt(LLM_REQUEST_TIMEOUT_MS_CONFIG);
      RequestConfig requestConfig = RequestConfig.custom()
                                                 .setConnectTimeout(timeoutMs)
                                                 .setConnectionRequestTimeout(timeoutMs)
                                                 .setSocketTimeout(timeoutMs)
                                                 .build();
      _httpClient = HttpClients.custom().setDefaultRequestConfig(requestConfig).build();
      _enabled = true;
      LOG.info("LLM enrichment enabled with model {} at {}.", _model, _apiUrl);
    }
  }

  /**
   * @return The API key from the environment, or {@code null} if none is set.
   */
  protected String environmentApiKey() {
    return System.getenv(LLM_API_KEY_ENV);
  }

  @Override
  public boolean isEnabled() {
    return _enabled;
  }

  @Override
  public List<Anomaly> enrich(List<Anomaly> anomalies) throws EnrichmentException {
    if (!_enabled) {
      throw new EnrichmentException("LLM enrichment is disabled.");
    }
    LOG.info("Analyzing {} anomalies with model {}.", anomalies.size(), _model);
    List<Anomaly> enriched = new ArrayList<>(anomalies.size());
    int numFailures = 0;
    for (Anomaly anomaly : anomalies) {
      if (Thread.interrupted()) {
        Thread.currentThread().interrupt();
        throw new EnrichmentException(String.format("Interrupted after analyzing %d of %d anomalies.",
                                                    enriched.size(), anomalies.size()));
      }
      Map<String, Object> analysis = new LinkedHashMap<>();
      try {
        String answer = complete(validationPrompt(anomaly));
        analysis.put(LLM_VALIDATION, true);
        analysis.put(LLM_ANALYSIS, answer);
        analysis.put(LLM_MODEL, _model);
      } catch (IOException e) {
        LOG.error("Failed to analyze anomaly {} of {}.", anomaly.id(), anomaly.metricName(), e);
        analysis.put(LLM_VALIDATION, false);
        analysis.put(LLM_ERROR, e.getMessage());
        numFailures++;
      }
      enriched.add(anomaly.withMetadata(analysis));
    }
    LOG.info("LLM analysis completed for {} anomalies, {} failed.", anomalies.size(), numFailures);
    return enriched;
  }

  static String validationPrompt(Anomaly anomaly) {
    return String.format("Validate whether this anomaly is real and provide an analysis:%n%n"
                         + "DETECTED ANOMALY:%n"
                         + "- Metric: %s%n"
                         + "- Type: %s%n"
                         + "- Observed value: %s%n"
                         + "- Expected value: %s%n"
                         + "- Severity: %s%n"
                         + "- Detector confidence: %.2f%n"
                         + "- Initial description: %s%n%n"
                         + "QUESTIONS:%n"
                         + "1. Is this anomaly real (yes/no) and why?%n"
                         + "2. What is the potential impact on the service?%n"
                         + "3. Which actions are recommended to investigate it?%n"
                         + "4. Could it be a false positive?%n%n"
                         + "Be precise and concise.",
                         anomaly.metricName(), anomaly.kind().lowerCaseName(), anomaly.value(),
                         anomaly.expectedValue() == null ? "N/A" : anomaly.expectedValue(),
                         anomaly.severity().lowerCaseName(), anomaly.confidence(), anomaly.description());
  }

  /**
   * Send the prompt to the chat completions endpoint.
   *
   * @param prompt The user message.
   * @return The content of the first choice of the answer.
   * @throws IOException If the endpoint cannot be reached, or answers with an error or without content.
   */
  String complete(String prompt) throws IOException {
    ChatCompletionRequest request = new ChatCompletionRequest(_model,
                                                              Arrays.asList(new ChatMessage("system", SYSTEM_PROMPT),
                                                                            new ChatMessage("user", prompt)),
                                                              _temperature, _maxTokens, _topP);
    HttpPost httpPost = new HttpPost(_apiUrl);
    httpPost.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + _apiKey);
    httpPost.setEntity(new StringEntity(GSON.toJson(request), ContentType.APPLICATION_JSON));

    try (CloseableHttpResponse response = _httpClient.execute(httpPost)) {
      int responseCode = response.getStatusLine().getStatusCode();
      HttpEntity entity = response.getEntity();
      String responseString = entity == null ? "" : IOUtils.toString(entity.getContent(), StandardCharsets.UTF_8);
      if (responseCode / 100 != 2) {
        throw new IOException(String.format("Received response code %d from the chat completions endpoint, "
                                            + "response body = %s", responseCode, responseString));
      }
      ChatCompletionResponse completion;
      try {
        completion = GSON.fromJson(responseString, ChatCompletionResponse.class);
      } catch (JsonParseException e) {
        throw new IOException("Malformed chat completion: " + responseString, e);
      }
      if (completion == null || completion.choices == null || completion.choices.isEmpty()
          || completion.choices.get(0).message == null || completion.choices.get(0).message.content == null) {
        throw new IOException("Chat completion has no content: " + responseString);
      }
      return completion.choices.get(0).message.content;
    }
  }

  @Override
  public void close() throws IOException {
    if (_httpClient != null) {
      _httpClient.close();
    }
  }

  private static class ChatMessage {
    private String role;
    private String content;

    ChatMessage(String role, String content) {
      this.role = role;
      this.content = content;
    }
  }

  private static class ChatCompletionRequest {
    private final String model;
    private final List<ChatMessage> messages;
    private final double temperature;
    @SerializedName("max_tokens")
    private final int maxTokens;
    @SerializedName("top_p")
    private final double topP;

    ChatCompletionRequest(String model, List<ChatMessage> messages, double temperature, int maxTokens, double topP) {
      this.model = model;
      this.messages = messages;
      this.temperature = temperature;
      this.maxTokens = maxTokens;
      this.topP = topP;
    }
  }

  private static class ChatCompletionResponse {
    private List<Choice> choices;
  }

  private static class Choice {
    private ChatMessage message;
  }
}
