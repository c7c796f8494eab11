/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.sink;

import com.google.gson.Gson;
import com.linkedin.anomalyagent.config.AnomalyAgentConfig;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalyagent.AnomalyAgentUtils.utcDateFor;
import static com.linkedin.anomalyagent.config.constants.AgentConfig.AGENT_NAME_CONFIG;
import static com.linkedin.anomalyagent.config.constants.OrchestratorSinkConfig.ORCHESTRATOR_ENABLED_CONFIG;
import static com.linkedin.anomalyagent.config.constants.OrchestratorSinkConfig.ORCHESTRATOR_ENDPOINT_CONFIG;
import static com.linkedin.anomalyagent.config.constants.OrchestratorSinkConfig.ORCHESTRATOR_TIMEOUT_MS_CONFIG;


/**
 * Posts the anomalies of each cycle as a JSON {@link AnomalyBatch} to the downstream orchestrator. A batch that cannot
 * be delivered is logged and dropped.
 */
public class HttpAnomalySink implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(HttpAnomalySink.class);
  private static final Gson GSON = new Gson();
  private final boolean _enabled;
  private final String _agentName;
  private final String _endpoint;
  private final Clock _clock;
  private final CloseableHttpClient _httpClient;

  public HttpAnomalySink(AnomalyAgentConfig config, Clock clock) {
    _enabled = config.getBoolean(ORCHESTRATOR_ENABLED_CONFIG);
    _agentName = config.getString(AGENT_NAME_CONFIG);
    _endpoint = config.getString(ORCHESTRATOR_ENDPOINT_CONFIG);
    _clock = clock;
    int timeoutMs = config.getInt(ORCHESTRATOR_TIMEOUT_MS_CONFIG);
    RequestConfig requestConfig = RequestConfig.custom()
                                               .setConnectTimeout(timeoutMs)
                                               .setConnectionRequestTimeout(timeoutMs)
                                               .setSocketTimeout(timeoutMs)
                                               .build();
    _httpClient = HttpClients.custom().setDefaultRequestConfig(requestConfig).build();
  }

  public boolean isEnabled() {
    return _enabled;
  }

  /**
   * Publish the records of a cycle. Nothing is sent if the sink is disabled or there are no records.
   *
   * @param records Records of the anomalies of a cycle.
   * @return {@code true} if the orchestrator accepted the batch.
   */
  public boolean publish(List<AnomalyRecord> records) {
    if (!_enabled || records.isEmpty()) {
      return false;
    }
    AnomalyBatch batch = new AnomalyBatch(_agentName, utcDateFor(_clock.millis()), records);
    LOG.info("Sending {} anomalies to the orchestrator at {}.", records.size(), _endpoint);
    try {
      int responseCode = send(GSON.toJson(batch));
      if (responseCode / 100 != 2) {
        LOG.error("Failed to send anomalies to the orchestrator, response code = {}.", responseCode);
        return false;
      }
      LOG.info("Anomalies successfully sent to the orchestrator.");
      return true;
    } catch (IOException e) {
      LOG.error("Error sending anomalies to the orchestrator at {}.", _endpoint, e);
      return false;
    }
  }

  /**
   * @param body The JSON document to post.
   * @return The response code of the orchestrator.
   * @throws IOException If the orchestrator cannot be reached.
   */
  protected int send(String body) throws IOException {
    HttpPost httpPost = new HttpPost(_endpoint);
    httpPost.setEntity(new StringEntity(body, ContentType.APPLICATION_JSON));
    httpPost.setHeader("Accept", "application/json");
    LOG.debug("Sending anomalies to: {}\nBody:\n{}", httpPost, body);
    try (CloseableHttpResponse response = _httpClient.execute(httpPost)) {
      EntityUtils.consume(response.getEntity());
      return response.getStatusLine().getStatusCode();
    }
  }

  @Override
  public void close() throws IOException {
    _httpClient.close();
  }
}
