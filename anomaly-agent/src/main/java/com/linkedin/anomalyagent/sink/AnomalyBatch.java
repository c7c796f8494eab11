/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.sink;

import com.google.gson.annotations.SerializedName;
import java.util.List;


/**
 * The anomalies of a cycle, as posted to the downstream orchestrator.
 */
public class AnomalyBatch {
  @SerializedName("agent")
  private final String _agent;
  @SerializedName("timestamp")
  private final String _timestamp;
  @SerializedName("anomalies")
  private final List<AnomalyRecord> _anomalies;

  public AnomalyBatch(String agent, String timestamp, List<AnomalyRecord> anomalies) {
    _agent = agent;
    _timestamp = timestamp;
    _anomalies = anomalies;
  }

  public String agent() {
    return _agent;
  }

  public String timestamp() {
    return _timestamp;
  }

  public List<AnomalyRecord> anomalies() {
    return _anomalies;
  }
}
