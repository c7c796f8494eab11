/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.orchestrator;

import com.linkedin.anomalyagent.model.Anomaly;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * The outcome of one detection cycle.
 */
public class DetectionCycleResult {
  private final List<Anomaly> _anomalies;
  private final long _windowStartMs;
  private final long _windowEndMs;
  private final List<String> _analyzedMetrics;
  private final Map<String, String> _skippedMetrics;
  private final boolean _enriched;
  private final long _durationMs;

  public DetectionCycleResult(List<Anomaly> anomalies,
                              long windowStartMs,
                              long windowEndMs,
                              List<String> analyzedMetrics,
                              Map<String, String> skippedMetrics,
                              boolean enriched,
                              long durationMs) {
    _anomalies = List.copyOf(anomalies);
    _windowStartMs = windowStartMs;
    _windowEndMs = windowEndMs;
    _analyzedMetrics = List.copyOf(analyzedMetrics);
    _skippedMetrics = Collections.unmodifiableMap(new LinkedHashMap<>(skippedMetrics));
    _enriched = enriched;
    _durationMs = durationMs;
  }

  /**
   * @return The anomalies of the cycle. Consumers should not rely on their order.
   */
  public List<Anomaly> anomalies() {
    return _anomalies;
  }

  public long windowStartMs() {
    return _windowStartMs;
  }

  public long windowEndMs() {
    return _windowEndMs;
  }

  /**
   * @return The metrics whose series was fetched and checked by the detectors.
   */
  public List<String> analyzedMetrics() {
    return _analyzedMetrics;
  }

  /**
   * @return The metrics skipped during the cycle, with the reason why.
   */
  public Map<String, String> skippedMetrics() {
    return _skippedMetrics;
  }

  /**
   * @return {@code true} if the anomalies went through the enricher successfully.
   */
  public boolean enriched() {
    return _enriched;
  }

  public long durationMs() {
    return _durationMs;
  }

  @Override
  public String toString() {
    return String.format("DetectionCycleResult{anomalies=%d, window=[%d, %d], analyzed=%d, skipped=%s, enriched=%s, "
                         + "durationMs=%d}", _anomalies.size(), _windowStartMs, _windowEndMs, _analyzedMetrics.size(),
                         _skippedMetrics.keySet(), _enriched, _durationMs);
  }
}
