/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.enricher;

import com.linkedin.anomalyagent.common.AnomalyAgentConfigurable;
import com.linkedin.anomalyagent.exception.EnrichmentException;
import com.linkedin.anomalyagent.model.Anomaly;
import java.util.List;


/**
 * An optional stage adding context, such as a narrative or a validation verdict, to the anomalies of a cycle.
 * <p>
 * An enricher must not drop anomalies: it returns one anomaly per input anomaly, with the same id, typically created
 * with {@link Anomaly#withMetadata(java.util.Map)}. Callers keep the original anomalies when enrichment fails.
 */
public interface AnomalyEnricher extends AnomalyAgentConfigurable, AutoCloseable {

  /**
   * @return {@code true} if the enricher is configured and can be used.
   */
  boolean isEnabled();

  /**
   * @param anomalies Anomalies of a detection cycle.
   * @return The enriched anomalies, in the same order.
   * @throws EnrichmentException If the batch cannot be enriched.
   */
  List<Anomaly> enrich(List<Anomaly> anomalies) throws EnrichmentException;

  @Override
  default void close() throws Exception {
  }
}
