/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.sink;

import com.linkedin.anomalyagent.metricdef.MetricCatalog;
import com.linkedin.anomalyagent.metricdef.MetricDefinition;
import com.linkedin.anomalyagent.model.Anomaly;
import java.util.ArrayList;
import java.util.List;

import static com.linkedin.anomalyagent.AnomalyAgentUtils.SEC_TO_MS;
import static com.linkedin.anomalyagent.common.utils.Utils.validateNotNull;


/**
 * Turns the anomalies of a cycle into {@link AnomalyRecord}s, adding the context of their metric from the catalog.
 */
public class AnomalyRecordFactory {
  static final String UNKNOWN_METRIC_TYPE = "unknown";
  private final MetricCatalog _catalog;
  private final String _lookbackWindow;

  public AnomalyRecordFactory(MetricCatalog catalog, long lookbackWindowMs) {
    _catalog = validateNotNull(catalog, "Metric catalog cannot be null.");
    _lookbackWindow = lookbackWindowMs / SEC_TO_MS + "s";
  }

  public AnomalyRecord toRecord(Anomaly anomaly) {
    MetricDefinition metric = _catalog.metric(anomaly.metricName());
    AnomalyRecord.Context context = metric == null
                                    ? new AnomalyRecord.Context(UNKNOWN_METRIC_TYPE, "", _lookbackWindow)
                                    : new AnomalyRecord.Context(metric.kind().lowerCaseName(),
                                                                metric.unit() == null ? "" : metric.unit(),
                                                                _lookbackWindow);
    return new AnomalyRecord(anomaly, context);
  }

  public List<AnomalyRecord> toRecords(List<Anomaly> anomalies) {
    List<AnomalyRecord> records = new ArrayList<>(anomalies.size());
    for (Anomaly anomaly : anomalies) {
      records.add(toRecord(anomaly));
    }
    return records;
  }
}
