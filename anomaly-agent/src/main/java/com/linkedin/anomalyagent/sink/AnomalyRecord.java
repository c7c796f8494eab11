/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.sink;

import com.google.gson.annotations.SerializedName;
import com.linkedin.anomalyagent.detector.PatternDetector;
import com.linkedin.anomalyagent.detector.SpikeDetector;
import com.linkedin.anomalyagent.detector.StatisticalDetector;
import com.linkedin.anomalyagent.detector.ThresholdDetector;
import com.linkedin.anomalyagent.enricher.LlmAnomalyEnricher;
import com.linkedin.anomalyagent.model.Anomaly;
import java.util.Map;

import static com.linkedin.anomalyagent.AnomalyAgentUtils.utcDateFor;


/**
 * The representation of an anomaly sent to the downstream orchestrator, and returned by the HTTP API.
 * Values that are unknown are left out of the JSON document.
 */
public class AnomalyRecord {
  public static final String SOURCE = "metrics";
  public static final String UNKNOWN_CATEGORY = "unknown";
  public static final String LLM_STATUS_VALIDATED = "validated";
  public static final String LLM_STATUS_ERROR = "error";
  private static final Map<String, String> CATEGORY_BY_DETECTOR = Map.of(SpikeDetector.NAME, "performance",
                                                                         StatisticalDetector.NAME, "performance",
                                                                         ThresholdDetector.NAME, "capacity",
                                                                         PatternDetector.NAME, "availability");
  @SerializedName("anomaly_id")
  private final String _anomalyId;
  @SerializedName("source")
  private final String _source;
  @SerializedName("metric_name")
  private final String _metricName;
  @SerializedName("labels")
  private final Map<String, String> _labels;
  @SerializedName("detector")
  private final String _detector;
  @SerializedName("severity")
  private final String _severity;
  @SerializedName("description")
  private final String _description;
  @SerializedName("observed_value")
  private final double _observedValue;
  @SerializedName("expected_value")
  private final Double _expectedValue;
  @SerializedName("threshold")
  private final Double _threshold;
  @SerializedName("confidence")
  private final double _confidence;
  @SerializedName("start_time")
  private final String _startTime;
  @SerializedName("end_time")
  private final String _endTime;
  @SerializedName("context")
  private final Context _context;
  @SerializedName("suggested_category")
  private final String _suggestedCategory;
  @SerializedName("llm_analysis")
  private final String _llmAnalysis;
  @SerializedName("llm_status")
  private final String _llmStatus;
  @SerializedName("llm_validated")
  private final Boolean _llmValidated;

  AnomalyRecord(Anomaly anomaly, Context context) {
    _anomalyId = anomaly.id();
    _source = SOURCE;
    _metricName = anomaly.metricName();
    _labels = anomaly.labels();
    _detector = anomaly.detectorName();
    _severity = anomaly.severity().lowerCaseName();
    _description = anomaly.description().isEmpty() ? anomaly.kind().lowerCaseName() + " detected"
                                                   : anomaly.description();
    _observedValue = anomaly.value();
    _expectedValue = anomaly.expectedValue();
    Object threshold = anomaly.metadata().get(ThresholdDetector.THRESHOLD);
    _threshold = threshold instanceof Number ? ((Number) threshold).doubleValue() : null;
    _confidence = Math.round(anomaly.confidence() * 100.0) / 100.0;
    _startTime = utcDateFor(anomaly.startTimeMs());
    _endTime = utcDateFor(anomaly.endTimeMs());
    _context = context;
    _suggestedCategory = suggestedCategory(anomaly.detectorName());

    Object validation = anomaly.metadata().get(LlmAnomalyEnricher.LLM_VALIDATION);
    if (validation instanceof Boolean) {
      _llmValidated = (Boolean) validation;
      _llmStatus = _llmValidated ? LLM_STATUS_VALIDATED : LLM_STATUS_ERROR;
      Object analysis = anomaly.metadata().get(_llmValidated ? LlmAnomalyEnricher.LLM_ANALYSIS
                                                             : LlmAnomalyEnricher.LLM_ERROR);
      _llmAnalysis = analysis == null ? null : analysis.toString();
    } else {
      _llmValidated = null;
      _llmStatus = null;
      _llmAnalysis = null;
    }
  }

  /**
   * @param detectorName Name of a detector.
   * @return The category of incident the detector hints at, or {@link #UNKNOWN_CATEGORY}.
   */
  public static String suggestedCategory(String detectorName) {
    return CATEGORY_BY_DETECTOR.getOrDefault(detectorName, UNKNOWN_CATEGORY);
  }

  public String anomalyId() {
    return _anomalyId;
  }

  public String source() {
    return _source;
  }

  public String metricName() {
    return _metricName;
  }

  public Map<String, String> labels() {
    return _labels;
  }

  public String detector() {
    return _detector;
  }

  public String severity() {
    return _severity;
  }

  public String description() {
    return _description;
  }

  public double observedValue() {
    return _observedValue;
  }

  public Double expectedValue() {
    return _expectedValue;
  }

  public Double threshold() {
    return _threshold;
  }

  public double confidence() {
    return _confidence;
  }

  public String startTime() {
    return _startTime;
  }

  public String endTime() {
    return _endTime;
  }

  public Context context() {
    return _context;
  }

  public String suggestedCategory() {
    return _suggestedCategory;
  }

  public String llmAnalysis() {
    return _llmAnalysis;
  }

  public String llmStatus() {
    return _llmStatus;
  }

  public Boolean llmValidated() {
    return _llmValidated;
  }

  /**
   * Where the anomalous metric comes from.
   */
  public static class Context {
    @SerializedName("metric_type")
    private final String _metricType;
    @SerializedName("unit")
    private final String _unit;
    @SerializedName("lookback_window")
    private final String _lookbackWindow;

    public Context(String metricType, String unit, String lookbackWindow) {
      _metricType = metricType;
      _unit = unit;
      _lookbackWindow = lookbackWindow;
    }

    public String metricType() {
      return _metricType;
    }

    public String unit() {
      return _unit;
    }

    public String lookbackWindow() {
      return _lookbackWindow;
    }
  }
}
