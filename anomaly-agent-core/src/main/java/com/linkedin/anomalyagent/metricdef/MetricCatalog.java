/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.metricdef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.linkedin.anomalyagent.common.utils.Utils.validateNotNull;

/**
 * The metrics watched by the agent and the static bounds of the metrics.
 * <p>
 * Bounds are resolved in the following order:
 * <ol>
 *   <li>the bounds declared on the metric definition with the exact metric name,</li>
 *   <li>the shared bounds registered under the exact metric name,</li>
 *   <li>the first shared bounds, in declaration order, whose key contains a {@code *} wildcard matching the whole
 *   metric name. Each {@code *} matches any substring, every other character matches itself. A key never matches a
 *   prefix only: {@code *_total} matches {@code http_total} but not {@code http_total_y}.</li>
 * </ol>
 */
public class MetricCatalog {
  /**
   * Config key under which the catalog is handed to the detectors.
   */
  public static final String METRIC_CATALOG_OBJECT_CONFIG = "metric.catalog.object";
  public static final String WILDCARD = "*";

  private final List<MetricDefinition> _metrics;
  private final Map<String, MetricDefinition> _metricsByName;
  private final Map<String, MetricBounds> _sharedBounds;
  private final Map<String, Pattern> _wildcardPatterns;

  public MetricCatalog(List<MetricDefinition> metrics, Map<String, MetricBounds> sharedBounds) {
    _metrics = List.copyOf(validateNotNull(metrics, "Metric definitions cannot be null."));
    _metricsByName = new LinkedHashMap<>();
    for (MetricDefinition metric : _metrics) {
      _metricsByName.putIfAbsent(metric.name(), metric);
    }
    _sharedBounds = sharedBounds == null ? Collections.emptyMap()
                                         : Collections.unmodifiableMap(new LinkedHashMap<>(sharedBounds));
    _wildcardPatterns = new LinkedHashMap<>();
    for (String key : _sharedBounds.keySet()) {
      if (key.contains(WILDCARD)) {
        _wildcardPatterns.put(key, toPattern(key));
      }
    }
  }

  /**
   * @return A catalog without metrics nor bounds.
   */
  public static MetricCatalog empty() {
    return new MetricCatalog(Collections.emptyList(), Collections.emptyMap());
  }

  /**
   * @return The watched metrics, in configuration order.
   */
  public List<MetricDefinition> metrics() {
    return _metrics;
  }

  /**
   * @return The names of the watched metrics, in configuration order.
   */
  public List<String> metricNames() {
    List<String> names = new ArrayList<>(_metrics.size());
    for (MetricDefinition metric : _metrics) {
      names.add(metric.name());
    }
    return names;
  }

  /**
   * @param metricName Metric name.
   * @return The definition of the metric, or {@code null} if the metric is not watched.
   */
  public MetricDefinition metric(String metricName) {
    return _metricsByName.get(metricName);
  }

  public Map<String, MetricBounds> sharedBounds() {
    return _sharedBounds;
  }

  /**
   * @param metricName Metric name.
   * @return The bounds that apply to the metric, or {@code null} if none does.
   */
  public MetricBounds boundsFor(String metricName) {
    MetricDefinition definition = _metricsByName.get(metricName);
    if (definition != null && definition.bounds() != null && !definition.bounds().isEmpty()) {
      return definition.bounds();
    }
    MetricBounds exact = _sharedBounds.get(metricName);
    if (exact != null) {
      return exact;
    }
    for (Map.Entry<String, Pattern> entry : _wildcardPatterns.entrySet()) {
      if (entry.getValue().matcher(metricName).matches()) {
        return _sharedBounds.get(entry.getKey());
      }
    }
    return null;
  }

  private static Pattern toPattern(String wildcardKey) {
    StringBuilder regex = new StringBuilder();
    int start = 0;
    int index;
    while ((index = wildcardKey.indexOf(WILDCARD, start)) >= 0) {
      if (index > start) {
        regex.append(Pattern.quote(wildcardKey.substring(start, index)));
      }
      regex.append(".*");
      start = index + 1;
    }
    if (start < wildcardKey.length()) {
      regex.append(Pattern.quote(wildcardKey.substring(start)));
    }
    return Pattern.compile(regex.toString());
  }
}
