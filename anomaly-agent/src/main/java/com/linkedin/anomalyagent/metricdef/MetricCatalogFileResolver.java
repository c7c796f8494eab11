/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.metricdef;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.google.gson.stream.JsonReader;
import com.linkedin.anomalyagent.common.config.ConfigException;
import com.linkedin.anomalyagent.model.SeriesKind;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Loads a {@link MetricCatalog} from a JSON file. The file should contain the watched metrics and, optionally, bounds
 * shared by name or by wildcard pattern. For example:
 *
 * <pre>
 * {
 *   "metrics": [
 *     {
 *       "name": "node_cpu_usage_percent",
 *       "type": "gauge",
 *       "unit": "percent",
 *       "detectors": ["spike_detector", "threshold_detector"],
 *       "thresholds": {"warning": 70, "critical": 90}
 *     },
 *     {
 *       "name": "http_requests_total",
 *       "type": "counter",
 *       "enabled": false
 *     }
 *   ],
 *   "thresholds": {
 *     "node_*_bytes": {"min": 0, "max_rate": 1048576}
 *   }
 * }
 * </pre>
 *
 * <ul>
 *   <li>{@code type} is one of counter, gauge, histogram, summary and defaults to gauge.</li>
 *   <li>An empty or missing {@code detectors} list runs every enabled detector on the metric.</li>
 *   <li>A metric with {@code "enabled": false} is not watched.</li>
 *   <li>Threshold keys are warning, critical, min, max, max_rate and min_rate.</li>
 * </ul>
 */
public final class MetricCatalogFileResolver {
  private static final Logger LOG = LoggerFactory.getLogger(MetricCatalogFileResolver.class);

  private MetricCatalogFileResolver() {
  }

  /**
   * @param configFile Path of the JSON file.
   * @return The catalog declared in the file.
   * @throws ConfigException If the file cannot be read or declares an invalid metric.
   */
  public static MetricCatalog loadCatalog(String configFile) {
    MetricCatalogFile catalogFile;
    try (JsonReader reader = new JsonReader(new InputStreamReader(new FileInputStream(configFile),
                                                                  StandardCharsets.UTF_8))) {
      catalogFile = new Gson().fromJson(reader, MetricCatalogFile.class);
    } catch (IOException | JsonParseException e) {
      throw new ConfigException(String.format("Unable to load metric definitions from %s.", configFile), e);
    }
    if (catalogFile == null || catalogFile.metrics == null) {
      throw new ConfigException(String.format("Metric definition file %s does not declare any metrics.", configFile));
    }

    List<MetricDefinition> definitions = new ArrayList<>(catalogFile.metrics.size());
    for (MetricEntry entry : catalogFile.metrics) {
      if (entry == null || entry.name == null || entry.name.isEmpty()) {
        throw new ConfigException(String.format("Metric definition file %s has a metric without name.", configFile));
      }
      if (entry.enabled != null && !entry.enabled) {
        LOG.info("Metric {} is disabled.", entry.name);
        continue;
      }
      SeriesKind kind;
      try {
        kind = SeriesKind.forName(entry.type);
      } catch (IllegalArgumentException e) {
        throw new ConfigException(entry.name + ".type", entry.type, e.getMessage());
      }
      definitions.add(new MetricDefinition(entry.name, kind, entry.unit, entry.detectors, toBounds(entry.thresholds)));
    }

    Map<String, MetricBounds> sharedBounds = new LinkedHashMap<>();
    if (catalogFile.thresholds != null) {
      for (Map.Entry<String, Thresholds> entry : catalogFile.thresholds.entrySet()) {
        MetricBounds bounds = toBounds(entry.getValue());
        if (bounds != null) {
          sharedBounds.put(entry.getKey(), bounds);
        }
      }
    }
    LOG.info("Loaded {} metric definition(s) and {} shared threshold(s) from {}.", definitions.size(),
             sharedBounds.size(), configFile);
    return new MetricCatalog(definitions, sharedBounds);
  }

  private static MetricBounds toBounds(Thresholds thresholds) {
    if (thresholds == null) {
      return null;
    }
    return new MetricBounds(thresholds.warning, thresholds.critical, thresholds.min, thresholds.max, thresholds.maxRate,
                            thresholds.minRate);
  }

  private static class MetricCatalogFile {
    private List<MetricEntry> metrics;
    private Map<String, Thresholds> thresholds;
  }

  private static class MetricEntry {
    private String name;
    private String type;
    private String unit;
    private Boolean enabled;
    private List<String> detectors;
    private Thresholds thresholds;
  }

  private static class Thresholds {
    private Double warning;
    private Double critical;
    private Double min;
    private Double max;
    @SerializedName("max_rate")
    private Double maxRate;
    @SerializedName("min_rate")
    private Double minRate;
  }
}
