/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.source.prometheus.model;

import com.google.gson.annotations.SerializedName;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Encapsulates the query result obtained from Prometheus API corresponding
 * to a single series that matches the query made in the API call.
 * Multiple such results can be returned as part of a query_range API call
 * if multiple series match the query that was made.
 */
public class PrometheusQueryResult {
    @SerializedName("metric")
    private final Map<String, String> _metric;
    @SerializedName("values")
    private final List<PrometheusValue> _values;

    public PrometheusQueryResult(Map<String, String> metric, List<PrometheusValue> values) {
        _metric = metric;
        _values = values;
    }

    /**
     * @return The labels of the series that was matched to the query, including its name as {@code __name__}.
     */
    public Map<String, String> metric() {
        return _metric;
    }

    /**
     * @return List of values for the series, with their respective timestamps.
     */
    public List<PrometheusValue> values() {
        return _values;
    }

    @Override
    public String toString() {
        return "PrometheusQueryResult{_metric=" + _metric + ", _values=" + _values + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PrometheusQueryResult result = (PrometheusQueryResult) o;
        return Objects.equals(_metric, result._metric) && Objects.equals(_values, result._values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_metric, _values);
    }
}
