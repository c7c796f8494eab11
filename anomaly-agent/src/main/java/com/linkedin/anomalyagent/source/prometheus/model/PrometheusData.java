/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.source.prometheus.model;

import com.google.gson.annotations.SerializedName;
import java.util.List;
import java.util.Objects;

/**
 * Encapsulates the results of the Prometheus API call.
 */
public class PrometheusData {
    @SerializedName("resultType")
    private final String _resultType;
    @SerializedName("result")
    private final List<PrometheusQueryResult> _result;

    public PrometheusData(String resultType, List<PrometheusQueryResult> result) {
        _resultType = resultType;
        _result = result;
    }

    /**
     * @return Type of the results, "matrix" for a query_range call.
     */
    public String resultType() {
        return _resultType;
    }

    /**
     * @return List of query results.
     */
    public List<PrometheusQueryResult> result() {
        return _result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PrometheusData that = (PrometheusData) o;
        return Objects.equals(_resultType, that._resultType) && Objects.equals(_result, that._result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_resultType, _result);
    }
}
