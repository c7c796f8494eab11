/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.source.prometheus.model;

import com.google.gson.annotations.SerializedName;
import java.util.Objects;

/**
 * Represents the response sent from the Prometheus HTTP API.
 */
public class PrometheusResponse {
    @SerializedName("status")
    private final String _status;
    @SerializedName("data")
    private final PrometheusData _data;
    @SerializedName("error")
    private final String _error;

    public PrometheusResponse(String status, PrometheusData data, String error) {
        _status = status;
        _data = data;
        _error = error;
    }

    /**
     * @return Status of the API call. Expected to be "success" if call was successful.
     */
    public String status() {
        return _status;
    }

    /**
     * @return Data encapsulating the results from the API call.
     */
    public PrometheusData data() {
        return _data;
    }

    /**
     * @return The error reported by Prometheus, if the call was not successful.
     */
    public String error() {
        return _error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PrometheusResponse response = (PrometheusResponse) o;
        return Objects.equals(_status, response._status) && Objects.equals(_data, response._data)
               && Objects.equals(_error, response._error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_status, _data, _error);
    }
}
