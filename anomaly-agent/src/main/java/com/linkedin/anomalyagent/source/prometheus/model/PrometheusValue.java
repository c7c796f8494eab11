/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.source.prometheus.model;

import com.google.gson.annotations.JsonAdapter;
import java.util.Objects;

import static com.linkedin.anomalyagent.AnomalyAgentUtils.SEC_TO_MS;

/**
 * Encapsulates the value of a series at a given instant in time.
 */
@JsonAdapter(PrometheusValueDeserializer.class)
public class PrometheusValue {
    private final double _epochSeconds;
    private final double _value;

    public PrometheusValue(final double epochSeconds, final double value) {
        _epochSeconds = epochSeconds;
        _value = value;
    }

    /**
     * @return The timestamp at which the series obtained this value,
     * represented as seconds elapsed since the Unix epoch, with a decimal part.
     */
    public double epochSeconds() {
        return _epochSeconds;
    }

    /**
     * @return The timestamp in epoch milliseconds.
     */
    public long timestampMs() {
        return Math.round(_epochSeconds * SEC_TO_MS);
    }

    /**
     * @return The value of the series at the given time. May be NaN or infinite.
     */
    public double value() {
        return _value;
    }

    @Override
    public String toString() {
        return "PrometheusValue{_epochSeconds=" + _epochSeconds + ", _value=" + _value + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PrometheusValue that = (PrometheusValue) o;
        return Double.compare(that._epochSeconds, _epochSeconds) == 0 && Double.compare(that._value, _value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(_epochSeconds, _value);
    }
}
