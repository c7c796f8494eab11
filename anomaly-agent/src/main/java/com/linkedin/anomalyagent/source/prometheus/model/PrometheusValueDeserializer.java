/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.source.prometheus.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import java.lang.reflect.Type;

/**
 * Deserializer used to transform a sample obtained from Prometheus'
 * query_range API response to the POJO {@link PrometheusValue}.
 *
 * The sample is represented in the response as a one-dimensional array of
 * length of exactly two. The first element in the array is the timestamp
 * of the sample in epoch seconds, possibly with a decimal part, and the second
 * element is the raw value as a string, which may also be "NaN", "+Inf" or "-Inf".
 */
class PrometheusValueDeserializer implements JsonDeserializer<PrometheusValue> {
    @Override
    public PrometheusValue deserialize(JsonElement json,
                                       Type typeOfT,
                                       JsonDeserializationContext context) throws JsonParseException {
        if (!json.isJsonArray()) {
            throw new JsonParseException("Every value should be an array, got " + json);
        }
        final JsonArray valueArray = json.getAsJsonArray();
        if (valueArray.size() != 2) {
            throw new JsonParseException("Every value array should have exactly two elements");
        }
        try {
            final double timestamp = valueArray.get(0).getAsDouble();
            final String valueString = valueArray.get(1).getAsString();
            final double numericValue = Double.parseDouble(valueString.replace("Inf", "Infinity"));
            return new PrometheusValue(timestamp, numericValue);
        } catch (NumberFormatException | IllegalStateException | UnsupportedOperationException e) {
            throw new JsonParseException("Malformed value " + json, e);
        }
    }
}
