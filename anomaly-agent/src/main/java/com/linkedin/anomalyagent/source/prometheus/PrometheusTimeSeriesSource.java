/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.source.prometheus;

import com.linkedin.anomalyagent.common.config.AbstractConfig;
import com.linkedin.anomalyagent.common.config.ConfigDef;
import com.linkedin.anomalyagent.common.config.ConfigException;
import com.linkedin.anomalyagent.config.constants.PrometheusConfig;
import com.linkedin.anomalyagent.exception.MetricNotFoundException;
import com.linkedin.anomalyagent.exception.TimeSeriesSourceException;
import com.linkedin.anomalyagent.model.Sample;
import com.linkedin.anomalyagent.model.Series;
import com.linkedin.anomalyagent.model.SeriesKind;
import com.linkedin.anomalyagent.source.TimeSeriesSource;
import com.linkedin.anomalyagent.source.prometheus.model.PrometheusQueryResult;
import com.linkedin.anomalyagent.source.prometheus.model.PrometheusValue;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.http.HttpHost;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalyagent.config.constants.PrometheusConfig.PROMETHEUS_QUERY_TIMEOUT_MS_CONFIG;
import static com.linkedin.anomalyagent.config.constants.PrometheusConfig.PROMETHEUS_SERVER_ENDPOINT_CONFIG;

/**
 * Time series source that fetches the series of a metric from a Prometheus server, through the query_range API.
 *
 * Configurations for this class.
 * <ul>
 *   <li>{@link PrometheusConfig#PROMETHEUS_SERVER_ENDPOINT_CONFIG}: The HTTP endpoint of the Prometheus server,
 *   as schema://host:port.</li>
 *   <li>{@link PrometheusConfig#PROMETHEUS_QUERY_TIMEOUT_MS_CONFIG}: The connect and socket timeout of a query.</li>
 * </ul>
 * When a query matches several series, only the first one returned by Prometheus is used. Samples whose value is not
 * a finite number are dropped.
 */
public class PrometheusTimeSeriesSource implements TimeSeriesSource {
    private static final Logger LOG = LoggerFactory.getLogger(PrometheusTimeSeriesSource.class);
    private static final ConfigDef CONFIG = PrometheusConfig.define(new ConfigDef());

    protected PrometheusAdapter _prometheusAdapter;
    private CloseableHttpClient _httpClient;

    @Override
    public void configure(Map<String, ?> configs) {
        AbstractConfig config = new AbstractConfig(CONFIG, configs);
        String endpoint = config.getString(PROMETHEUS_SERVER_ENDPOINT_CONFIG);
        int timeoutMs = config.getInt(PROMETHEUS_QUERY_TIMEOUT_MS_CONFIG);
        try {
            HttpHost host = HttpHost.create(endpoint);
            if (host.getPort() < 0) {
                throw new IllegalArgumentException();
            }
            RequestConfig requestConfig = RequestConfig.custom()
                                                       .setConnectTimeout(timeoutMs)
                                                       .setConnectionRequestTimeout(timeoutMs)
                                                       .setSocketTimeout(timeoutMs)
                                                       .build();
            _httpClient = HttpClients.custom().setDefaultRequestConfig(requestConfig).build();
            _prometheusAdapter = new PrometheusAdapter(_httpClient, host);
        } catch (IllegalArgumentException ex) {
            throw new ConfigException(
                String.format("Prometheus endpoint URI is malformed, "
                              + "expected schema://host:port, provided %s", endpoint));
        }
        LOG.info("Fetching series from Prometheus at {}.", endpoint);
    }

    @Override
    public Series fetchRange(String query, long startMs, long endMs, long stepMs)
        throws MetricNotFoundException, TimeSeriesSourceException {
        final List<PrometheusQueryResult> results;
        try {
            results = _prometheusAdapter.queryMetric(query, startMs, endMs, stepMs);
        } catch (IOException e) {
            throw new TimeSeriesSourceException(String.format("Could not query %s from Prometheus at %s.",
                                                              query, _prometheusAdapter.prometheusEndpoint()), e);
        }
        if (results.isEmpty()) {
            throw new MetricNotFoundException(query);
        }
        if (results.size() > 1) {
            LOG.debug("Query {} matched {} series, using the first one.", query, results.size());
        }
        PrometheusQueryResult result = results.get(0);
        Map<String, String> labels = result.metric();
        List<Sample> samples = new ArrayList<>();
        if (result.values() != null) {
            for (PrometheusValue value : result.values()) {
                if (Double.isNaN(value.value()) || Double.isInfinite(value.value())) {
                    LOG.trace("Drop sample {} of {}, its value is not a finite number.", value, query);
                    continue;
                }
                samples.add(new Sample(value.timestampMs(), value.value(), labels));
            }
        }
        return new Series(query, SeriesKind.GAUGE, samples);
    }

    @Override
    public void close() throws IOException {
        if (_httpClient != null) {
            _httpClient.close();
        }
    }
}
