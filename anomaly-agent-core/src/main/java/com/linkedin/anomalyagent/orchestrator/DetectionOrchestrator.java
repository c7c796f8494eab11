/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.orchestrator;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.linkedin.anomalyagent.common.AnomalyAgentThreadFactory;
import com.linkedin.anomalyagent.common.config.AbstractConfig;
import com.linkedin.anomalyagent.detector.Detector;
import com.linkedin.anomalyagent.enricher.AnomalyEnricher;
import com.linkedin.anomalyagent.exception.AnomalyAgentException;
import com.linkedin.anomalyagent.exception.MetricNotFoundException;
import com.linkedin.anomalyagent.exception.TimeSeriesSourceException;
import com.linkedin.anomalyagent.metricdef.MetricCatalog;
import com.linkedin.anomalyagent.metricdef.MetricDefinition;
import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.Series;
import com.linkedin.anomalyagent.source.TimeSeriesSource;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalyagent.common.utils.Utils.validateNotNull;
import static com.linkedin.anomalyagent.metricdef.MetricCatalog.METRIC_CATALOG_OBJECT_CONFIG;
import static com.linkedin.anomalyagent.orchestrator.DetectionOrchestratorConfig.DETECTOR_CLASSES_CONFIG;
import static com.linkedin.anomalyagent.orchestrator.DetectionOrchestratorConfig.ENRICHMENT_TIMEOUT_MS_CONFIG;
import static com.linkedin.anomalyagent.orchestrator.DetectionOrchestratorConfig.LOOKBACK_WINDOW_MS_CONFIG;
import static com.linkedin.anomalyagent.orchestrator.DetectionOrchestratorConfig.QUERY_STEP_MS_CONFIG;
import static com.linkedin.anomalyagent.orchestrator.DetectionOrchestratorConfig.SOURCE_FETCH_TIMEOUT_MS_CONFIG;


/**
 * Runs detection cycles. A cycle fetches the series of every watched metric over the lookback window, runs the
 * enabled detectors on it and collects their anomalies, then passes them through the enricher, if any.
 * <p>
 * Failures are contained: a metric that cannot be fetched, or whose series is empty, is skipped; a detector that throws
 * is skipped for that metric; a failed enrichment leaves the anomalies as the detectors reported them. Anomalies of
 * different detectors are never merged.
 * <p>
 * Metrics are processed one at a time and detectors run in the configured order. The calls to the source and the
 * enricher run on a caller thread; a call that times out is left to its thread, which is retired and replaced, so it
 * never delays the next calls. Scheduling the cycles is up to the caller.
 */
public class DetectionOrchestrator {
  private static final Logger LOG = LoggerFactory.getLogger(DetectionOrchestrator.class);
  private static final String METRIC_GROUP = "DetectionOrchestrator";
  private final TimeSeriesSource _source;
  private final List<Detector> _detectors;
  private final AnomalyEnricher _enricher;
  private final MetricCatalog _catalog;
  private final long _lookbackWindowMs;
  private final long _stepMs;
  private final long _fetchTimeoutMs;
  private final long _enrichmentTimeoutMs;
  private final Clock _clock;
  private volatile ExecutorService _callExecutor;
  private final Timer _cycleTimer;
  private final Meter _anomalyRate;
  private final Meter _skippedMetricRate;
  private final Meter _detectorFailureRate;
  private final Meter _enrichmentFailureRate;
  private volatile DetectionState _state;

  /**
   * Create an orchestrator running the detectors listed in <code>detector.classes</code>.
   *
   * @param config Configuration with the keys of {@link DetectionOrchestratorConfig}.
   * @param source The metrics store.
   * @param enricher The enricher, or {@code null} to skip enrichment.
   * @param catalog The watched metrics.
   * @param metricRegistry The registry of the orchestrator metrics.
   * @param clock Clock giving the end of the lookback window.
   */
  public DetectionOrchestrator(AbstractConfig config,
                               TimeSeriesSource source,
                               AnomalyEnricher enricher,
                               MetricCatalog catalog,
                               MetricRegistry metricRegistry,
                               Clock clock) throws AnomalyAgentException {
    this(source,
         config.getConfiguredInstances(DETECTOR_CLASSES_CONFIG, Detector.class,
                                       Collections.<String, Object>singletonMap(METRIC_CATALOG_OBJECT_CONFIG, catalog)),
         enricher,
         catalog,
         config.getLong(LOOKBACK_WINDOW_MS_CONFIG),
         config.getLong(QUERY_STEP_MS_CONFIG),
         config.getLong(SOURCE_FETCH_TIMEOUT_MS_CONFIG),
         config.getLong(ENRICHMENT_TIMEOUT_MS_CONFIG),
         metricRegistry,
         clock);
  }

  /**
   * Create an orchestrator with the given, already configured, detectors.
   */
  public DetectionOrchestrator(TimeSeriesSource source,
                               List<Detector> detectors,
                               AnomalyEnricher enricher,
                               MetricCatalog catalog,
                               long lookbackWindowMs,
                               long stepMs,
                               long fetchTimeoutMs,
                               long enrichmentTimeoutMs,
                               MetricRegistry metricRegistry,
                               Clock clock) {
    _source = validateNotNull(source, "Time series source cannot be null.");
    _detectors = List.copyOf(validateNotNull(detectors, "Detectors cannot be null."));
    _enricher = enricher;
    _catalog = validateNotNull(catalog, "Metric catalog cannot be null.");
    _lookbackWindowMs = lookbackWindowMs;
    _stepMs = stepMs;
    _fetchTimeoutMs = fetchTimeoutMs;
    _enrichmentTimeoutMs = enrichmentTimeoutMs;
    _clock = validateNotNull(clock, "Clock cannot be null.");
    _callExecutor = newCallExecutor();
    MetricRegistry registry = metricRegistry == null ? new MetricRegistry() : metricRegistry;
    _cycleTimer = registry.timer(MetricRegistry.name(METRIC_GROUP, "cycle-timer"));
    _anomalyRate = registry.meter(MetricRegistry.name(METRIC_GROUP, "anomaly-rate"));
    _skippedMetricRate = registry.meter(MetricRegistry.name(METRIC_GROUP, "skipped-metric-rate"));
    _detectorFailureRate = registry.meter(MetricRegistry.name(METRIC_GROUP, "detector-failure-rate"));
    _enrichmentFailureRate = registry.meter(MetricRegistry.name(METRIC_GROUP, "enrichment-failure-rate"));
    _state = DetectionState.IDLE;
    for (Detector detector : _detectors) {
      LOG.info("Loaded detector {} ({}).", detector.name(), detector.isEnabled() ? "enabled" : "disabled");
    }
  }

  /**
   * Run a detection cycle over the lookback window ending now.
   *
   * @return The outcome of the cycle.
   */
  public synchronized DetectionCycleResult runOneCycle() {
    long startMs = _clock.millis();
    long windowEndMs = startMs;
    long windowStartMs = windowEndMs - _lookbackWindowMs;
    List<Anomaly> anomalies = new ArrayList<>();
    List<String> analyzedMetrics = new ArrayList<>();
    Map<String, String> skippedMetrics = new LinkedHashMap<>();
    boolean enriched = false;

    try (Timer.Context ignored = _cycleTimer.time()) {
      for (MetricDefinition metric : _catalog.metrics()) {
        _state = DetectionState.FETCHING;
        Series series;
        try {
          series = fetch(metric, windowStartMs, windowEndMs);
        } catch (InterruptedException ie) {
          LOG.warn("Detection cycle interrupted while fetching {}.", metric.name());
          Thread.currentThread().interrupt();
          skippedMetrics.put(metric.name(), "interrupted");
          break;
        } catch (MetricSkippedException mse) {
          skippedMetrics.put(metric.name(), mse.getMessage());
          _skippedMetricRate.mark();
          continue;
        }
        _state = DetectionState.DETECTING;
        anomalies.addAll(detect(metric, series));
        analyzedMetrics.add(metric.name());
      }
      _state = DetectionState.AGGREGATED;
      LOG.debug("Detectors reported {} anomalies over {} metrics.", anomalies.size(), analyzedMetrics.size());

      if (_enricher != null && _enricher.isEnabled() && !anomalies.isEmpty()) {
        _state = DetectionState.ENRICHING;
        List<Anomaly> enrichedAnomalies = enrich(anomalies);
        if (enrichedAnomalies != null) {
          anomalies = enrichedAnomalies;
          enriched = true;
        }
      }
    } finally {
      _state = DetectionState.DONE;
    }
    _anomalyRate.mark(anomalies.size());
    DetectionCycleResult result = new DetectionCycleResult(anomalies, windowStartMs, windowEndMs, analyzedMetrics,
                                                           skippedMetrics, enriched, _clock.millis() - startMs);
    LOG.info("Detection cycle done: {}", result);
    return result;
  }

  private Series fetch(MetricDefinition metric, long windowStartMs, long windowEndMs)
      throws InterruptedException, MetricSkippedException {
    Future<Series> future =
        _callExecutor.submit(() -> _source.fetchRange(metric.name(), windowStartMs, windowEndMs, _stepMs));
    Series series;
    try {
      series = future.get(_fetchTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException te) {
      retireCallExecutor(future);
      LOG.warn("Skip metric {}: no series received within {} ms.", metric.name(), _fetchTimeoutMs);
      throw new MetricSkippedException("fetch timed out");
    } catch (ExecutionException ee) {
      Throwable cause = ee.getCause();
      if (cause instanceof MetricNotFoundException) {
        LOG.warn("Skip metric {}: {}", metric.name(), cause.getMessage());
        throw new MetricSkippedException("not found");
      } else if (cause instanceof TimeSeriesSourceException) {
        LOG.warn("Skip metric {}: failed to fetch its series.", metric.name(), cause);
        throw new MetricSkippedException("source unavailable");
      }
      LOG.warn("Skip metric {}: unexpected failure while fetching its series.", metric.name(), cause);
      throw new MetricSkippedException("fetch failed");
    }
    if (series == null || series.isEmpty()) {
      LOG.warn("Skip metric {}: empty series.", metric.name());
      throw new MetricSkippedException("empty series");
    }
    return series.withUnit(metric.unit());
  }

  private List<Anomaly> detect(MetricDefinition metric, Series series) {
    List<Anomaly> anomalies = new ArrayList<>();
    for (Detector detector : _detectors) {
      if (!detector.isEnabled() || !metric.runsDetector(detector.name())) {
        continue;
      }
      try {
        List<Anomaly> found = detector.detect(series);
        if (!found.isEmpty()) {
          LOG.debug("{} found {} anomalies in {}.", detector.name(), found.size(), metric.name());
        }
        anomalies.addAll(found);
      } catch (Exception e) {
        _detectorFailureRate.mark();
        LOG.warn("Detector {} failed on metric {}, skipping it.", detector.name(), metric.name(), e);
      }
    }
    return anomalies;
  }

  /**
   * @return The enriched anomalies, or {@code null} if the original anomalies must be kept.
   */
  private List<Anomaly> enrich(List<Anomaly> anomalies) {
    List<Anomaly> batch = List.copyOf(anomalies);
    Future<List<Anomaly>> future = _callExecutor.submit(() -> _enricher.enrich(batch));
    try {
      List<Anomaly> enriched = future.get(_enrichmentTimeoutMs, TimeUnit.MILLISECONDS);
      if (enriched == null || enriched.size() != batch.size()) {
        _enrichmentFailureRate.mark();
        LOG.warn("Enricher returned {} anomalies for {}, keeping the original anomalies.",
                 enriched == null ? null : enriched.size(), batch.size());
        return null;
      }
      return enriched;
    } catch (TimeoutException te) {
      retireCallExecutor(future);
      _enrichmentFailureRate.mark();
      LOG.warn("Enrichment did not complete within {} ms, keeping the original anomalies.", _enrichmentTimeoutMs);
    } catch (ExecutionException ee) {
      _enrichmentFailureRate.mark();
      LOG.warn("Enrichment failed, keeping the original anomalies.", ee.getCause());
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted during enrichment, keeping the original anomalies.");
    }
    return null;
  }

  private static ExecutorService newCallExecutor() {
    return Executors.newSingleThreadExecutor(new AnomalyAgentThreadFactory("DetectionOrchestratorCaller"));
  }

  /**
   * Interrupt the call that timed out and move the next calls to a new thread. The call may ignore the interrupt, its
   * thread then ends once the call returns.
   */
  private void retireCallExecutor(Future<?> timedOut) {
    timedOut.cancel(true);
    _callExecutor.shutdownNow();
    _callExecutor = newCallExecutor();
  }

  /**
   * @return The step of the current or last detection cycle.
   */
  public DetectionState state() {
    return _state;
  }

  /**
   * @return The configured detectors, enabled or not, in run order.
   */
  public List<Detector> detectors() {
    return _detectors;
  }

  public MetricCatalog catalog() {
    return _catalog;
  }

  public long lookbackWindowMs() {
    return _lookbackWindowMs;
  }

  /**
   * Stop the thread used for the calls to the source and the enricher.
   */
  public void shutdown() {
    _callExecutor.shutdownNow();
    try {
      _callExecutor.awaitTermination(_fetchTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while waiting for the detection orchestrator to shutdown.");
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Signals that a metric is skipped for the current cycle; the message is the reason.
   */
  private static final class MetricSkippedException extends Exception {
    private static final long serialVersionUID = 1L;

    MetricSkippedException(String reason) {
      super(reason, null, false, false);
    }
  }
}
