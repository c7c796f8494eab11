/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent;

import com.codahale.metrics.MetricRegistry;
import com.linkedin.anomalyagent.common.AnomalyAgentThreadFactory;
import com.linkedin.anomalyagent.config.AnomalyAgentConfig;
import com.linkedin.anomalyagent.detector.Detector;
import com.linkedin.anomalyagent.enricher.AnomalyEnricher;
import com.linkedin.anomalyagent.exception.AnomalyAgentException;
import com.linkedin.anomalyagent.metricdef.MetricCatalog;
import com.linkedin.anomalyagent.metricdef.MetricCatalogFileResolver;
import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.Severity;
import com.linkedin.anomalyagent.orchestrator.DetectionCycleResult;
import com.linkedin.anomalyagent.orchestrator.DetectionOrchestrator;
import com.linkedin.anomalyagent.sink.AnomalyRecord;
import com.linkedin.anomalyagent.sink.AnomalyRecordFactory;
import com.linkedin.anomalyagent.sink.HttpAnomalySink;
import com.linkedin.anomalyagent.source.TimeSeriesSource;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalyagent.config.constants.AgentConfig.AGENT_NAME_CONFIG;
import static com.linkedin.anomalyagent.config.constants.AgentConfig.ANOMALY_ENRICHER_CLASS_CONFIG;
import static com.linkedin.anomalyagent.config.constants.AgentConfig.CHECK_INTERVAL_MS_CONFIG;
import static com.linkedin.anomalyagent.config.constants.AgentConfig.METRICS_CONFIG_FILE_CONFIG;
import static com.linkedin.anomalyagent.config.constants.AgentConfig.TIME_SERIES_SOURCE_CLASS_CONFIG;


/**
 * The anomaly agent service. It runs a detection cycle every <code>check.interval.ms</code>, publishes the anomalies of
 * each cycle to the downstream orchestrator and keeps the records of the latest cycle for the HTTP API.
 */
public class AnomalyAgent {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyAgent.class);
  private static final long SCHEDULER_SHUTDOWN_TIMEOUT_MS = 30 * AnomalyAgentUtils.SEC_TO_MS;
  private final String _agentName;
  private final long _checkIntervalMs;
  private final TimeSeriesSource _source;
  private final AnomalyEnricher _enricher;
  private final DetectionOrchestrator _orchestrator;
  private final AnomalyRecordFactory _recordFactory;
  private final HttpAnomalySink _sink;
  private final Clock _clock;
  private final ScheduledExecutorService _detectionScheduler;
  private volatile List<AnomalyRecord> _latestRecords;
  private volatile DetectionCycleResult _latestResult;
  private volatile long _lastCycleTimeMs;

  /**
   * Create the agent from its configuration: the metric catalog file is loaded and the source, the enricher and the
   * detectors are instantiated from the configured classes.
   *
   * @param config The agent configuration.
   * @param metricRegistry The registry of the agent metrics.
   * @param clock The clock of the detection cycles.
   */
  public AnomalyAgent(AnomalyAgentConfig config, MetricRegistry metricRegistry, Clock clock)
      throws AnomalyAgentException {
    this(config, MetricCatalogFileResolver.loadCatalog(config.getString(METRICS_CONFIG_FILE_CONFIG)), metricRegistry,
         clock);
  }

  AnomalyAgent(AnomalyAgentConfig config, MetricCatalog catalog, MetricRegistry metricRegistry, Clock clock)
      throws AnomalyAgentException {
    this(config,
         config.getConfiguredInstance(TIME_SERIES_SOURCE_CLASS_CONFIG, TimeSeriesSource.class,
                                      Collections.emptyMap()),
         config.getConfiguredInstance(ANOMALY_ENRICHER_CLASS_CONFIG, AnomalyEnricher.class, Collections.emptyMap()),
         catalog,
         metricRegistry,
         clock);
  }

  private AnomalyAgent(AnomalyAgentConfig config,
                       TimeSeriesSource source,
                       AnomalyEnricher enricher,
                       MetricCatalog catalog,
                       MetricRegistry metricRegistry,
                       Clock clock) throws AnomalyAgentException {
    this(config.getString(AGENT_NAME_CONFIG),
         config.getLong(CHECK_INTERVAL_MS_CONFIG),
         source,
         enricher,
         new DetectionOrchestrator(config, source, enricher, catalog, metricRegistry, clock),
         new HttpAnomalySink(config, clock),
         clock);
  }

  /**
   * Package private for unit tests.
   */
  AnomalyAgent(String agentName,
               long checkIntervalMs,
               TimeSeriesSource source,
               AnomalyEnricher enricher,
               DetectionOrchestrator orchestrator,
               HttpAnomalySink sink,
               Clock clock) {
    _agentName = agentName;
    _checkIntervalMs = checkIntervalMs;
    _source = source;
    _enricher = enricher;
    _orchestrator = orchestrator;
    _recordFactory = new AnomalyRecordFactory(orchestrator.catalog(), orchestrator.lookbackWindowMs());
    _sink = sink;
    _clock = clock;
    _detectionScheduler = Executors.newSingleThreadScheduledExecutor(new AnomalyAgentThreadFactory("AnomalyAgent"));
    _latestRecords = Collections.emptyList();
    _latestResult = null;
    _lastCycleTimeMs = -1L;
  }

  /**
   * Start the periodic detection. The first cycle runs immediately.
   */
  public void startUp() {
    LOG.info("Starting {} with {} metric(s), checking every {} ms.", _agentName,
             _orchestrator.catalog().metrics().size(), _checkIntervalMs);
    _detectionScheduler.scheduleAtFixedRate(this::runScheduledDetection, 0, _checkIntervalMs, TimeUnit.MILLISECONDS);
  }

  private void runScheduledDetection() {
    try {
      runDetection();
    } catch (RuntimeException e) {
      // Keep the schedule alive, the next cycle may succeed.
      LOG.error("Unexpected error in detection cycle.", e);
    }
    LOG.info("Waiting {} ms before next check.", _checkIntervalMs);
  }

  /**
   * Run a detection cycle now, publish its anomalies and make them the latest ones.
   * Scheduled and on-demand cycles are serialized, so the latest records always come from the latest cycle.
   *
   * @return The records of the anomalies of the cycle.
   */
  public synchronized List<AnomalyRecord> runDetection() {
    DetectionCycleResult result = _orchestrator.runOneCycle();
    List<AnomalyRecord> records = _recordFactory.toRecords(result.anomalies());
    _latestResult = result;
    _latestRecords = Collections.unmodifiableList(records);
    _lastCycleTimeMs = _clock.millis();
    if (records.isEmpty()) {
      LOG.info("No anomalies detected in this cycle.");
    } else {
      _sink.publish(records);
      logSummary(result.anomalies());
    }
    return _latestRecords;
  }

  static Map<Severity, List<Anomaly>> bySeverity(List<Anomaly> anomalies) {
    Map<Severity, List<Anomaly>> bySeverity = new EnumMap<>(Severity.class);
    for (Anomaly anomaly : anomalies) {
      bySeverity.computeIfAbsent(anomaly.severity(), s -> new ArrayList<>()).add(anomaly);
    }
    return bySeverity;
  }

  private void logSummary(List<Anomaly> anomalies) {
    Map<Severity, List<Anomaly>> bySeverity = bySeverity(anomalies);
    LOG.info("--- Anomalies Summary ---");
    for (Severity severity : new Severity[]{Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW}) {
      List<Anomaly> ofSeverity = bySeverity.get(severity);
      if (ofSeverity != null) {
        LOG.info("{}: {} anomalies", severity, ofSeverity.size());
      }
    }
    List<Anomaly> critical = bySeverity.get(Severity.CRITICAL);
    if (critical != null) {
      LOG.warn("CRITICAL anomalies detected:");
      for (Anomaly anomaly : critical) {
        LOG.warn("  - {}: {}", anomaly.metricName(), anomaly.description());
      }
    }
  }

  public String agentName() {
    return _agentName;
  }

  /**
   * @return The records of the latest cycle, empty before the first cycle.
   */
  public List<AnomalyRecord> latestRecords() {
    return _latestRecords;
  }

  /**
   * @return The result of the latest cycle, or {@code null} before the first cycle.
   */
  public DetectionCycleResult latestResult() {
    return _latestResult;
  }

  /**
   * @return The time the latest cycle ended, or -1 before the first cycle.
   */
  public long lastCycleTimeMs() {
    return _lastCycleTimeMs;
  }

  public MetricCatalog catalog() {
    return _orchestrator.catalog();
  }

  public DetectionOrchestrator orchestrator() {
    return _orchestrator;
  }

  /**
   * @return The name of the configured detectors, enabled or not.
   */
  public List<String> detectorNames() {
    List<String> names = new ArrayList<>();
    for (Detector detector : _orchestrator.detectors()) {
      names.add(detector.name());
    }
    return names;
  }

  /**
   * Stop the periodic detection and release the source, the enricher and the sink.
   */
  public void shutdown() {
    LOG.info("Shutting down {}.", _agentName);
    _detectionScheduler.shutdownNow();
    try {
      _detectionScheduler.awaitTermination(SCHEDULER_SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while waiting for the detection scheduler to shutdown.");
      Thread.currentThread().interrupt();
    }
    _orchestrator.shutdown();
    closeQuietly(_source, "time series source");
    closeQuietly(_enricher, "anomaly enricher");
    closeQuietly(_sink, "anomaly sink");
    LOG.info("{} stopped.", _agentName);
  }

  private static void closeQuietly(AutoCloseable closeable, String name) {
    if (closeable == null) {
      return;
    }
    try {
      closeable.close();
    } catch (Exception e) {
      LOG.warn("Failed to close the {}.", name, e);
    }
  }
}
