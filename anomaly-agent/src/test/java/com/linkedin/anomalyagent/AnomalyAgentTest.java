/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent;

import com.codahale.metrics.MetricRegistry;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.linkedin.anomalyagent.config.AnomalyAgentConfig;
import com.linkedin.anomalyagent.detector.Detector;
import com.linkedin.anomalyagent.detector.SpikeDetector;
import com.linkedin.anomalyagent.metricdef.MetricCatalog;
import com.linkedin.anomalyagent.metricdef.MetricDefinition;
import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.AnomalyKind;
import com.linkedin.anomalyagent.model.Sample;
import com.linkedin.anomalyagent.model.Series;
import com.linkedin.anomalyagent.model.SeriesKind;
import com.linkedin.anomalyagent.model.Severity;
import com.linkedin.anomalyagent.orchestrator.DetectionOrchestrator;
import com.linkedin.anomalyagent.sink.AnomalyRecord;
import com.linkedin.anomalyagent.sink.HttpAnomalySink;
import com.linkedin.anomalyagent.source.TimeSeriesSource;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.easymock.EasyMock;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.anomalyagent.AnomalyAgentUtils.MIN_TO_MS;
import static org.easymock.EasyMock.anyLong;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 * Unit test for {@link AnomalyAgent}.
 */
public class AnomalyAgentTest {
  private static final String METRIC = "node_cpu_usage_percent";
  private static final long START_TIME_MS = 1700000000000L;
  private static final long NOW_MS = START_TIME_MS + 60 * MIN_TO_MS;
  private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(NOW_MS), ZoneOffset.UTC);
  private static final MetricCatalog CATALOG = new MetricCatalog(
      Collections.singletonList(new MetricDefinition(METRIC, SeriesKind.GAUGE, "percent", null, null)),
      Collections.emptyMap());

  private TimeSeriesSource _source;
  private RecordingSink _sink;

  @Before
  public void setUp() {
    _source = EasyMock.mock(TimeSeriesSource.class);
    _sink = new RecordingSink();
  }

  private static Series series(double... values) {
    List<Sample> samples = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      samples.add(new Sample(START_TIME_MS + i * MIN_TO_MS, values[i], Map.of("instance", "host-1:9100")));
    }
    return new Series(METRIC, SeriesKind.GAUGE, samples);
  }

  private AnomalyAgent agent() {
    SpikeDetector spikeDetector = new SpikeDetector();
    spikeDetector.configure(Collections.emptyMap());
    List<Detector> detectors = Collections.singletonList(spikeDetector);
    DetectionOrchestrator orchestrator = new DetectionOrchestrator(_source, detectors, null, CATALOG, 60 * MIN_TO_MS,
                                                                   MIN_TO_MS, 1000L, 1000L, new MetricRegistry(),
                                                                   CLOCK);
    return new AnomalyAgent("test-agent", MIN_TO_MS, _source, null, orchestrator, _sink, CLOCK);
  }

  @Test
  public void testRunDetectionPublishesAndKeepsLatestRecords() throws Exception {
    expect(_source.fetchRange(eq(METRIC), anyLong(), anyLong(), anyLong()))
        .andReturn(series(100, 100, 100, 100, 300, 100, 100));
    _source.close();
    EasyMock.expectLastCall();
    replay(_source);
    AnomalyAgent agent = agent();
    assertTrue(agent.latestRecords().isEmpty());
    assertNull(agent.latestResult());
    assertEquals(-1L, agent.lastCycleTimeMs());

    List<AnomalyRecord> records = agent.runDetection();

    assertEquals(2, records.size());
    assertEquals("critical", records.get(0).severity());
    assertEquals("percent", records.get(0).context().unit());
    assertEquals(records, agent.latestRecords());
    assertEquals(2, agent.latestResult().anomalies().size());
    assertEquals(NOW_MS, agent.lastCycleTimeMs());
    assertEquals(1, _sink.bodies().size());
    JsonObject batch = JsonParser.parseString(_sink.bodies().get(0)).getAsJsonObject();
    assertEquals(2, batch.getAsJsonArray("anomalies").size());
    agent.shutdown();
    verify(_source);
  }

  @Test
  public void testNothingPublishedWithoutAnomalies() throws Exception {
    expect(_source.fetchRange(eq(METRIC), anyLong(), anyLong(), anyLong()))
        .andReturn(series(100, 101, 100, 99, 100, 100, 101));
    _source.close();
    EasyMock.expectLastCall();
    replay(_source);
    AnomalyAgent agent = agent();

    assertTrue(agent.runDetection().isEmpty());

    assertTrue(_sink.bodies().isEmpty());
    assertEquals(NOW_MS, agent.lastCycleTimeMs());
    agent.shutdown();
  }

  @Test
  public void testShutdownClosesSource() throws Exception {
    _source.close();
    EasyMock.expectLastCall();
    replay(_source);
    AnomalyAgent agent = agent();

    assertEquals(Collections.singletonList(SpikeDetector.NAME), agent.detectorNames());
    assertEquals("test-agent", agent.agentName());
    agent.shutdown();
    verify(_source);
  }

  @Test
  public void testConcurrentDetectionsAreSerialized() throws Exception {
    expect(_source.fetchRange(eq(METRIC), anyLong(), anyLong(), anyLong()))
        .andReturn(series(100, 100, 100, 100, 300, 100, 100)).times(2);
    _source.close();
    EasyMock.expectLastCall();
    replay(_source);
    AnomalyAgent agent = agent();
    _sink.expectLockOf(agent);

    Thread scheduled = new Thread(agent::runDetection);
    scheduled.start();
    agent.runDetection();
    scheduled.join();

    assertEquals(2, _sink.bodies().size());
    assertEquals(List.of(true, true), _sink.sentUnderLock());
    agent.shutdown();
    verify(_source);
  }

  @Test
  public void testBySeverity() {
    Anomaly critical = anomaly(Severity.CRITICAL);
    Anomaly low = anomaly(Severity.LOW);
    Anomaly otherLow = anomaly(Severity.LOW);

    Map<Severity, List<Anomaly>> bySeverity = AnomalyAgent.bySeverity(List.of(low, critical, otherLow));

    assertEquals(List.of(critical), bySeverity.get(Severity.CRITICAL));
    assertEquals(List.of(low, otherLow), bySeverity.get(Severity.LOW));
    assertNull(bySeverity.get(Severity.HIGH));
  }

  private static Anomaly anomaly(Severity severity) {
    return new Anomaly(METRIC, SpikeDetector.NAME, AnomalyKind.SPIKE, severity, 0.5, 1.0, null, NOW_MS, "", null, null);
  }

  /**
   * A sink that records the batches instead of sending them.
   */
  private static class RecordingSink extends HttpAnomalySink {
    private final List<String> _bodies = Collections.synchronizedList(new ArrayList<>());
    private final List<Boolean> _sentUnderLock = Collections.synchronizedList(new ArrayList<>());
    private volatile Object _lock;

    RecordingSink() {
      super(new AnomalyAgentConfig(new Properties(), false), CLOCK);
    }

    @Override
    protected int send(String body) {
      _bodies.add(body);
      if (_lock != null) {
        _sentUnderLock.add(Thread.holdsLock(_lock));
      }
      return 200;
    }

    void expectLockOf(Object lock) {
      _lock = lock;
    }

    List<Boolean> sentUnderLock() {
      return _sentUnderLock;
    }

    List<String> bodies() {
      return _bodies;
    }
  }
}
