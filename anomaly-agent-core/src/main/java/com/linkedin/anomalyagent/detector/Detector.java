/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.common.AnomalyAgentConfigurable;
import com.linkedin.anomalyagent.model.Anomaly;
import com.linkedin.anomalyagent.model.Series;
import java.util.List;


/**
 * An algorithm that finds anomalies in the series of a metric.
 * <p>
 * Detectors are instantiated by reflection from the <code>detector.classes</code> configuration and configured once.
 * {@link #detect(Series)} is a pure function of the series and the configuration: it keeps no state across
 * invocations, never reorders the series and returns an empty list when the series is too short or degenerate.
 */
public interface Detector extends AnomalyAgentConfigurable {

  /**
   * @return The name of the detector, e.g. <code>spike_detector</code>. Metric definitions refer to detectors by name.
   */
  String name();

  /**
   * @return {@code true} if the detector is enabled by configuration.
   */
  boolean isEnabled();

  /**
   * Find the anomalies in the given series.
   *
   * @param series The series to check.
   * @return The anomalies found in the series, possibly empty, never {@code null}.
   */
  List<Anomaly> detect(Series series);
}
