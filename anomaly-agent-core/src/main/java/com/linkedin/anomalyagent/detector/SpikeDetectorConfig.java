/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.common.config.AbstractConfig;
import com.linkedin.anomalyagent.common.config.ConfigDef;
import java.util.Map;

import static com.linkedin.anomalyagent.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.anomalyagent.common.config.ConfigDef.Range.between;


public class SpikeDetectorConfig extends AbstractConfig {
  /**
   * <code>spike.detector.enabled</code>
   */
  public static final String SPIKE_DETECTOR_ENABLED_CONFIG = "spike.detector.enabled";
  public static final boolean DEFAULT_SPIKE_DETECTOR_ENABLED = true;
  public static final String SPIKE_DETECTOR_ENABLED_DOC = "True if the spike detector should run on the watched metrics.";

  /**
   * <code>spike.min.change.percent</code>
   */
  public static final String SPIKE_MIN_CHANGE_PERCENT_CONFIG = "spike.min.change.percent";
  public static final double DEFAULT_SPIKE_MIN_CHANGE_PERCENT = 50.0;
  public static final String SPIKE_MIN_CHANGE_PERCENT_DOC = "The minimum absolute percent change between two consecutive "
      + "samples for the spike detector to report a spike (increase) or a drop (decrease). For example, with the default "
      + "of 50, a change from 100 to 150 or from 100 to 50 is reported.";

  /**
   * <code>spike.sensitivity</code>
   */
  public static final String SPIKE_SENSITIVITY_CONFIG = "spike.sensitivity";
  public static final double DEFAULT_SPIKE_SENSITIVITY = 0.8;
  public static final String SPIKE_SENSITIVITY_DOC = "The factor, within [0.0, 1.0], applied to the confidence of every "
      + "spike. The confidence before damping is the absolute percent change divided by 100, capped to 1.0.";

  private static final ConfigDef CONFIG = define(new ConfigDef());

  SpikeDetectorConfig(Map<?, ?> originals) {
    super(CONFIG, originals);
  }

  /**
   * Define configs for the spike detector.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the spike detector.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(SPIKE_DETECTOR_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_SPIKE_DETECTOR_ENABLED,
                            ConfigDef.Importance.MEDIUM,
                            SPIKE_DETECTOR_ENABLED_DOC)
                    .define(SPIKE_MIN_CHANGE_PERCENT_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_SPIKE_MIN_CHANGE_PERCENT,
                            atLeast(0.0),
                            ConfigDef.Importance.MEDIUM,
                            SPIKE_MIN_CHANGE_PERCENT_DOC)
                    .define(SPIKE_SENSITIVITY_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_SPIKE_SENSITIVITY,
                            between(0.0, 1.0),
                            ConfigDef.Importance.LOW,
                            SPIKE_SENSITIVITY_DOC);
  }
}
