/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.common.config.AbstractConfig;
import com.linkedin.anomalyagent.common.config.ConfigDef;
import java.util.Map;


public class ThresholdDetectorConfig extends AbstractConfig {
  /**
   * <code>threshold.detector.enabled</code>
   */
  public static final String THRESHOLD_DETECTOR_ENABLED_CONFIG = "threshold.detector.enabled";
  public static final boolean DEFAULT_THRESHOLD_DETECTOR_ENABLED = true;
  public static final String THRESHOLD_DETECTOR_ENABLED_DOC = "True if the threshold detector should check the watched "
      + "metrics against the bounds of the metric definitions file.";

  private static final ConfigDef CONFIG = define(new ConfigDef());

  ThresholdDetectorConfig(Map<?, ?> originals) {
    super(CONFIG, originals);
  }

  /**
   * Define configs for the threshold detector.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the threshold detector.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(THRESHOLD_DETECTOR_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_THRESHOLD_DETECTOR_ENABLED,
                            ConfigDef.Importance.MEDIUM,
                            THRESHOLD_DETECTOR_ENABLED_DOC);
  }
}
