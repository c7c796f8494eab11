/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.common.config.AbstractConfig;
import com.linkedin.anomalyagent.common.config.ConfigDef;
import java.util.Map;

import static com.linkedin.anomalyagent.common.config.ConfigDef.Range.atLeast;


public class PatternDetectorConfig extends AbstractConfig {
  /**
   * <code>pattern.detector.enabled</code>
   */
  public static final String PATTERN_DETECTOR_ENABLED_CONFIG = "pattern.detector.enabled";
  public static final boolean DEFAULT_PATTERN_DETECTOR_ENABLED = true;
  public static final String PATTERN_DETECTOR_ENABLED_DOC = "True if the pattern detector should run on the watched "
      + "metrics.";

  /**
   * <code>pattern.window.size</code>
   */
  public static final String PATTERN_WINDOW_SIZE_CONFIG = "pattern.window.size";
  public static final int DEFAULT_PATTERN_WINDOW_SIZE = 24;
  public static final String PATTERN_WINDOW_SIZE_DOC = "The number of samples of the trailing window used for the moving "
      + "average and the moving standard deviation. Half of it is the width of the window smoothing the gradient for "
      + "the trend reversal detection. Series shorter than twice the window size are skipped.";

  /**
   * <code>pattern.deviation.threshold</code>
   */
  public static final String PATTERN_DEVIATION_THRESHOLD_CONFIG = "pattern.deviation.threshold";
  public static final double DEFAULT_PATTERN_DEVIATION_THRESHOLD = 2.5;
  public static final String PATTERN_DEVIATION_THRESHOLD_DOC = "A sample deviates from the moving average if its "
      + "distance to it, in moving standard deviations, is greater than this threshold.";

  /**
   * <code>pattern.trend.neighborhood.size</code>
   */
  public static final String PATTERN_TREND_NEIGHBORHOOD_SIZE_CONFIG = "pattern.trend.neighborhood.size";
  public static final int DEFAULT_PATTERN_TREND_NEIGHBORHOOD_SIZE = 5;
  public static final String PATTERN_TREND_NEIGHBORHOOD_SIZE_DOC = "The number of gradient values averaged before and "
      + "after a sign flip of the smoothed gradient to tell a peak or a trough from noise.";

  private static final ConfigDef CONFIG = define(new ConfigDef());

  PatternDetectorConfig(Map<?, ?> originals) {
    super(CONFIG, originals);
  }

  /**
   * Define configs for the pattern detector.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the pattern detector.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(PATTERN_DETECTOR_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_PATTERN_DETECTOR_ENABLED,
                            ConfigDef.Importance.MEDIUM,
                            PATTERN_DETECTOR_ENABLED_DOC)
                    .define(PATTERN_WINDOW_SIZE_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_PATTERN_WINDOW_SIZE,
                            atLeast(2),
                            ConfigDef.Importance.MEDIUM,
                            PATTERN_WINDOW_SIZE_DOC)
                    .define(PATTERN_DEVIATION_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_PATTERN_DEVIATION_THRESHOLD,
                            atLeast(0.0),
                            ConfigDef.Importance.MEDIUM,
                            PATTERN_DEVIATION_THRESHOLD_DOC)
                    .define(PATTERN_TREND_NEIGHBORHOOD_SIZE_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_PATTERN_TREND_NEIGHBORHOOD_SIZE,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            PATTERN_TREND_NEIGHBORHOOD_SIZE_DOC);
  }
}
