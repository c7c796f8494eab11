/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.detector;

import com.linkedin.anomalyagent.common.config.AbstractConfig;
import com.linkedin.anomalyagent.common.config.ConfigDef;
import java.util.Map;

import static com.linkedin.anomalyagent.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.anomalyagent.common.config.ConfigDef.Range.between;


public class StatisticalDetectorConfig extends AbstractConfig {
  /**
   * <code>statistical.detector.enabled</code>
   */
  public static final String STATISTICAL_DETECTOR_ENABLED_CONFIG = "statistical.detector.enabled";
  public static final boolean DEFAULT_STATISTICAL_DETECTOR_ENABLED = true;
  public static final String STATISTICAL_DETECTOR_ENABLED_DOC = "True if the statistical detector should run on the "
      + "watched metrics.";

  /**
   * <code>statistical.min.samples</code>
   */
  public static final String STATISTICAL_MIN_SAMPLES_CONFIG = "statistical.min.samples";
  public static final int DEFAULT_STATISTICAL_MIN_SAMPLES = 10;
  public static final String STATISTICAL_MIN_SAMPLES_DOC = "The minimum number of samples a series must have for the "
      + "statistical detector to check it. Shorter series are skipped.";

  /**
   * <code>statistical.zscore.threshold</code>
   */
  public static final String STATISTICAL_ZSCORE_THRESHOLD_CONFIG = "statistical.zscore.threshold";
  public static final double DEFAULT_STATISTICAL_ZSCORE_THRESHOLD = 3.0;
  public static final String STATISTICAL_ZSCORE_THRESHOLD_DOC = "A sample is an outlier if its distance to the mean of "
      + "the series, in population standard deviations, is greater than this threshold.";

  /**
   * <code>statistical.iqr.multiplier</code>
   */
  public static final String STATISTICAL_IQR_MULTIPLIER_CONFIG = "statistical.iqr.multiplier";
  public static final double DEFAULT_STATISTICAL_IQR_MULTIPLIER = 1.5;
  public static final String STATISTICAL_IQR_MULTIPLIER_DOC = "The multiplier k of the interquartile range. A sample is "
      + "an outlier if it is below Q1 - k * IQR or above Q3 + k * IQR.";

  private static final ConfigDef CONFIG = define(new ConfigDef());

  StatisticalDetectorConfig(Map<?, ?> originals) {
    super(CONFIG, originals);
  }

  /**
   * Define configs for the statistical detector.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the statistical detector.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(STATISTICAL_DETECTOR_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_STATISTICAL_DETECTOR_ENABLED,
                            ConfigDef.Importance.MEDIUM,
                            STATISTICAL_DETECTOR_ENABLED_DOC)
                    .define(STATISTICAL_MIN_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_STATISTICAL_MIN_SAMPLES,
                            atLeast(2),
                            ConfigDef.Importance.LOW,
                            STATISTICAL_MIN_SAMPLES_DOC)
                    .define(STATISTICAL_ZSCORE_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_STATISTICAL_ZSCORE_THRESHOLD,
                            atLeast(0.0),
                            ConfigDef.Importance.MEDIUM,
                            STATISTICAL_ZSCORE_THRESHOLD_DOC)
                    .define(STATISTICAL_IQR_MULTIPLIER_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_STATISTICAL_IQR_MULTIPLIER,
                            between(0.0, 10.0),
                            ConfigDef.Importance.MEDIUM,
                            STATISTICAL_IQR_MULTIPLIER_DOC);
  }
}
