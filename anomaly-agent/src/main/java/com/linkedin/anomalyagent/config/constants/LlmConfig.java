/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.config.constants;

import com.linkedin.anomalyagent.common.config.ConfigDef;
import java.util.concurrent.TimeUnit;

import static com.linkedin.anomalyagent.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.anomalyagent.common.config.ConfigDef.Range.between;


/**
 * A class to keep the configs of the LLM anomaly enricher.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class LlmConfig {
  /**
   * Environment variable read when <code>llm.api.key</code> is not set.
   */
  public static final String LLM_API_KEY_ENV = "GROQ_API_KEY";

  /**
   * <code>llm.enabled</code>
   */
  public static final String LLM_ENABLED_CONFIG = "llm.enabled";
  public static final boolean DEFAULT_LLM_ENABLED = true;
  public static final String LLM_ENABLED_DOC = "Whether the anomalies of a cycle are sent to the LLM for analysis. "
      + "The enricher stays disabled without an API key.";

  /**
   * <code>llm.api.url</code>
   */
  public static final String LLM_API_URL_CONFIG = "llm.api.url";
  public static final String DEFAULT_LLM_API_URL = "https://api.groq.com/openai/v1/chat/completions";
  public static final String LLM_API_URL_DOC = "The OpenAI compatible chat completions endpoint.";

  /**
   * <code>llm.api.key</code>
   */
  public static final String LLM_API_KEY_CONFIG = "llm.api.key";
  public static final String LLM_API_KEY_DOC = "The bearer token of the chat completions endpoint. Defaults to the "
      + LLM_API_KEY_ENV + " environment variable.";

  /**
   * <code>llm.model</code>
   */
  public static final String LLM_MODEL_CONFIG = "llm.model";
  public static final String DEFAULT_LLM_MODEL = "openai/gpt-oss-120b";
  public static final String LLM_MODEL_DOC = "The model asked to analyze the anomalies.";

  /**
   * <code>llm.temperature</code>
   */
  public static final String LLM_TEMPERATURE_CONFIG = "llm.temperature";
  public static final double DEFAULT_LLM_TEMPERATURE = 0.3;
  public static final String LLM_TEMPERATURE_DOC = "The sampling temperature of the completions.";

  /**
   * <code>llm.max.tokens</code>
   */
  public static final String LLM_MAX_TOKENS_CONFIG = "llm.max.tokens";
  public static final int DEFAULT_LLM_MAX_TOKENS = 500;
  public static final String LLM_MAX_TOKENS_DOC = "The maximum number of tokens of an analysis.";

  /**
   * <code>llm.top.p</code>
   */
  public static final String LLM_TOP_P_CONFIG = "llm.top.p";
  public static final double DEFAULT_LLM_TOP_P = 0.9;
  public static final String LLM_TOP_P_DOC = "The nucleus sampling probability mass of the completions.";

  /**
   * <code>llm.request.timeout.ms</code>
   */
  public static final String LLM_REQUEST_TIMEOUT_MS_CONFIG = "llm.request.timeout.ms";
  public static final int DEFAULT_LLM_REQUEST_TIMEOUT_MS = (int) TimeUnit.SECONDS.toMillis(30);
  public static final String LLM_REQUEST_TIMEOUT_MS_DOC = "The connect and socket timeout in milliseconds of the "
      + "analysis of a single anomaly.";

  private LlmConfig() {
  }

  /**
   * Define configs for the LLM enricher.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the LLM enricher.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(LLM_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_LLM_ENABLED,
                            ConfigDef.Importance.MEDIUM,
                            LLM_ENABLED_DOC)
                    .define(LLM_API_URL_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_LLM_API_URL,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.MEDIUM,
                            LLM_API_URL_DOC)
                    .define(LLM_API_KEY_CONFIG,
                            ConfigDef.Type.PASSWORD,
                            null,
                            ConfigDef.Importance.HIGH,
                            LLM_API_KEY_DOC)
                    .define(LLM_MODEL_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_LLM_MODEL,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.MEDIUM,
                            LLM_MODEL_DOC)
                    .define(LLM_TEMPERATURE_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_LLM_TEMPERATURE,
                            between(0, 2),
                            ConfigDef.Importance.LOW,
                            LLM_TEMPERATURE_DOC)
                    .define(LLM_MAX_TOKENS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_LLM_MAX_TOKENS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            LLM_MAX_TOKENS_DOC)
                    .define(LLM_TOP_P_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_LLM_TOP_P,
                            between(0, 1),
                            ConfigDef.Importance.LOW,
                            LLM_TOP_P_DOC)
                    .define(LLM_REQUEST_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_LLM_REQUEST_TIMEOUT_MS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            LLM_REQUEST_TIMEOUT_MS_DOC);
  }
}
