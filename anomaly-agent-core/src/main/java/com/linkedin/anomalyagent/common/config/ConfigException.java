/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.anomalyagent.common.config;

/**
 * Thrown if the agent is started with an invalid configuration, either in the properties file or in the metric
 * definitions file.
 */
public class ConfigException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }

  public ConfigException(String name, Object value, String message) {
    super("Invalid value " + value + " for configuration " + name + (message == null ? "" : ": " + message));
  }
}
