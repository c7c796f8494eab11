/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.anomalyagent.common.config.types;

/**
 * Wraps a secret configuration value, such as an API key, so it is never printed when the configuration is logged.
 */
public class Password {

  public static final String HIDDEN = "[hidden]";

  private final String _value;

  public Password(String value) {
    _value = value;
  }

  @Override
  public int hashCode() {
    return _value.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Password)) {
      return false;
    }
    return _value.equals(((Password) obj)._value);
  }

  @Override
  public String toString() {
    return HIDDEN;
  }

  /**
   * @return The secret in clear text.
   */
  public String value() {
    return _value;
  }
}
