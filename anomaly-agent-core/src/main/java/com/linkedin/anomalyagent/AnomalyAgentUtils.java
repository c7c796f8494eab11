/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalUnit;


/**
 * Utils class for the anomaly agent.
 */
public final class AnomalyAgentUtils {
  public static final long SEC_TO_MS = 1000L;
  public static final long MIN_TO_MS = 60 * SEC_TO_MS;

  private AnomalyAgentUtils() {

  }

  /**
   * Format the timestamp from long to a human readable string.
   * @param timeMs Epoch time in milliseconds.
   * @return The ISO-8601 UTC representation of the given time, truncated to seconds, e.g. 2024-05-01T12:00:00Z.
   */
  public static String utcDateFor(long timeMs) {
    return utcDateFor(timeMs, 0, ChronoUnit.SECONDS);
  }

  /**
   * @param timeMs Epoch time in milliseconds.
   * @param precision Number of fractional digits of the second to print, -1 to print as many as needed.
   * @param roundTo The unit to truncate the time to.
   * @return The ISO-8601 UTC representation of the given time.
   */
  public static String utcDateFor(long timeMs, int precision, TemporalUnit roundTo) {
    DateTimeFormatter formatter = new DateTimeFormatterBuilder().appendInstant(precision).toFormatter();
    return formatter.format(Instant.ofEpochMilli(timeMs).truncatedTo(roundTo));
  }

  /**
   * Check if the given string is null or empty.
   * @param key Key name used for the error message.
   * @param value Value to check.
   */
  public static void ensureValidString(String key, String value) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException(String.format("%s cannot be null or empty.", key));
    }
  }
}
