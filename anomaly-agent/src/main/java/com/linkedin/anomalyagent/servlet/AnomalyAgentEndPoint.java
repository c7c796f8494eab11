/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.servlet;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;


public enum AnomalyAgentEndPoint {
  HEALTH,
  ANOMALIES,
  DETECTORS,
  METRICS,
  ANALYZE;

  private static final List<AnomalyAgentEndPoint> CACHED_VALUES = List.of(values());
  private static final List<AnomalyAgentEndPoint> GET_ENDPOINTS = Arrays.asList(HEALTH,
                                                                                ANOMALIES,
                                                                                DETECTORS,
                                                                                METRICS);
  private static final List<AnomalyAgentEndPoint> POST_ENDPOINTS = Collections.singletonList(ANALYZE);

  public static List<AnomalyAgentEndPoint> getEndpoints() {
    return Collections.unmodifiableList(GET_ENDPOINTS);
  }

  public static List<AnomalyAgentEndPoint> postEndpoints() {
    return Collections.unmodifiableList(POST_ENDPOINTS);
  }

  /**
   * @return The path of the endpoint, relative to the servlet, e.g. <code>/health</code>.
   */
  public String path() {
    return "/" + name().toLowerCase();
  }

  /**
   * @param path The path of a request, relative to the servlet.
   * @return The endpoint of the given path, or {@code null} if there is none.
   */
  public static AnomalyAgentEndPoint forPath(String path) {
    if (path == null) {
      return null;
    }
    for (AnomalyAgentEndPoint endPoint : CACHED_VALUES) {
      if (endPoint.path().equalsIgnoreCase(path)) {
        return endPoint;
      }
    }
    return null;
  }

  /**
   * @return Cached values of the enum.
   */
  public static List<AnomalyAgentEndPoint> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }
}
