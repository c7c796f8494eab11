/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.orchestrator;

/**
 * The steps of a detection cycle.
 */
public enum DetectionState {
  IDLE, FETCHING, DETECTING, AGGREGATED, ENRICHING, DONE
}
