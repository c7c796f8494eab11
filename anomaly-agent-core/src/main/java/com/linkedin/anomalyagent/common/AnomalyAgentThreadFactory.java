/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalyagent.common;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


public class AnomalyAgentThreadFactory implements ThreadFactory {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyAgentThreadFactory.class);
  private final String _name;
  private final boolean _daemon;
  private final AtomicInteger _id = new AtomicInteger(0);

  public AnomalyAgentThreadFactory(String name) {
    this(name, true);
  }

  public AnomalyAgentThreadFactory(String name, boolean daemon) {
    _name = name;
    _daemon = daemon;
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread t = new Thread(r, _name + "-" + _id.getAndIncrement());
    t.setDaemon(_daemon);
    t.setUncaughtExceptionHandler((t1, e) -> LOG.error("Uncaught exception in " + t1.getName() + ": ", e));
    return t;
  }
}
