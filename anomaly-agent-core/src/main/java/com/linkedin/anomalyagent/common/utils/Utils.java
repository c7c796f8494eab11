/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.anomalyagent.common.utils;

import com.linkedin.anomalyagent.exception.AnomalyAgentException;
import java.util.function.Supplier;


public final class Utils {

  private Utils() {
  }

  /**
   * Instantiate the class
   * @param c The class to instantiate.
   * @param <T> The type of the instance.
   * @return A new instance created with the public no-argument constructor.
   */
  public static <T> T newInstance(Class<T> c) throws AnomalyAgentException {
    if (c == null) {
      throw new AnomalyAgentException("class cannot be null");
    }
    try {
      return c.getDeclaredConstructor().newInstance();
    } catch (NoSuchMethodException e) {
      throw new AnomalyAgentException("Could not find a public no-argument constructor for " + c.getName(), e);
    } catch (ReflectiveOperationException | RuntimeException e) {
      throw new AnomalyAgentException("Could not instantiate class " + c.getName(), e);
    }
  }

  /**
   * Look up the class by name and instantiate it.
   * @param klass class name
   * @param base super class of the class to be instantiated
   * @param <T> The type of the base class.
   * @return the new instance
   */
  public static <T> T newInstance(String klass, Class<T> base) throws ClassNotFoundException, AnomalyAgentException {
    return Utils.newInstance(Class.forName(klass, true, Utils.getContextOrAnomalyAgentClassLoader()).asSubclass(base));
  }

  /**
   * @return The context class loader of the current thread, or the class loader that loaded the agent if there is none.
   */
  public static ClassLoader getContextOrAnomalyAgentClassLoader() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    return cl == null ? Utils.class.getClassLoader() : cl;
  }

  /**
   * Checks that the specified object reference is not null and throws a customized IllegalArgumentException if it is.
   *
   * @param obj the object reference to check for nullity
   * @param errorMsg the message to be used in the event that a IllegalArgumentException is thrown
   * @param <T> the type of the reference
   * @return obj if not null
   */
  public static <T> T validateNotNull(T obj, String errorMsg) {
    if (obj == null) {
      throw new IllegalArgumentException(errorMsg);
    }
    return obj;
  }

  /**
   * Same as {@link #validateNotNull(Object, String)} with a lazily built message.
   *
   * @param obj the object reference to check for nullity
   * @param errorMsgSupplier supplier of the message to be used in the event that a IllegalArgumentException is thrown
   * @param <T> the type of the reference
   * @return obj if not null
   */
  public static <T> T validateNotNull(T obj, Supplier<String> errorMsgSupplier) {
    if (obj == null) {
      throw new IllegalArgumentException(errorMsgSupplier.get());
    }
    return obj;
  }
}
