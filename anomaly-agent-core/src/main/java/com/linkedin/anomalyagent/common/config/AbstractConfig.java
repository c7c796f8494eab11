/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.anomalyagent.common.config;

import com.linkedin.anomalyagent.common.AnomalyAgentConfigurable;
import com.linkedin.anomalyagent.common.config.types.Password;
import com.linkedin.anomalyagent.common.utils.Utils;
import com.linkedin.anomalyagent.exception.AnomalyAgentException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A convenient base class for configurations to extend.
 * <p>
 * This class holds both the original configuration that was provided as well as the parsed values.
 */
public class AbstractConfig {

  public static final String NL = System.lineSeparator();

  private final Logger _log = LoggerFactory.getLogger(getClass());

  /* the original values passed in by the user */
  private final Map<String, ?> _originals;

  /* the parsed values */
  private final Map<String, Object> _values;

  private final ConfigDef _definition;

  @SuppressWarnings("unchecked")
  public AbstractConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
    /* check that all the keys are really strings */
    for (Map.Entry<?, ?> entry : originals.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new ConfigException(entry.getKey().toString(), entry.getValue(), "Key must be a string.");
      }
    }
    _originals = (Map<String, ?>) originals;
    _values = definition.parse(_originals);
    _definition = definition;
    if (doLog) {
      logAll();
    }
  }

  public AbstractConfig(ConfigDef definition, Map<?, ?> originals) {
    this(definition, originals, false);
  }

  protected Object get(String key) {
    if (!_values.containsKey(key)) {
      throw new ConfigException(String.format("Unknown configuration '%s'", key));
    }
    return _values.get(key);
  }

  public Integer getInt(String key) {
    return (Integer) get(key);
  }

  public Long getLong(String key) {
    return (Long) get(key);
  }

  public Double getDouble(String key) {
    return (Double) get(key);
  }

  @SuppressWarnings("unchecked")
  public List<String> getList(String key) {
    return (List<String>) get(key);
  }

  public Boolean getBoolean(String key) {
    return (Boolean) get(key);
  }

  public String getString(String key) {
    return (String) get(key);
  }

  public Password getPassword(String key) {
    return (Password) get(key);
  }

  public Class<?> getClass(String key) {
    return (Class<?>) get(key);
  }

  /**
   * @return Configs that were supplied but are not part of this definition.
   */
  public Set<String> unused() {
    Set<String> keys = new HashSet<>(_originals.keySet());
    keys.removeAll(_definition.names());
    return keys;
  }

  /**
   * @return A mutable copy of the original configs.
   */
  public Map<String, Object> originals() {
    return new HashMap<>(_originals);
  }

  /**
   * @return An unmodifiable view of the parsed values.
   */
  public Map<String, ?> values() {
    return Collections.unmodifiableMap(_values);
  }

  private void logAll() {
    StringBuilder b = new StringBuilder();
    b.append(getClass().getSimpleName());
    b.append(" values: ");
    b.append(NL);

    for (Map.Entry<String, Object> entry : new TreeMap<>(_values).entrySet()) {
      b.append('\t');
      b.append(entry.getKey());
      b.append(" = ");
      b.append(entry.getValue());
      b.append(NL);
    }
    _log.info(b.toString());
  }

  /**
   * Log warnings for any unused configurations
   */
  public void logUnused() {
    for (String key : unused()) {
      _log.warn("The configuration '{}' was supplied but isn't a known config.", key);
    }
  }

  /**
   * Get a configured instance of the give class specified by the given configuration key. If the object implements
   * {@link AnomalyAgentConfigurable} configure it using the configuration.
   *
   * @param key The configuration key for the class
   * @param t The interface the class should implement
   * @param configOverrides Configuration overrides to use.
   * @param <T> The type of the configured instance to be returned.
   * @return A configured instance of the class, or {@code null} if no class is configured.
   */
  public <T> T getConfiguredInstance(String key, Class<T> t, Map<String, Object> configOverrides)
      throws AnomalyAgentException {
    Class<?> c = getClass(key);
    if (c == null) {
      return null;
    }
    Object o = Utils.newInstance(c);
    if (!t.isInstance(o)) {
      throw new AnomalyAgentException(c.getName() + " is not an instance of " + t.getName());
    }
    if (o instanceof AnomalyAgentConfigurable) {
      Map<String, Object> configPairs = originals();
      configPairs.putAll(configOverrides);
      ((AnomalyAgentConfigurable) o).configure(configPairs);
    }
    return t.cast(o);
  }

  /**
   * Get a list of configured instances of the given class specified by the given configuration key. The configuration
   * may specify either {@code null} or an empty string to indicate no configured instances. In both cases, this method
   * returns an empty list to indicate no configured instances.
   * @param key The configuration key for the class
   * @param t The interface the class should implement
   * @param configOverrides Configuration overrides to use, typically objects shared with the instances.
   * @param <T> The type of the configured instances to be returned.
   * @return The list of configured instances, in the order of the configuration.
   */
  public <T> List<T> getConfiguredInstances(String key, Class<T> t, Map<String, Object> configOverrides)
      throws AnomalyAgentException {
    List<String> klasses = getList(key);
    List<T> objects = new ArrayList<>();
    if (klasses == null) {
      return objects;
    }
    Map<String, Object> configPairs = originals();
    configPairs.putAll(configOverrides);
    for (String klass : klasses) {
      Object o;
      try {
        o = Utils.newInstance(klass, t);
      } catch (ClassNotFoundException e) {
        throw new AnomalyAgentException(klass + " ClassNotFoundException exception occurred", e);
      } catch (ClassCastException e) {
        throw new AnomalyAgentException(klass + " is not an instance of " + t.getName(), e);
      }
      if (o instanceof AnomalyAgentConfigurable) {
        ((AnomalyAgentConfigurable) o).configure(configPairs);
      }
      objects.add(t.cast(o));
    }
    return objects;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return _originals.equals(((AbstractConfig) o)._originals);
  }

  @Override
  public int hashCode() {
    return _originals.hashCode();
  }
}
