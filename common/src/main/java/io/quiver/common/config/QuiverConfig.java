/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.quiver.common.config;

import java.util.Map.Entry;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;

import io.quiver.common.exceptions.UserException;

/**
 * Immutable view of the engine configuration, backed by a TypeSafe
 * {@link Config}.
 */
public class QuiverConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(QuiverConfig.class);

  private final Config config;

  @VisibleForTesting
  public QuiverConfig(Config config) {
    this.config = config;
    logger.trace("Given Config object is:\n{}", config.root().render(ConfigRenderOptions.concise()));
  }

  /**
   * Creates a QuiverConfig object using the default config file names.
   * @return The new QuiverConfig object.
   */
  public static QuiverConfig create() {
    return create(null);
  }

  /**
   * QuiverConfig loads up configuration information from the classpath,
   * utilizing the configuration fallbacks provided by the TypeSafe
   * configuration library. The order of precedence is:
   * <ul>
   * <li>the given properties, if any,</li>
   * <li>JVM system properties,</li>
   * <li>a single copy of "{@code quiver-override.conf}",</li>
   * <li>all copies of "{@code quiver-module.conf}", merged in an
   *     indeterminate order,</li>
   * <li>a single copy of "{@code quiver-default.conf}".</li>
   * </ul>
   *
   * @param overriderProps optional properties applied on top of everything else
   * @return a resolved configuration
   */
  public static QuiverConfig create(Properties overriderProps) {
    final StringBuilder logString = new StringBuilder();
    final Stopwatch watch = Stopwatch.createStarted();

    // 1. Defaults and per-module files. parseResources merges every copy found.
    Config fallback = ConfigFactory.parseResources(CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME);
    logString.append("Base Configuration: ").append(fallback.origin().description()).append("\n");
    Config modules = ConfigFactory.parseResources(CommonConstants.CONFIG_MODULE_RESOURCE_PATHNAME);
    if (!modules.isEmpty()) {
      logString.append("Module Configuration: ").append(modules.origin().description()).append("\n");
      fallback = modules.withFallback(fallback);
    }

    // 2. Overrides file, then system properties.
    Config overrides = ConfigFactory.parseResources(CommonConstants.CONFIG_OVERRIDE_RESOURCE_PATHNAME);
    if (!overrides.isEmpty()) {
      logString.append("Override File: ").append(overrides.origin().description()).append("\n");
    }
    Config effectiveConfig = ConfigFactory.systemProperties()
        .withFallback(overrides)
        .withFallback(fallback);

    // 3. Apply any overriding properties.
    if (overriderProps != null) {
      logString.append("Overridden Properties:\n");
      for (Entry<Object, Object> entry : overriderProps.entrySet()) {
        logString.append("\t-").append(entry.getKey()).append(" = ").append(entry.getValue()).append("\n");
      }
      effectiveConfig = ConfigFactory.parseProperties(overriderProps).withFallback(effectiveConfig);
    }

    logger.info("Configuration file(s) identified in {}ms.\n{}",
        watch.elapsed(TimeUnit.MILLISECONDS),
        logString);
    return new QuiverConfig(effectiveConfig.resolve());
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
  }

  public int getInt(String path) {
    try {
      return config.getInt(path);
    } catch (ConfigException e) {
      throw invalid(path, e);
    }
  }

  public long getLong(String path) {
    try {
      return config.getLong(path);
    } catch (ConfigException e) {
      throw invalid(path, e);
    }
  }

  public long getBytes(String path) {
    try {
      return config.getBytes(path);
    } catch (ConfigException e) {
      throw invalid(path, e);
    }
  }

  public boolean getBoolean(String path) {
    try {
      return config.getBoolean(path);
    } catch (ConfigException e) {
      throw invalid(path, e);
    }
  }

  public String getString(String path) {
    try {
      return config.getString(path);
    } catch (ConfigException e) {
      throw invalid(path, e);
    }
  }

  private static UserException invalid(String path, ConfigException e) {
    return UserException.validationError()
        .message("Invalid or missing configuration value: %s", e.getMessage())
        .addContext("Configuration path", path)
        .build(logger);
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
