/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.rollup.common;

import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Typed access to the configuration properties. */
public class RollupConfigBase {
  private static final Logger logger = LoggerFactory.getLogger(RollupConfigBase.class);

  private static volatile RollupConfigBase instance;

  private volatile Properties properties = System.getProperties();

  /**
   * RollupConfigBase is instantiated as a singleton.
   *
   * @return The instance.
   */
  public static RollupConfigBase getInstance() {
    if (instance == null) {
      synchronized (RollupConfigBase.class) {
        if (instance == null) {
          instance = new RollupConfigBase();
        }
      }
    }
    return instance;
  }

  public static void setProperties(Properties properties) {
    getInstance().properties = properties;
  }

  /**
   * Generic method to get property as integer.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as an integer.
   */
  private int getInt(String key, int defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new RuntimeException(e);
    }
  }

  /**
   * Generic method to get property as integer.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @param minimumValue allowed minimum value
   * @param maximumValue allowed maximum value
   * @return property as an integer.
   */
  public int getInt(String key, int defaultValue, int minimumValue, int maximumValue) {
    final int intValue = getInt(key, defaultValue);
    if (intValue < minimumValue || intValue > maximumValue) {
      throw new RuntimeException(
          String.format(
              "Value of parameter %s is out of allowed range [%d : %d]: %d",
              key, minimumValue, maximumValue, intValue));
    }
    return intValue;
  }

  /**
   * Generic method to get property as boolean.
   *
   * <p>Values other than "true" and "false" (case-insensitive) fall back to the default value.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property is missing or malformed.
   * @return property as a boolean.
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    final var trimmed = value.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    logger.warn("Invalid boolean value for {}: {}; using default {}", key, value, defaultValue);
    return defaultValue;
  }
}
