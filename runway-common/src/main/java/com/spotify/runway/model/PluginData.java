/*-
 * -\-\-
 * Spotify Runway Common
 * --
 * Copyright (C) 2023 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.runway.model;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Flat, immutable string-keyed configuration handed to a job dispatcher once at construction.
 */
public final class PluginData {

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private static final PluginData EMPTY = new PluginData(ImmutableMap.of());

  private final ImmutableMap<String, String> values;

  private PluginData(Map<String, String> values) {
    this.values = ImmutableMap.copyOf(values);
  }

  public static PluginData empty() {
    return EMPTY;
  }

  public static PluginData of(Map<String, String> values) {
    return new PluginData(requireNonNull(values, "values"));
  }

  /**
   * Flattens a config object into plugin data. Nested paths are joined with dots, values are
   * rendered as strings.
   */
  public static PluginData fromConfig(Config config) {
    final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    config.entrySet().forEach(entry -> {
      final String key = String.join(".", com.typesafe.config.ConfigUtil.splitPath(entry.getKey()));
      builder.put(key, String.valueOf(entry.getValue().unwrapped()));
    });
    return new PluginData(builder.build());
  }

  /**
   * Collects every variable that starts with {@code prefix}. The prefix is stripped and the rest of
   * the name is lower-cased, so {@code PREFIX_API_URL} becomes {@code api_url}.
   */
  public static PluginData fromEnvironment(String prefix, Map<String, String> env) {
    requireNonNull(prefix, "prefix");
    final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    env.forEach((name, value) -> {
      if (name.startsWith(prefix) && name.length() > prefix.length()) {
        builder.put(name.substring(prefix.length()).toLowerCase(Locale.ROOT), value);
      }
    });
    return new PluginData(builder.build());
  }

  /**
   * Returns a copy where entries of {@code overrides} replace entries with the same key.
   */
  public PluginData merge(PluginData overrides) {
    final Map<String, String> merged = new HashMap<>(values);
    merged.putAll(overrides.values);
    return new PluginData(merged);
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  public Optional<String> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  public String get(String key, String defaultValue) {
    return values.getOrDefault(key, defaultValue);
  }

  public String require(String key) {
    final String value = values.get(key);
    if (value == null) {
      throw new InvalidPluginDataException("plugin data requires '" + key + "' field");
    }
    return value;
  }

  /**
   * Verifies that every key in {@code keys} is present.
   *
   * @param owner what is asking, used in the error message
   * @throws InvalidPluginDataException naming the first missing key
   */
  public void checkRequired(String owner, Collection<String> keys) {
    for (String key : keys) {
      if (!values.containsKey(key)) {
        throw new InvalidPluginDataException(owner + " requires plugin data '" + key + "' field");
      }
    }
  }

  /**
   * Splits a comma separated value. Entries are trimmed and empty entries dropped; a missing key
   * yields an empty list.
   */
  public List<String> getList(String key) {
    return get(key).map(LIST_SPLITTER::splitToList).orElse(List.of());
  }

  /**
   * Reads a boolean flag, defaulting to false when absent.
   */
  public boolean getBoolean(String key) {
    return getOptionalBoolean(key).orElse(false);
  }

  /**
   * Reads a boolean if present. Accepts true/false in any case as well as t/f and 1/0.
   *
   * @throws InvalidPluginDataException if the value is present but not a boolean
   */
  public Optional<Boolean> getOptionalBoolean(String key) {
    return get(key).map(value -> {
      switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "true":
        case "t":
        case "1":
          return true;
        case "false":
        case "f":
        case "0":
          return false;
        default:
          throw new InvalidPluginDataException(
              "failed to parse '" + key + "' as a boolean: " + value);
      }
    });
  }

  public Map<String, String> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return values.equals(((PluginData) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  // Values may hold secrets, only the keys are printed.
  @Override
  public String toString() {
    return "PluginData{keys=" + values.keySet() + "}";
  }
}
