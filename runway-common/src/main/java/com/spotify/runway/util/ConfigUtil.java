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

package com.spotify.runway.util;

import com.typesafe.config.Config;
import java.util.Optional;
import java.util.function.Function;

public class ConfigUtil {

  private ConfigUtil() {
    throw new UnsupportedOperationException();
  }

  /**
   * Optionally get a string.
   */
  public static Optional<String> getString(Config config, String path) {
    return get(config, config::getString, path);
  }

  /**
   * Optionally get a string, treating a blank value the same as a missing one.
   */
  public static Optional<String> getNonEmptyString(Config config, String path) {
    return getString(config, path).filter(value -> !value.isBlank());
  }

  /**
   * Optionally get a configuration value.
   */
  public static <T> Optional<T> get(Config config, Function<String, T> getter, String path) {
    if (!config.hasPath(path)) {
      return Optional.empty();
    }
    return Optional.of(getter.apply(path));
  }
}
