/*-
 * -\-\-
 * Spotify Runway Dispatcher
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

package com.spotify.runway.dispatch.kubernetes.configurer;

import static java.util.Objects.requireNonNull;

import com.spotify.runway.model.InvalidPluginDataException;
import io.fabric8.kubernetes.client.Config;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads connection settings from a kubeconfig file, using its current context. The file is parsed
 * on every call so that credential rotations written to it are picked up.
 */
public class ConfigFileConfigurer implements Configurer {

  private final Path path;

  private ConfigFileConfigurer(Path path) {
    this.path = requireNonNull(path, "path");
  }

  /**
   * @throws InvalidPluginDataException if there is no file at {@code path}
   */
  public static ConfigFileConfigurer create(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new InvalidPluginDataException("kube config file '" + path + "' does not exist");
    }
    return new ConfigFileConfigurer(path);
  }

  @Override
  public Config getConfig() throws IOException {
    try {
      final String contents = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
      return Config.fromKubeconfig(null, contents, path.toString());
    } catch (IOException | RuntimeException e) {
      throw new IOException("failed to load kube config from " + path, e);
    }
  }
}
