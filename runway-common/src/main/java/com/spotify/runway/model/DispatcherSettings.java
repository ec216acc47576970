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

import com.spotify.runway.util.ConfigUtil;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Which job dispatcher to run and the plugin data to build it from.
 */
public final class DispatcherSettings {

  static final String DISPATCHER_PATH = "runway.dispatcher";
  static final String TYPE = "type";
  static final String SERVICE_DISCOVERY_HOST = "service-discovery-host";
  static final String PLUGIN_DATA = "plugin-data";

  public static final String ENV_PLUGIN_DATA_PREFIX = "RUNWAY_DISPATCHER_DATA_";

  private final String dispatcherType;
  private final Optional<String> serviceDiscoveryHost;
  private final PluginData pluginData;

  public DispatcherSettings(String dispatcherType, Optional<String> serviceDiscoveryHost,
                            PluginData pluginData) {
    this.dispatcherType = requireNonNull(dispatcherType, "dispatcherType");
    this.serviceDiscoveryHost = requireNonNull(serviceDiscoveryHost, "serviceDiscoveryHost");
    this.pluginData = requireNonNull(pluginData, "pluginData");
  }

  /**
   * Loads settings from the default config stack and the process environment.
   */
  public static DispatcherSettings load() {
    return fromConfig(ConfigFactory.load(), System.getenv());
  }

  /**
   * Reads {@code runway.dispatcher} from {@code config}. Plugin data found in {@code env} under
   * {@link #ENV_PLUGIN_DATA_PREFIX} takes precedence over plugin data in the config file.
   */
  public static DispatcherSettings fromConfig(Config config, Map<String, String> env) {
    if (!config.hasPath(DISPATCHER_PATH)) {
      throw new InvalidPluginDataException("missing '" + DISPATCHER_PATH + "' configuration");
    }
    final Config dispatcher = config.getConfig(DISPATCHER_PATH);

    final String type = ConfigUtil.getNonEmptyString(dispatcher, TYPE)
        .orElseThrow(() -> new InvalidPluginDataException(
            "job dispatcher type is required at '" + DISPATCHER_PATH + "." + TYPE + "'"));

    final PluginData fileData = dispatcher.hasPath(PLUGIN_DATA)
        ? PluginData.fromConfig(dispatcher.getConfig(PLUGIN_DATA))
        : PluginData.empty();
    final PluginData envData = PluginData.fromEnvironment(ENV_PLUGIN_DATA_PREFIX, env);

    return new DispatcherSettings(
        type,
        ConfigUtil.getNonEmptyString(dispatcher, SERVICE_DISCOVERY_HOST),
        fileData.merge(envData));
  }

  public String dispatcherType() {
    return dispatcherType;
  }

  public Optional<String> serviceDiscoveryHost() {
    return serviceDiscoveryHost;
  }

  public PluginData pluginData() {
    return pluginData;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final DispatcherSettings that = (DispatcherSettings) o;
    return dispatcherType.equals(that.dispatcherType)
           && serviceDiscoveryHost.equals(that.serviceDiscoveryHost)
           && pluginData.equals(that.pluginData);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dispatcherType, serviceDiscoveryHost, pluginData);
  }

  @Override
  public String toString() {
    return "DispatcherSettings{"
           + "dispatcherType='" + dispatcherType + '\''
           + ", serviceDiscoveryHost=" + serviceDiscoveryHost
           + ", pluginData=" + pluginData
           + '}';
  }
}
