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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Optional;
import org.junit.Test;

public class DispatcherSettingsTest {

  private static final Config CONFIG = ConfigFactory.parseString(
      "runway.dispatcher {\n"
      + "  type = kubernetes\n"
      + "  service-discovery-host = \"discovery.example.com\"\n"
      + "  plugin-data {\n"
      + "    api_url = \"http://api\"\n"
      + "    image = \"runner:1\"\n"
      + "  }\n"
      + "}\n");

  @Test
  public void shouldLoadFromConfig() {
    final DispatcherSettings settings = DispatcherSettings.fromConfig(CONFIG, ImmutableMap.of());
    assertThat(settings.dispatcherType(), is("kubernetes"));
    assertThat(settings.serviceDiscoveryHost(), is(Optional.of("discovery.example.com")));
    assertThat(settings.pluginData(),
        is(PluginData.of(ImmutableMap.of("api_url", "http://api", "image", "runner:1"))));
  }

  @Test
  public void environmentShouldOverridePluginData() {
    final DispatcherSettings settings = DispatcherSettings.fromConfig(CONFIG, ImmutableMap.of(
        "RUNWAY_DISPATCHER_DATA_IMAGE", "runner:2",
        "RUNWAY_DISPATCHER_DATA_AUTH_TYPE", "in_cluster"));
    assertThat(settings.pluginData().get("image"), is(Optional.of("runner:2")));
    assertThat(settings.pluginData().get("auth_type"), is(Optional.of("in_cluster")));
    assertThat(settings.pluginData().get("api_url"), is(Optional.of("http://api")));
  }

  @Test
  public void shouldLoadWithoutPluginData() {
    final Config config = ConfigFactory.parseString("runway.dispatcher.type = local");
    final DispatcherSettings settings = DispatcherSettings.fromConfig(config, ImmutableMap.of());
    assertThat(settings.serviceDiscoveryHost(), is(Optional.empty()));
    assertThat(settings.pluginData(), is(PluginData.empty()));
  }

  @Test
  public void referenceConfigShouldLeaveTypeUnset() {
    final Config config = ConfigFactory.defaultReference().resolve();
    final InvalidPluginDataException e = assertThrows(InvalidPluginDataException.class,
        () -> DispatcherSettings.fromConfig(config, ImmutableMap.of()));
    assertThat(e.getMessage(), containsString("runway.dispatcher.type"));
  }

  @Test
  public void shouldFailWithoutDispatcherConfig() {
    final InvalidPluginDataException e = assertThrows(InvalidPluginDataException.class,
        () -> DispatcherSettings.fromConfig(ConfigFactory.empty(), ImmutableMap.of()));
    assertThat(e.getMessage(), containsString("runway.dispatcher"));
  }

  @Test
  public void shouldFailOnBlankType() {
    final Config config = ConfigFactory.parseString("runway.dispatcher.type = \"  \"");
    assertThrows(InvalidPluginDataException.class,
        () -> DispatcherSettings.fromConfig(config, ImmutableMap.of()));
  }
}
