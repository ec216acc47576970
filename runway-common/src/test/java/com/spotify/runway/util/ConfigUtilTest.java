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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Optional;
import org.junit.Test;

public class ConfigUtilTest {

  @Test
  public void getStringShouldReturnValue() {
    final Config config = ConfigFactory.parseMap(ImmutableMap.of("foo.bar", "baz"));
    assertThat(ConfigUtil.getString(config, "foo.bar"), is(Optional.of("baz")));
  }

  @Test
  public void getStringShouldReturnEmpty() {
    final Config config = ConfigFactory.empty();
    assertThat(ConfigUtil.getString(config, "foo.bar"), is(Optional.empty()));
  }

  @Test
  public void getNonEmptyStringShouldSkipBlankValue() {
    final Config config = ConfigFactory.parseMap(ImmutableMap.of("foo.bar", " "));
    assertThat(ConfigUtil.getNonEmptyString(config, "foo.bar"), is(Optional.empty()));
  }

  @Test
  public void getNonEmptyStringShouldReturnValue() {
    final Config config = ConfigFactory.parseMap(ImmutableMap.of("foo.bar", "baz"));
    assertThat(ConfigUtil.getNonEmptyString(config, "foo.bar"), is(Optional.of("baz")));
  }

  @Test
  public void getShouldReturnValue() {
    final Config config = ConfigFactory.parseMap(ImmutableMap.of("foo.bar", 17));
    assertThat(ConfigUtil.get(config, config::getInt, "foo.bar"), is(Optional.of(17)));
  }

  @Test
  public void getShouldReturnEmpty() {
    final Config config = ConfigFactory.empty();
    assertThat(ConfigUtil.get(config, config::getInt, "foo.bar"), is(Optional.empty()));
  }
}
