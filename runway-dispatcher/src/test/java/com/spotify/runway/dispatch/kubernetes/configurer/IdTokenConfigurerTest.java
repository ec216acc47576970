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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.when;

import com.spotify.runway.dispatch.TokenGetter;
import com.spotify.runway.model.InvalidPluginDataException;
import io.fabric8.kubernetes.client.Config;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class IdTokenConfigurerTest {

  private static final String SERVER = "https://kube.example.com";

  @Mock private TokenGetter tokenGetter;

  @Test
  public void shouldUseRunnerToken() throws IOException {
    when(tokenGetter.getToken())
        .thenReturn(CompletableFuture.completedFuture("token-1"))
        .thenReturn(CompletableFuture.completedFuture("token-2"));
    final IdTokenConfigurer configurer = IdTokenConfigurer.create(SERVER, Optional.of("Y2E="), tokenGetter);

    final Config config = configurer.getConfig();
    assertThat(config.getMasterUrl(), containsString(SERVER));
    assertThat(config.getOauthToken(), is("token-1"));
    assertThat(config.getCaCertData(), is("Y2E="));

    // asked again on every call
    assertThat(configurer.getConfig().getOauthToken(), is("token-2"));
  }

  @Test
  public void shouldWrapTokenFailure() {
    final RuntimeException cause = new RuntimeException("token service unavailable");
    when(tokenGetter.getToken()).thenReturn(CompletableFuture.failedFuture(cause));
    final IdTokenConfigurer configurer = IdTokenConfigurer.create(SERVER, Optional.empty(), tokenGetter);

    final IOException e = assertThrows(IOException.class, configurer::getConfig);
    assertThat(e.getMessage(), is("failed to get runner ID token for kube server " + SERVER));
    assertThat(e.getCause(), is(cause));
  }

  @Test
  public void shouldRejectInvalidCaCertificate() {
    assertThrows(InvalidPluginDataException.class,
        () -> IdTokenConfigurer.create(SERVER, Optional.of("c?a"), tokenGetter));
  }
}
