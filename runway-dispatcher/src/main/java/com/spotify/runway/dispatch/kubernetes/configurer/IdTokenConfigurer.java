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

import com.spotify.runway.dispatch.TokenGetter;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Presents the runner's own identity token as bearer token. The API server must be set up to trust
 * the issuer of that token.
 */
public class IdTokenConfigurer implements Configurer {

  private final String server;
  private final Optional<String> caCertData;
  private final TokenGetter tokenGetter;

  private IdTokenConfigurer(String server, Optional<String> caCertData, TokenGetter tokenGetter) {
    this.server = requireNonNull(server, "server");
    this.caCertData = requireNonNull(caCertData, "caCertData");
    this.tokenGetter = requireNonNull(tokenGetter, "tokenGetter");
  }

  public static IdTokenConfigurer create(String server, Optional<String> caCert, TokenGetter tokenGetter) {
    return new IdTokenConfigurer(
        server, caCert.map(ca -> X509CertConfigurer.validBase64("ca_cert", ca)), tokenGetter);
  }

  @Override
  public Config getConfig() throws IOException {
    final String token;
    try {
      token = tokenGetter.getToken().toCompletableFuture().get();
    } catch (ExecutionException e) {
      throw new IOException("failed to get runner ID token for kube server " + server, e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      final InterruptedIOException interrupted =
          new InterruptedIOException("interrupted while getting runner ID token for kube server " + server);
      interrupted.initCause(e);
      throw interrupted;
    }

    final ConfigBuilder builder = new ConfigBuilder()
        .withMasterUrl(server)
        .withOauthToken(token);
    caCertData.ifPresent(builder::withCaCertData);
    return builder.build();
  }
}
