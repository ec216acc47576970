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

import static com.google.common.base.Strings.isNullOrEmpty;
import static java.util.Objects.requireNonNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.net.HostAndPort;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Uses the service account credentials Kubernetes mounts into every pod. The token is read on each
 * call since projected service account tokens are rotated by the kubelet.
 */
public class InClusterConfigurer implements Configurer {

  static final String SERVICE_HOST_ENV = "KUBERNETES_SERVICE_HOST";
  static final String SERVICE_PORT_ENV = "KUBERNETES_SERVICE_PORT";

  private static final Path SERVICE_ACCOUNT_DIR =
      Paths.get("/var/run/secrets/kubernetes.io/serviceaccount");

  private final Map<String, String> env;
  private final Path tokenPath;
  private final Path caCertPath;

  public InClusterConfigurer() {
    this(System.getenv(), SERVICE_ACCOUNT_DIR.resolve("token"), SERVICE_ACCOUNT_DIR.resolve("ca.crt"));
  }

  @VisibleForTesting
  InClusterConfigurer(Map<String, String> env, Path tokenPath, Path caCertPath) {
    this.env = requireNonNull(env, "env");
    this.tokenPath = requireNonNull(tokenPath, "tokenPath");
    this.caCertPath = requireNonNull(caCertPath, "caCertPath");
  }

  @Override
  public Config getConfig() throws IOException {
    final String host = env.get(SERVICE_HOST_ENV);
    final String port = env.get(SERVICE_PORT_ENV);
    if (isNullOrEmpty(host) || isNullOrEmpty(port)) {
      throw new IOException("unable to load in-cluster configuration, "
                            + SERVICE_HOST_ENV + " and " + SERVICE_PORT_ENV + " must be defined");
    }

    final HostAndPort hostAndPort;
    try {
      hostAndPort = HostAndPort.fromParts(host, Integer.parseInt(port));
    } catch (IllegalArgumentException e) {
      throw new IOException("invalid in-cluster API server address " + host + ":" + port, e);
    }

    final String token = new String(Files.readAllBytes(tokenPath), StandardCharsets.UTF_8).trim();
    if (!Files.isReadable(caCertPath)) {
      throw new IOException("in-cluster CA certificate " + caCertPath + " is not readable");
    }

    return new ConfigBuilder()
        .withMasterUrl("https://" + hostAndPort)
        .withOauthToken(token)
        .withCaCertFile(caCertPath.toString())
        .build();
  }
}
