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

package com.spotify.runway.dispatch.docker;

import static java.util.Objects.requireNonNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.spotify.docker.client.DefaultDockerClient;
import com.spotify.docker.client.DockerClient;
import com.spotify.docker.client.auth.FixedRegistryAuthSupplier;
import com.spotify.docker.client.auth.RegistryAuthSupplier;
import com.spotify.docker.client.exceptions.DockerException;
import com.spotify.docker.client.messages.ContainerConfig;
import com.spotify.docker.client.messages.ContainerCreation;
import com.spotify.docker.client.messages.HostConfig;
import com.spotify.docker.client.messages.RegistryAuth;
import com.spotify.runway.dispatch.JobDispatcher;
import com.spotify.runway.dispatch.JobEnvironment;
import com.spotify.runway.model.InvalidPluginDataException;
import com.spotify.runway.model.PluginData;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs each job as a container on a Docker engine. Containers are removed by the engine once they
 * exit.
 */
public class DockerJobDispatcher implements JobDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(DockerJobDispatcher.class);

  private static final String OWNER = "docker job dispatcher";

  static final String HOST = "host";
  static final String IMAGE = "image";
  static final String API_URL = "api_url";
  static final String BIND_PATH = "bind_path";
  static final String EXTRA_HOSTS = "extra_hosts";
  static final String MEMORY_LIMIT = "memory_limit";
  static final String LOCAL_IMAGE = "local_image";
  static final String REGISTRY_USERNAME = "registry_username";
  static final String REGISTRY_PASSWORD = "registry_password";

  static final List<String> REQUIRED_FIELDS = ImmutableList.of(HOST, IMAGE, API_URL);

  // Credentials only ever come from plugin data, never from the local docker config
  @VisibleForTesting
  static final RegistryAuthSupplier NO_REGISTRY_AUTH = new FixedRegistryAuthSupplier(null, null);

  private final DockerClient client;
  private final String image;
  private final String apiUrl;
  private final boolean localImage;
  private final Optional<RegistryAuth> registryAuth;
  private final List<String> binds;
  private final List<String> extraHosts;
  private final Optional<String> memoryLimit;
  private final long memoryLimitBytes;
  private final List<String> discoveryProtocolHosts;

  @VisibleForTesting
  DockerJobDispatcher(DockerClient client, PluginData pluginData, Optional<String> serviceDiscoveryHost) {
    this.client = requireNonNull(client, "client");
    pluginData.checkRequired(OWNER, REQUIRED_FIELDS);

    this.image = pluginData.require(IMAGE);
    this.apiUrl = pluginData.require(API_URL);
    this.localImage = pluginData.getBoolean(LOCAL_IMAGE);
    this.registryAuth = registryAuth(pluginData);
    this.binds = pluginData.getList(BIND_PATH);
    this.extraHosts = pluginData.getList(EXTRA_HOSTS);
    this.memoryLimit = pluginData.get(MEMORY_LIMIT).filter(limit -> !limit.trim().isEmpty());
    this.memoryLimitBytes = memoryLimit.map(MemorySize::parseBytes).orElse(0L);
    this.discoveryProtocolHosts = JobEnvironment.discoveryProtocolHosts(serviceDiscoveryHost, pluginData);

    LOG.info("Created docker job dispatcher: image={}, local_image={}, registry_auth={}",
             image, localImage, registryAuth.isPresent());
  }

  public static DockerJobDispatcher create(PluginData pluginData, Optional<String> serviceDiscoveryHost) {
    final String host = pluginData.get(HOST)
        .orElseThrow(() -> new InvalidPluginDataException(OWNER + " requires plugin data '" + HOST + "' field"));
    final DockerClient client;
    try {
      client = DefaultDockerClient.builder()
          .uri(URI.create(host))
          .registryAuthSupplier(NO_REGISTRY_AUTH)
          .build();
    } catch (IllegalArgumentException e) {
      throw new InvalidPluginDataException("invalid docker host '" + host + "'", e);
    }

    try {
      return new DockerJobDispatcher(client, pluginData, serviceDiscoveryHost);
    } catch (RuntimeException e) {
      client.close();
      throw e;
    }
  }

  private static Optional<RegistryAuth> registryAuth(PluginData pluginData) {
    final Optional<String> username = pluginData.get(REGISTRY_USERNAME).filter(s -> !s.isEmpty());
    final Optional<String> password = pluginData.get(REGISTRY_PASSWORD).filter(s -> !s.isEmpty());
    if (username.isEmpty() || password.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(RegistryAuth.builder()
        .username(username.get())
        .password(password.get())
        .build());
  }

  @Override
  public String dispatchJob(String jobId, String token) throws DispatchException {
    final JobEnvironment environment =
        JobEnvironment.create(jobId, token, apiUrl, discoveryProtocolHosts, memoryLimit);

    try {
      if (!localImage) {
        pullImage();
      }

      final ContainerCreation creation = client.createContainer(containerConfig(environment));
      client.startContainer(creation.id());
      LOG.info("Started container {} for job {}", creation.id(), jobId);
      return creation.id();
    } catch (DockerException e) {
      throw new DispatchException(OWNER + " failed to run for job " + jobId + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DispatchException(OWNER + " was interrupted while running job " + jobId, e);
    }
  }

  private void pullImage() throws DockerException, InterruptedException {
    LOG.debug("Pulling image {}", image);
    if (registryAuth.isPresent()) {
      client.pull(image, registryAuth.get());
    } else {
      client.pull(image);
    }
  }

  @VisibleForTesting
  ContainerConfig containerConfig(JobEnvironment environment) {
    final HostConfig.Builder hostConfig = HostConfig.builder()
        .autoRemove(true)
        .binds(binds)
        .extraHosts(extraHosts);
    if (memoryLimitBytes > 0) {
      hostConfig.memory(memoryLimitBytes).memoryReservation(memoryLimitBytes);
    }

    return ContainerConfig.builder()
        .image(image)
        .env(toEnvList(environment.toEnv()))
        .hostConfig(hostConfig.build())
        .build();
  }

  private static List<String> toEnvList(Map<String, String> env) {
    return env.entrySet().stream()
        .map(e -> e.getKey() + "=" + e.getValue())
        .collect(Collectors.toList());
  }

  @Override
  public void close() {
    client.close();
  }
}
