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

package com.spotify.runway.dispatch.kubernetes;

import static java.util.Objects.requireNonNull;

import com.spotify.runway.dispatch.kubernetes.configurer.Configurer;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.DefaultKubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.io.IOException;
import java.util.function.Function;

/**
 * A thin wrapper around the fabric8 {@link KubernetesClient} that exposes the one call the job
 * dispatcher makes, which is easier to mock than the fluent client.
 */
public interface KubernetesJobClient {

  /**
   * Creates a batch job and returns it as stored by the API server.
   */
  Job createJob(String namespace, Job job) throws IOException;

  static KubernetesJobClient of(Configurer configurer) {
    return new Impl(configurer, DefaultKubernetesClient::new);
  }

  class Impl implements KubernetesJobClient {

    private final Configurer configurer;
    private final Function<Config, KubernetesClient> clientFactory;

    Impl(Configurer configurer, Function<Config, KubernetesClient> clientFactory) {
      this.configurer = requireNonNull(configurer, "configurer");
      this.clientFactory = requireNonNull(clientFactory, "clientFactory");
    }

    @Override
    public Job createJob(String namespace, Job job) throws IOException {
      // A new client per call, the configurer may hand out fresh credentials each time
      final Config config = configurer.getConfig();
      try (KubernetesClient client = clientFactory.apply(config)) {
        return client.batch().v1().jobs().inNamespace(namespace).create(job);
      } catch (KubernetesClientException e) {
        throw new IOException("Failed to create Kubernetes job in namespace " + namespace, e);
      }
    }
  }
}
