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

package com.spotify.runway.dispatch;

import com.spotify.runway.dispatch.docker.DockerJobDispatcher;
import com.spotify.runway.dispatch.ecs.EcsJobDispatcher;
import com.spotify.runway.dispatch.kubernetes.KubernetesJobDispatcher;
import com.spotify.runway.dispatch.local.JobExecutor;
import com.spotify.runway.dispatch.local.LocalJobDispatcher;
import com.spotify.runway.model.PluginData;
import java.io.Closeable;
import java.util.Optional;

/**
 * Launches a single job on a compute substrate.
 *
 * <p>One dispatcher is built per process from {@link PluginData} and is immutable afterwards.
 * Construction validates all configuration and throws
 * {@link com.spotify.runway.model.InvalidPluginDataException} on any problem.
 */
public interface JobDispatcher extends Closeable {

  /**
   * Submits a launch request for a job.
   *
   * @param jobId the job to run
   * @param token bearer token handed to the launched job, never inspected
   * @return an identifier assigned by the substrate, opaque to the caller
   * @throws DispatchException if credentials could not be acquired or the substrate rejected the
   *                           request
   */
  String dispatchJob(String jobId, String token) throws DispatchException;

  static JobDispatcher kubernetes(PluginData pluginData,
                                  Optional<String> serviceDiscoveryHost,
                                  TokenGetter tokenGetter) {
    return KubernetesJobDispatcher.create(pluginData, serviceDiscoveryHost, tokenGetter);
  }

  static JobDispatcher docker(PluginData pluginData, Optional<String> serviceDiscoveryHost) {
    return DockerJobDispatcher.create(pluginData, serviceDiscoveryHost);
  }

  static JobDispatcher ecs(PluginData pluginData, Optional<String> serviceDiscoveryHost) {
    return EcsJobDispatcher.create(pluginData, serviceDiscoveryHost);
  }

  /**
   * Creates a dispatcher that runs jobs inside this process. For local development only: the
   * returned dispatcher reports success before the job has started and never reports its failure.
   */
  static JobDispatcher local(PluginData pluginData,
                             Optional<String> serviceDiscoveryHost,
                             JobExecutor jobExecutor) {
    return LocalJobDispatcher.create(pluginData, serviceDiscoveryHost, jobExecutor);
  }

  class DispatchException extends Exception {

    public DispatchException(String message) {
      super(message);
    }

    public DispatchException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
