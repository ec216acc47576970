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

import static java.util.Objects.requireNonNull;

import com.spotify.runway.dispatch.local.JobExecutor;
import com.spotify.runway.model.DispatcherSettings;
import com.spotify.runway.model.InvalidPluginDataException;
import com.spotify.runway.model.PluginData;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects and builds the {@link JobDispatcher} named by the dispatcher type.
 */
public class JobDispatcherFactory {

  private static final Logger LOG = LoggerFactory.getLogger(JobDispatcherFactory.class);

  public static final String KUBERNETES = "kubernetes";
  public static final String DOCKER = "docker";
  public static final String ECS = "ecs";
  public static final String LOCAL = "local";

  private final TokenGetter tokenGetter;
  private final JobExecutor jobExecutor;

  /**
   * @param tokenGetter identity token source for the {@code runner_id_token} kubernetes auth type
   * @param jobExecutor in-process executor used by the {@code local} dispatcher
   */
  public JobDispatcherFactory(TokenGetter tokenGetter, JobExecutor jobExecutor) {
    this.tokenGetter = requireNonNull(tokenGetter, "tokenGetter");
    this.jobExecutor = requireNonNull(jobExecutor, "jobExecutor");
  }

  public JobDispatcher create(DispatcherSettings settings) {
    return create(settings.dispatcherType(), settings.pluginData(), settings.serviceDiscoveryHost());
  }

  public JobDispatcher create(String dispatcherType, PluginData pluginData,
                              Optional<String> serviceDiscoveryHost) {
    LOG.info("Creating job dispatcher of type {} with plugin data {}", dispatcherType, pluginData);
    switch (dispatcherType) {
      case KUBERNETES:
        return JobDispatcher.kubernetes(pluginData, serviceDiscoveryHost, tokenGetter);
      case DOCKER:
        return JobDispatcher.docker(pluginData, serviceDiscoveryHost);
      case ECS:
        return JobDispatcher.ecs(pluginData, serviceDiscoveryHost);
      case LOCAL:
        return JobDispatcher.local(pluginData, serviceDiscoveryHost, jobExecutor);
      default:
        throw new InvalidPluginDataException("job dispatcher type '" + dispatcherType + "' is not supported");
    }
  }
}
