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

package com.spotify.runway.dispatch.local;

import static java.util.Objects.requireNonNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Closer;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.spotify.runway.dispatch.JobDispatcher;
import com.spotify.runway.dispatch.JobEnvironment;
import com.spotify.runway.model.PluginData;
import com.spotify.runway.util.CloserUtil;
import com.spotify.runway.util.MDCUtil;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs jobs inside the dispatching process, for local development.
 *
 * <p>{@link #dispatchJob} only hands the job to a background thread and returns {@value #EXTERNAL_ID}
 * right away, before the job has started. The background job is not tied to the calling thread:
 * interrupting the caller does not stop it, and if it fails the failure is logged and nothing
 * else. Callers cannot tell a running job from one that failed to start.
 */
public class LocalJobDispatcher implements JobDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(LocalJobDispatcher.class);

  private static final String OWNER = "local job dispatcher";

  static final String API_URL = "api_url";
  static final String EXTERNAL_ID = "local";

  private static final ThreadFactory THREAD_FACTORY = new ThreadFactoryBuilder()
      .setDaemon(true)
      .setNameFormat("local-job-executor-%d")
      .build();

  private final Closer closer = Closer.create();

  private final JobExecutor jobExecutor;
  private final Executor executor;
  private final String apiUrl;
  private final List<String> discoveryProtocolHosts;

  @VisibleForTesting
  LocalJobDispatcher(PluginData pluginData, Optional<String> serviceDiscoveryHost,
                     JobExecutor jobExecutor, ExecutorService executorService) {
    this.jobExecutor = requireNonNull(jobExecutor, "jobExecutor");
    pluginData.checkRequired(OWNER, ImmutableList.of(API_URL));
    this.apiUrl = pluginData.require(API_URL);
    this.discoveryProtocolHosts = JobEnvironment.discoveryProtocolHosts(serviceDiscoveryHost, pluginData);
    this.executor = MDCUtil.withMDC(CloserUtil.register(closer, executorService, "local-job-executor"));
    LOG.warn("Created local job dispatcher, jobs will run inside this process");
  }

  public static LocalJobDispatcher create(PluginData pluginData, Optional<String> serviceDiscoveryHost,
                                          JobExecutor jobExecutor) {
    pluginData.checkRequired(OWNER, ImmutableList.of(API_URL));
    return new LocalJobDispatcher(pluginData, serviceDiscoveryHost, jobExecutor,
                                  Executors.newCachedThreadPool(THREAD_FACTORY));
  }

  @Override
  public String dispatchJob(String jobId, String token) {
    final JobEnvironment environment =
        JobEnvironment.create(jobId, token, apiUrl, discoveryProtocolHosts, Optional.empty());
    executor.execute(() -> runJob(environment));
    LOG.info("Handed job {} to the local job executor", jobId);
    return EXTERNAL_ID;
  }

  private void runJob(JobEnvironment environment) {
    try {
      jobExecutor.execute(environment);
      LOG.info("Local job {} finished", environment.jobId());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.error("Local job {} was interrupted", environment.jobId(), e);
    } catch (Exception e) {
      LOG.error("Local job {} failed", environment.jobId(), e);
    }
  }

  @Override
  public void close() throws IOException {
    closer.close();
  }
}
