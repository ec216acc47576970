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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.spotify.runway.model.PluginData;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The environment every launched job receives, whatever the substrate. Built fresh for each
 * dispatch since it carries the job token.
 */
public final class JobEnvironment {

  public static final String JOB_ID = "JOB_ID";
  public static final String JOB_TOKEN = "JOB_TOKEN";
  public static final String API_URL = "API_URL";
  public static final String DISCOVERY_PROTOCOL_HOSTS = "DISCOVERY_PROTOCOL_HOSTS";
  public static final String MEMORY_LIMIT = "MEMORY_LIMIT";

  static final String EXTRA_SERVICE_DISCOVERY_HOSTS = "extra_service_discovery_hosts";

  private final String jobId;
  private final String jobToken;
  private final String apiUrl;
  private final List<String> discoveryProtocolHosts;
  private final Optional<String> memoryLimit;

  private JobEnvironment(String jobId, String jobToken, String apiUrl,
                         List<String> discoveryProtocolHosts, Optional<String> memoryLimit) {
    this.jobId = jobId;
    this.jobToken = jobToken;
    this.apiUrl = requireNonNull(apiUrl, "apiUrl");
    this.discoveryProtocolHosts = ImmutableList.copyOf(discoveryProtocolHosts);
    this.memoryLimit = requireNonNull(memoryLimit, "memoryLimit");
  }

  /**
   * @throws IllegalArgumentException if the job id or token is empty
   */
  public static JobEnvironment create(String jobId, String jobToken, String apiUrl,
                                      List<String> discoveryProtocolHosts,
                                      Optional<String> memoryLimit) {
    checkArgument(!isNullOrEmpty(jobId), "job id must not be empty");
    checkArgument(!isNullOrEmpty(jobToken), "job token must not be empty");
    return new JobEnvironment(jobId, jobToken, apiUrl, discoveryProtocolHosts, memoryLimit);
  }

  /**
   * The service discovery host, if any, followed by the hosts listed in
   * {@code extra_service_discovery_hosts}.
   */
  public static List<String> discoveryProtocolHosts(Optional<String> serviceDiscoveryHost,
                                                    PluginData pluginData) {
    final ImmutableList.Builder<String> hosts = ImmutableList.builder();
    serviceDiscoveryHost.filter(host -> !host.isEmpty()).ifPresent(hosts::add);
    hosts.addAll(pluginData.getList(EXTRA_SERVICE_DISCOVERY_HOSTS));
    return hosts.build();
  }

  public String jobId() {
    return jobId;
  }

  public String jobToken() {
    return jobToken;
  }

  public String apiUrl() {
    return apiUrl;
  }

  public List<String> discoveryProtocolHosts() {
    return discoveryProtocolHosts;
  }

  public Optional<String> memoryLimit() {
    return memoryLimit;
  }

  /**
   * Environment variables in a stable order. {@link #MEMORY_LIMIT} is left out when no limit is
   * configured.
   */
  public Map<String, String> toEnv() {
    final Map<String, String> env = new LinkedHashMap<>();
    env.put(JOB_ID, jobId);
    env.put(JOB_TOKEN, jobToken);
    env.put(API_URL, apiUrl);
    env.put(DISCOVERY_PROTOCOL_HOSTS, String.join(",", discoveryProtocolHosts));
    memoryLimit.ifPresent(limit -> env.put(MEMORY_LIMIT, limit));
    return Collections.unmodifiableMap(env);
  }

  @Override
  public String toString() {
    return "JobEnvironment{"
           + "jobId='" + jobId + '\''
           + ", apiUrl='" + apiUrl + '\''
           + ", discoveryProtocolHosts=" + discoveryProtocolHosts
           + ", memoryLimit=" + memoryLimit
           + '}';
  }
}
