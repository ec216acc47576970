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

package com.spotify.runway.dispatch.ecs;

import static com.google.common.base.Strings.isNullOrEmpty;
import static java.util.Objects.requireNonNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spotify.runway.dispatch.JobDispatcher;
import com.spotify.runway.dispatch.JobEnvironment;
import com.spotify.runway.model.InvalidPluginDataException;
import com.spotify.runway.model.PluginData;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ecs.EcsClient;
import software.amazon.awssdk.services.ecs.model.AssignPublicIp;
import software.amazon.awssdk.services.ecs.model.ContainerOverride;
import software.amazon.awssdk.services.ecs.model.Failure;
import software.amazon.awssdk.services.ecs.model.KeyValuePair;
import software.amazon.awssdk.services.ecs.model.LaunchType;
import software.amazon.awssdk.services.ecs.model.RunTaskRequest;
import software.amazon.awssdk.services.ecs.model.RunTaskResponse;

/**
 * Runs each job as an ECS task from a preconfigured task definition.
 */
public class EcsJobDispatcher implements JobDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(EcsJobDispatcher.class);

  private static final String OWNER = "ecs job dispatcher";

  static final String API_URL = "api_url";
  static final String REGION = "region";
  static final String TASK_DEFINITION = "task_definition";
  static final String CLUSTER = "cluster";
  static final String SUBNETS = "subnets";
  static final String LAUNCH_TYPE = "launch_type";

  static final List<String> REQUIRED_FIELDS =
      ImmutableList.of(API_URL, REGION, TASK_DEFINITION, CLUSTER, SUBNETS, LAUNCH_TYPE);

  static final String MAIN_CONTAINER_NAME = "main";

  private static final Map<String, LaunchType> LAUNCH_TYPES = ImmutableMap.of(
      "ec2", LaunchType.EC2,
      "fargate", LaunchType.FARGATE);

  private final EcsClient client;
  private final String apiUrl;
  private final String taskDefinition;
  private final String cluster;
  private final List<String> subnets;
  private final LaunchType launchType;
  private final List<String> discoveryProtocolHosts;

  @VisibleForTesting
  EcsJobDispatcher(EcsClient client, PluginData pluginData, Optional<String> serviceDiscoveryHost) {
    this.client = requireNonNull(client, "client");
    pluginData.checkRequired(OWNER, REQUIRED_FIELDS);

    final String launchTypeValue = pluginData.require(LAUNCH_TYPE);
    this.launchType = LAUNCH_TYPES.get(launchTypeValue);
    if (launchType == null) {
      throw new InvalidPluginDataException(
          "ECS launch type '" + launchTypeValue + "' is not supported, expected one of " + LAUNCH_TYPES.keySet());
    }

    this.apiUrl = pluginData.require(API_URL);
    this.taskDefinition = pluginData.require(TASK_DEFINITION);
    this.cluster = pluginData.require(CLUSTER);
    this.subnets = pluginData.getList(SUBNETS);
    this.discoveryProtocolHosts = JobEnvironment.discoveryProtocolHosts(serviceDiscoveryHost, pluginData);

    LOG.info("Created ecs job dispatcher: cluster={}, task_definition={}, launch_type={}",
             cluster, taskDefinition, launchTypeValue);
  }

  public static EcsJobDispatcher create(PluginData pluginData, Optional<String> serviceDiscoveryHost) {
    pluginData.checkRequired(OWNER, REQUIRED_FIELDS);
    final EcsClient client = EcsClient.builder()
        .region(Region.of(pluginData.require(REGION)))
        .build();
    try {
      return new EcsJobDispatcher(client, pluginData, serviceDiscoveryHost);
    } catch (RuntimeException e) {
      client.close();
      throw e;
    }
  }

  @Override
  public String dispatchJob(String jobId, String token) throws DispatchException {
    final JobEnvironment environment =
        JobEnvironment.create(jobId, token, apiUrl, discoveryProtocolHosts, Optional.empty());

    final RunTaskResponse response;
    try {
      response = client.runTask(runTaskRequest(environment));
    } catch (SdkException e) {
      throw new DispatchException(OWNER + " failed to run for job " + jobId + ": " + e.getMessage(), e);
    }

    if (response.hasFailures() && !response.failures().isEmpty()) {
      throw new DispatchException(OWNER + " failed to run for job " + jobId + ": "
                                  + failureMessage(response.failures().get(0)));
    }
    if (!response.hasTasks() || response.tasks().isEmpty()) {
      throw new DispatchException(OWNER + " failed to run for job " + jobId + ": no ECS tasks were created");
    }

    final String taskArn = response.tasks().get(0).taskArn();
    LOG.info("Started ECS task {} for job {}", taskArn, jobId);
    return taskArn;
  }

  @VisibleForTesting
  RunTaskRequest runTaskRequest(JobEnvironment environment) {
    final List<KeyValuePair> env = environment.toEnv().entrySet().stream()
        .map(e -> KeyValuePair.builder().name(e.getKey()).value(e.getValue()).build())
        .collect(Collectors.toList());

    return RunTaskRequest.builder()
        .cluster(cluster)
        .taskDefinition(taskDefinition)
        .launchType(launchType)
        .count(1)
        .networkConfiguration(network -> network.awsvpcConfiguration(vpc -> vpc
            .subnets(subnets)
            .assignPublicIp(AssignPublicIp.DISABLED)))
        .overrides(overrides -> overrides.containerOverrides(ContainerOverride.builder()
            .name(MAIN_CONTAINER_NAME)
            .environment(env)
            .build()))
        .build();
  }

  @VisibleForTesting
  static String failureMessage(Failure failure) {
    final String cause = Stream.of(failure.reason(), failure.detail())
        .filter(part -> !isNullOrEmpty(part))
        .collect(Collectors.joining("; "));
    return cause.isEmpty() ? "failed to run task" : "failed to run task: " + cause;
  }

  @Override
  public void close() {
    client.close();
  }
}
