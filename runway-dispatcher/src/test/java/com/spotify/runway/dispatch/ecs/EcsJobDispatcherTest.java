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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableMap;
import com.spotify.runway.dispatch.JobDispatcher.DispatchException;
import com.spotify.runway.model.InvalidPluginDataException;
import com.spotify.runway.model.PluginData;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.ecs.EcsClient;
import software.amazon.awssdk.services.ecs.model.AssignPublicIp;
import software.amazon.awssdk.services.ecs.model.AwsVpcConfiguration;
import software.amazon.awssdk.services.ecs.model.ContainerOverride;
import software.amazon.awssdk.services.ecs.model.Failure;
import software.amazon.awssdk.services.ecs.model.KeyValuePair;
import software.amazon.awssdk.services.ecs.model.LaunchType;
import software.amazon.awssdk.services.ecs.model.RunTaskRequest;
import software.amazon.awssdk.services.ecs.model.RunTaskResponse;
import software.amazon.awssdk.services.ecs.model.Task;

@RunWith(JUnitParamsRunner.class)
public class EcsJobDispatcherTest {

  private static final String TASK_ARN = "arn:aws:ecs:us-east-1:123456789012:task/runners/0123456789abcdef";

  private static final Map<String, String> BASE_DATA = ImmutableMap.<String, String>builder()
      .put("api_url", "http://api.example.com")
      .put("region", "us-east-1")
      .put("task_definition", "runner:3")
      .put("cluster", "runners")
      .put("subnets", "subnet-a, subnet-b")
      .put("launch_type", "fargate")
      .build();

  private EcsClient client;

  @Before
  public void setUp() {
    client = mock(EcsClient.class);
  }

  private EcsJobDispatcher dispatcher(Map<String, String> overrides) {
    final Map<String, String> data = new HashMap<>(BASE_DATA);
    data.putAll(overrides);
    return new EcsJobDispatcher(client, PluginData.of(data), Optional.of("disco.example.com"));
  }

  private void runTaskReturns(RunTaskResponse response) {
    when(client.runTask(any(RunTaskRequest.class))).thenReturn(response);
  }

  @Test
  @Parameters({"api_url", "region", "task_definition", "cluster", "subnets", "launch_type"})
  public void shouldRequireField(String field) {
    final Map<String, String> data = new HashMap<>(BASE_DATA);
    data.remove(field);
    final InvalidPluginDataException e = assertThrows(InvalidPluginDataException.class,
        () -> new EcsJobDispatcher(client, PluginData.of(data), Optional.empty()));
    assertThat(e.getMessage(), is("ecs job dispatcher requires plugin data '" + field + "' field"));
  }

  @Test
  @Parameters({"ec2", "fargate"})
  public void shouldAcceptLaunchType(String launchType) {
    dispatcher(ImmutableMap.of("launch_type", launchType));
  }

  @Test
  @Parameters({"EC2", "external", "fargate_spot"})
  public void shouldRejectLaunchType(String launchType) {
    final InvalidPluginDataException e = assertThrows(InvalidPluginDataException.class,
        () -> dispatcher(ImmutableMap.of("launch_type", launchType)));
    assertThat(e.getMessage(), containsString("ECS launch type '" + launchType + "' is not supported"));
  }

  @Test
  public void shouldRunTask() throws Exception {
    runTaskReturns(RunTaskResponse.builder().tasks(Task.builder().taskArn(TASK_ARN).build()).build());

    final String externalId = dispatcher(ImmutableMap.of()).dispatchJob("job-1", "token");

    assertThat(externalId, is(TASK_ARN));
    final ArgumentCaptor<RunTaskRequest> request = ArgumentCaptor.forClass(RunTaskRequest.class);
    verify(client).runTask(request.capture());

    assertThat(request.getValue().cluster(), is("runners"));
    assertThat(request.getValue().taskDefinition(), is("runner:3"));
    assertThat(request.getValue().launchType(), is(LaunchType.FARGATE));
    assertThat(request.getValue().count(), is(1));

    final AwsVpcConfiguration vpc = request.getValue().networkConfiguration().awsvpcConfiguration();
    assertThat(vpc.subnets(), contains("subnet-a", "subnet-b"));
    assertThat(vpc.assignPublicIp(), is(AssignPublicIp.DISABLED));

    final ContainerOverride override = request.getValue().overrides().containerOverrides().get(0);
    assertThat(override.name(), is("main"));
    assertThat(override.environment(), contains(
        KeyValuePair.builder().name("JOB_ID").value("job-1").build(),
        KeyValuePair.builder().name("JOB_TOKEN").value("token").build(),
        KeyValuePair.builder().name("API_URL").value("http://api.example.com").build(),
        KeyValuePair.builder().name("DISCOVERY_PROTOCOL_HOSTS").value("disco.example.com").build()));
  }

  @Test
  public void shouldUseEc2LaunchType() throws Exception {
    runTaskReturns(RunTaskResponse.builder().tasks(Task.builder().taskArn(TASK_ARN).build()).build());

    dispatcher(ImmutableMap.of("launch_type", "ec2")).dispatchJob("job-1", "token");

    final ArgumentCaptor<RunTaskRequest> request = ArgumentCaptor.forClass(RunTaskRequest.class);
    verify(client).runTask(request.capture());
    assertThat(request.getValue().launchType(), is(LaunchType.EC2));
  }

  @Test
  public void shouldFailWhenNoTasksCreated() {
    runTaskReturns(RunTaskResponse.builder().build());

    final DispatchException e = assertThrows(DispatchException.class,
        () -> dispatcher(ImmutableMap.of()).dispatchJob("job-1", "token"));
    assertThat(e.getMessage(), containsString("no ECS tasks were created"));
    assertThat(e.getMessage(), containsString("job-1"));
  }

  @Test
  public void shouldReportFailureBeforeTasks() {
    runTaskReturns(RunTaskResponse.builder()
        .tasks(Task.builder().taskArn(TASK_ARN).build())
        .failures(Failure.builder().reason("RESOURCE:MEMORY").detail("not enough memory").build())
        .build());

    final DispatchException e = assertThrows(DispatchException.class,
        () -> dispatcher(ImmutableMap.of()).dispatchJob("job-1", "token"));
    assertThat(e.getMessage(),
        is("ecs job dispatcher failed to run for job job-1: failed to run task: RESOURCE:MEMORY; not enough memory"));
  }

  @Test
  public void failureMessageShouldUseReason() {
    assertThat(EcsJobDispatcher.failureMessage(Failure.builder().reason("MISSING").build()),
        is("failed to run task: MISSING"));
  }

  @Test
  public void failureMessageShouldAppendDetail() {
    assertThat(EcsJobDispatcher.failureMessage(Failure.builder().reason("MISSING").detail("subnet gone").build()),
        is("failed to run task: MISSING; subnet gone"));
  }

  @Test
  public void failureMessageShouldSkipMissingReason() {
    assertThat(EcsJobDispatcher.failureMessage(Failure.builder().detail("subnet gone").build()),
        is("failed to run task: subnet gone"));
    assertThat(EcsJobDispatcher.failureMessage(Failure.builder().arn("arn:aws:ecs:task").build()),
        is("failed to run task"));
  }

  @Test
  public void shouldWrapClientFailure() {
    when(client.runTask(any(RunTaskRequest.class))).thenThrow(SdkClientException.create("connection reset"));

    final DispatchException e = assertThrows(DispatchException.class,
        () -> dispatcher(ImmutableMap.of()).dispatchJob("job-1", "token"));
    assertThat(e.getMessage(), is("ecs job dispatcher failed to run for job job-1: connection reset"));
    assertThat(e.getCause(), instanceOf(SdkClientException.class));
  }

  @Test
  public void shouldCloseClient() {
    dispatcher(ImmutableMap.of()).close();
    verify(client).close();
  }
}
