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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spotify.runway.dispatch.JobDispatcher;
import com.spotify.runway.dispatch.JobEnvironment;
import com.spotify.runway.dispatch.TokenGetter;
import com.spotify.runway.dispatch.kubernetes.configurer.ConfigFileConfigurer;
import com.spotify.runway.dispatch.kubernetes.configurer.Configurer;
import com.spotify.runway.dispatch.kubernetes.configurer.EksIamConfigurer;
import com.spotify.runway.dispatch.kubernetes.configurer.IdTokenConfigurer;
import com.spotify.runway.dispatch.kubernetes.configurer.InClusterConfigurer;
import com.spotify.runway.dispatch.kubernetes.configurer.X509CertConfigurer;
import com.spotify.runway.model.InvalidPluginDataException;
import com.spotify.runway.model.PluginData;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirementsBuilder;
import io.fabric8.kubernetes.api.model.SecurityContext;
import io.fabric8.kubernetes.api.model.SecurityContextBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs each job as a single-container Kubernetes batch job. The created job is never retried by
 * Kubernetes and is deleted as soon as it finishes.
 */
public class KubernetesJobDispatcher implements JobDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(KubernetesJobDispatcher.class);

  private static final String OWNER = "kubernetes job dispatcher";

  static final String API_URL = "api_url";
  static final String AUTH_TYPE = "auth_type";
  static final String IMAGE = "image";
  static final String MEMORY_REQUEST = "memory_request";
  static final String MEMORY_LIMIT = "memory_limit";
  static final String NAMESPACE = "namespace";
  static final String NODE_SELECTOR = "node_selector";
  static final String RUN_AS_USER = "security_context_run_as_user";
  static final String RUN_AS_GROUP = "security_context_run_as_group";
  static final String RUN_AS_NON_ROOT = "security_context_run_as_non_root";
  static final String CA_CERT = "ca_cert";

  static final List<String> REQUIRED_FIELDS =
      ImmutableList.of(API_URL, AUTH_TYPE, IMAGE, MEMORY_REQUEST, MEMORY_LIMIT);

  static final String DEFAULT_NAMESPACE = "default";
  static final String MAIN_CONTAINER_NAME = "main";
  static final String JOB_NAME_PREFIX = "runway-job-";
  static final String JOB_ID_ANNOTATION = "job.runway.io/id";
  static final String SAFE_TO_EVICT_LABEL = "cluster-autoscaler.kubernetes.io/safe-to-evict";

  private static final Splitter NODE_SELECTOR_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  enum AuthType {
    IN_CLUSTER("in_cluster"),
    KUBE_CONFIG("kube_config", "kube_config_path"),
    X509_CERT("x509_cert", "kube_server", "client_cert", "client_key"),
    RUNNER_ID_TOKEN("runner_id_token", "kube_server"),
    EKS_IAM("eks_iam", "region", "eks_cluster");

    private final String value;
    private final List<String> requiredFields;

    AuthType(String value, String... requiredFields) {
      this.value = value;
      this.requiredFields = ImmutableList.copyOf(requiredFields);
    }

    String value() {
      return value;
    }

    List<String> requiredFields() {
      return requiredFields;
    }

    static AuthType of(String value) {
      return Arrays.stream(values())
          .filter(authType -> authType.value.equals(value))
          .findFirst()
          .orElseThrow(() -> new InvalidPluginDataException(
              OWNER + " doesn't support auth_type '" + value + "'"));
    }
  }

  private final KubernetesJobClient client;
  private final AuthType authType;
  private final String image;
  private final String apiUrl;
  private final String namespace;
  private final String memoryLimit;
  private final Quantity memoryRequestQuantity;
  private final Quantity memoryLimitQuantity;
  private final SecurityContext securityContext;
  private final Map<String, String> nodeSelector;
  private final List<String> discoveryProtocolHosts;

  @VisibleForTesting
  KubernetesJobDispatcher(PluginData pluginData,
                          Optional<String> serviceDiscoveryHost,
                          BiFunction<AuthType, PluginData, KubernetesJobClient> clientFactory) {
    pluginData.checkRequired(OWNER, REQUIRED_FIELDS);

    this.authType = AuthType.of(pluginData.require(AUTH_TYPE));
    for (String field : authType.requiredFields()) {
      if (!pluginData.contains(field)) {
        throw new InvalidPluginDataException(String.format(
            "%s requires plugin data '%s' field when using the '%s' auth type", OWNER, field, authType.value()));
      }
    }

    this.image = pluginData.require(IMAGE);
    this.apiUrl = pluginData.require(API_URL);
    this.namespace = pluginData.get(NAMESPACE).filter(ns -> !ns.isEmpty()).orElse(DEFAULT_NAMESPACE);
    this.memoryRequestQuantity = parseQuantity(MEMORY_REQUEST, pluginData.require(MEMORY_REQUEST));
    this.memoryLimitQuantity = parseQuantity(MEMORY_LIMIT, pluginData.require(MEMORY_LIMIT));
    this.memoryLimit = Quantities.canonical(memoryLimitQuantity);
    this.securityContext = securityContext(pluginData);
    this.nodeSelector = pluginData.get(NODE_SELECTOR)
        .map(KubernetesJobDispatcher::parseNodeSelector)
        .orElse(ImmutableMap.of());
    this.discoveryProtocolHosts = JobEnvironment.discoveryProtocolHosts(serviceDiscoveryHost, pluginData);

    // Last, as some auth types reach out to the network
    this.client = requireNonNull(clientFactory.apply(authType, pluginData), "client");

    LOG.info("Created kubernetes job dispatcher: auth_type={}, namespace={}, image={}",
             authType.value(), namespace, image);
  }

  public static KubernetesJobDispatcher create(PluginData pluginData,
                                               Optional<String> serviceDiscoveryHost,
                                               TokenGetter tokenGetter) {
    requireNonNull(tokenGetter, "tokenGetter");
    return new KubernetesJobDispatcher(pluginData, serviceDiscoveryHost,
        (authType, data) -> KubernetesJobClient.of(configurer(authType, data, tokenGetter)));
  }

  @VisibleForTesting
  static Configurer configurer(AuthType authType, PluginData pluginData, TokenGetter tokenGetter) {
    switch (authType) {
      case IN_CLUSTER:
        return new InClusterConfigurer();
      case KUBE_CONFIG:
        return ConfigFileConfigurer.create(Paths.get(pluginData.require("kube_config_path")));
      case X509_CERT:
        return X509CertConfigurer.create(pluginData.require("kube_server"),
                                         pluginData.require("client_cert"),
                                         pluginData.require("client_key"),
                                         pluginData.get(CA_CERT));
      case RUNNER_ID_TOKEN:
        return IdTokenConfigurer.create(pluginData.require("kube_server"), pluginData.get(CA_CERT), tokenGetter);
      case EKS_IAM:
        return EksIamConfigurer.create(pluginData.require("region"), pluginData.require("eks_cluster"));
      default:
        throw new AssertionError("Unhandled auth type: " + authType);
    }
  }

  @Override
  public String dispatchJob(String jobId, String token) throws DispatchException {
    final JobEnvironment environment = JobEnvironment.create(
        jobId, token, apiUrl, discoveryProtocolHosts, Optional.of(memoryLimit));

    final Job created;
    try {
      created = client.createJob(namespace, createJob(environment));
    } catch (IOException e) {
      throw new DispatchException(
          String.format("%s failed to run for job %s: %s", OWNER, jobId, e.getMessage()), e);
    }

    final String uid = created.getMetadata().getUid();
    LOG.info("Created kubernetes job {} in namespace {} for job {}",
             created.getMetadata().getName(), namespace, jobId);
    return uid;
  }

  @VisibleForTesting
  Job createJob(JobEnvironment environment) {
    final String jobId = environment.jobId();
    final List<EnvVar> env = environment.toEnv().entrySet().stream()
        .map(e -> new EnvVarBuilder().withName(e.getKey()).withValue(e.getValue()).build())
        .collect(Collectors.toList());

    return new JobBuilder()
        .withNewMetadata()
        .withGenerateName(generateNamePrefix(jobId))
        .endMetadata()
        .withNewSpec()
        .withBackoffLimit(0)
        .withTtlSecondsAfterFinished(0)
        .withNewTemplate()
        .withNewMetadata()
        .addToLabels(SAFE_TO_EVICT_LABEL, "false")
        .addToAnnotations(JOB_ID_ANNOTATION, jobId)
        .endMetadata()
        .withNewSpec()
        .withRestartPolicy("Never")
        .withAutomountServiceAccountToken(false)
        .withNodeSelector(nodeSelector.isEmpty() ? null : nodeSelector)
        .addNewContainer()
        .withName(MAIN_CONTAINER_NAME)
        .withImage(image)
        .withEnv(env)
        .withSecurityContext(securityContext)
        .withResources(new ResourceRequirementsBuilder()
            .addToRequests("memory", memoryRequestQuantity)
            .addToLimits("memory", memoryLimitQuantity)
            .build())
        .endContainer()
        .endSpec()
        .endTemplate()
        .endSpec()
        .build();
  }

  static String generateNamePrefix(String jobId) {
    final String shortId = jobId.length() > 8 ? jobId.substring(0, 8) : jobId;
    return JOB_NAME_PREFIX + shortId.toLowerCase(Locale.ROOT);
  }

  private static Quantity parseQuantity(String field, String value) {
    try {
      final Quantity quantity = Quantity.parse(value);
      Quantity.getAmountInBytes(quantity);
      return quantity;
    } catch (IllegalArgumentException | ArithmeticException e) {
      throw new InvalidPluginDataException("failed to parse " + field + " '" + value + "' for runner jobs", e);
    }
  }

  private static SecurityContext securityContext(PluginData pluginData) {
    final SecurityContextBuilder builder = new SecurityContextBuilder()
        .withPrivileged(false)
        .withAllowPrivilegeEscalation(false)
        .withNewCapabilities()
        .addToDrop("NET_RAW")
        .endCapabilities();

    pluginData.get(RUN_AS_USER).map(value -> parseId(RUN_AS_USER, value)).ifPresent(builder::withRunAsUser);
    pluginData.get(RUN_AS_GROUP).map(value -> parseId(RUN_AS_GROUP, value)).ifPresent(builder::withRunAsGroup);
    final Optional<Boolean> runAsNonRoot;
    try {
      runAsNonRoot = pluginData.getOptionalBoolean(RUN_AS_NON_ROOT);
    } catch (InvalidPluginDataException e) {
      throw new InvalidPluginDataException("failed to parse " + RUN_AS_NON_ROOT + " for runner jobs", e);
    }
    runAsNonRoot.ifPresent(builder::withRunAsNonRoot);

    return builder.build();
  }

  private static Long parseId(String field, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new InvalidPluginDataException("failed to parse " + field + " for runner jobs", e);
    }
  }

  @VisibleForTesting
  static Map<String, String> parseNodeSelector(String value) {
    final Map<String, String> selector = new LinkedHashMap<>();
    for (String pair : NODE_SELECTOR_SPLITTER.split(value)) {
      final List<String> keyValue = Splitter.on('=').limit(2).trimResults().splitToList(pair);
      if (keyValue.size() != 2) {
        throw new InvalidPluginDataException(String.format(
            "invalid node selector format: \"%s\", expected format: key1=value1,key2=value2", pair));
      }
      if (keyValue.get(0).isEmpty() || keyValue.get(1).isEmpty()) {
        throw new InvalidPluginDataException(String.format(
            "invalid node selector format: \"%s\", key and value must not be empty", pair));
      }
      selector.put(keyValue.get(0), keyValue.get(1));
    }
    return Collections.unmodifiableMap(selector);
  }

  @Override
  public void close() {
    // clients are opened per submission
  }
}
