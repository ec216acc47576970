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
import com.google.common.io.BaseEncoding;
import com.spotify.runway.model.InvalidPluginDataException;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.eks.EksClient;
import software.amazon.awssdk.services.eks.model.Cluster;
import software.amazon.awssdk.services.eks.model.DescribeClusterRequest;

/**
 * Authenticates to an EKS cluster with a token derived from the process' AWS IAM identity.
 *
 * <p>The cluster endpoint and CA are looked up once, when the configurer is created. Tokens are
 * presigned STS requests; one is cached and handed out until it expires, and at most one is
 * being generated at any time.
 */
public class EksIamConfigurer implements Configurer {

  private static final Logger LOG = LoggerFactory.getLogger(EksIamConfigurer.class);

  static final String TOKEN_PREFIX = "k8s-aws-v1.";

  // Shorter than the 15 minutes the API server accepts a presigned request for
  static final Duration TOKEN_VALIDITY = Duration.ofMinutes(14);

  private final String clusterName;
  private final String endpoint;
  private final String caCertData;
  private final CallerIdentityPresigner presigner;

  private final Lock lock = new ReentrantLock();

  // guarded by lock
  private String token;
  private Instant tokenExpiry;

  @VisibleForTesting
  EksIamConfigurer(String clusterName, String endpoint, String caCertData,
                   CallerIdentityPresigner presigner, String token, Instant tokenExpiry) {
    this.clusterName = requireNonNull(clusterName, "clusterName");
    this.endpoint = requireNonNull(endpoint, "endpoint");
    this.caCertData = requireNonNull(caCertData, "caCertData");
    this.presigner = requireNonNull(presigner, "presigner");
    this.token = token;
    this.tokenExpiry = tokenExpiry;
  }

  /**
   * Looks up the cluster and creates a configurer for it.
   *
   * @throws InvalidPluginDataException if the cluster cannot be described or has no usable CA
   */
  public static EksIamConfigurer create(String region, String clusterName) {
    final Region awsRegion = Region.of(region);
    final Cluster cluster;
    try (EksClient eks = EksClient.builder().region(awsRegion).build()) {
      cluster = describe(eks, clusterName);
    }
    LOG.info("Using EKS cluster {} at {}", clusterName, cluster.endpoint());
    return new EksIamConfigurer(clusterName, cluster.endpoint(), cluster.certificateAuthority().data(),
                                StsCallerIdentityPresigner.create(awsRegion), null, null);
  }

  @VisibleForTesting
  static Cluster describe(EksClient eks, String clusterName) {
    final Cluster cluster;
    try {
      cluster = eks.describeCluster(DescribeClusterRequest.builder().name(clusterName).build()).cluster();
    } catch (SdkException e) {
      throw new InvalidPluginDataException("failed to describe EKS cluster " + clusterName, e);
    }

    if (cluster.certificateAuthority() == null || isNullOrEmpty(cluster.certificateAuthority().data())) {
      throw new InvalidPluginDataException("EKS cluster " + clusterName + " has no certificate authority data");
    }
    try {
      X509CertConfigurer.decodeStrict(cluster.certificateAuthority().data());
    } catch (IllegalArgumentException e) {
      throw new InvalidPluginDataException(
          "EKS cluster " + clusterName + " has invalid certificate authority data", e);
    }
    return cluster;
  }

  @Override
  public Config getConfig() throws IOException {
    return new ConfigBuilder()
        .withMasterUrl(endpoint)
        .withCaCertData(caCertData)
        .withOauthToken(token())
        .build();
  }

  @VisibleForTesting
  String token() throws IOException {
    lock.lock();
    try {
      final Instant now = Instant.now();
      if (token == null || !now.isBefore(tokenExpiry)) {
        LOG.debug("Generating token for EKS cluster {}", clusterName);
        token = generateToken();
        tokenExpiry = now.plus(TOKEN_VALIDITY);
      }
      return token;
    } finally {
      lock.unlock();
    }
  }

  private String generateToken() throws IOException {
    final URI signedRequest;
    try {
      signedRequest = presigner.presign(clusterName);
    } catch (SdkException e) {
      throw new IOException("failed to generate token for EKS cluster " + clusterName, e);
    }
    return TOKEN_PREFIX + BaseEncoding.base64Url().omitPadding()
        .encode(signedRequest.toString().getBytes(StandardCharsets.UTF_8));
  }
}
