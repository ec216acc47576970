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

import static java.util.Objects.requireNonNull;

import com.google.common.annotations.VisibleForTesting;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.signer.Aws4Signer;
import software.amazon.awssdk.auth.signer.params.Aws4PresignerParams;
import software.amazon.awssdk.http.SdkHttpFullRequest;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.regions.Region;

/**
 * SigV4 presigner for the request the EKS API server replays to establish the caller's IAM
 * identity.
 */
public class StsCallerIdentityPresigner implements CallerIdentityPresigner {

  static final String CLUSTER_ID_HEADER = "x-k8s-aws-id";
  static final Duration REQUEST_EXPIRY = Duration.ofSeconds(60);

  private static final String SIGNING_NAME = "sts";

  private final Region region;
  private final AwsCredentialsProvider credentialsProvider;
  private final Clock clock;
  private final Aws4Signer signer = Aws4Signer.create();

  @VisibleForTesting
  StsCallerIdentityPresigner(Region region, AwsCredentialsProvider credentialsProvider, Clock clock) {
    this.region = requireNonNull(region, "region");
    this.credentialsProvider = requireNonNull(credentialsProvider, "credentialsProvider");
    this.clock = requireNonNull(clock, "clock");
  }

  public static StsCallerIdentityPresigner create(Region region) {
    return new StsCallerIdentityPresigner(region, DefaultCredentialsProvider.create(), Clock.systemUTC());
  }

  @Override
  public URI presign(String clusterName) {
    final SdkHttpFullRequest request = SdkHttpFullRequest.builder()
        .method(SdkHttpMethod.GET)
        .protocol("https")
        .host(SIGNING_NAME + "." + region.id() + ".amazonaws.com")
        .encodedPath("/")
        .putRawQueryParameter("Action", "GetCallerIdentity")
        .putRawQueryParameter("Version", "2011-06-15")
        .putHeader(CLUSTER_ID_HEADER, clusterName)
        .build();

    final Instant now = clock.instant();
    final Aws4PresignerParams params = Aws4PresignerParams.builder()
        .awsCredentials(credentialsProvider.resolveCredentials())
        .signingName(SIGNING_NAME)
        .signingRegion(region)
        .signingClockOverride(Clock.fixed(now, ZoneOffset.UTC))
        .expirationTime(now.plus(REQUEST_EXPIRY))
        .build();

    return signer.presign(request, params).getUri();
  }
}
