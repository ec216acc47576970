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

import com.google.common.io.BaseEncoding;
import com.spotify.runway.model.InvalidPluginDataException;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import java.util.Optional;

/**
 * Authenticates with a client certificate and key. All certificate material is given as base64
 * encoded PEM.
 */
public class X509CertConfigurer implements Configurer {

  private final String server;
  private final String clientCertData;
  private final String clientKeyData;
  private final Optional<String> caCertData;

  private X509CertConfigurer(String server, String clientCertData, String clientKeyData,
                             Optional<String> caCertData) {
    this.server = requireNonNull(server, "server");
    this.clientCertData = clientCertData;
    this.clientKeyData = clientKeyData;
    this.caCertData = caCertData;
  }

  /**
   * @throws InvalidPluginDataException if any of the certificates or the key is not valid base64
   */
  public static X509CertConfigurer create(String server, String clientCert, String clientKey,
                                          Optional<String> caCert) {
    return new X509CertConfigurer(
        server,
        validBase64("client_cert", clientCert),
        validBase64("client_key", clientKey),
        caCert.map(ca -> validBase64("ca_cert", ca)));
  }

  static String validBase64(String field, String value) {
    final String trimmed = value.trim();
    try {
      // fabric8 takes the encoded form, but rejects it late and with a poor message
      decodeStrict(trimmed);
      return trimmed;
    } catch (IllegalArgumentException e) {
      throw new InvalidPluginDataException("failed to decode " + field + ": " + e.getMessage(), e);
    }
  }

  /**
   * Decodes standard base64, also rejecting the malformed padding Guava alone lets through.
   */
  static byte[] decodeStrict(String value) {
    final byte[] decoded = BaseEncoding.base64().decode(value);
    if (!BaseEncoding.base64().encode(decoded).equals(value)) {
      throw new IllegalArgumentException("Invalid padding in input");
    }
    return decoded;
  }

  @Override
  public Config getConfig() {
    final ConfigBuilder builder = new ConfigBuilder()
        .withMasterUrl(server)
        .withClientCertData(clientCertData)
        .withClientKeyData(clientKeyData);
    caCertData.ifPresent(builder::withCaCertData);
    return builder.build();
  }
}
