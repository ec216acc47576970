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

import io.fabric8.kubernetes.client.Config;
import java.io.IOException;

/**
 * Produces the connection settings (API endpoint, CA data and credential) used to reach a
 * Kubernetes API server. Implementations are asked again on every job submission, so short-lived
 * credentials can be refreshed.
 */
@FunctionalInterface
public interface Configurer {

  Config getConfig() throws IOException;
}
