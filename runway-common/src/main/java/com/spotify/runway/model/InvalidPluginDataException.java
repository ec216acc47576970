/*-
 * -\-\-
 * Spotify Runway Common
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

package com.spotify.runway.model;

/**
 * Thrown when dispatcher configuration is missing a required key or carries a value that cannot be
 * used. These are detected while constructing a dispatcher and are fatal to startup.
 */
public class InvalidPluginDataException extends IllegalArgumentException {

  public InvalidPluginDataException(String message) {
    super(message);
  }

  public InvalidPluginDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
