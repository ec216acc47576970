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

package com.spotify.runway.util;

import java.util.Map;
import java.util.concurrent.Executor;
import org.slf4j.MDC;

/**
 * Utilities for carrying the {@link MDC} of a calling thread over to tasks that run elsewhere.
 */
public class MDCUtil {

  private MDCUtil() {
    throw new UnsupportedOperationException();
  }

  /**
   * Runs tasks on the supplied executor, with MDC propagated from the submitting thread.
   */
  public static Executor withMDC(Executor executor) {
    return runnable -> executor.execute(withMDC(runnable));
  }

  /**
   * Wrap a {@link Runnable} to use the {@link MDC} captured when this method is called.
   */
  public static Runnable withMDC(Runnable r) {
    final Map<String, String> contextMap = MDC.getCopyOfContextMap();
    return () -> {
      final Map<String, String> previous = MDC.getCopyOfContextMap();
      setContextMap(contextMap);
      try {
        r.run();
      } finally {
        setContextMap(previous);
      }
    };
  }

  private static void setContextMap(Map<String, String> contextMap) {
    if (contextMap == null) {
      MDC.clear();
    } else {
      MDC.setContextMap(contextMap);
    }
  }
}
