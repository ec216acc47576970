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

import static com.spotify.runway.util.MDCUtil.withMDC;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.MDC;

public class MDCUtilTest {

  private static final ExecutorService EXECUTOR = Executors.newSingleThreadExecutor();

  @Before
  public void setUp() {
    MDC.clear();
  }

  @After
  public void tearDown() {
    MDC.clear();
  }

  @AfterClass
  public static void shutdown() {
    EXECUTOR.shutdownNow();
  }

  @Test
  public void withMDCRunnable() throws ExecutionException, InterruptedException {
    MDC.put("foo", "bar");
    final CompletableFuture<String> value = new CompletableFuture<>();
    EXECUTOR.submit(withMDC(() -> value.complete(MDC.get("foo"))));
    assertThat(value.get(), is("bar"));
  }

  @Test
  public void withMDCExecutor() throws ExecutionException, InterruptedException {
    MDC.put("foo", "bar");
    CompletableFuture.runAsync(() -> assertThat(MDC.get("foo"), is("bar")), withMDC(EXECUTOR)).get();

    // MDC should not leak to later tasks
    EXECUTOR.submit(() -> assertThat(MDC.get("foo"), is(nullValue()))).get();
  }

  @Test
  public void shouldRestorePreviousContext() {
    MDC.put("foo", "outer");
    final Runnable wrapped = withMDC(() -> assertThat(MDC.get("foo"), is("outer")));
    MDC.put("foo", "current");
    wrapped.run();
    assertThat(MDC.get("foo"), is("current"));
  }
}
