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

import static com.spotify.runway.util.CloserUtil.DEFAULT_TIMEOUT;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.io.Closer;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class CloserUtilTest {

  @Mock private ExecutorService executorService;
  @Mock private Runnable runnable;

  private final Closer closer = Closer.create();

  @After
  public void tearDown() {
    // clear the flag set by the interruption test
    Thread.interrupted();
  }

  @Test
  public void shouldCloseRegisteredExecutorService() throws IOException, InterruptedException {
    final ExecutorService registered = CloserUtil.register(closer, executorService, "foobar");
    assertThat(registered, is(executorService));
    when(executorService.shutdownNow()).thenReturn(List.of(runnable));
    closer.close();
    verifyShutdown(DEFAULT_TIMEOUT);
  }

  @Test
  public void closeableShouldUseGivenTimeout() throws IOException, InterruptedException {
    final Duration timeout = Duration.ofSeconds(5);
    final Closeable closeable = CloserUtil.closeable(executorService, "foobar", timeout);
    when(executorService.shutdownNow()).thenReturn(List.of());
    closeable.close();
    verifyShutdown(timeout);
  }

  @Test
  public void shouldHandleInterruption() throws IOException, InterruptedException {
    final Closeable closeable = CloserUtil.closeable(executorService, "foobar", DEFAULT_TIMEOUT);
    when(executorService.shutdownNow()).thenReturn(List.of(runnable));
    doThrow(new InterruptedException()).when(executorService).awaitTermination(anyLong(), any());
    closeable.close();
    assertThat(Thread.currentThread().isInterrupted(), is(true));
    verifyShutdown(DEFAULT_TIMEOUT);
  }

  private void verifyShutdown(Duration timeout) throws InterruptedException {
    verify(executorService).shutdown();
    verify(executorService).awaitTermination(timeout.toNanos(), NANOSECONDS);
    verify(executorService).shutdownNow();
  }
}
