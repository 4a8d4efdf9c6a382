/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.metr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.metr.handlers.RecordingHandler;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExceptionRecorderTest {

  private RecordingHandler handler;
  private Metr metr;

  @BeforeEach
  void setUp() {
    MetrRegistry registry = new MetrRegistry();
    handler = new RecordingHandler();
    metr = registry.get("test_exception_record");
    metr.addHandler(handler);
  }

  @Test
  void countsEachConfiguredFailureAndRethrowsIt() {
    AtomicInteger calls = new AtomicInteger();
    Runnable flaky =
        metr.exceptions(AssertionError.class)
            .wrapRunnable(
                () -> {
                  int call = calls.incrementAndGet();
                  if (call % 2 == 1) {
                    throw new AssertionError("call " + call);
                  }
                });

    int rethrown = 0;
    for (int i = 0; i < 5; i++) {
      try {
        flaky.run();
      } catch (AssertionError expected) {
        rethrown++;
      }
    }

    assertThat(rethrown).isEqualTo(3);
    assertThat(handler.values()).containsExactly(1L, 1L, 1L);
  }

  @Test
  void rethrowsTheSameInstance() {
    IllegalStateException failure = new IllegalStateException("boom");
    ExceptionRecorder recorder = metr.exceptions(IllegalStateException.class);

    assertThatThrownBy(
            () ->
                recorder.run(
                    () -> {
                      throw failure;
                    }))
        .isSameAs(failure);
    assertThat(handler.values()).containsExactly(1L);
  }

  @Test
  void successPassesReturnValueThrough() throws Exception {
    ExceptionRecorder recorder = metr.exceptions(IOException.class);

    Callable<String> wrapped = recorder.wrapCallable(() -> "ok");

    assertThat(wrapped.call()).isEqualTo("ok");
    assertThat(recorder.get(() -> 12)).isEqualTo(12);
    assertThat(handler.records()).isEmpty();
  }

  @Test
  void unconfiguredFailuresAreNotCounted() {
    ExceptionRecorder recorder = metr.exceptions(IOException.class);

    assertThatThrownBy(
            () ->
                recorder.run(
                    () -> {
                      throw new UncheckedIOException(new IOException("disk"));
                    }))
        .isInstanceOf(UncheckedIOException.class);
    assertThat(handler.records()).isEmpty();
  }

  @Test
  void checkedFailuresFromCallableAreCounted() {
    ExceptionRecorder recorder = metr.exceptions(IOException.class, IllegalStateException.class);

    assertThatThrownBy(
            () ->
                recorder.call(
                    () -> {
                      throw new IOException("disk");
                    }))
        .isInstanceOf(IOException.class)
        .hasMessage("disk");
    assertThat(handler.values()).containsExactly(1L);
  }

  @Test
  void subclassesOfConfiguredKindMatch() {
    ExceptionRecorder recorder = metr.exceptions(RuntimeException.class);
    Function<String, Integer> parse = recorder.wrapFunction(Integer::parseInt);

    assertThat(parse.apply("41")).isEqualTo(41);
    assertThatThrownBy(() -> parse.apply("x")).isInstanceOf(NumberFormatException.class);
    assertThat(handler.values()).containsExactly(1L);
  }

  @Test
  void handlerFailureIsSuppressedUnderApplicationFailure() {
    Metr failing = new MetrRegistry().get("failing");
    failing.addHandler(
        record -> {
          throw new IllegalStateException("sink down");
        });
    ExceptionRecorder recorder = failing.exceptions(IllegalArgumentException.class);

    assertThatThrownBy(
            () ->
                recorder.run(
                    () -> {
                      throw new IllegalArgumentException("bad input");
                    }))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("bad input")
        .satisfies(
            e -> {
              assertThat(e.getSuppressed()).hasSize(1);
              assertThat(e.getSuppressed()[0]).hasMessage("sink down");
            });
  }

  @Test
  void requiresAtLeastOneKind() {
    assertThatThrownBy(() -> metr.exceptions()).isInstanceOf(IllegalArgumentException.class);
  }
}
