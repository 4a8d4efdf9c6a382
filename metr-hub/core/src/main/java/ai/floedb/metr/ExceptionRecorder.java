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

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Counts failures of wrapped calls.
 *
 * <p>When a wrapped call throws one of the configured kinds the recorder records {@code 1} and
 * re-throws the same throwable. Any other outcome records nothing. The recorder keeps no state
 * between calls.
 */
public final class ExceptionRecorder extends Recorder {
  private final List<Class<? extends Throwable>> kinds;

  ExceptionRecorder(Metr metr, Class<? extends Throwable>[] kinds) {
    super(metr);
    Objects.requireNonNull(kinds, "kinds");
    if (kinds.length == 0) {
      throw new IllegalArgumentException("at least one exception kind is required");
    }
    for (Class<? extends Throwable> kind : kinds) {
      Objects.requireNonNull(kind, "kind");
    }
    this.kinds = List.of(kinds);
  }

  public List<Class<? extends Throwable>> kinds() {
    return kinds;
  }

  /** Invokes {@code callable}, counting configured failures. */
  public <T> T call(Callable<T> callable) throws Exception {
    Objects.requireNonNull(callable, "callable");
    try {
      return callable.call();
    } catch (Throwable t) {
      observe(t);
      throw t;
    }
  }

  /** Invokes {@code runnable}, counting configured failures. */
  public void run(Runnable runnable) {
    Objects.requireNonNull(runnable, "runnable");
    try {
      runnable.run();
    } catch (Throwable t) {
      observe(t);
      throw t;
    }
  }

  /** Invokes {@code supplier}, counting configured failures. */
  public <T> T get(Supplier<T> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    try {
      return supplier.get();
    } catch (Throwable t) {
      observe(t);
      throw t;
    }
  }

  public <T> Callable<T> wrapCallable(Callable<T> callable) {
    Objects.requireNonNull(callable, "callable");
    return () -> call(callable);
  }

  public Runnable wrapRunnable(Runnable runnable) {
    Objects.requireNonNull(runnable, "runnable");
    return () -> run(runnable);
  }

  public <T> Supplier<T> wrapSupplier(Supplier<T> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    return () -> get(supplier);
  }

  public <A, R> Function<A, R> wrapFunction(Function<A, R> function) {
    Objects.requireNonNull(function, "function");
    return arg -> get(() -> function.apply(arg));
  }

  /** Whether {@code t} is an instance of one of the configured kinds. */
  public boolean matches(Throwable t) {
    for (Class<? extends Throwable> kind : kinds) {
      if (kind.isInstance(t)) {
        return true;
      }
    }
    return false;
  }

  private void observe(Throwable t) {
    if (!matches(t)) {
      return;
    }
    try {
      commit(1);
    } catch (RuntimeException | Error handlerFailure) {
      // the application failure is what the caller gets
      if (handlerFailure != t) {
        t.addSuppressed(handlerFailure);
      }
    }
  }
}
