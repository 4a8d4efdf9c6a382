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

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accumulating scope. Values passed to {@link #add(long)} are summed and recorded as a single value
 * when the scope is closed.
 *
 * <pre>{@code
 * try (CounterRecorder counter = metr.counter()) {
 *   for (Row row : rows) {
 *     counter.add(row.size());
 *   }
 * }
 * }</pre>
 */
public final class CounterRecorder extends Recorder implements AutoCloseable {
  private final AtomicLong sum = new AtomicLong();
  private final AtomicBoolean closed = new AtomicBoolean();

  CounterRecorder(Metr metr) {
    super(metr);
  }

  /** Adds {@code delta} to the running sum. */
  public void add(long delta) {
    if (closed.get()) {
      throw new IllegalStateException("counter for " + metr().tag() + " is already closed");
    }
    sum.addAndGet(delta);
  }

  /** Current running sum. */
  public long value() {
    return sum.get();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /** Records the accumulated sum. Only the first call commits. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      commit(sum.get());
    }
  }
}
