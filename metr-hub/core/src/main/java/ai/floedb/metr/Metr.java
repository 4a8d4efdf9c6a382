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
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * A named point in the metric hierarchy.
 *
 * <p>Instances are created only by {@link MetrRegistry#get(String)}, exactly once per tag. Each
 * value recorded here is handed to this node's handlers in registration order and then to every
 * ancestor up to the root, always as the same {@link MetrRecord}.
 */
public final class Metr {
  private final MetrRegistry registry;
  private final String tag;
  private final Metr parent;
  private final CopyOnWriteArrayList<Handler> handlers = new CopyOnWriteArrayList<>();
  private final IntRecorder intRecorder;

  Metr(MetrRegistry registry, String tag, Metr parent) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.tag = Objects.requireNonNull(tag, "tag");
    this.parent = parent;
    this.intRecorder = new IntRecorder(this);
  }

  public String tag() {
    return tag;
  }

  /** Returns the metr one level up, or {@code null} for a root. */
  public Metr parent() {
    return parent;
  }

  /** Snapshot of the handlers registered on this node, in registration order. */
  public List<Handler> handlers() {
    return List.copyOf(handlers);
  }

  /**
   * Registers {@code handler} on this node. A handler already present is not added twice. Takes
   * effect for subsequent dispatches only.
   */
  public void addHandler(Handler handler) {
    Objects.requireNonNull(handler, "handler");
    if (handlers.addIfAbsent(handler)) {
      registry.track(handler);
    }
  }

  /** Equivalent to {@code registry.get(tag() + "." + suffix)}. */
  public Metr getChild(String suffix) {
    return registry.get(TagValidator.child(tag, suffix));
  }

  /** Records {@code value} against this metr and dispatches it up the hierarchy. */
  public void handleValue(long value) {
    dispatch(registry.newRecord(tag, value));
  }

  void dispatch(MetrRecord record) {
    for (Metr node = this; node != null; node = node.parent) {
      for (Handler handler : node.handlers) {
        handler.handle(record);
      }
    }
  }

  /** Shortcut for {@code intRecorder().rec(value)}. */
  public void rec(long value) {
    intRecorder.rec(value);
  }

  public IntRecorder intRecorder() {
    return intRecorder;
  }

  /** Opens an accumulating scope. Use with try-with-resources; the sum is recorded on close. */
  public CounterRecorder counter() {
    return new CounterRecorder(this);
  }

  /** Runs {@code body} inside a counter scope and records the accumulated sum when it exits. */
  public void counted(Consumer<CounterRecorder> body) {
    Objects.requireNonNull(body, "body");
    try (CounterRecorder counter = counter()) {
      body.accept(counter);
    }
  }

  /** Returns a recorder that counts occurrences of the given exception kinds. */
  @SafeVarargs
  public final ExceptionRecorder exceptions(Class<? extends Throwable>... kinds) {
    return new ExceptionRecorder(this, kinds);
  }

  @Override
  public String toString() {
    return "Metr(" + tag + ")";
  }
}
