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

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of all metrs, keyed by tag.
 *
 * <p>Nodes are created on first lookup, root first, and are never removed. Lookups for the same or
 * overlapping tags are safe from any number of threads and always resolve to one node per tag.
 */
public final class MetrRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(MetrRegistry.class);

  private final ConcurrentMap<String, Metr> nodes = new ConcurrentHashMap<>();
  private final Set<Handler> handlers = new LinkedHashSet<>();
  private final Clock clock;

  public MetrRegistry() {
    this(Clock.systemUTC());
  }

  public MetrRegistry(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the metr for {@code tag}, creating it and any missing ancestors.
   *
   * @throws InvalidTagException if the tag is malformed; nothing is created in that case
   */
  public Metr get(String tag) {
    Objects.requireNonNull(tag, "tag");
    Metr existing = nodes.get(tag);
    if (existing != null) {
      return existing;
    }
    Metr node = null;
    for (String prefix : TagValidator.prefixes(tag)) {
      Metr parent = node;
      node = nodes.computeIfAbsent(prefix, key -> create(key, parent));
    }
    return node;
  }

  /** Returns the metr for {@code tag} if it was already created. */
  public Optional<Metr> find(String tag) {
    Objects.requireNonNull(tag, "tag");
    return Optional.ofNullable(nodes.get(tag));
  }

  /** Sorted snapshot of every tag created so far. */
  public SortedSet<String> tags() {
    return Collections.unmodifiableSortedSet(new TreeSet<>(nodes.keySet()));
  }

  public int size() {
    return nodes.size();
  }

  /**
   * Flushes and closes every handler attached to a metr of this registry, most recently attached
   * first. Each handler is closed once even if it is attached to several metrs. Failures are
   * logged and do not stop the remaining handlers from closing.
   */
  public void shutdown() {
    List<Handler> snapshot;
    synchronized (handlers) {
      snapshot = new ArrayList<>(handlers);
      handlers.clear();
    }
    Collections.reverse(snapshot);
    for (Handler handler : snapshot) {
      try {
        handler.flush();
        handler.close();
      } catch (RuntimeException e) {
        LOG.warn("Failed to close handler {}", handler, e);
      }
    }
  }

  /** Handlers that will be closed by {@link #shutdown()}, in attachment order. */
  public List<Handler> trackedHandlers() {
    synchronized (handlers) {
      return List.copyOf(handlers);
    }
  }

  void track(Handler handler) {
    synchronized (handlers) {
      handlers.add(handler);
    }
  }

  MetrRecord newRecord(String tag, long value) {
    return new MetrRecord(clock.instant(), tag, value, SessionId.current());
  }

  private Metr create(String tag, Metr parent) {
    LOG.debug("Creating metr {} (parent {})", tag, parent == null ? "none" : parent.tag());
    return new Metr(this, tag, parent);
  }
}
