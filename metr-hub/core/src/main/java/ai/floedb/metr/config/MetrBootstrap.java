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
package ai.floedb.metr.config;

import ai.floedb.metr.Handler;
import ai.floedb.metr.Metr;
import ai.floedb.metr.MetrRegistry;
import ai.floedb.metr.Metrs;
import ai.floedb.metr.format.TextFormatter;
import ai.floedb.metr.handlers.LoggingHandler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wires the handlers described by {@link MetrConfig} onto the configured tags. */
public final class MetrBootstrap {
  private static final Logger LOG = LoggerFactory.getLogger(MetrBootstrap.class);

  private MetrBootstrap() {}

  /** Handlers enabled by {@code config}, in a stable order. */
  public static List<Handler> configuredHandlers(MetrConfig config) {
    Objects.requireNonNull(config, "config");
    List<Handler> handlers = new ArrayList<>();
    MetrConfig.Logging logging = config.logging();
    if (logging.enabled()) {
      handlers.add(
          new LoggingHandler(
              LoggerFactory.getLogger(logging.category()),
              logging.level(),
              TextFormatter.INSTANCE,
              config.handlerPolicy()));
    }
    return handlers;
  }

  /** Configures the process-wide registry. */
  public static List<Metr> configure(MetrConfig config, Handler... extraHandlers) {
    return attach(Metrs.registry(), config, extraHandlers);
  }

  /**
   * Attaches the configured handlers, followed by {@code extraHandlers}, to every tag listed in
   * {@code metr.tags}.
   *
   * @return the metrs that received handlers, in configuration order
   */
  public static List<Metr> attach(
      MetrRegistry registry, MetrConfig config, Handler... extraHandlers) {
    Objects.requireNonNull(registry, "registry");
    List<Handler> handlers = configuredHandlers(config);
    if (extraHandlers != null) {
      handlers.addAll(Arrays.asList(extraHandlers));
    }
    List<Metr> attached = new ArrayList<>();
    for (String tag : config.tags().orElse(List.of())) {
      Metr metr = registry.get(tag);
      handlers.forEach(metr::addHandler);
      attached.add(metr);
    }
    if (!handlers.isEmpty() && attached.isEmpty()) {
      LOG.warn("{} metr handler(s) configured but metr.tags is empty", handlers.size());
    }
    if (config.shutdownHook() && registry == Metrs.registry()) {
      Metrs.installShutdownHook();
    }
    return List.copyOf(attached);
  }
}
