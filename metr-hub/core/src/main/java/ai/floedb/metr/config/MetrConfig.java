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

import ai.floedb.metr.handlers.HandlerPolicy;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.util.List;
import java.util.Optional;
import org.slf4j.event.Level;

@ConfigMapping(prefix = "metr")
public interface MetrConfig {
  @WithDefault("LENIENT")
  HandlerPolicy handlerPolicy();

  @WithDefault("true")
  boolean shutdownHook();

  /** Tags that the configured handlers are attached to. */
  Optional<List<String>> tags();

  Logging logging();

  interface Logging {
    @WithDefault("false")
    boolean enabled();

    @WithDefault("metr")
    String category();

    @WithDefault("INFO")
    Level level();
  }
}
