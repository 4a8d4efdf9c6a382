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

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.metr.handlers.HandlerPolicy;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

class MetrConfigsTest {

  @Test
  void defaultsApplyWithoutProperties() {
    MetrConfig config = MetrConfigs.load(MetrConfig.class);

    assertThat(config.handlerPolicy()).isEqualTo(HandlerPolicy.LENIENT);
    assertThat(config.shutdownHook()).isTrue();
    assertThat(config.tags()).isEmpty();
    assertThat(config.logging().enabled()).isFalse();
    assertThat(config.logging().category()).isEqualTo("metr");
    assertThat(config.logging().level()).isEqualTo(Level.INFO);
  }

  @Test
  void overridesAreMapped() {
    MetrConfig config =
        MetrConfigs.load(
            MetrConfig.class,
            Map.of(
                "metr.handler-policy", "STRICT",
                "metr.shutdown-hook", "false",
                "metr.tags", "app,worker.jobs",
                "metr.logging.enabled", "true",
                "metr.logging.category", "app.metrics",
                "metr.logging.level", "DEBUG"));

    assertThat(config.handlerPolicy()).isEqualTo(HandlerPolicy.STRICT);
    assertThat(config.shutdownHook()).isFalse();
    assertThat(config.tags())
        .hasValueSatisfying(tags -> assertThat(tags).containsExactly("app", "worker.jobs"));
    assertThat(config.logging().enabled()).isTrue();
    assertThat(config.logging().category()).isEqualTo("app.metrics");
    assertThat(config.logging().level()).isEqualTo(Level.DEBUG);
  }

  @Test
  void unrelatedMetrKeysAreTolerated() {
    MetrConfig config =
        MetrConfigs.load(MetrConfig.class, Map.of("metr.jdbc.url", "jdbc:postgresql://db/metrics"));

    assertThat(config.handlerPolicy()).isEqualTo(HandlerPolicy.LENIENT);
  }
}
