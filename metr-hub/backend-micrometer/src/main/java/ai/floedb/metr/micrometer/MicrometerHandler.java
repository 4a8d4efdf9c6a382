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
package ai.floedb.metr.micrometer;

import ai.floedb.metr.Handler;
import ai.floedb.metr.MetrRecord;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes recorded values as a Micrometer {@link DistributionSummary}.
 *
 * <p>All values share one meter name; the originating metr tag becomes the {@value #TAG_KEY} meter
 * tag, so a handler attached to a parent metr produces one summary per descendant that records.
 */
public final class MicrometerHandler implements Handler {
  private static final Logger LOG = LoggerFactory.getLogger(MicrometerHandler.class);

  public static final String DEFAULT_METER_NAME = "metr.values";
  public static final String TAG_KEY = "metr";

  private final MeterRegistry registry;
  private final String meterName;
  private final ConcurrentMap<String, DistributionSummary> summaries = new ConcurrentHashMap<>();

  public MicrometerHandler(MeterRegistry registry) {
    this(registry, DEFAULT_METER_NAME);
  }

  public MicrometerHandler(MeterRegistry registry, String meterName) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.meterName = Objects.requireNonNull(meterName, "meterName");
    if (meterName.isBlank()) {
      throw new IllegalArgumentException("meterName must not be blank");
    }
  }

  @Override
  public void handle(MetrRecord record) {
    summaries.computeIfAbsent(record.tag(), this::register).record(record.value());
  }

  public String meterName() {
    return meterName;
  }

  /** Removes the meters this handler registered. */
  @Override
  public void close() {
    for (DistributionSummary summary : summaries.values()) {
      registry.remove(summary);
    }
    LOG.debug("Removed {} {} summaries", summaries.size(), meterName);
    summaries.clear();
  }

  private DistributionSummary register(String tag) {
    LOG.debug("Registering summary {} for metr {}", meterName, tag);
    return DistributionSummary.builder(meterName)
        .description("Values recorded by metr handlers")
        .tag(TAG_KEY, tag)
        .register(registry);
  }

  @Override
  public String toString() {
    return "MicrometerHandler(" + meterName + ")";
  }
}
