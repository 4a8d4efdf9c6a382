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
package ai.floedb.metr.handlers;

import ai.floedb.metr.Handler;
import ai.floedb.metr.MetrRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** Lightweight in-memory handler for tests. Keeps every record it receives, in arrival order. */
public final class RecordingHandler implements Handler {
  private final String name;
  private final List<MetrRecord> records = new ArrayList<>();
  private final AtomicInteger flushes = new AtomicInteger();
  private final AtomicInteger closes = new AtomicInteger();

  public RecordingHandler() {
    this("recording");
  }

  public RecordingHandler(String name) {
    this.name = name;
  }

  @Override
  public synchronized void handle(MetrRecord record) {
    records.add(record);
  }

  @Override
  public void flush() {
    flushes.incrementAndGet();
  }

  @Override
  public void close() {
    closes.incrementAndGet();
  }

  public synchronized List<MetrRecord> records() {
    return List.copyOf(records);
  }

  public synchronized List<Long> values() {
    List<Long> values = new ArrayList<>(records.size());
    for (MetrRecord record : records) {
      values.add(record.value());
    }
    return values;
  }

  public synchronized List<String> tags() {
    List<String> tags = new ArrayList<>(records.size());
    for (MetrRecord record : records) {
      tags.add(record.tag());
    }
    return tags;
  }

  public synchronized MetrRecord last() {
    if (records.isEmpty()) {
      throw new IllegalStateException(name + " has not received any record");
    }
    return records.get(records.size() - 1);
  }

  public synchronized void clear() {
    records.clear();
  }

  public int flushCount() {
    return flushes.get();
  }

  public int closeCount() {
    return closes.get();
  }

  @Override
  public String toString() {
    return name;
  }
}
