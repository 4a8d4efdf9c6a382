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

import java.time.Instant;
import java.util.Objects;

/**
 * One immutable observation.
 *
 * <p>The {@link #tag()} names the metr that produced the value. Ancestors receive the same
 * instance while the record propagates, so their handlers still see the originating tag.
 */
public final class MetrRecord {
  private final Instant created;
  private final String tag;
  private final long value;
  private final String sessionId;
  private final long threadId;
  private final String threadName;

  public MetrRecord(Instant created, String tag, long value, String sessionId) {
    this(created, tag, value, sessionId, Thread.currentThread());
  }

  private MetrRecord(Instant created, String tag, long value, String sessionId, Thread thread) {
    this.created = Objects.requireNonNull(created, "created");
    this.tag = Objects.requireNonNull(tag, "tag");
    this.value = value;
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.threadId = thread.getId();
    this.threadName = thread.getName();
  }

  public Instant created() {
    return created;
  }

  public String tag() {
    return tag;
  }

  public long value() {
    return value;
  }

  public String sessionId() {
    return sessionId;
  }

  /** Id of the thread that recorded the value. */
  public long threadId() {
    return threadId;
  }

  public String threadName() {
    return threadName;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof MetrRecord other)) {
      return false;
    }
    return value == other.value
        && threadId == other.threadId
        && created.equals(other.created)
        && tag.equals(other.tag)
        && sessionId.equals(other.sessionId)
        && threadName.equals(other.threadName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(created, tag, value, sessionId, threadId, threadName);
  }

  @Override
  public String toString() {
    return "[thread:"
        + threadId
        + "][thread_name:"
        + threadName
        + "][session:"
        + sessionId
        + "][created:"
        + created
        + "][tag:"
        + tag
        + "][value:"
        + value
        + "]";
  }
}
