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
import ai.floedb.metr.MetrException;
import ai.floedb.metr.MetrRecord;
import ai.floedb.metr.format.Formatter;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for sinks that serialise writes and recover from their own failures.
 *
 * <p>Calls to {@link #emit(MetrRecord)}, {@link #doFlush()} and {@link #doClose()} are made while
 * holding a per-handler lock. A failing {@code emit} is passed to {@link #handleError}, which
 * re-throws under {@link HandlerPolicy#STRICT} and logs under {@link HandlerPolicy#LENIENT}.
 */
public abstract class AbstractHandler implements Handler {
  private static final Logger LOG = LoggerFactory.getLogger(AbstractHandler.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Formatter formatter;
  private final HandlerPolicy policy;

  protected AbstractHandler(Formatter formatter, HandlerPolicy policy) {
    this.formatter = Objects.requireNonNull(formatter, "formatter");
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  @Override
  public final void handle(MetrRecord record) {
    Objects.requireNonNull(record, "record");
    lock.lock();
    try {
      emit(record);
    } catch (Exception e) {
      handleError(record, e);
    } finally {
      lock.unlock();
    }
  }

  /** Writes one record to the sink. */
  protected abstract void emit(MetrRecord record) throws Exception;

  @Override
  public final void flush() {
    lock.lock();
    try {
      doFlush();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public final void close() {
    lock.lock();
    try {
      doClose();
    } finally {
      lock.unlock();
    }
  }

  protected void doFlush() {}

  protected void doClose() {}

  protected String format(MetrRecord record) {
    return formatter.format(record);
  }

  public Formatter formatter() {
    return formatter;
  }

  public HandlerPolicy policy() {
    return policy;
  }

  /** Applies the handler policy to a failed {@link #emit(MetrRecord)}. */
  protected void handleError(MetrRecord record, Exception error) {
    if (policy.isStrict()) {
      if (error instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new MetrException(
          getClass().getSimpleName() + " failed to handle record for " + record.tag(), error);
    }
    LOG.error("Error in handler {} for record {}", getClass().getSimpleName(), record, error);
  }
}
