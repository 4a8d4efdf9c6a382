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

import ai.floedb.metr.MetrRecord;
import ai.floedb.metr.format.Formatter;
import ai.floedb.metr.format.TextFormatter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/** Writes each record as one line to an SLF4J logger at a fixed level. */
public final class LoggingHandler extends AbstractHandler {
  private final Logger logger;
  private final Level level;

  public LoggingHandler(String category, Level level) {
    this(LoggerFactory.getLogger(Objects.requireNonNull(category, "category")), level);
  }

  public LoggingHandler(Logger logger, Level level) {
    this(logger, level, TextFormatter.INSTANCE, HandlerPolicy.LENIENT);
  }

  public LoggingHandler(Logger logger, Level level, Formatter formatter, HandlerPolicy policy) {
    super(formatter, policy);
    this.logger = Objects.requireNonNull(logger, "logger");
    this.level = Objects.requireNonNull(level, "level");
  }

  @Override
  protected void emit(MetrRecord record) {
    String line = format(record);
    switch (level) {
      case ERROR -> logger.error(line);
      case WARN -> logger.warn(line);
      case INFO -> logger.info(line);
      case DEBUG -> logger.debug(line);
      case TRACE -> logger.trace(line);
    }
  }

  public Level level() {
    return level;
  }

  public String category() {
    return logger.getName();
  }

  @Override
  public String toString() {
    return "LoggingHandler(" + logger.getName() + ", " + level + ")";
  }
}
