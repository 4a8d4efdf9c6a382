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
package ai.floedb.metr.format;

import ai.floedb.metr.MetrRecord;

/**
 * Renders a record as an SQL value list, {@code '<created>', '<tag>', <value>, '<sessionId>'}.
 *
 * <p>String literals are quoted with single quotes; embedded quotes are doubled.
 */
public final class SqlValuesFormatter implements Formatter {
  public static final SqlValuesFormatter INSTANCE = new SqlValuesFormatter();

  @Override
  public String format(MetrRecord record) {
    return quote(record.created().toString())
        + ", "
        + quote(record.tag())
        + ", "
        + record.value()
        + ", "
        + quote(record.sessionId());
  }

  static String quote(String literal) {
    return "'" + literal.replace("'", "''") + "'";
  }
}
