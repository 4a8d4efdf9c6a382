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

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.metr.MetrRecord;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class FormatterTest {
  private static final Instant CREATED = Instant.parse("2026-05-04T03:02:01.500Z");

  @Test
  void sqlValuesAreOrderedAndQuoted() {
    MetrRecord record = new MetrRecord(CREATED, "db.rows", 15, "session-1");

    assertThat(SqlValuesFormatter.INSTANCE.format(record))
        .isEqualTo("'2026-05-04T03:02:01.500Z', 'db.rows', 15, 'session-1'");
  }

  @Test
  void sqlValuesEscapeQuotes() {
    MetrRecord record = new MetrRecord(CREATED, "o'brien", -3, "s");

    assertThat(SqlValuesFormatter.INSTANCE.format(record))
        .isEqualTo("'2026-05-04T03:02:01.500Z', 'o''brien', -3, 's'");
  }

  @Test
  void textContainsThreadSessionTimeTagAndValue() {
    MetrRecord record = new MetrRecord(CREATED, "api.calls", 2, "session-7");
    Thread thread = Thread.currentThread();

    assertThat(TextFormatter.INSTANCE.format(record))
        .isEqualTo(
            "[thread:"
                + thread.getId()
                + "][thread_name:"
                + thread.getName()
                + "][session:session-7][created:2026-05-04T03:02:01.500Z]"
                + "[tag:api.calls][value:2]");
  }
}
