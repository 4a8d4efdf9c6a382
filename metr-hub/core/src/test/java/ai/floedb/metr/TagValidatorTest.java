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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TagValidatorTest {

  @Test
  void acceptsDottedTags() {
    assertThat(TagValidator.validate("a")).isEqualTo("a");
    assertThat(TagValidator.validate("app.db.insert_rows")).isEqualTo("app.db.insert_rows");
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "a..b", ".a", "a.", ".", "a b", "a.\tb", "x.y\n"})
  void rejectsMalformedTags(String tag) {
    assertThatThrownBy(() -> TagValidator.validate(tag))
        .isInstanceOf(InvalidTagException.class)
        .extracting(e -> ((InvalidTagException) e).tag())
        .isEqualTo(tag);
  }

  @Test
  void nullTagIsAProgrammingError() {
    assertThatThrownBy(() -> TagValidator.validate(null)).isInstanceOf(NullPointerException.class);
  }

  @Test
  void prefixesAreRootFirst() {
    assertThat(TagValidator.prefixes("a.b.c")).containsExactly("a", "a.b", "a.b.c");
    assertThat(TagValidator.prefixes("root")).containsExactly("root");
  }

  @Test
  void childJoinsWithSeparator() {
    assertThat(TagValidator.child("a.b", "c")).isEqualTo("a.b.c");
  }
}
