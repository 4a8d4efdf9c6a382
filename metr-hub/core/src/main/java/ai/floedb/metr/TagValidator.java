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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validates dotted metr tags and splits them into their hierarchy prefixes.
 *
 * <p>A tag is one or more non-empty segments joined by {@code '.'}. Segments may not contain
 * whitespace.
 */
public final class TagValidator {
  public static final char SEPARATOR = '.';

  private static final Pattern WHITESPACE = Pattern.compile("\\s");

  private TagValidator() {}

  /**
   * Returns {@code tag} unchanged if it is a valid identity.
   *
   * @throws InvalidTagException if the tag is empty, contains whitespace or has an empty segment
   */
  public static String validate(String tag) {
    Objects.requireNonNull(tag, "tag");
    if (tag.isEmpty()) {
      throw new InvalidTagException(tag, "tag must not be empty");
    }
    if (WHITESPACE.matcher(tag).find()) {
      throw new InvalidTagException(tag, "tag must not contain whitespace");
    }
    int start = 0;
    while (true) {
      int dot = tag.indexOf(SEPARATOR, start);
      int end = dot < 0 ? tag.length() : dot;
      if (end == start) {
        throw new InvalidTagException(tag, "empty segment at offset " + start);
      }
      if (dot < 0) {
        return tag;
      }
      start = dot + 1;
    }
  }

  /** Validates {@code tag} and returns its prefixes root first, e.g. {@code a, a.b, a.b.c}. */
  public static List<String> prefixes(String tag) {
    validate(tag);
    List<String> prefixes = new ArrayList<>();
    int dot = tag.indexOf(SEPARATOR);
    while (dot >= 0) {
      prefixes.add(tag.substring(0, dot));
      dot = tag.indexOf(SEPARATOR, dot + 1);
    }
    prefixes.add(tag);
    return List.copyOf(prefixes);
  }

  /** Joins a parent tag and a child suffix. The result is validated by the caller's lookup. */
  public static String child(String parent, String suffix) {
    Objects.requireNonNull(parent, "parent");
    Objects.requireNonNull(suffix, "suffix");
    return parent + SEPARATOR + suffix;
  }
}
