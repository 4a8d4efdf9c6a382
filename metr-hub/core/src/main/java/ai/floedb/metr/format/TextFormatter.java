package ai.floedb.metr.format;

import ai.floedb.metr.MetrRecord;

/**
 * Structured single-line form:
 * {@code [thread:<id>][thread_name:<name>][session:<id>][created:<ts>][tag:<tag>][value:<n>]}.
 */
public final class TextFormatter implements Formatter {
  public static final TextFormatter INSTANCE = new TextFormatter();

  @Override
  public String format(MetrRecord record) {
    return record.toString();
  }
}
