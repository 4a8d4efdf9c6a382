package ai.floedb.metr.format;

import ai.floedb.metr.MetrRecord;

/** Renders a record for a specific sink. Implementations are pure and thread-safe. */
@FunctionalInterface
public interface Formatter {

  String format(MetrRecord record);
}
