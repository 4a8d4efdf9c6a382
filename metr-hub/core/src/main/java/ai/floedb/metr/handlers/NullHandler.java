package ai.floedb.metr.handlers;

import ai.floedb.metr.Handler;
import ai.floedb.metr.MetrRecord;

/** Discards every record. Stands in for a sink that could not be set up. */
public final class NullHandler implements Handler {
  public static final NullHandler INSTANCE = new NullHandler();

  private NullHandler() {}

  @Override
  public void handle(MetrRecord record) {}

  @Override
  public String toString() {
    return "NullHandler";
  }
}
