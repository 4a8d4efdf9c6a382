package ai.floedb.metr;

import java.util.Objects;

/** Shapes application events into values recorded against a single {@link Metr}. */
public abstract class Recorder {
  private final Metr metr;

  Recorder(Metr metr) {
    this.metr = Objects.requireNonNull(metr, "metr");
  }

  public Metr metr() {
    return metr;
  }

  protected void commit(long value) {
    metr.handleValue(value);
  }
}
