package ai.floedb.metr;

/** Records single values immediately, on the calling thread. */
public final class IntRecorder extends Recorder {

  IntRecorder(Metr metr) {
    super(metr);
  }

  public void rec(long value) {
    commit(value);
  }
}
