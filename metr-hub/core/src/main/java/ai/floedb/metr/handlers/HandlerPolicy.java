package ai.floedb.metr.handlers;

/** What an {@link AbstractHandler} does when writing a record to its sink fails. */
public enum HandlerPolicy {
  /** Re-throw to the caller of the recording metr, aborting the rest of the dispatch. */
  STRICT,
  /** Log the failure and return normally. */
  LENIENT;

  public boolean isStrict() {
    return this == STRICT;
  }
}
