package ai.floedb.metr;

/**
 * Sink for recorded values.
 *
 * <p>{@link #handle(MetrRecord)} runs synchronously on the recording thread, so an implementation
 * that blocks stalls the whole propagation chain above the originating metr. Failures thrown from
 * {@code handle} reach the caller of {@link Metr#handleValue(long)}.
 */
public interface Handler {

  void handle(MetrRecord record);

  /** Pushes any pending output to the underlying sink. */
  default void flush() {}

  /** Releases the sink. Called once by {@link MetrRegistry#shutdown()}. */
  default void close() {}
}
