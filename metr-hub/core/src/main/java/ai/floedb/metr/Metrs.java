package ai.floedb.metr;

import java.util.concurrent.atomic.AtomicBoolean;

/** Static facade for the process-wide {@link MetrRegistry}. */
public final class Metrs {
  private static final MetrRegistry REGISTRY = new MetrRegistry();
  private static final AtomicBoolean SHUTDOWN_HOOK = new AtomicBoolean();

  private Metrs() {}

  /** The registry shared by the whole process. */
  public static MetrRegistry registry() {
    return REGISTRY;
  }

  /** Shortcut for {@code registry().get(tag)}. */
  public static Metr get(String tag) {
    return REGISTRY.get(tag);
  }

  /**
   * Closes the handlers of the shared registry when the JVM exits. Calling this more than once has
   * no further effect.
   *
   * @return {@code true} if this call installed the hook
   */
  public static boolean installShutdownHook() {
    if (!SHUTDOWN_HOOK.compareAndSet(false, true)) {
      return false;
    }
    Runtime.getRuntime().addShutdownHook(new Thread(REGISTRY::shutdown, "metr-shutdown"));
    return true;
  }
}
