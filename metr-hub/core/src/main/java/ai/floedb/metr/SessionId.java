package ai.floedb.metr;

import java.util.UUID;

/**
 * Process-lifetime correlation id. Generated once when the class is initialised and shared by
 * every {@link MetrRecord} produced in this JVM.
 */
public final class SessionId {
  private static final String CURRENT = UUID.randomUUID().toString();

  private SessionId() {}

  public static String current() {
    return CURRENT;
  }
}
