package ai.floedb.metr;

/** Raised when a metr tag is empty or malformed. No node is created for a rejected tag. */
public class InvalidTagException extends MetrException {
  private final String tag;

  public InvalidTagException(String tag, String reason) {
    super("invalid metr tag '" + tag + "': " + reason);
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }
}
