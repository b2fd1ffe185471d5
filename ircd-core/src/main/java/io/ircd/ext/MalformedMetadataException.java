package io.ircd.ext;

/**
 * Thrown by {@link ExtensionRegistry#deserializeFromNetwork} under
 * {@link MalformedValuePolicy#REJECT} when the slot codec cannot decode the text.
 */
public final class MalformedMetadataException extends ExtensionException {
  private final String slotName;
  private final String text;

  public MalformedMetadataException(String slotName, String text, Throwable cause) {
    super("Malformed value for extension slot " + slotName + ": '" + text + "'", cause);
    this.slotName = slotName;
    this.text = text;
  }

  public String slotName() {
    return slotName;
  }

  public String text() {
    return text;
  }
}
