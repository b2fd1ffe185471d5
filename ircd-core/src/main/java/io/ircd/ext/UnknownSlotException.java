package io.ircd.ext;

/**
 * Thrown when a slot handle is used after it was unregistered, or was created by a
 * different registry.
 */
public final class UnknownSlotException extends ExtensionException {

  public UnknownSlotException(String message) {
    super(message);
  }
}
