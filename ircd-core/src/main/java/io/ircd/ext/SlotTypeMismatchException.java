package io.ircd.ext;

/**
 * Thrown when a value or entity does not match the type and kind a slot was declared with.
 */
public final class SlotTypeMismatchException extends ExtensionException {

  public SlotTypeMismatchException(String message) {
    super(message);
  }
}
