package io.ircd.ext;

/**
 * Base class for extension slot failures.
 *
 * <p>Registration conflicts and mismatched access are programming errors and surface
 * to the module loader; malformed replicated values only surface when
 * {@link MalformedValuePolicy#REJECT} is configured.
 */
public class ExtensionException extends RuntimeException {

  public ExtensionException(String message) {
    super(message);
  }

  public ExtensionException(String message, Throwable cause) {
    super(message, cause);
  }
}
