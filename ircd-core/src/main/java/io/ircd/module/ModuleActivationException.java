package io.ircd.module;

/**
 * Thrown when a module fails to load. The module's partial registrations have been
 * rolled back by the time this is thrown.
 */
public class ModuleActivationException extends RuntimeException {
  private final String moduleName;

  public ModuleActivationException(String moduleName, String message) {
    super(message);
    this.moduleName = moduleName;
  }

  public ModuleActivationException(String moduleName, String message, Throwable cause) {
    super(message, cause);
    this.moduleName = moduleName;
  }

  public String moduleName() {
    return moduleName;
  }
}
