package io.ircd.module;

/**
 * A feature module. Modules extend the server only through their {@link ModuleContext}:
 * extension slots, event listeners and published services.
 */
public interface Module {

  /**
   * Returns the module name, used as the owner of everything it registers.
   *
   * @return unique module name, for example {@code m_sslinfo}
   */
  String name();

  default String description() {
    return "";
  }

  /**
   * Registers the module's slots, listeners and services.
   *
   * <p>If this throws, everything registered so far is rolled back and the module does
   * not become active.
   *
   * @param context the module's view of the server
   * @throws Exception if the module cannot start
   */
  void load(ModuleContext context) throws Exception;

  /**
   * Called before the module's registrations are removed.
   *
   * @param context the module's view of the server
   */
  default void unload(ModuleContext context) {
  }
}
