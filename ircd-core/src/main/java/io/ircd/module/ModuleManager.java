package io.ircd.module;

import io.ircd.config.ServerConfig;
import io.ircd.entity.UserDirectory;
import io.ircd.event.EventDispatcher;
import io.ircd.ext.ExtensionRegistry;
import io.ircd.loop.CompletionQueue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and unloads modules and tears down what they registered.
 *
 * <p>Unloading a module cancels its listeners first, then unregisters its extension slots
 * (releasing every value bound to them), then withdraws its services.
 */
public final class ModuleManager {
  private static final Logger logger = Logger.getLogger(ModuleManager.class.getName());

  private final ExtensionRegistry extensions;
  private final EventDispatcher dispatcher;
  private final ServerConfig config;
  private final UserDirectory users;
  private final CompletionQueue completions;
  private final Map<String, Loaded> modules = new LinkedHashMap<>();
  private final Map<Class<?>, Provided> services = new LinkedHashMap<>();

  public ModuleManager(ExtensionRegistry extensions, EventDispatcher dispatcher, ServerConfig config,
      UserDirectory users, CompletionQueue completions) {
    this.extensions = Objects.requireNonNull(extensions, "extensions");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.config = Objects.requireNonNull(config, "config");
    this.users = Objects.requireNonNull(users, "users");
    this.completions = Objects.requireNonNull(completions, "completions");
  }

  /**
   * Loads a module.
   *
   * @param module the module
   * @throws ModuleActivationException if a module with the same name is loaded, or if
   *                                   {@link Module#load} fails
   */
  public void load(Module module) {
    Objects.requireNonNull(module, "module");
    String name = module.name();
    if (modules.containsKey(name)) {
      throw new ModuleActivationException(name, "Module " + name + " is already loaded");
    }
    ModuleContext context = new ModuleContext(name, this);
    try {
      module.load(context);
    } catch (Exception e) {
      teardown(name);
      throw new ModuleActivationException(name, "Module " + name + " failed to load: " + e.getMessage(), e);
    }
    modules.put(name, new Loaded(module, context));
    logger.info("Loaded module " + name + (module.description().isEmpty() ? "" : ": " + module.description()));
  }

  /**
   * Unloads a module.
   *
   * @param name module name
   * @return {@code false} if no such module is loaded
   */
  public boolean unload(String name) {
    Loaded loaded = modules.remove(name);
    if (loaded == null) {
      return false;
    }
    try {
      loaded.module().unload(loaded.context());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Module " + name + " failed during unload", e);
    }
    teardown(name);
    logger.info("Unloaded module " + name);
    return true;
  }

  /**
   * Unloads every module in reverse load order.
   */
  public void unloadAll() {
    List<String> names = new ArrayList<>(modules.keySet());
    Collections.reverse(names);
    for (String name : names) {
      unload(name);
    }
  }

  public boolean isLoaded(String name) {
    return modules.containsKey(name);
  }

  public List<String> loadedModules() {
    return List.copyOf(modules.keySet());
  }

  public <S> Optional<S> service(Class<S> type) {
    Provided provided = services.get(type);
    return provided == null ? Optional.empty() : Optional.of(type.cast(provided.service()));
  }

  <S> void provide(String owner, Class<S> type, S service) {
    Provided existing = services.get(type);
    if (existing != null) {
      throw new IllegalStateException("Service " + type.getName() + " is already provided by " + existing.owner());
    }
    services.put(type, new Provided(owner, service));
  }

  ExtensionRegistry extensions() {
    return extensions;
  }

  EventDispatcher dispatcher() {
    return dispatcher;
  }

  ServerConfig config() {
    return config;
  }

  UserDirectory users() {
    return users;
  }

  CompletionQueue completions() {
    return completions;
  }

  private void teardown(String name) {
    int listeners = dispatcher.unsubscribeAll(name);
    int slots = extensions.unregisterAll(name);
    services.values().removeIf(provided -> provided.owner().equals(name));
    logger.fine(() -> "Tore down " + name + ": " + listeners + " listener(s), " + slots + " slot(s)");
  }

  private record Loaded(Module module, ModuleContext context) {
  }

  private record Provided(String owner, Object service) {
  }
}
