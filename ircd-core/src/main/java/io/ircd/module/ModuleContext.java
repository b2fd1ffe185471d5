package io.ircd.module;

import io.ircd.config.ServerConfig;
import io.ircd.entity.UserDirectory;
import io.ircd.event.AdvisoryEvent;
import io.ircd.event.AdvisoryListener;
import io.ircd.event.EventDispatcher;
import io.ircd.event.Priority;
import io.ircd.event.Subscription;
import io.ircd.event.VetoListener;
import io.ircd.event.VetoableEvent;
import io.ircd.ext.ExtensionRegistry;
import io.ircd.ext.ExtensionSlot;
import io.ircd.loop.CompletionQueue;

import java.util.Objects;
import java.util.Optional;

/**
 * A module's view of the server. Registrations made through the context are owned by
 * the module and removed when it unloads.
 */
public final class ModuleContext {
  private final String moduleName;
  private final ModuleManager manager;

  ModuleContext(String moduleName, ModuleManager manager) {
    this.moduleName = moduleName;
    this.manager = manager;
  }

  public String moduleName() {
    return moduleName;
  }

  public <T> ExtensionSlot<T> register(ExtensionSlot.Spec<T> spec) {
    return manager.extensions().register(moduleName, spec);
  }

  public <P> Subscription subscribe(VetoableEvent<P> kind, VetoListener<? super P> listener) {
    return subscribe(kind, listener, Priority.NORMAL);
  }

  public <P> Subscription subscribe(VetoableEvent<P> kind, VetoListener<? super P> listener, int priority) {
    return manager.dispatcher().subscribe(kind, moduleName, listener, priority);
  }

  public <P> Subscription subscribe(AdvisoryEvent<P> kind, AdvisoryListener<? super P> listener) {
    return subscribe(kind, listener, Priority.NORMAL);
  }

  public <P> Subscription subscribe(AdvisoryEvent<P> kind, AdvisoryListener<? super P> listener, int priority) {
    return manager.dispatcher().subscribe(kind, moduleName, listener, priority);
  }

  /**
   * Publishes a service other modules can look up by type.
   *
   * @throws IllegalStateException if another module already provides the type
   */
  public <S> void provide(Class<S> type, S service) {
    manager.provide(moduleName, type, Objects.requireNonNull(service, "service"));
  }

  public <S> Optional<S> service(Class<S> type) {
    return manager.service(type);
  }

  public ExtensionRegistry extensions() {
    return manager.extensions();
  }

  public EventDispatcher dispatcher() {
    return manager.dispatcher();
  }

  public ServerConfig config() {
    return manager.config();
  }

  public UserDirectory users() {
    return manager.users();
  }

  public CompletionQueue completions() {
    return manager.completions();
  }
}
