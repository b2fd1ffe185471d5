package io.ircd.ext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for long-lived core entities that modules can attach data to.
 *
 * <p>Storage is keyed by {@link ExtensionSlot} identity and holds at most one value
 * per slot. The map is only reachable through {@link ExtensionRegistry}; subclasses
 * and modules never see the raw values.
 *
 * <p>Once {@link ExtensionRegistry#onEntityDestroyed(Extensible)} has run the entity
 * is inert: reads return nothing and writes are dropped.
 */
public abstract class Extensible {
  private final Map<ExtensionSlot<?>, Object> extensions = new LinkedHashMap<>();
  private boolean destroyed;

  /**
   * Returns the kind of this entity, used to validate slot access.
   *
   * @return the entity kind
   */
  public abstract EntityKind kind();

  /**
   * Returns {@code true} once the entity has been destroyed by the core.
   *
   * @return whether the entity is destroyed
   */
  public final boolean isDestroyed() {
    return destroyed;
  }

  /**
   * Returns the number of slots currently holding a value for this entity.
   *
   * @return attached value count
   */
  public final int extensionCount() {
    return extensions.size();
  }

  Object getRaw(ExtensionSlot<?> slot) {
    return extensions.get(slot);
  }

  Object setRaw(ExtensionSlot<?> slot, Object value) {
    return extensions.put(slot, value);
  }

  Object unsetRaw(ExtensionSlot<?> slot) {
    return extensions.remove(slot);
  }

  List<Map.Entry<ExtensionSlot<?>, Object>> markDestroyed() {
    destroyed = true;
    List<Map.Entry<ExtensionSlot<?>, Object>> remaining = new ArrayList<>(extensions.entrySet().size());
    for (Map.Entry<ExtensionSlot<?>, Object> entry : extensions.entrySet()) {
      remaining.add(Map.entry(entry.getKey(), entry.getValue()));
    }
    extensions.clear();
    return remaining;
  }
}
