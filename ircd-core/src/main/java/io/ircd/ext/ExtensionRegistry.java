package io.ircd.ext;

import io.ircd.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns every {@link ExtensionSlot} descriptor and every (entity, slot) binding.
 *
 * <p>Values are stored on the entities themselves; the registry keeps a reverse index
 * of holders per slot so that {@link #unregister} can release values without walking
 * every entity in the server. Each binding is released exactly once, whichever of
 * replacement, {@link #clear}, {@link #onEntityDestroyed} or {@link #unregister}
 * ends it.
 *
 * <h2>Threading</h2>
 * <p>Not thread-safe. All calls are made from the server's control thread; async work
 * hands results back through {@link io.ircd.loop.CompletionQueue}.
 *
 * @see ExtensionSlot
 * @see ExtensionReplicator
 */
public final class ExtensionRegistry {
  private static final Logger logger = Logger.getLogger(ExtensionRegistry.class.getName());

  private final Map<SlotKey, ExtensionSlot<?>> slots = new LinkedHashMap<>();
  private final Map<ExtensionSlot<?>, Set<Extensible>> holders = new IdentityHashMap<>();
  private final MalformedValuePolicy malformedValuePolicy;
  private final MetricsExporter metrics;

  private ExtensionRegistry(Builder builder) {
    this.malformedValuePolicy = builder.malformedValuePolicy;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Registration ────────────────────────────────────────────────

  /**
   * Registers a slot on behalf of a module.
   *
   * <p>Registering the same {@code (name, kind)} again from the same owner returns the
   * existing handle.
   *
   * @param owner the owning module name
   * @param spec  the slot declaration
   * @param <T>   the value type
   * @return the slot handle
   * @throws DuplicateSlotException     if another owner holds the name for this kind
   * @throws SlotTypeMismatchException  if the same owner re-registers with a different
   *                                    value type or network flag
   */
  public <T> ExtensionSlot<T> register(String owner, ExtensionSlot.Spec<T> spec) {
    Objects.requireNonNull(owner, "owner");
    Objects.requireNonNull(spec, "spec");
    SlotKey key = new SlotKey(spec.name(), spec.kind());
    ExtensionSlot<?> existing = slots.get(key);
    if (existing != null) {
      if (!existing.owner().equals(owner)) {
        throw new DuplicateSlotException(spec.name(), spec.kind(), existing.owner(), owner);
      }
      if (!existing.matches(spec)) {
        throw new SlotTypeMismatchException("Extension slot " + spec.name() + " (" + spec.kind()
            + ") was registered by " + owner + " with a different declaration");
      }
      @SuppressWarnings("unchecked")
      ExtensionSlot<T> same = (ExtensionSlot<T>) existing;
      return same;
    }
    ExtensionSlot<T> slot = new ExtensionSlot<>(this, owner, spec);
    slots.put(key, slot);
    holders.put(slot, Collections.newSetFromMap(new IdentityHashMap<>()));
    logger.fine(() -> "Registered " + slot);
    return slot;
  }

  /**
   * Removes a slot, releasing every value still bound to it.
   *
   * @param slot the slot to remove
   * @return number of values released
   * @throws UnknownSlotException if the slot is not registered here
   */
  public int unregister(ExtensionSlot<?> slot) {
    Set<Extensible> bound = ensureRegistered(slot);
    int released = 0;
    for (Extensible entity : new ArrayList<>(bound)) {
      Object raw = entity.unsetRaw(slot);
      if (raw != null) {
        release(slot, raw);
        released++;
      }
    }
    holders.remove(slot);
    slots.remove(new SlotKey(slot.name(), slot.kind()));
    slot.markUnregistered();
    metrics.recordBoundValues(slot.name(), 0);
    int count = released;
    logger.fine(() -> "Unregistered " + slot + ", released " + count + " value(s)");
    return released;
  }

  /**
   * Unregisters every slot owned by a module.
   *
   * @param owner the module name
   * @return number of slots removed
   */
  public int unregisterAll(String owner) {
    List<ExtensionSlot<?>> owned = slotsOwnedBy(owner);
    for (ExtensionSlot<?> slot : owned) {
      unregister(slot);
    }
    return owned.size();
  }

  /**
   * Looks up a slot by name and entity kind.
   *
   * @param name the slot name
   * @param kind the entity kind
   * @return the slot, if registered
   */
  public Optional<ExtensionSlot<?>> find(String name, EntityKind kind) {
    return Optional.ofNullable(slots.get(new SlotKey(name, kind)));
  }

  /**
   * Returns all registered slots in registration order.
   *
   * @return immutable snapshot of the slots
   */
  public List<ExtensionSlot<?>> slots() {
    return List.copyOf(slots.values());
  }

  public List<ExtensionSlot<?>> slotsOwnedBy(String owner) {
    List<ExtensionSlot<?>> owned = new ArrayList<>();
    for (ExtensionSlot<?> slot : slots.values()) {
      if (slot.owner().equals(owner)) {
        owned.add(slot);
      }
    }
    return owned;
  }

  // ── Value access ────────────────────────────────────────────────

  /**
   * Returns the value bound to {@code (entity, slot)}.
   *
   * @return the value, or empty if unset or the entity was destroyed
   * @throws UnknownSlotException       if the slot is not registered
   * @throws SlotTypeMismatchException  if the entity is of another kind
   */
  public <T> Optional<T> get(ExtensionSlot<T> slot, Extensible entity) {
    ensureRegistered(slot);
    checkKind(slot, entity);
    if (entity.isDestroyed()) {
      return Optional.empty();
    }
    Object raw = entity.getRaw(slot);
    return raw == null ? Optional.empty() : Optional.of(slot.cast(raw));
  }

  /**
   * Binds a value, releasing any value previously bound to the same pair.
   *
   * <p>Setting a value on a destroyed entity is a no-op; the value is not retained.
   *
   * @throws UnknownSlotException       if the slot is not registered
   * @throws SlotTypeMismatchException  if the entity kind or value type does not match
   */
  public <T> void set(ExtensionSlot<T> slot, Extensible entity, T value) {
    Set<Extensible> bound = ensureRegistered(slot);
    checkKind(slot, entity);
    Objects.requireNonNull(value, "value");
    if (!slot.type().isInstance(value)) {
      throw new SlotTypeMismatchException("Extension slot " + slot.name() + " holds "
          + slot.type().getName() + ", not " + value.getClass().getName());
    }
    if (entity.isDestroyed()) {
      logger.fine(() -> "Ignoring set of " + slot.name() + " on destroyed " + entity);
      return;
    }
    if (value instanceof RefCounted counted) {
      // Retain before unbinding so that re-setting the same object never drops it to zero
      counted.retain();
    }
    Object old = entity.setRaw(slot, value);
    bound.add(entity);
    if (old == value) {
      // Same object re-bound: no release hook, only balance the retain above
      if (value instanceof RefCounted counted) {
        counted.release();
      }
    } else if (old != null) {
      release(slot, old);
    } else {
      metrics.recordBoundValues(slot.name(), bound.size());
    }
  }

  /**
   * Releases and removes the value bound to {@code (entity, slot)}, if any.
   */
  public void clear(ExtensionSlot<?> slot, Extensible entity) {
    Set<Extensible> bound = ensureRegistered(slot);
    checkKind(slot, entity);
    Object old = entity.unsetRaw(slot);
    if (old != null) {
      bound.remove(entity);
      release(slot, old);
      metrics.recordBoundValues(slot.name(), bound.size());
    }
  }

  /**
   * Releases every value still attached to an entity and makes it inert.
   *
   * <p>The core calls this before discarding the entity. Calling it twice is harmless.
   *
   * @param entity the entity being destroyed
   */
  public void onEntityDestroyed(Extensible entity) {
    Objects.requireNonNull(entity, "entity");
    if (entity.isDestroyed()) {
      return;
    }
    for (Map.Entry<ExtensionSlot<?>, Object> entry : entity.markDestroyed()) {
      ExtensionSlot<?> slot = entry.getKey();
      Set<Extensible> bound = holders.get(slot);
      if (bound != null) {
        bound.remove(entity);
        metrics.recordBoundValues(slot.name(), bound.size());
      }
      release(slot, entry.getValue());
    }
  }

  // ── Network synchronization ─────────────────────────────────────

  /**
   * Encodes the current value for a linked server.
   *
   * @return wire text, or empty if no value is bound or encoding failed
   * @throws IllegalStateException if the slot is not network-synchronized
   */
  public <T> Optional<String> serializeForNetwork(ExtensionSlot<T> slot, Extensible entity) {
    SlotCodec<T> codec = requireCodec(slot);
    Optional<T> value = get(slot, entity);
    if (value.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(codec.encode(value.get()));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to encode extension slot " + slot.name() + " for " + entity, e);
      return Optional.empty();
    }
  }

  /**
   * Decodes wire text from a linked server and binds the result.
   *
   * <p>Text the codec rejects binds {@link SlotCodec#invalidValue(String)} instead, unless
   * the registry was built with {@link MalformedValuePolicy#REJECT}.
   *
   * @throws IllegalStateException       if the slot is not network-synchronized
   * @throws MalformedMetadataException  under the reject policy, if decoding fails
   */
  public <T> void deserializeFromNetwork(ExtensionSlot<T> slot, Extensible entity, String text) {
    SlotCodec<T> codec = requireCodec(slot);
    checkKind(slot, entity);
    T value;
    try {
      value = codec.decode(text);
    } catch (RuntimeException e) {
      metrics.incrementDecodeFailure(slot.name());
      if (malformedValuePolicy == MalformedValuePolicy.REJECT) {
        throw new MalformedMetadataException(slot.name(), text, e);
      }
      logger.log(Level.WARNING, "Malformed network value for extension slot " + slot.name()
          + " on " + entity + ": '" + text + "'; attaching invalid value", e);
      value = codec.invalidValue(text);
    }
    set(slot, entity, value);
  }

  public MalformedValuePolicy malformedValuePolicy() {
    return malformedValuePolicy;
  }

  // ── Internals ───────────────────────────────────────────────────

  private Set<Extensible> ensureRegistered(ExtensionSlot<?> slot) {
    Objects.requireNonNull(slot, "slot");
    Set<Extensible> bound = slot.registry() == this ? holders.get(slot) : null;
    if (bound == null) {
      throw new UnknownSlotException("Extension slot " + slot.name() + " (" + slot.kind()
          + ") is not registered");
    }
    return bound;
  }

  private static void checkKind(ExtensionSlot<?> slot, Extensible entity) {
    Objects.requireNonNull(entity, "entity");
    if (entity.kind() != slot.kind()) {
      throw new SlotTypeMismatchException("Extension slot " + slot.name() + " is declared for "
          + slot.kind() + " entities, not " + entity.kind());
    }
  }

  private <T> SlotCodec<T> requireCodec(ExtensionSlot<T> slot) {
    ensureRegistered(slot);
    SlotCodec<T> codec = slot.codec();
    if (codec == null) {
      throw new IllegalStateException("Extension slot " + slot.name() + " is not network-synchronized");
    }
    return codec;
  }

  private <T> void release(ExtensionSlot<T> slot, Object raw) {
    T value = slot.cast(raw);
    try {
      slot.releaseHook().release(value);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Release hook for extension slot " + slot.name() + " failed", e);
    }
    if (value instanceof RefCounted counted) {
      counted.release();
    }
    metrics.incrementValueReleased(slot.name());
  }

  private record SlotKey(String name, EntityKind kind) {
  }

  /** Builder for {@link ExtensionRegistry}. */
  public static final class Builder {
    private MalformedValuePolicy malformedValuePolicy = MalformedValuePolicy.TOLERATE;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets how undecodable network values are handled.
     *
     * <p>Defaults to {@link MalformedValuePolicy#TOLERATE}.
     *
     * @param malformedValuePolicy the policy
     * @return this builder
     */
    public Builder malformedValuePolicy(MalformedValuePolicy malformedValuePolicy) {
      this.malformedValuePolicy = Objects.requireNonNull(malformedValuePolicy, "malformedValuePolicy");
      return this;
    }

    /**
     * Sets the metrics exporter. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public ExtensionRegistry build() {
      return new ExtensionRegistry(this);
    }
  }
}
