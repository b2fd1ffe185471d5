package io.ircd.ext;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed handle for a named attribute that modules attach to core entities.
 *
 * <p>Handles are created by {@link ExtensionRegistry#register(String, Spec)} and carry
 * the value type fixed at registration, so {@link #set} and {@link #get} are checked
 * at compile time inside the owning module while the registry stores values opaquely.
 * Every method delegates to the registry that created the handle.
 *
 * <pre>{@code
 * ExtensionSlot<Integer> marker = registry.register("m_example",
 *     ExtensionSlot.spec("example_marker", EntityKind.USER, Integer.class)
 *         .networked(SlotCodecs.integer()));
 *
 * marker.set(user, 1);
 * marker.get(user).ifPresent(v -> ...);
 * }</pre>
 *
 * @param <T> the value type
 */
public final class ExtensionSlot<T> {
  private final ExtensionRegistry registry;
  private final String name;
  private final EntityKind kind;
  private final Class<T> type;
  private final String owner;
  private final SlotCodec<T> codec;
  private final ReleaseHook<? super T> releaseHook;
  private boolean registered = true;

  ExtensionSlot(ExtensionRegistry registry, String owner, Spec<T> spec) {
    this.registry = registry;
    this.owner = owner;
    this.name = spec.name;
    this.kind = spec.kind;
    this.type = spec.type;
    this.codec = spec.codec;
    this.releaseHook = spec.releaseHook;
  }

  /**
   * Starts a slot declaration.
   *
   * @param name slot name, unique per entity kind and free of whitespace
   * @param kind the entity kind the slot attaches to
   * @param type the value type
   * @param <T>  the value type
   * @return a new declaration
   */
  public static <T> Spec<T> spec(String name, EntityKind kind, Class<T> type) {
    return new Spec<>(name, kind, type);
  }

  public String name() {
    return name;
  }

  public EntityKind kind() {
    return kind;
  }

  public Class<T> type() {
    return type;
  }

  /**
   * Returns the name of the module that registered this slot.
   *
   * @return the owning module name
   */
  public String owner() {
    return owner;
  }

  public boolean isNetworkSynchronized() {
    return codec != null;
  }

  /**
   * Returns {@code false} once {@link ExtensionRegistry#unregister} has run for this handle.
   *
   * @return whether the slot is still registered
   */
  public boolean isRegistered() {
    return registered;
  }

  public Optional<T> get(Extensible entity) {
    return registry.get(this, entity);
  }

  public void set(Extensible entity, T value) {
    registry.set(this, entity, value);
  }

  public void clear(Extensible entity) {
    registry.clear(this, entity);
  }

  public Optional<String> serialize(Extensible entity) {
    return registry.serializeForNetwork(this, entity);
  }

  public void deserialize(Extensible entity, String text) {
    registry.deserializeFromNetwork(this, entity, text);
  }

  ExtensionRegistry registry() {
    return registry;
  }

  SlotCodec<T> codec() {
    return codec;
  }

  ReleaseHook<? super T> releaseHook() {
    return releaseHook;
  }

  T cast(Object raw) {
    return type.cast(raw);
  }

  boolean matches(Spec<?> spec) {
    return type.equals(spec.type) && (codec != null) == (spec.codec != null);
  }

  void markUnregistered() {
    registered = false;
  }

  @Override
  public String toString() {
    return "ExtensionSlot{" + name + ", " + kind + ", owner=" + owner
        + (codec != null ? ", networked" : "") + "}";
  }

  /**
   * Declaration of a slot, passed to {@link ExtensionRegistry#register(String, Spec)}.
   *
   * @param <T> the value type
   */
  public static final class Spec<T> {
    private final String name;
    private final EntityKind kind;
    private final Class<T> type;
    private SlotCodec<T> codec;
    private ReleaseHook<? super T> releaseHook = ReleaseHook.none();

    private Spec(String name, EntityKind kind, Class<T> type) {
      this.name = Objects.requireNonNull(name, "name");
      this.kind = Objects.requireNonNull(kind, "kind");
      this.type = Objects.requireNonNull(type, "type");
      if (name.isEmpty()) {
        throw new IllegalArgumentException("Slot name cannot be empty");
      }
      for (int i = 0; i < name.length(); i++) {
        if (Character.isWhitespace(name.charAt(i))) {
          throw new IllegalArgumentException("Slot name cannot contain whitespace: '" + name + "'");
        }
      }
    }

    /**
     * Marks the slot as network-synchronized using the given codec.
     *
     * @param codec the wire codec
     * @return this declaration
     */
    public Spec<T> networked(SlotCodec<T> codec) {
      this.codec = Objects.requireNonNull(codec, "codec");
      return this;
    }

    /**
     * Sets the hook run when a value leaves its binding.
     *
     * @param releaseHook the hook
     * @return this declaration
     */
    public Spec<T> onRelease(ReleaseHook<? super T> releaseHook) {
      this.releaseHook = Objects.requireNonNull(releaseHook, "releaseHook");
      return this;
    }

    public String name() {
      return name;
    }

    public EntityKind kind() {
      return kind;
    }
  }
}
