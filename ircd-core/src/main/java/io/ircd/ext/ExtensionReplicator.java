package io.ircd.ext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Server-link side of extension storage: collects the network-synchronized values of an
 * entity for a peer and applies values received from one.
 *
 * <p>Slot names the local registry does not know are ignored so that peers running extra
 * modules can link.
 */
public final class ExtensionReplicator {
  private static final Logger logger = Logger.getLogger(ExtensionReplicator.class.getName());

  private final ExtensionRegistry registry;

  public ExtensionReplicator(ExtensionRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Serializes every network-synchronized value currently bound to the entity.
   *
   * @param entity the entity being burst to a peer
   * @return lines in slot registration order; empty if nothing is bound
   */
  public List<MetadataLine> collect(Extensible entity) {
    Objects.requireNonNull(entity, "entity");
    List<MetadataLine> lines = new ArrayList<>();
    for (ExtensionSlot<?> slot : registry.slots()) {
      if (slot.kind() != entity.kind() || !slot.isNetworkSynchronized()) {
        continue;
      }
      Optional<String> text = registry.serializeForNetwork(slot, entity);
      text.ifPresent(value -> lines.add(new MetadataLine(slot.name(), value)));
    }
    return lines;
  }

  /**
   * Applies one received line.
   *
   * @param entity the entity the peer sent metadata for
   * @param line   the received line
   * @return {@code true} if a local slot accepted the value
   */
  public boolean apply(Extensible entity, MetadataLine line) {
    Objects.requireNonNull(line, "line");
    return apply(entity, line.name(), line.value());
  }

  /**
   * Applies one received {@code name value} pair.
   *
   * <p>Unknown names and slots that are not network-synchronized are skipped.
   *
   * @return {@code true} if a local slot accepted the value
   */
  public boolean apply(Extensible entity, String name, String value) {
    Objects.requireNonNull(entity, "entity");
    Optional<ExtensionSlot<?>> slot = registry.find(name, entity.kind());
    if (slot.isEmpty() || !slot.get().isNetworkSynchronized()) {
      logger.fine(() -> "Ignoring metadata '" + name + "' for " + entity + ": no local network slot");
      return false;
    }
    registry.deserializeFromNetwork(slot.get(), entity, value);
    return true;
  }
}
