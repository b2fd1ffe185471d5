package io.ircd.ext;

/**
 * Thrown when a module registers a slot whose {@code (name, kind)} is already owned by
 * a different module.
 */
public final class DuplicateSlotException extends ExtensionException {
  private final String slotName;
  private final EntityKind kind;
  private final String existingOwner;
  private final String requestedBy;

  public DuplicateSlotException(String slotName, EntityKind kind, String existingOwner, String requestedBy) {
    super("Extension slot " + slotName + " (" + kind + ") is already registered by "
        + existingOwner + "; cannot register it for " + requestedBy);
    this.slotName = slotName;
    this.kind = kind;
    this.existingOwner = existingOwner;
    this.requestedBy = requestedBy;
  }

  public String slotName() {
    return slotName;
  }

  public EntityKind kind() {
    return kind;
  }

  public String existingOwner() {
    return existingOwner;
  }

  public String requestedBy() {
    return requestedBy;
  }
}
