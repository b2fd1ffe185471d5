package io.ircd.ext;

/**
 * The kinds of core entity that extension slots can be declared for.
 *
 * <p>A slot is registered for exactly one kind; attaching it to an entity of
 * another kind is rejected with {@link SlotTypeMismatchException}.
 */
public enum EntityKind {
  USER,
  CHANNEL,
  MEMBERSHIP,
  SERVER
}
