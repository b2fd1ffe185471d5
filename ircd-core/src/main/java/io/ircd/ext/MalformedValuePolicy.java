package io.ircd.ext;

/**
 * What {@link ExtensionRegistry#deserializeFromNetwork} does with text its codec rejects.
 */
public enum MalformedValuePolicy {
  /** Attach the codec's invalid sentinel, log, and carry on. */
  TOLERATE,
  /** Throw {@link MalformedMetadataException} and leave the entity untouched. */
  REJECT
}
