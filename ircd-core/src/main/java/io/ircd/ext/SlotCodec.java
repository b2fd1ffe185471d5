package io.ircd.ext;

/**
 * Converts a slot value to and from the single-line text sent between linked servers.
 *
 * <p>A slot is network-synchronized exactly when it was registered with a codec.
 * Encoded values must not contain line breaks. Built-in codecs are available from
 * {@link SlotCodecs}.
 *
 * @param <T> the slot value type
 * @see ExtensionRegistry#serializeForNetwork(ExtensionSlot, Extensible)
 * @see ExtensionRegistry#deserializeFromNetwork(ExtensionSlot, Extensible, String)
 */
public interface SlotCodec<T> {

  /**
   * Encodes a value for the wire.
   *
   * @param value the value, never null
   * @return wire text without line breaks
   */
  String encode(T value);

  /**
   * Decodes wire text received from a peer.
   *
   * @param text the wire text
   * @return the decoded value, never null
   * @throws IllegalArgumentException if the text is malformed
   */
  T decode(String text);

  /**
   * Returns the sentinel attached in place of a value whose text could not be decoded.
   *
   * @param text the offending wire text, possibly null or empty
   * @return a non-null value that represents "invalid"
   */
  T invalidValue(String text);
}
