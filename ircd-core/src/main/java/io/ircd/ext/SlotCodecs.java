package io.ircd.ext;

/**
 * Codecs for simple slot value types.
 */
public final class SlotCodecs {

  private static final SlotCodec<String> STRING = new SlotCodec<>() {
    @Override
    public String encode(String value) {
      return value.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public String decode(String text) {
      if (text == null) {
        throw new IllegalArgumentException("text is null");
      }
      return text;
    }

    @Override
    public String invalidValue(String text) {
      return "";
    }
  };

  private static final SlotCodec<Integer> INTEGER = new SlotCodec<>() {
    @Override
    public String encode(Integer value) {
      return Integer.toString(value);
    }

    @Override
    public Integer decode(String text) {
      if (text == null) {
        throw new IllegalArgumentException("text is null");
      }
      try {
        return Integer.valueOf(text.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Not an integer: '" + text + "'", e);
      }
    }

    @Override
    public Integer invalidValue(String text) {
      return 0;
    }
  };

  private SlotCodecs() {
  }

  /**
   * Codec for free-form text values. Line breaks encode as spaces so the value stays on
   * one protocol line; decoding never fails for a non-null string.
   *
   * @return the string codec
   */
  public static SlotCodec<String> string() {
    return STRING;
  }

  /**
   * Decimal codec for integer values; malformed text decodes to {@code 0}.
   *
   * @return the integer codec
   */
  public static SlotCodec<Integer> integer() {
    return INTEGER;
  }
}
