package io.ircd.event;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A parsed WHO request, as far as listeners need it: which reply fields exist and
 * where.
 *
 * <p>Plain WHO replies have the fixed layout {@code channel user host server nick flags
 * :hops realname}. WHOX replies contain only the requested fields, in the order
 * {@code t c u i h s n f d l a o r}.
 */
public final class WhoRequest {
  private static final String PLAIN_FIELDS = "cuhsnf";
  private static final String WHOX_ORDER = "tcuihsnfdlaor";

  private final String mask;
  private final boolean whox;
  private final String fields;

  private WhoRequest(String mask, boolean whox, String fields) {
    this.mask = Objects.requireNonNull(mask, "mask");
    this.whox = whox;
    this.fields = fields;
  }

  public static WhoRequest plain(String mask) {
    return new WhoRequest(mask, false, "");
  }

  /**
   * Creates a WHOX request.
   *
   * @param mask   the WHO mask
   * @param fields requested field letters, in any order
   * @return the request
   */
  public static WhoRequest whox(String mask, String fields) {
    return new WhoRequest(mask, true, Objects.requireNonNull(fields, "fields"));
  }

  public String mask() {
    return mask;
  }

  public boolean isWhox() {
    return whox;
  }

  /**
   * Returns the position of a field within the reply parameters, not counting the
   * leading target nick.
   *
   * @param field field letter, for example {@code 'f'} for flags
   * @return the index, or empty if the reply does not contain the field
   */
  public OptionalInt fieldIndex(char field) {
    if (!whox) {
      int index = PLAIN_FIELDS.indexOf(field);
      if (index >= 0) {
        return OptionalInt.of(index);
      }
      // hop count and real name share the trailing parameter
      return field == 'd' || field == 'r' ? OptionalInt.of(PLAIN_FIELDS.length()) : OptionalInt.empty();
    }
    if (fields.indexOf(field) < 0 || WHOX_ORDER.indexOf(field) < 0) {
      return OptionalInt.empty();
    }
    int index = 0;
    for (int i = 0; i < WHOX_ORDER.indexOf(field); i++) {
      if (fields.indexOf(WHOX_ORDER.charAt(i)) >= 0) {
        index++;
      }
    }
    return OptionalInt.of(index);
  }
}
