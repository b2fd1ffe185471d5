package io.ircd.entity;

import java.util.List;
import java.util.Objects;

/**
 * A message sent from the server to a user.
 */
public sealed interface Reply permits Reply.Numeric, Reply.Notice {

  /**
   * A numeric reply. The target nick is prepended by the sink, not stored here.
   *
   * @param code   three-digit numeric
   * @param params parameters after the target nick; the last may contain spaces
   */
  record Numeric(int code, List<String> params) implements Reply {
    public Numeric {
      params = List.copyOf(params);
    }
  }

  /**
   * A server notice.
   *
   * @param text notice text
   */
  record Notice(String text) implements Reply {
    public Notice {
      Objects.requireNonNull(text, "text");
    }
  }
}
