package io.ircd.event;

import io.ircd.entity.User;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Payload of {@link CoreEvents#WHOIS}: the reply being built for {@code source} about
 * {@code target}. Listeners add lines with {@link #sendLine}; the core sends them after
 * dispatch.
 */
public final class WhoisContext {
  private final User source;
  private final User target;
  private final List<Line> lines = new ArrayList<>();

  public WhoisContext(User source, User target) {
    this.source = Objects.requireNonNull(source, "source");
    this.target = Objects.requireNonNull(target, "target");
  }

  public User source() {
    return source;
  }

  public User target() {
    return target;
  }

  public boolean isSelfWhois() {
    return source == target;
  }

  public void sendLine(int numeric, String text) {
    lines.add(new Line(numeric, text));
  }

  public List<Line> lines() {
    return Collections.unmodifiableList(lines);
  }

  /**
   * One added WHOIS line, sent as {@code numeric source-nick target-nick :text}.
   *
   * @param numeric reply numeric
   * @param text    trailing text
   */
  public record Line(int numeric, String text) {
    public Line {
      Objects.requireNonNull(text, "text");
    }
  }
}
