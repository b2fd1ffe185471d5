package io.ircd.ext;

import java.util.Objects;

/**
 * One replicated extension value: {@code <slot-name> <encoded-value>}.
 *
 * <p>The value may be empty and may itself contain spaces; only the first space
 * separates the name.
 *
 * @param name  slot name
 * @param value encoded value, possibly empty
 */
public record MetadataLine(String name, String value) {

  public MetadataLine {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
    if (name.isEmpty() || name.indexOf(' ') >= 0) {
      throw new IllegalArgumentException("Invalid metadata name: '" + name + "'");
    }
  }

  /**
   * Parses a line in wire form.
   *
   * @param line {@code name} or {@code name value...}
   * @return the parsed line
   * @throws IllegalArgumentException if the line has no name
   */
  public static MetadataLine parse(String line) {
    Objects.requireNonNull(line, "line");
    int space = line.indexOf(' ');
    if (space < 0) {
      return new MetadataLine(line, "");
    }
    return new MetadataLine(line.substring(0, space), line.substring(space + 1));
  }

  @Override
  public String toString() {
    return value.isEmpty() ? name : name + " " + value;
  }
}
