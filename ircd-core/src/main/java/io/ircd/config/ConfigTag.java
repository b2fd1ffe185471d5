package io.ircd.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * One configuration block: a tag name with key/value items and the source location
 * it was read from.
 *
 * <p>Typed accessors never throw for bad values; they log a warning naming the tag
 * location and return the default.
 *
 * <pre>{@code
 * ConfigTag tag = ConfigTag.builder("connect")
 *     .location("ircd.conf", 12)
 *     .put("name", "secure")
 *     .put("requiressl", "trusted")
 *     .build();
 * }</pre>
 */
public final class ConfigTag {
  private static final Logger logger = Logger.getLogger(ConfigTag.class.getName());

  private final String name;
  private final String sourceName;
  private final int sourceLine;
  private final Map<String, String> items;

  private ConfigTag(Builder builder) {
    this.name = builder.name;
    this.sourceName = builder.sourceName;
    this.sourceLine = builder.sourceLine;
    this.items = Collections.unmodifiableMap(new LinkedHashMap<>(builder.items));
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Returns a tag with no items, used when a lookup finds nothing.
   *
   * @param name the tag name that was looked up
   * @return an empty tag
   */
  public static ConfigTag empty(String name) {
    return builder(name).location("<auto>", 0).build();
  }

  public String name() {
    return name;
  }

  public Map<String, String> items() {
    return items;
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  /**
   * Reads a raw value.
   *
   * @param key item key, case-insensitive
   * @return the value if the key is present
   */
  public Optional<String> readString(String key) {
    return Optional.ofNullable(items.get(normalize(key)));
  }

  public String getString(String key) {
    return getString(key, "");
  }

  public String getString(String key, String def) {
    return readString(key).orElse(def);
  }

  /**
   * Reads an integer, accepting a {@code k}, {@code m} or {@code g} magnitude suffix.
   *
   * @param key item key
   * @param def value returned when the key is absent or malformed
   * @return the parsed value
   */
  public long getInt(String key, long def) {
    Optional<String> raw = readString(key);
    if (raw.isEmpty() || raw.get().isBlank()) {
      return def;
    }
    String text = raw.get().trim();
    long multiplier = 1;
    switch (Character.toLowerCase(text.charAt(text.length() - 1))) {
      case 'k' -> multiplier = 1024L;
      case 'm' -> multiplier = 1024L * 1024;
      case 'g' -> multiplier = 1024L * 1024 * 1024;
      default -> {
      }
    }
    if (multiplier != 1) {
      text = text.substring(0, text.length() - 1);
    }
    try {
      return Math.multiplyExact(Long.parseLong(text), multiplier);
    } catch (NumberFormatException | ArithmeticException e) {
      logger.warning("Value of <" + name + ":" + key + "> at " + location()
          + " is not a valid number ('" + raw.get() + "'); using " + def);
      return def;
    }
  }

  public double getFloat(String key, double def) {
    Optional<String> raw = readString(key);
    if (raw.isEmpty() || raw.get().isBlank()) {
      return def;
    }
    try {
      return Double.parseDouble(raw.get().trim());
    } catch (NumberFormatException e) {
      logger.warning("Value of <" + name + ":" + key + "> at " + location()
          + " is not a valid decimal ('" + raw.get() + "'); using " + def);
      return def;
    }
  }

  public boolean getBool(String key) {
    return getBool(key, false);
  }

  /**
   * Reads a boolean. Accepts {@code yes/true/on/1} and {@code no/false/off/0}.
   *
   * @param key item key
   * @param def value returned when the key is absent or malformed
   * @return the parsed value
   */
  public boolean getBool(String key, boolean def) {
    Optional<String> raw = readString(key);
    if (raw.isEmpty() || raw.get().isBlank()) {
      return def;
    }
    switch (raw.get().trim().toLowerCase(Locale.ROOT)) {
      case "yes", "true", "on", "1":
        return true;
      case "no", "false", "off", "0":
        return false;
      default:
        logger.warning("Value of <" + name + ":" + key + "> at " + location()
            + " is not a valid boolean ('" + raw.get() + "'); using " + def);
        return def;
    }
  }

  /**
   * Returns where the tag was defined, for diagnostics.
   *
   * @return {@code file:line}
   */
  public String location() {
    return sourceName + ":" + sourceLine;
  }

  @Override
  public String toString() {
    return "<" + name + "> at " + location();
  }

  private static String normalize(String key) {
    return Objects.requireNonNull(key, "key").toLowerCase(Locale.ROOT);
  }

  /** Builder for {@link ConfigTag}. */
  public static final class Builder {
    private final String name;
    private final Map<String, String> items = new LinkedHashMap<>();
    private String sourceName = "<unknown>";
    private int sourceLine;

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder location(String sourceName, int sourceLine) {
      this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
      this.sourceLine = sourceLine;
      return this;
    }

    /**
     * Adds an item. A repeated key keeps its first value.
     *
     * @param key   item key, case-insensitive
     * @param value item value
     * @return this builder
     */
    public Builder put(String key, String value) {
      Objects.requireNonNull(value, "value");
      items.putIfAbsent(normalize(key), value);
      return this;
    }

    public Builder putAll(Map<String, String> values) {
      values.forEach(this::put);
      return this;
    }

    public ConfigTag build() {
      return new ConfigTag(this);
    }
  }
}
