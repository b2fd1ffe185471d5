package io.ircd.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Read-only view of the server configuration.
 *
 * <p>Tags are looked up by name; {@link #tag(String)} never returns null so callers can
 * chain typed accessors with their defaults:
 *
 * <pre>{@code
 * boolean operOnly = config.tag("sslinfo").getBool("operonly");
 * }</pre>
 *
 * <p>{@code <connect>} and {@code <oper>} tags are indexed into {@link ConnectClass} and
 * {@link OperInfo} by their {@code name} item.
 */
public final class ServerConfig {
  private static final Logger logger = Logger.getLogger(ServerConfig.class.getName());

  private final String serverName;
  private final Map<String, List<ConfigTag>> tags;
  private final Map<String, ConnectClass> connectClasses = new LinkedHashMap<>();
  private final Map<String, OperInfo> operBlocks = new LinkedHashMap<>();

  private ServerConfig(Builder builder) {
    this.serverName = builder.serverName;
    Map<String, List<ConfigTag>> copy = new LinkedHashMap<>();
    builder.tags.forEach((name, list) -> copy.put(name, List.copyOf(list)));
    this.tags = Collections.unmodifiableMap(copy);
    indexConnectClasses();
    indexOperBlocks();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String serverName() {
    return serverName;
  }

  /**
   * Returns the first tag with the given name.
   *
   * @param name tag name
   * @return the tag, or an empty tag if none exists
   */
  public ConfigTag tag(String name) {
    return tag(name, 0);
  }

  /**
   * Returns the {@code n}th tag with the given name, counting from zero.
   *
   * @param name tag name
   * @param n    occurrence index
   * @return the tag, or an empty tag if there are not enough occurrences
   */
  public ConfigTag tag(String name, int n) {
    List<ConfigTag> list = tags(name);
    return n >= 0 && n < list.size() ? list.get(n) : ConfigTag.empty(name);
  }

  public List<ConfigTag> tags(String name) {
    return tags.getOrDefault(Objects.requireNonNull(name, "name"), List.of());
  }

  public Optional<ConnectClass> connectClass(String name) {
    return Optional.ofNullable(connectClasses.get(name));
  }

  public List<ConnectClass> connectClasses() {
    return List.copyOf(connectClasses.values());
  }

  public Optional<OperInfo> operBlock(String name) {
    return Optional.ofNullable(operBlocks.get(name));
  }

  public List<OperInfo> operBlocks() {
    return List.copyOf(operBlocks.values());
  }

  private void indexConnectClasses() {
    List<ConfigTag> list = tags("connect");
    for (int i = 0; i < list.size(); i++) {
      ConfigTag tag = list.get(i);
      String name = tag.getString("name", "unnamed-" + i);
      if (connectClasses.putIfAbsent(name, new ConnectClass(name, tag)) != null) {
        logger.warning("Duplicate connect class '" + name + "' at " + tag.location() + " ignored");
      }
    }
  }

  private void indexOperBlocks() {
    for (ConfigTag tag : tags("oper")) {
      Optional<String> name = tag.readString("name");
      if (name.isEmpty() || name.get().isEmpty()) {
        logger.warning("<oper> tag at " + tag.location() + " has no name; ignored");
        continue;
      }
      if (operBlocks.putIfAbsent(name.get(), new OperInfo(name.get(), tag)) != null) {
        logger.warning("Duplicate oper block '" + name.get() + "' at " + tag.location() + " ignored");
      }
    }
  }

  /** Builder for {@link ServerConfig}. */
  public static final class Builder {
    private final Map<String, List<ConfigTag>> tags = new LinkedHashMap<>();
    private String serverName = "irc.local";

    private Builder() {}

    public Builder serverName(String serverName) {
      this.serverName = Objects.requireNonNull(serverName, "serverName");
      return this;
    }

    public Builder tag(ConfigTag tag) {
      Objects.requireNonNull(tag, "tag");
      tags.computeIfAbsent(tag.name(), ignored -> new ArrayList<>()).add(tag);
      return this;
    }

    public ServerConfig build() {
      return new ServerConfig(this);
    }
  }
}
