package io.ircd.entity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Index of connected users by UUID and by nick.
 *
 * <p>Nick lookups are case-insensitive. A user must be re-indexed with
 * {@link #changeNick} when its nick changes.
 */
public final class UserDirectory {
  private final Map<String, User> byUuid = new HashMap<>();
  private final Map<String, User> byNick = new HashMap<>();

  public void add(User user) {
    Objects.requireNonNull(user, "user");
    if (byUuid.putIfAbsent(user.uuid(), user) != null) {
      throw new IllegalStateException("Duplicate user UUID " + user.uuid());
    }
    byNick.put(fold(user.nick()), user);
  }

  public boolean remove(User user) {
    if (byUuid.remove(user.uuid(), user)) {
      byNick.remove(fold(user.nick()), user);
      return true;
    }
    return false;
  }

  public void changeNick(User user, String nick) {
    byNick.remove(fold(user.nick()), user);
    user.setNick(nick);
    byNick.put(fold(nick), user);
  }

  public Optional<User> findNick(String nick) {
    return Optional.ofNullable(byNick.get(fold(nick)));
  }

  public Optional<User> findUuid(String uuid) {
    return Optional.ofNullable(byUuid.get(uuid));
  }

  public List<User> all() {
    return new ArrayList<>(byUuid.values());
  }

  public int size() {
    return byUuid.size();
  }

  private static String fold(String nick) {
    return nick.toLowerCase(Locale.ROOT);
  }
}
