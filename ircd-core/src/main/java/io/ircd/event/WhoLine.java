package io.ircd.event;

import io.ircd.entity.LocalUser;
import io.ircd.entity.Membership;
import io.ircd.entity.User;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Payload of {@link CoreEvents#WHO_LINE}: one reply line about {@code user}, sent to
 * {@code source} unless a listener denies it.
 */
public final class WhoLine {
  private final WhoRequest request;
  private final LocalUser source;
  private final User user;
  private final Membership membership;
  private final List<String> params;

  /**
   * @param membership the channel membership the line is about, or null
   * @param params     reply parameters; copied, then editable through {@link #params()}
   */
  public WhoLine(WhoRequest request, LocalUser source, User user, Membership membership,
      List<String> params) {
    this.request = Objects.requireNonNull(request, "request");
    this.source = Objects.requireNonNull(source, "source");
    this.user = Objects.requireNonNull(user, "user");
    this.membership = membership;
    this.params = new ArrayList<>(params);
  }

  public WhoRequest request() {
    return request;
  }

  public LocalUser source() {
    return source;
  }

  public User user() {
    return user;
  }

  public Optional<Membership> membership() {
    return Optional.ofNullable(membership);
  }

  /**
   * Returns the reply parameters, which listeners may edit in place.
   *
   * @return mutable parameter list
   */
  public List<String> params() {
    return params;
  }

  /**
   * Appends text to one field if the reply contains it.
   *
   * @param field field letter
   * @param text  text to append
   * @return {@code true} if the field exists and was changed
   */
  public boolean appendToField(char field, String text) {
    OptionalInt index = request.fieldIndex(field);
    if (index.isEmpty() || index.getAsInt() >= params.size()) {
      return false;
    }
    params.set(index.getAsInt(), params.get(index.getAsInt()) + text);
    return true;
  }
}
