package io.ircd.event;

/**
 * Common listener priorities. Lower values run first; any {@code int} is allowed.
 */
public final class Priority {
  public static final int FIRST = -1000;
  public static final int NORMAL = 0;
  public static final int LAST = 1000;

  private Priority() {
  }
}
