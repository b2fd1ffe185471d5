package io.ircd;

/**
 * Reply numerics sent by the core and its bundled modules.
 */
public final class Numerics {
  public static final int RPL_WHOISCERTFP = 276;
  public static final int RPL_YOUREOPER = 381;
  public static final int ERR_NOSUCHNICK = 401;
  public static final int ERR_NOOPERHOST = 491;
  public static final int RPL_WHOISSECURE = 671;

  private Numerics() {
  }
}
