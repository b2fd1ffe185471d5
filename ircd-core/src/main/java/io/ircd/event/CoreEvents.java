package io.ircd.event;

import java.util.List;

/**
 * The event kinds raised by the core.
 */
public final class CoreEvents {

  /** A local user tries to log in as an operator. Deny to refuse the login. */
  public static final VetoableEvent<AuthenticationAttempt> AUTHENTICATION_ATTEMPT =
      new VetoableEvent<>("authentication-attempt", AuthenticationAttempt.class);

  /** A local user has completed registration. */
  public static final AdvisoryEvent<PostConnect> POST_CONNECT =
      new AdvisoryEvent<>("post-connect", PostConnect.class);

  /** A WHOIS reply is being built; listeners may add lines. */
  public static final AdvisoryEvent<WhoisContext> WHOIS =
      new AdvisoryEvent<>("whois", WhoisContext.class);

  /** A WHO reply line is being built; listeners may edit fields. Deny hides the line. */
  public static final VetoableEvent<WhoLine> WHO_LINE =
      new VetoableEvent<>("who-line", WhoLine.class);

  /** A connect class is being considered for a local user. Deny to skip the class. */
  public static final VetoableEvent<ConnectClassSelection> CONNECT_CLASS_SELECTION =
      new VetoableEvent<>("connect-class-selection", ConnectClassSelection.class);

  /** A WebIRC gateway has authenticated a user and announced its flags. */
  public static final AdvisoryEvent<GatewayAuthentication> GATEWAY_FLAG_ANNOUNCEMENT =
      new AdvisoryEvent<>("gateway-flag-announcement", GatewayAuthentication.class);

  private static final List<EventKind<?>> ALL = List.of(
      AUTHENTICATION_ATTEMPT,
      POST_CONNECT,
      WHOIS,
      WHO_LINE,
      CONNECT_CLASS_SELECTION,
      GATEWAY_FLAG_ANNOUNCEMENT);

  private CoreEvents() {
  }

  public static List<EventKind<?>> all() {
    return ALL;
  }
}
