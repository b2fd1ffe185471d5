package io.ircd.entity;

/**
 * Destination for replies to one user: a local connection's send queue, or the link a
 * remote user is reached through.
 */
@FunctionalInterface
public interface ReplySink {

  /**
   * Sink that drops every reply.
   */
  ReplySink DISCARD = reply -> {
  };

  void write(Reply reply);
}
