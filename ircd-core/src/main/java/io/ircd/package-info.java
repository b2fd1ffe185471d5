/**
 * Extensibility core of the IRC server.
 *
 * <p>{@link io.ircd.ServerContext} wires the extension registry ({@link io.ircd.ext}), the
 * event dispatcher ({@link io.ircd.event}) and module lifecycle ({@link io.ircd.module})
 * into one closeable unit.
 */
package io.ircd;
