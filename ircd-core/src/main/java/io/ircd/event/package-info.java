/**
 * Ordered event dispatch with veto semantics.
 *
 * <p>Event kinds are declared in {@link io.ircd.event.CoreEvents}. Modules subscribe
 * through {@link io.ircd.event.EventDispatcher}; vetoable kinds short-circuit on the
 * first decisive vote, advisory kinds notify every listener.
 */
package io.ircd.event;
