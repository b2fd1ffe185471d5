/**
 * Typed extension storage for core entities.
 *
 * <p>A module declares an {@link io.ircd.ext.ExtensionSlot} through
 * {@link io.ircd.ext.ExtensionRegistry#register}, then attaches values to
 * {@link io.ircd.ext.Extensible} entities through the handle. Network-synchronized slots
 * carry a {@link io.ircd.ext.SlotCodec} and are replicated by
 * {@link io.ircd.ext.ExtensionReplicator}.
 */
package io.ircd.ext;
