/**
 * Message-passing boundary into the single control thread.
 */
package io.ircd.loop;
