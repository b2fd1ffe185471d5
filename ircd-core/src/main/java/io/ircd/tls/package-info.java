/**
 * Client certificate values and the TLS session boundary.
 *
 * <p>Cryptographic validation happens in the socket layer; this package only carries
 * its result as an attachable, replicable value.
 */
package io.ircd.tls;
