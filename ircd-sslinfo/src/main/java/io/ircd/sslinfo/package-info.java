/**
 * TLS client certificate information for users: the {@code SSLINFO} command, WHOIS and
 * WHO decorations, certificate-based oper and connect class rules, and WebIRC gateway
 * handling.
 */
package io.ircd.sslinfo;
