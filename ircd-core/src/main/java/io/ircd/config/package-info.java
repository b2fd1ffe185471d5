/**
 * Configuration lookup: named tags with typed, defaulted accessors.
 *
 * <p>Parsing a configuration file is not part of this package; tags are supplied through
 * {@link io.ircd.config.ServerConfig.Builder}, for example by the Spring Boot starter.
 */
package io.ircd.config;
