/**
 * Micrometer bridge for {@link io.ircd.spi.MetricsExporter}.
 */
package io.ircd.micrometer;
