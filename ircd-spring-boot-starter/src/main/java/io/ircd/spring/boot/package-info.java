/**
 * Spring Boot auto-configuration for the ircd server context, its metrics, and
 * {@link io.ircd.spring.boot.IrcdModule @IrcdModule} beans.
 */
package io.ircd.spring.boot;
