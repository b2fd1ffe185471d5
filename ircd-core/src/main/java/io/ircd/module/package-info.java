/**
 * Module lifecycle: load with rollback on failure, unload with full teardown.
 */
package io.ircd.module;
