/**
 * Core entities that modules attach extension values to.
 */
package io.ircd.entity;
