package io.ircd.ext;

/**
 * A payload that may be shared between several slot bindings.
 *
 * <p>The registry retains the value when it is bound and releases it when the binding
 * ends. The payload is deallocated only when the last holder releases it.
 *
 * @see AbstractRefCounted
 */
public interface RefCounted {

  /**
   * Returns the current number of holders.
   *
   * @return reference count
   */
  int refCnt();

  /**
   * Adds a holder.
   *
   * @return this object
   */
  RefCounted retain();

  /**
   * Drops a holder, deallocating the payload when none remain.
   *
   * @return {@code true} if this call deallocated the payload
   * @throws IllegalStateException if the count is already zero
   */
  boolean release();
}
