package io.ircd.ext;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Skeletal {@link RefCounted} whose count starts at zero.
 *
 * <p>A freshly created object has no holders; binding it to a slot takes the first
 * reference. Subclasses override {@link #deallocate()} to free resources once the
 * count drops back to zero.
 */
public abstract class AbstractRefCounted implements RefCounted {
  private final AtomicInteger refCnt = new AtomicInteger();

  @Override
  public final int refCnt() {
    return refCnt.get();
  }

  @Override
  public RefCounted retain() {
    refCnt.incrementAndGet();
    return this;
  }

  @Override
  public final boolean release() {
    int remaining = refCnt.decrementAndGet();
    if (remaining < 0) {
      refCnt.incrementAndGet();
      throw new IllegalStateException("release() called on " + getClass().getSimpleName()
          + " with no outstanding references");
    }
    if (remaining == 0) {
      deallocate();
      return true;
    }
    return false;
  }

  /**
   * Called once when the last reference is released.
   */
  protected void deallocate() {
  }
}
