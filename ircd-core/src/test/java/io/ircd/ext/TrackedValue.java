package io.ircd.ext;

import java.util.concurrent.atomic.AtomicInteger;

/** Ref-counted test payload that counts deallocations. */
final class TrackedValue extends AbstractRefCounted {
  final String label;
  final AtomicInteger deallocations = new AtomicInteger();

  TrackedValue(String label) {
    this.label = label;
  }

  @Override
  protected void deallocate() {
    deallocations.incrementAndGet();
  }
}
