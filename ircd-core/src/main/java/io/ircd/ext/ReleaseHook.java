package io.ircd.ext;

/**
 * Callback run when a value leaves its (entity, slot) binding.
 *
 * <p>The registry invokes the hook exactly once per binding: on replacement, clear,
 * entity destruction, or slot unregistration. Values implementing {@link RefCounted}
 * are additionally released by the registry after the hook returns, so hooks must not
 * call {@link RefCounted#release()} themselves.
 *
 * @param <T> the slot value type
 */
@FunctionalInterface
public interface ReleaseHook<T> {

  /**
   * Returns a hook that does nothing.
   *
   * @param <T> the slot value type
   * @return a no-op hook
   */
  static <T> ReleaseHook<T> none() {
    return value -> {
    };
  }

  /**
   * Called with the value that was unbound.
   *
   * @param value the released value, never null
   */
  void release(T value);
}
