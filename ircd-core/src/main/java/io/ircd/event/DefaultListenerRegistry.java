package io.ircd.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener registry backed by copy-on-write lists.
 *
 * <p>Each event kind keeps its listeners sorted by priority, then registration order.
 * {@link #listenersFor} returns a snapshot, so adding or removing listeners while a
 * dispatch iterates never disturbs that dispatch.
 *
 * <h2>Thread Safety</h2>
 * <p>This implementation is thread-safe. Additions and removals on the same event kind
 * are serialized on that kind's list, and lookups return consistent snapshots.
 *
 * @see ListenerRegistry
 */
public final class DefaultListenerRegistry implements ListenerRegistry {

  private final Map<EventKind<?>, CopyOnWriteArrayList<RegisteredListener>> listeners = new ConcurrentHashMap<>();

  @Override
  public void add(RegisteredListener listener) {
    CopyOnWriteArrayList<RegisteredListener> list =
        listeners.computeIfAbsent(listener.kind(), ignored -> new CopyOnWriteArrayList<>());
    synchronized (list) {
      int index = 0;
      while (index < list.size() && RegisteredListener.ORDER.compare(list.get(index), listener) <= 0) {
        index++;
      }
      list.add(index, listener);
    }
  }

  @Override
  public boolean remove(RegisteredListener listener) {
    CopyOnWriteArrayList<RegisteredListener> list = listeners.get(listener.kind());
    if (list == null) {
      return false;
    }
    boolean removed;
    synchronized (list) {
      removed = list.remove(listener);
    }
    if (removed) {
      listener.deactivate();
    }
    return removed;
  }

  @Override
  public int removeOwnedBy(String owner) {
    int removed = 0;
    for (CopyOnWriteArrayList<RegisteredListener> list : listeners.values()) {
      List<RegisteredListener> owned = new ArrayList<>();
      synchronized (list) {
        for (RegisteredListener listener : list) {
          if (listener.owner().equals(owner)) {
            owned.add(listener);
          }
        }
        list.removeAll(owned);
      }
      for (RegisteredListener listener : owned) {
        listener.deactivate();
        removed++;
      }
    }
    return removed;
  }

  @Override
  public List<RegisteredListener> listenersFor(EventKind<?> kind) {
    CopyOnWriteArrayList<RegisteredListener> list = listeners.get(kind);
    if (list == null) {
      return List.of();
    }
    return Collections.unmodifiableList(new ArrayList<>(list));
  }
}
