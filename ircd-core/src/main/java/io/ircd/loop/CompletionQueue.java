package io.ircd.loop;

import io.ircd.ext.Extensible;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hand-off point between background work (DNS lookups, TLS handshakes) and the
 * server's control thread.
 *
 * <p>Any thread may {@link #submit} a completion; only the control thread calls
 * {@link #drain()}, which runs the queued completions in submission order. Entity and
 * extension state is therefore only ever touched from the control thread.
 */
public final class CompletionQueue {
  private static final Logger logger = Logger.getLogger(CompletionQueue.class.getName());

  private final BlockingQueue<Runnable> queue;

  public CompletionQueue(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.queue = new ArrayBlockingQueue<>(capacity);
  }

  /**
   * Queues a completion.
   *
   * @param completion work to run on the control thread
   * @return {@code false} if the queue is full and the completion was dropped
   */
  public boolean submit(Runnable completion) {
    Objects.requireNonNull(completion, "completion");
    boolean accepted = queue.offer(completion);
    if (!accepted) {
      logger.warning("Completion queue full (" + queue.remainingCapacity() + " free); dropping completion");
    }
    return accepted;
  }

  /**
   * Queues a completion for an entity. If the entity has been destroyed by the time the
   * completion runs, it is skipped.
   *
   * @param entity the entity the result belongs to
   * @param action work to run with the entity
   * @return {@code false} if the queue is full and the completion was dropped
   */
  public <E extends Extensible> boolean submitFor(E entity, Consumer<? super E> action) {
    Objects.requireNonNull(entity, "entity");
    Objects.requireNonNull(action, "action");
    return submit(() -> {
      if (entity.isDestroyed()) {
        logger.fine(() -> "Skipping completion for destroyed " + entity);
        return;
      }
      action.accept(entity);
    });
  }

  /**
   * Runs every completion queued so far on the calling thread.
   *
   * <p>A completion that throws is logged; the remaining ones still run. Completions
   * submitted while draining wait for the next call.
   *
   * @return number of completions run
   */
  public int drain() {
    List<Runnable> batch = new ArrayList<>(queue.size());
    queue.drainTo(batch);
    for (Runnable completion : batch) {
      try {
        completion.run();
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Completion failed", e);
      }
    }
    return batch.size();
  }

  public int size() {
    return queue.size();
  }
}
