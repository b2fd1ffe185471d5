package io.ircd.loop;

import io.ircd.entity.RemoteUser;
import io.ircd.entity.Server;
import io.ircd.ext.ExtensionRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CompletionQueueTest {

  @Test
  void drainRunsCompletionsInSubmissionOrderOnCaller() {
    CompletionQueue queue = new CompletionQueue(8);
    List<String> ran = new ArrayList<>();
    Thread caller = Thread.currentThread();
    List<Thread> threads = new ArrayList<>();

    queue.submit(() -> ran.add("a"));
    queue.submit(() -> {
      ran.add("b");
      threads.add(Thread.currentThread());
    });

    assertEquals(2, queue.drain());
    assertEquals(List.of("a", "b"), ran);
    assertEquals(List.of(caller), threads);
    assertEquals(0, queue.drain());
  }

  @Test
  void failingCompletionDoesNotStopDrain() {
    CompletionQueue queue = new CompletionQueue(8);
    List<String> ran = new ArrayList<>();
    queue.submit(() -> {
      throw new IllegalStateException("boom");
    });
    queue.submit(() -> ran.add("after"));

    assertEquals(2, queue.drain());
    assertEquals(List.of("after"), ran);
  }

  @Test
  void fullQueueRejectsSubmission() {
    CompletionQueue queue = new CompletionQueue(1);

    assertTrue(queue.submit(() -> { }));
    assertFalse(queue.submit(() -> { }));
    assertEquals(1, queue.size());
  }

  @Test
  void completionForDestroyedEntityIsSkipped() {
    CompletionQueue queue = new CompletionQueue(8);
    ExtensionRegistry registry = ExtensionRegistry.builder().build();
    RemoteUser user = new RemoteUser("001AAAAAA", new Server("irc.example.net", "001"));
    List<String> ran = new ArrayList<>();
    queue.submitFor(user, u -> ran.add(u.uuid()));

    registry.onEntityDestroyed(user);
    queue.drain();

    assertTrue(ran.isEmpty());
  }

  @Test
  void backgroundThreadsHandOffThroughQueue() throws Exception {
    CompletionQueue queue = new CompletionQueue(8);
    List<String> ran = new ArrayList<>();
    CountDownLatch submitted = new CountDownLatch(1);

    Thread worker = new Thread(() -> {
      queue.submit(() -> ran.add("dns-done"));
      submitted.countDown();
    });
    worker.start();
    assertTrue(submitted.await(5, TimeUnit.SECONDS));

    queue.drain();
    assertEquals(List.of("dns-done"), ran);
  }

  @Test
  void capacityMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new CompletionQueue(0));
  }
}
