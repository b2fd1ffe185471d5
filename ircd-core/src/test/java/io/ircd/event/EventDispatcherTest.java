package io.ircd.event;

import io.ircd.config.ConfigTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EventDispatcherTest {
  private EventDispatcher dispatcher;
  private List<String> calls;

  @BeforeEach
  void setUp() {
    dispatcher = EventDispatcher.builder().build();
    calls = new ArrayList<>();
  }

  private VetoListener<ConnectClassSelection> voting(String name, EventOutcome vote) {
    return selection -> {
      calls.add(name);
      return vote;
    };
  }

  // ── Ordering and short-circuit ──────────────────────────────────

  @Test
  void lowerPriorityNumberRunsFirst() {
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m_one",
        voting("L1", EventOutcome.PASS_THROUGH), 10);
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m_two",
        voting("L2", EventOutcome.PASS_THROUGH), 5);

    EventOutcome outcome = dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, TestPayloads.selection());

    assertEquals(EventOutcome.PASS_THROUGH, outcome);
    assertEquals(List.of("L2", "L1"), calls);
  }

  @Test
  void firstDecisiveVoteStopsTheChain() {
    AtomicInteger lateCalls = new AtomicInteger();
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m_one",
        voting("L1", EventOutcome.ALLOW), 10);
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m_two",
        voting("L2", EventOutcome.DENY), 5);
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m_three", selection -> {
      lateCalls.incrementAndGet();
      return EventOutcome.ALLOW;
    }, 20);

    EventOutcome outcome = dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, TestPayloads.selection());

    assertEquals(EventOutcome.DENY, outcome);
    assertEquals(List.of("L2"), calls);
    assertEquals(0, lateCalls.get());
  }

  @Test
  void equalPrioritiesRunInSubscriptionOrder() {
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m", voting("a", EventOutcome.PASS_THROUGH));
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m", voting("b", EventOutcome.PASS_THROUGH));
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m", voting("first", EventOutcome.PASS_THROUGH),
        Priority.FIRST);
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m", voting("c", EventOutcome.PASS_THROUGH));

    dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, TestPayloads.selection());

    assertEquals(List.of("first", "a", "b", "c"), calls);
  }

  @Test
  void noListenersMeansPassThrough() {
    assertEquals(EventOutcome.PASS_THROUGH,
        dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, TestPayloads.selection()));
  }

  @Test
  void listenerDeniesClassMissingRequiredFlag() {
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m_require",
        selection -> selection.user().tlsSession().isPresent() || !selection.connectClass().config().getBool("requiressl")
            ? EventOutcome.PASS_THROUGH : EventOutcome.DENY);

    ConnectClassSelection strict = TestPayloads.selection(
        ConfigTag.builder("connect").put("name", "secure").put("requiressl", "yes").build());
    ConnectClassSelection lax = TestPayloads.selection(
        ConfigTag.builder("connect").put("name", "main").build());

    assertEquals(EventOutcome.DENY, dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, strict));
    EventOutcome laxOutcome = dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, lax);
    assertEquals(EventOutcome.PASS_THROUGH, laxOutcome);
    assertEquals(EventOutcome.ALLOW, laxOutcome.orDefault(EventOutcome.ALLOW));
  }

  // ── Failures ────────────────────────────────────────────────────

  @Test
  void throwingListenerCountsAsPassThrough() {
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m_broken", selection -> {
      throw new IllegalStateException("boom");
    }, 1);
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m_ok", voting("ok", EventOutcome.DENY), 2);

    EventOutcome outcome = dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, TestPayloads.selection());

    assertEquals(EventOutcome.DENY, outcome);
    assertEquals(List.of("ok"), calls);
  }

  @Test
  void nullVoteCountsAsPassThrough() {
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m_null", voting("null", null));
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m_ok", voting("ok", EventOutcome.ALLOW));

    assertEquals(EventOutcome.ALLOW,
        dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, TestPayloads.selection()));
  }

  @Test
  void wrongPayloadTypeIsRejectedThroughRawKind() {
    @SuppressWarnings({"unchecked", "rawtypes"})
    VetoableEvent<Object> raw = (VetoableEvent) CoreEvents.CONNECT_CLASS_SELECTION;

    assertThrows(IllegalArgumentException.class, () -> dispatcher.dispatch(raw, "not a selection"));
  }

  // ── Advisory events ─────────────────────────────────────────────

  @Test
  void advisoryEventsRunEveryListener() {
    List<String> seen = new ArrayList<>();
    dispatcher.subscribe(CoreEvents.POST_CONNECT, "m_a", payload -> seen.add("a"));
    dispatcher.subscribe(CoreEvents.POST_CONNECT, "m_b", payload -> {
      seen.add("b");
      throw new IllegalStateException("boom");
    });
    dispatcher.subscribe(CoreEvents.POST_CONNECT, "m_c", payload -> seen.add("c"));

    dispatcher.dispatch(CoreEvents.POST_CONNECT, TestPayloads.postConnect());

    assertEquals(List.of("a", "b", "c"), seen);
  }

  // ── Unsubscribe ─────────────────────────────────────────────────

  @Test
  void cancelledSubscriptionStopsReceivingEvents() {
    Subscription subscription = dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m",
        voting("x", EventOutcome.PASS_THROUGH));

    assertTrue(subscription.cancel());
    assertFalse(subscription.cancel());
    assertFalse(subscription.isActive());

    dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, TestPayloads.selection());
    assertTrue(calls.isEmpty());
  }

  @Test
  void unsubscribeByListenerIdentity() {
    VetoListener<ConnectClassSelection> listener = voting("x", EventOutcome.DENY);
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m", listener);

    assertTrue(dispatcher.unsubscribe(CoreEvents.CONNECT_CLASS_SELECTION, listener));
    assertFalse(dispatcher.unsubscribe(CoreEvents.CONNECT_CLASS_SELECTION, listener));
    assertEquals(EventOutcome.PASS_THROUGH,
        dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, TestPayloads.selection()));
  }

  @Test
  void listenerCancelledDuringDispatchIsSkipped() {
    Subscription[] later = new Subscription[1];
    dispatcher.subscribe(CoreEvents.POST_CONNECT, "m_a", payload -> {
      calls.add("a");
      later[0].cancel();
    }, 1);
    later[0] = dispatcher.subscribe(CoreEvents.POST_CONNECT, "m_b", payload -> calls.add("b"), 2);

    dispatcher.dispatch(CoreEvents.POST_CONNECT, TestPayloads.postConnect());

    assertEquals(List.of("a"), calls);
  }

  @Test
  void listenerSubscribedDuringDispatchRunsNextTime() {
    dispatcher.subscribe(CoreEvents.POST_CONNECT, "m_a", payload -> {
      calls.add("a");
      if (calls.size() == 1) {
        dispatcher.subscribe(CoreEvents.POST_CONNECT, "m_b", p -> calls.add("b"));
      }
    });

    dispatcher.dispatch(CoreEvents.POST_CONNECT, TestPayloads.postConnect());
    assertEquals(List.of("a"), calls);

    dispatcher.dispatch(CoreEvents.POST_CONNECT, TestPayloads.postConnect());
    assertEquals(List.of("a", "a", "b"), calls);
  }

  @Test
  void unsubscribeAllRemovesOnlyOwnersListeners() {
    dispatcher.subscribe(CoreEvents.POST_CONNECT, "m_gone", payload -> calls.add("gone"));
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m_gone", voting("gone", EventOutcome.DENY));
    dispatcher.subscribe(CoreEvents.POST_CONNECT, "m_kept", payload -> calls.add("kept"));

    assertEquals(2, dispatcher.unsubscribeAll("m_gone"));

    dispatcher.dispatch(CoreEvents.POST_CONNECT, TestPayloads.postConnect());
    assertEquals(EventOutcome.PASS_THROUGH,
        dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, TestPayloads.selection()));
    assertEquals(List.of("kept"), calls);
  }

  // ── Interceptors ────────────────────────────────────────────────

  @Test
  void interceptorsWrapDispatchInNestedOrder() {
    List<String> trace = new ArrayList<>();
    dispatcher = EventDispatcher.builder()
        .interceptor(new DispatchInterceptor() {
          @Override
          public void beforeDispatch(EventKind<?> kind, Object payload) {
            trace.add("before-1");
          }

          @Override
          public void afterDispatch(EventKind<?> kind, Object payload, EventOutcome outcome) {
            trace.add("after-1:" + outcome);
          }
        })
        .interceptor(DispatchInterceptor.before((kind, payload) -> trace.add("before-2")))
        .interceptor(DispatchInterceptor.after((kind, payload, outcome) -> trace.add("after-3:" + outcome)))
        .build();
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m", selection -> {
      trace.add("listener");
      return EventOutcome.DENY;
    });

    dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, TestPayloads.selection());

    assertEquals(List.of("before-1", "before-2", "listener", "after-3:DENY", "after-1:DENY"), trace);
  }

  @Test
  void failingInterceptorDoesNotChangeOutcome() {
    dispatcher = EventDispatcher.builder()
        .interceptor(DispatchInterceptor.before((kind, payload) -> {
          throw new Exception("before");
        }))
        .interceptor(DispatchInterceptor.after((kind, payload, outcome) -> {
          throw new IllegalStateException("after");
        }))
        .build();
    dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m", voting("x", EventOutcome.ALLOW));

    assertEquals(EventOutcome.ALLOW,
        dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, TestPayloads.selection()));
    assertEquals(List.of("x"), calls);
  }

  @Test
  void advisoryDispatchReportsNullOutcomeToInterceptors() {
    List<EventOutcome> outcomes = new ArrayList<>();
    dispatcher = EventDispatcher.builder()
        .interceptor(DispatchInterceptor.after((kind, payload, outcome) -> outcomes.add(outcome)))
        .build();

    dispatcher.dispatch(CoreEvents.POST_CONNECT, TestPayloads.postConnect());

    assertEquals(1, outcomes.size());
    assertNull(outcomes.get(0));
  }
}
