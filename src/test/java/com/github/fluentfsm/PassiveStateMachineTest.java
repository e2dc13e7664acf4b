package com.github.fluentfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.fluentfsm.StateMachine.StateMachineBuilder;
import com.github.fluentfsm.StateMachineException.Code;
import com.github.fluentfsm.TransitionResult.Outcome;

/**
 * Tests to maintain the sanity and correctness of PassiveStateMachine.
 */
public class PassiveStateMachineTest {
  private static final Logger logger =
      LogManager.getLogger(PassiveStateMachineTest.class.getSimpleName());

  @Test
  public void testTurnstileFlow() throws StateMachineException {
    // 1. load up the fsm
    final Turnstile turnstile = new Turnstile();
    final PassiveStateMachine<TurnstileState, TurnstileEvent, Turnstile> machine =
        turnstileMachine(turnstile);
    assertFalse(machine.isStarted());
    assertSame(turnstile, machine.model());

    // 2. start it
    machine.start();
    assertTrue(machine.isStarted());
    assertEquals(TurnstileState.LOCKED, machine.currentState());
    assertEquals(Arrays.asList("locked"), turnstile.messages);

    // 3. LOCKED: push is rejected but its action runs
    TransitionResult<TurnstileState, TurnstileEvent> result = machine.fire(TurnstileEvent.PUSH);
    assertEquals(Outcome.HANDLED, result.getOutcome());
    assertEquals(TurnstileState.LOCKED, machine.currentState());
    assertEquals("won't budge", turnstile.messages.get(1));

    // 4. LOCKED->UNLOCKED
    result = machine.fire(TurnstileEvent.COIN);
    assertTrue(result.isTransitioned());
    assertEquals(TurnstileState.LOCKED, result.getFromState());
    assertEquals(TurnstileState.UNLOCKED, result.getToState());
    assertEquals(TurnstileEvent.COIN, result.getEvent());
    assertEquals(TurnstileState.UNLOCKED, machine.currentState());
    assertEquals(1, turnstile.coins);
    assertEquals("clicks", turnstile.messages.get(2));

    // 5. UNLOCKED: another coin is only acknowledged
    result = machine.fire(TurnstileEvent.COIN);
    assertEquals(Outcome.HANDLED, result.getOutcome());
    assertEquals(TurnstileState.UNLOCKED, machine.currentState());
    assertEquals(1, turnstile.coins);

    // 6. UNLOCKED->LOCKED
    result = machine.fire(TurnstileEvent.PUSH);
    assertTrue(result.isTransitioned());
    assertEquals(TurnstileState.LOCKED, machine.currentState());
    assertEquals(1, turnstile.riders);
    assertEquals(Arrays.asList("locked", "won't budge", "clicks", "already paid", "locked"),
        turnstile.messages);
  }

  @Test
  public void testBasketFlow() throws StateMachineException {
    final Basket basket = new Basket();
    final PassiveStateMachine<BasketState, BasketEvent, Basket> machine =
        StateMachineBuilder.<BasketState, BasketEvent, Basket>create(BasketState.CLOSED, basket)
            .onEnterMut(model -> model.open = false)
            .on(BasketEvent.OPEN, () -> {
            }).goTo(BasketState.OPENED)
            .inState(BasketState.OPENED)
            .onEnterMut(model -> model.open = true)
            .onMut(BasketEvent.ADD_EGG, model -> model.eggs++)
            .onMut(BasketEvent.TAKE_EGG, model -> model.eggs--)
            .onLeaveMut(model -> model.eggs = 12)
            .on(BasketEvent.CLOSE, () -> {
            }).goTo(BasketState.CLOSED)
            .build();
    machine.start();
    assertFalse(machine.model().open);
    assertEquals(12, machine.model().eggs);

    // adding before it's open changes nothing
    assertEquals(Outcome.IGNORED, machine.fire(BasketEvent.ADD_EGG).getOutcome());
    assertEquals(12, machine.model().eggs);

    machine.fire(BasketEvent.OPEN);
    assertTrue(machine.model().open);

    machine.fire(BasketEvent.ADD_EGG);
    assertEquals(13, machine.model().eggs);
    machine.fire(BasketEvent.TAKE_EGG);
    machine.fire(BasketEvent.TAKE_EGG);
    assertEquals(11, machine.model().eggs);

    // leaving the opened basket restores a dozen
    machine.fire(BasketEvent.CLOSE);
    assertFalse(machine.model().open);
    assertEquals(12, machine.model().eggs);
  }

  @Test
  public void testEnterActionsRunInRegistrationOrder() throws StateMachineException {
    final AtomicInteger counter = new AtomicInteger();
    final List<Integer> observed = new ArrayList<>();
    final int actionCount = 10;
    StateMachineBuilder<String, String, List<Integer>> builder =
        StateMachineBuilder.<String, String, List<Integer>>create("A", observed);
    for (int iter = 0; iter < actionCount; iter++) {
      final int expected = iter;
      builder = builder.onEnterMut(model -> model.add(expected * 100 + counter.getAndIncrement()));
    }
    final PassiveStateMachine<String, String, List<Integer>> machine = builder.build();
    machine.start();

    assertEquals(actionCount, observed.size());
    for (int iter = 0; iter < actionCount; iter++) {
      assertEquals(iter * 100 + iter, observed.get(iter).intValue());
    }
  }

  @Test
  public void testSelfTransitionRunsLeaveThenEnterOnce() throws StateMachineException {
    final List<String> calls = new ArrayList<>();
    final PassiveStateMachine<String, String, List<String>> machine =
        StateMachineBuilder.<String, String, List<String>>create("A", calls)
            .onEnterMut(model -> model.add("enter"))
            .onLeaveMut(model -> model.add("leave"))
            .onMut("loop", model -> model.add("event")).goTo("A")
            .build();
    machine.start();
    assertEquals(Arrays.asList("enter"), calls);

    final TransitionResult<String, String> result = machine.fire("loop");
    assertTrue(result.isTransitioned());
    assertEquals("A", result.getFromState());
    assertEquals("A", result.getToState());
    assertEquals(Arrays.asList("enter", "event", "leave", "enter"), calls);

    machine.fire("loop");
    assertEquals(Arrays.asList("enter", "event", "leave", "enter", "event", "leave", "enter"),
        calls);
  }

  @Test
  public void testUnmatchedEventIsIgnored() throws StateMachineException {
    final List<String> calls = new ArrayList<>();
    final PassiveStateMachine<String, String, List<String>> machine =
        StateMachineBuilder.<String, String, List<String>>create("A", calls)
            .onLeaveMut(model -> model.add("leave"))
            .onMut("go", model -> model.add("go")).goTo("B")
            .inState("B")
            .onEnterMut(model -> model.add("enter B"))
            .build();
    machine.start();

    final TransitionResult<String, String> result = machine.fire("nobody-listens");
    assertEquals(Outcome.IGNORED, result.getOutcome());
    assertEquals("A", result.getFromState());
    assertEquals("A", result.getToState());
    assertEquals("A", machine.currentState());
    assertTrue(calls.isEmpty());

    // B has no transitions at all, everything fired there is ignored
    machine.fire("go");
    assertEquals("B", machine.currentState());
    assertEquals(Outcome.IGNORED, machine.fire("go").getOutcome());
    assertEquals("B", machine.currentState());
    assertEquals(Arrays.asList("go", "leave", "enter B"), calls);
  }

  @Test
  public void testLifecycleMisuse() throws StateMachineException {
    final PassiveStateMachine<TurnstileState, TurnstileEvent, Turnstile> machine =
        turnstileMachine(new Turnstile());
    try {
      machine.fire(TurnstileEvent.COIN);
      fail("fire before start must fail");
    } catch (StateMachineException expected) {
      assertEquals(Code.NOT_STARTED, expected.getCode());
    }

    machine.start();
    try {
      machine.start();
      fail("double start must fail");
    } catch (StateMachineException expected) {
      assertEquals(Code.ALREADY_STARTED, expected.getCode());
    }
    assertEquals(1, machine.model().messages.size());

    try {
      machine.fire(null);
      fail("null event must fail");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_EVENT, expected.getCode());
    }
  }

  @Test
  public void testFailedEnterActionKeepsSourceState() throws StateMachineException {
    final List<String> calls = new ArrayList<>();
    final IllegalStateException boom = new IllegalStateException("boom");
    final AtomicInteger failuresLeft = new AtomicInteger(1);
    final PassiveStateMachine<String, String, List<String>> machine =
        StateMachineBuilder.<String, String, List<String>>create("A", calls)
            .onLeaveMut(model -> model.add("leave A"))
            .onMut("go", model -> model.add("go")).goTo("B")
            .inState("B")
            .onEnterMut(model -> {
              model.add("enter B #1");
              if (failuresLeft.getAndDecrement() > 0) {
                throw boom;
              }
            })
            .onEnterMut(model -> model.add("enter B #2"))
            .build();
    machine.start();

    // 1. the step blows up in B's first enter action
    try {
      machine.fire("go");
      fail("failing enter action must propagate");
    } catch (StateMachineException expected) {
      assertEquals(Code.ACTION_FAILURE, expected.getCode());
      assertSame(boom, expected.getCause());
    }
    // 2. nothing after the failing action ran, and the state was not committed
    assertEquals(Arrays.asList("go", "leave A", "enter B #1"), calls);
    assertEquals("A", machine.currentState());

    // 3. the machine remains usable
    calls.clear();
    assertTrue(machine.fire("go").isTransitioned());
    assertEquals("B", machine.currentState());
    assertEquals(Arrays.asList("go", "leave A", "enter B #1", "enter B #2"), calls);
  }

  @Test
  public void testFailedEventActionSkipsTransition() throws StateMachineException {
    final List<String> calls = new ArrayList<>();
    final PassiveStateMachine<String, String, List<String>> machine =
        StateMachineBuilder.<String, String, List<String>>create("A", calls)
            .onLeaveMut(model -> model.add("leave A"))
            .on("go", () -> {
              throw new java.io.IOException("disk on fire");
            })
            .onMut("go", model -> model.add("never"))
            .goTo("B")
            .build();
    machine.start();
    try {
      machine.fire("go");
      fail();
    } catch (StateMachineException expected) {
      assertEquals(Code.ACTION_FAILURE, expected.getCode());
      assertTrue(expected.getCause() instanceof java.io.IOException);
      logger.info("Expected failure: " + expected.getMessage());
    }
    assertTrue(calls.isEmpty());
    assertEquals("A", machine.currentState());
  }

  @Test
  public void testFailedStartCanBeRetried() throws StateMachineException {
    final AtomicInteger attempts = new AtomicInteger();
    final PassiveStateMachine<String, String, AtomicInteger> machine =
        StateMachineBuilder.<String, String, AtomicInteger>create("A", attempts)
            .onEnterMut(model -> {
              if (model.incrementAndGet() == 1) {
                throw new IllegalStateException("not yet");
              }
            })
            .build();
    try {
      machine.start();
      fail();
    } catch (StateMachineException expected) {
      assertEquals(Code.ACTION_FAILURE, expected.getCode());
    }
    assertFalse(machine.isStarted());
    try {
      machine.fire("anything");
      fail();
    } catch (StateMachineException expected) {
      assertEquals(Code.NOT_STARTED, expected.getCode());
    }

    machine.start();
    assertTrue(machine.isStarted());
    assertEquals(2, attempts.get());
  }

  @Test
  public void testFireFromOwnActionIsRefused() throws StateMachineException {
    final AtomicReference<PassiveStateMachine<String, String, Object>> self =
        new AtomicReference<>();
    final PassiveStateMachine<String, String, Object> machine =
        StateMachineBuilder.<String, String, Object>create("A", null)
            .on("outer", () -> self.get().fire("inner")).goTo("B")
            .on("inner", () -> {
            }).goTo("C")
            .build();
    self.set(machine);
    machine.start();

    try {
      machine.fire("outer");
      fail("nested fire must be refused");
    } catch (StateMachineException expected) {
      assertEquals(Code.ACTION_FAILURE, expected.getCode());
      assertEquals(Code.REENTRANT_FIRE, ((StateMachineException) expected.getCause()).getCode());
    }
    assertEquals("A", machine.currentState());
    assertTrue(machine.fire("inner").isTransitioned());
    assertEquals("C", machine.currentState());
  }

  @Test
  public void testStateMachineThreadSafety() throws Exception {
    final Counter counter = new Counter();
    final PassiveStateMachine<String, String, Counter> machine =
        StateMachineBuilder.<String, String, Counter>create("COUNTING", counter)
            .onMut("tick", model -> model.value++)
            .build();
    machine.start();

    final int workerCount = 5;
    final int ticksPerWorker = 1000;
    final AtomicInteger failures = new AtomicInteger();
    final Runnable fireWorker = new Runnable() {
      @Override
      public void run() {
        try {
          for (int iter = 0; iter < ticksPerWorker; iter++) {
            machine.fire("tick");
          }
        } catch (StateMachineException problem) {
          failures.incrementAndGet();
          logger.error("machine:" + machine.getId() + " encountered an issue", problem);
        }
      }
    };

    final List<Thread> workers = new ArrayList<>(workerCount);
    for (int iter = 0; iter < workerCount; iter++) {
      workers.add(new Thread(fireWorker, "test-fire-worker-" + iter));
    }
    for (final Thread worker : workers) {
      worker.start();
    }
    for (final Thread worker : workers) {
      worker.join();
    }

    assertEquals(0, failures.get());
    assertEquals(workerCount * ticksPerWorker, machine.model().value);
  }

  static PassiveStateMachine<TurnstileState, TurnstileEvent, Turnstile> turnstileMachine(
      final Turnstile turnstile) throws StateMachineException {
    return StateMachineBuilder
        .<TurnstileState, TurnstileEvent, Turnstile>create(TurnstileState.LOCKED, turnstile)
        .onEnterMut(model -> model.messages.add("locked"))
        .onMut(TurnstileEvent.COIN, model -> model.coins++).goTo(TurnstileState.UNLOCKED)
        .onMut(TurnstileEvent.PUSH, model -> model.messages.add("won't budge"))
        .inState(TurnstileState.UNLOCKED)
        .onEnterMut(model -> model.messages.add("clicks"))
        .on(TurnstileEvent.PUSH, () -> logger.info("enjoy your ride!"))
        .onMut(TurnstileEvent.PUSH, model -> model.riders++).goTo(TurnstileState.LOCKED)
        .onMut(TurnstileEvent.COIN, model -> model.messages.add("already paid"))
        .build();
  }

  enum TurnstileState {
    LOCKED, UNLOCKED
  }

  enum TurnstileEvent {
    COIN, PUSH
  }

  static final class Turnstile {
    int coins;
    int riders;
    final List<String> messages = new ArrayList<>();
  }

  enum BasketState {
    CLOSED, OPENED
  }

  enum BasketEvent {
    OPEN, ADD_EGG, TAKE_EGG, CLOSE
  }

  static final class Basket {
    boolean open;
    int eggs = 12;
  }

  static final class Counter {
    int value;
  }

}
