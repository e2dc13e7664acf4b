package com.github.fluentfsm;

import com.github.fluentfsm.StateMachineException.Code;

/**
 * A simple Finite State Machine built from a declarative description of states, the actions to run
 * on entering and leaving them, the actions to run on events and the transitions those events
 * trigger.
 *
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this fsm<br>
 * 0b. less boilerplate code is the next most important virtue<br>
 *
 * 1. machines come in two flavours that share the exact same step semantics:
 * {@link PassiveStateMachine} processes a fired event on the caller thread before fire() returns,
 * {@link ActiveStateMachine} queues fired events and processes them one at a time on its own
 * worker thread<br>
 *
 * 2. states and events can be of any type with sane equals() and hashCode(); enums fit best<br>
 *
 * 3. the transition table is frozen when the machine is built and never changes afterwards, so
 * nothing about it needs locking<br>
 *
 * 4. it is designed to not be singleton within a process, so, if there's a desire to have many
 * state machines, just create as many as needed<br>
 *
 * 5. an unmatched event is not an error. It runs the event actions registered for it in the current
 * state, if any, and leaves the state alone<br>
 */
public interface StateMachine<S, E, M> {

  /**
   * Run the enter actions of the initial state. A machine can be started only once.
   */
  void start() throws StateMachineException;

  /**
   * Read/report the current state of the state machine.
   */
  S currentState();

  /**
   * Check if start() has been called successfully.
   */
  boolean isStarted();

  /**
   * Reports the id of this StateMachine instance, the configured machine name.
   */
  String getId();

  /**
   * Returns the frozen table this machine executes.
   */
  TransitionTable<S, E, M> getTransitionTable();

  /**
   * A fluent builder that describes one state at a time. Calls after {@link #create} or
   * {@link #inState} apply to that state; {@link #goTo} binds a transition to the event of the most
   * recent {@link #on} or {@link #onMut} call in that state.
   *
   * <pre>
   * StateMachineBuilder.create(LOCKED, turnstile)
   *     .onMut(COIN, model -&gt; model.coins++).goTo(UNLOCKED)
   *     .on(PUSH, () -&gt; logger.info("locked"))
   *     .inState(UNLOCKED)
   *     .on(PUSH, () -&gt; logger.info("welcome")).goTo(LOCKED)
   *     .build();
   * </pre>
   *
   * Building consumes the builder, and so does any construction error: every later call fails
   * with {@link Code#BUILDER_CONSUMED}.
   */
  public final static class StateMachineBuilder<S, E, M> {
    private final TransitionTable.Assembler<S, E, M> assembler;
    private final M initialModel;
    private StateMachineConfiguration config;
    private ActionFailureListener<S, E> failureListener;

    private S scopeState;
    private ActionSet<E, M> scopeActions;
    private E scopeEvent;
    private boolean consumed;

    public static <S, E, M> StateMachineBuilder<S, E, M> create(final S initialState,
        final M initialModel) throws StateMachineException {
      return new StateMachineBuilder<>(initialState, initialModel);
    }

    public StateMachineBuilder<S, E, M> config(final StateMachineConfiguration config)
        throws StateMachineException {
      checkUsable();
      if (config == null) {
        throw fail(new StateMachineException(Code.INVALID_MACHINE_CONFIG, "Config cannot be null"));
      }
      this.config = config;
      return this;
    }

    /**
     * Only used by active machines; a passive machine throws action failures at the caller.
     */
    public StateMachineBuilder<S, E, M> onActionFailure(
        final ActionFailureListener<S, E> failureListener) throws StateMachineException {
      checkUsable();
      if (failureListener == null) {
        throw fail(new StateMachineException(Code.INVALID_ACTION));
      }
      this.failureListener = failureListener;
      return this;
    }

    public StateMachineBuilder<S, E, M> inState(final S state) throws StateMachineException {
      checkUsable();
      if (state == null) {
        throw fail(new StateMachineException(Code.INVALID_STATE));
      }
      scopeActions = assembler.defineState(state);
      scopeState = state;
      scopeEvent = null;
      return this;
    }

    public StateMachineBuilder<S, E, M> onEnter(final Action action)
        throws StateMachineException {
      return onEnterMut(adapt(action));
    }

    public StateMachineBuilder<S, E, M> onEnterMut(final ModelAction<? super M> action)
        throws StateMachineException {
      checkUsable();
      scopeActions.addEnterAction(checkAction(action)::execute);
      return this;
    }

    public StateMachineBuilder<S, E, M> onLeave(final Action action)
        throws StateMachineException {
      return onLeaveMut(adapt(action));
    }

    public StateMachineBuilder<S, E, M> onLeaveMut(final ModelAction<? super M> action)
        throws StateMachineException {
      checkUsable();
      scopeActions.addLeaveAction(checkAction(action)::execute);
      return this;
    }

    public StateMachineBuilder<S, E, M> on(final E event, final Action action)
        throws StateMachineException {
      return onMut(event, adapt(action));
    }

    public StateMachineBuilder<S, E, M> onMut(final E event, final ModelAction<? super M> action)
        throws StateMachineException {
      checkUsable();
      if (event == null) {
        throw fail(new StateMachineException(Code.INVALID_EVENT));
      }
      scopeActions.addEventAction(event, checkAction(action)::execute);
      scopeEvent = event;
      return this;
    }

    /**
     * Transition from the state in scope to the given state when the event in scope is fired.
     */
    public StateMachineBuilder<S, E, M> goTo(final S state) throws StateMachineException {
      checkUsable();
      if (scopeEvent == null) {
        throw fail(new StateMachineException(Code.NO_EVENT_IN_SCOPE,
            "Can't add a transition to " + state + " from " + scopeState
                + " before an event is in scope with on()"));
      }
      try {
        assembler.addTransition(scopeState, scopeEvent, state);
      } catch (StateMachineException problem) {
        throw fail(problem);
      }
      return this;
    }

    /**
     * Same as {@link #buildPassive()}.
     */
    public PassiveStateMachine<S, E, M> build() throws StateMachineException {
      return buildPassive();
    }

    public PassiveStateMachine<S, E, M> buildPassive() throws StateMachineException {
      final TransitionTable<S, E, M> table = consume();
      return new PassiveStateMachine<>(config(), table, initialModel);
    }

    public ActiveStateMachine<S, E, M> buildActive() throws StateMachineException {
      final TransitionTable<S, E, M> table = consume();
      return new ActiveStateMachine<>(config(), table, initialModel, failureListener, null);
    }

    /**
     * Build an active machine that also consults the given {@link AutoTransition} whenever its
     * worker is idle.
     */
    public ActiveStateMachine<S, E, M> buildActive(final AutoTransition<S, ? super M> autoTransition)
        throws StateMachineException {
      checkUsable();
      if (autoTransition == null) {
        throw fail(new StateMachineException(Code.INVALID_ACTION));
      }
      final TransitionTable<S, E, M> table = consume();
      return new ActiveStateMachine<>(config(), table, initialModel, failureListener,
          autoTransition::next);
    }

    private StateMachineConfiguration config() {
      return config != null ? config : StateMachineConfiguration.defaults();
    }

    private TransitionTable<S, E, M> consume() throws StateMachineException {
      checkUsable();
      consumed = true;
      return assembler.freeze();
    }

    private void checkUsable() throws StateMachineException {
      if (consumed) {
        throw new StateMachineException(Code.BUILDER_CONSUMED);
      }
    }

    private <A> A checkAction(final A action) throws StateMachineException {
      if (action == null) {
        throw fail(new StateMachineException(Code.INVALID_ACTION));
      }
      return action;
    }

    private StateMachineException fail(final StateMachineException problem) {
      consumed = true;
      return problem;
    }

    private static <M> ModelAction<M> adapt(final Action action) {
      if (action == null) {
        return null;
      }
      return model -> action.execute();
    }

    private StateMachineBuilder(final S initialState, final M initialModel)
        throws StateMachineException {
      this.assembler = new TransitionTable.Assembler<>(initialState);
      this.initialModel = initialModel;
      this.scopeState = initialState;
      this.scopeActions = assembler.defineState(initialState);
    }
  }

}
