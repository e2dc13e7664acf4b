package com.github.fluentfsm;

import com.github.fluentfsm.StateMachineException.Code;

/**
 * A state machine that processes every fired event synchronously on the caller thread. When
 * {@link #fire(Object)} returns, the event actions, leave actions and enter actions of the step
 * have all run, or one of them has failed and the failure is being thrown at the caller.
 *
 * The machine exclusively owns its model. Methods are synchronized so that steps issued from
 * different threads never interleave, but actions must not fire events into their own machine:
 * that fails with {@link Code#REENTRANT_FIRE}.
 */
public final class PassiveStateMachine<S, E, M> implements StateMachine<S, E, M> {
  private final TransitionEngine<S, E, M> engine;
  private boolean started;

  PassiveStateMachine(final StateMachineConfiguration config, final TransitionTable<S, E, M> table,
      final M model) {
    this.engine = new TransitionEngine<>(config.getMachineName(), table, model);
    TransitionEngine.logInfo(engine.getMachineId(),
        "Built passive state machine with " + table);
  }

  /**
   * Runs the enter actions of the initial state. If one of them fails the machine stays
   * un-started, so start() may be retried.
   */
  @Override
  public synchronized void start() throws StateMachineException {
    if (started) {
      throw new StateMachineException(Code.ALREADY_STARTED);
    }
    engine.enterInitialState();
    started = true;
  }

  /**
   * Fire the event and process it to completion. Unmatched events are not an error; see
   * {@link TransitionResult} for how they are reported.
   *
   * @throws StateMachineException {@link Code#ACTION_FAILURE} if an action failed, in which case
   *         the current state is unchanged
   */
  public synchronized TransitionResult<S, E> fire(final E event) throws StateMachineException {
    if (event == null) {
      throw new StateMachineException(Code.INVALID_EVENT);
    }
    if (!started) {
      throw new StateMachineException(Code.NOT_STARTED);
    }
    return engine.fire(event);
  }

  /**
   * The model this machine owns. Mutate it only from model actions.
   */
  public synchronized M model() {
    return engine.getModel();
  }

  @Override
  public S currentState() {
    return engine.getCurrentState();
  }

  @Override
  public synchronized boolean isStarted() {
    return started;
  }

  @Override
  public String getId() {
    return engine.getMachineId();
  }

  @Override
  public TransitionTable<S, E, M> getTransitionTable() {
    return engine.getTable();
  }

  @Override
  public String toString() {
    return "PassiveStateMachine [id=" + getId() + ", started=" + isStarted() + ", currentState="
        + currentState() + "]";
  }
}
