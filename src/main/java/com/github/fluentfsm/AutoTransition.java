package com.github.fluentfsm;

/**
 * Lets an {@link ActiveStateMachine} move on its own. While no event is queued, the worker
 * periodically hands the current state and the model to {@link #next(Object, Object)}; a non-null
 * return value is entered exactly as if a registered transition had fired (leave actions of the
 * current state, then enter actions of the returned one).
 *
 * Runs on the worker thread while the model write lock is held, so it must not block for long.
 */
@FunctionalInterface
public interface AutoTransition<S, M> {

  /**
   * Returns the state to move to, or null to stay put.
   */
  S next(S currentState, M model);

}
