package com.github.fluentfsm;

/**
 * Side channel for action failures of an {@link ActiveStateMachine}. By the time its worker runs an
 * action, the {@code fire()} that queued the event has long returned, so failures are delivered
 * here instead. Invoked on the worker thread, after the failure has been logged.
 */
@FunctionalInterface
public interface ActionFailureListener<S, E> {

  /**
   * @param state the state the machine is in; the failed step did not change it
   * @param event the event being processed, null if the failure happened on start or during an
   *        auto-transition
   * @param failure an {@link StateMachineException.Code#ACTION_FAILURE} carrying the action's
   *        exception as its cause
   */
  void onActionFailure(S state, E event, StateMachineException failure);

}
