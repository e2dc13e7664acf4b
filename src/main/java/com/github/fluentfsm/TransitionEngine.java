package com.github.fluentfsm;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fluentfsm.StateMachineException.Code;
import com.github.fluentfsm.TransitionResult.Outcome;

/**
 * The step algorithm shared by the passive and the active machine. It owns the current state and
 * the model reference and knows nothing about threads: callers are responsible for making sure only
 * one step runs at a time.
 *
 * A step is: event actions of (current, event), then, if a transition is registered, leave actions
 * of current and enter actions of the target. The current state is committed only once the whole
 * sequence has succeeded. A failing action aborts the rest of the step and leaves the current state
 * where it was; whatever the earlier actions did to the model stays done.
 */
final class TransitionEngine<S, E, M> {
  private static final Logger logger = LogManager.getLogger(TransitionEngine.class.getSimpleName());

  private final String machineId;
  private final TransitionTable<S, E, M> table;
  private final M model;

  // written only by the thread running a step, read by anyone
  private volatile S currentState;

  private boolean stepping;

  TransitionEngine(final String machineId, final TransitionTable<S, E, M> table, final M model) {
    this.machineId = machineId;
    this.table = table;
    this.model = model;
    this.currentState = table.getInitialState();
  }

  String getMachineId() {
    return machineId;
  }

  TransitionTable<S, E, M> getTable() {
    return table;
  }

  M getModel() {
    return model;
  }

  S getCurrentState() {
    return currentState;
  }

  /**
   * Run the enter actions of the initial state.
   */
  void enterInitialState() throws StateMachineException {
    beginStep();
    try {
      final S state = currentState;
      runActions(table.getActionSet(state).getEnterActions(), "enter", state, null);
      logInfo(machineId, "Entered initial state " + state);
    } finally {
      stepping = false;
    }
  }

  TransitionResult<S, E> fire(final E event) throws StateMachineException {
    beginStep();
    try {
      final S fromState = currentState;
      final ActionSet<E, M> actionSet = table.getActionSet(fromState);
      runActions(actionSet.getEventActions(event), "event", fromState, event);

      final S toState = table.findTransition(fromState, event);
      if (toState == null) {
        final Outcome outcome =
            actionSet.hasEventActions(event) ? Outcome.HANDLED : Outcome.IGNORED;
        logDebug(machineId, String.format("%s %s in %s", outcome, event, fromState));
        return new TransitionResult<>(outcome, fromState, fromState, event);
      }
      transition(fromState, toState, event);
      return new TransitionResult<>(Outcome.TRANSITIONED, fromState, toState, event);
    } finally {
      stepping = false;
    }
  }

  /**
   * Move straight to the target state without an event: leave actions, enter actions, commit.
   */
  TransitionResult<S, E> goTo(final S toState) throws StateMachineException {
    if (toState == null) {
      throw new StateMachineException(Code.INVALID_STATE);
    }
    beginStep();
    try {
      final S fromState = currentState;
      transition(fromState, toState, null);
      return new TransitionResult<>(Outcome.TRANSITIONED, fromState, toState, null);
    } finally {
      stepping = false;
    }
  }

  private void transition(final S fromState, final S toState, final E event)
      throws StateMachineException {
    runActions(table.getActionSet(fromState).getLeaveActions(), "leave", fromState, event);
    runActions(table.getActionSet(toState).getEnterActions(), "enter", toState, event);
    currentState = toState;
    logDebug(machineId, String.format("%s --%s--> %s", fromState, event, toState));
  }

  private void beginStep() throws StateMachineException {
    if (stepping) {
      throw new StateMachineException(Code.REENTRANT_FIRE);
    }
    stepping = true;
  }

  private void runActions(final List<ModelAction<M>> actions, final String hook, final S state,
      final E event) throws StateMachineException {
    for (int iter = 0; iter < actions.size(); iter++) {
      try {
        actions.get(iter).execute(model);
      } catch (Exception problem) {
        throw new StateMachineException(Code.ACTION_FAILURE,
            String.format("%s action #%d of state %s failed%s", hook, iter + 1, state,
                event != null ? " on event " + event : ""),
            problem);
      }
    }
  }

  static void logError(final String machineId, final String message, final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString(), error);
  }

  static void logWarning(final String machineId, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  static void logInfo(final String machineId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  static void logDebug(final String machineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }
}
