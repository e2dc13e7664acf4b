package com.github.fluentfsm;

/**
 * Unified single exception that's thrown and handled by this FSM. The idea is to use the code enum
 * to encapsulate various error/exception conditions. Failures of user supplied actions are
 * reported as {@link Code#ACTION_FAILURE} with the original failure kept as the cause.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public StateMachineException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    DUPLICATE_TRANSITION("A transition for this state and event pair is already registered"),
    // 2.
    NO_EVENT_IN_SCOPE("Cannot add a transition before an event is in scope via on() or onMut()"),
    // 3.
    BUILDER_CONSUMED("State machine builder was already built or failed and cannot be reused"),
    // 4.
    INVALID_STATE("Null state is invalid"),
    // 5.
    INVALID_EVENT("Null event is invalid"),
    // 6.
    INVALID_ACTION("Null action is invalid"),
    // 7.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid"),
    // 8.
    ALREADY_STARTED("State machine is already started"),
    // 9.
    NOT_STARTED("State machine is not started and cannot service events"),
    // 10.
    MACHINE_NOT_ALIVE("State machine is stopped and cannot service requests"),
    // 11.
    REENTRANT_FIRE("Event fired from within an action of the same passive state machine"),
    // 12.
    ACTION_FAILURE(
        "An action failed while processing a step. Check exception cause for more details of the failure."),
    // 13.
    ILLEGAL_WORKER_OPERATION("Operation cannot be invoked from the state machine's own worker"),
    // 14.
    INTERRUPTED("State machine was interrupted");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
