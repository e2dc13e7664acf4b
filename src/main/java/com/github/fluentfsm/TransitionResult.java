package com.github.fluentfsm;

/**
 * This object encapsulates the result of firing one event into a {@link PassiveStateMachine}.
 *
 * {@link Outcome#TRANSITIONED} carries the state the machine left and the one it entered.
 * {@link Outcome#HANDLED} means the event actions of the current state ran but no transition was
 * registered, and {@link Outcome#IGNORED} means nothing at all was registered for the pair. Both
 * leave {@link #getFromState()} and {@link #getToState()} equal. Failures are not encoded here;
 * they are thrown as {@link StateMachineException}.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class TransitionResult<S, E> {
  private final Outcome outcome;
  private final S fromState;
  private final S toState;
  private final E event;

  TransitionResult(final Outcome outcome, final S fromState, final S toState, final E event) {
    this.outcome = outcome;
    this.fromState = fromState;
    this.toState = toState;
    this.event = event;
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public S getFromState() {
    return fromState;
  }

  public S getToState() {
    return toState;
  }

  /**
   * The event that caused this step; null for a transition triggered by an {@link AutoTransition}.
   */
  public E getEvent() {
    return event;
  }

  public boolean isTransitioned() {
    return outcome == Outcome.TRANSITIONED;
  }

  @Override
  public String toString() {
    return "TransitionResult [outcome=" + outcome + ", fromState=" + fromState + ", toState="
        + toState + ", event=" + event + "]";
  }

  public static enum Outcome {
    TRANSITIONED, HANDLED, IGNORED;
  }
}
