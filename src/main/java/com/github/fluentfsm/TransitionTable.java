package com.github.fluentfsm;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.github.fluentfsm.StateMachineException.Code;

/**
 * The immutable description of a machine: its initial state, the {@link ActionSet} of every known
 * state and the (state, event)->target transitions. A table is either being assembled by a builder
 * or fully frozen; a machine only ever sees the frozen form, so it can be read from any thread
 * without locking.
 */
public final class TransitionTable<S, E, M> {
  private final S initialState;

  // handed out for states that have no actions
  private final ActionSet<E, M> emptyActionSet = new ActionSet<E, M>().freeze();

  // K=state, V=actions of that state. Insertion ordered to keep logs readable.
  private final Map<S, ActionSet<E, M>> actionSets;

  // K=(state, event), V=target state.
  private final Map<TransitionKey<S, E>, S> transitions;

  private TransitionTable(final S initialState, final Map<S, ActionSet<E, M>> actionSets,
      final Map<TransitionKey<S, E>, S> transitions) {
    this.initialState = initialState;
    this.actionSets = actionSets;
    this.transitions = transitions;
  }

  public S getInitialState() {
    return initialState;
  }

  /**
   * Returns the actions of the given state, an empty set for a state that has none.
   */
  public ActionSet<E, M> getActionSet(final S state) {
    final ActionSet<E, M> actionSet = actionSets.get(state);
    return actionSet != null ? actionSet : emptyActionSet;
  }

  /**
   * Lookup the target of the transition registered for (state, event), or null if there is none.
   */
  public S findTransition(final S state, final E event) {
    return transitions.get(TransitionKey.of(state, event));
  }

  public Set<S> getStates() {
    return actionSets.keySet();
  }

  public Map<TransitionKey<S, E>, S> getTransitions() {
    return transitions;
  }

  @Override
  public String toString() {
    return "TransitionTable [initialState=" + initialState + ", states=" + actionSets.keySet()
        + ", transitions=" + transitions + "]";
  }

  /**
   * Incrementally assembles a table. Not thread-safe; it is owned by a single builder and dropped
   * once {@link #freeze()} hands out the immutable table.
   */
  static final class Assembler<S, E, M> {
    private final S initialState;
    private final Map<S, ActionSet<E, M>> actionSets = new LinkedHashMap<>();
    private final Map<TransitionKey<S, E>, S> transitions = new LinkedHashMap<>();

    Assembler(final S initialState) throws StateMachineException {
      if (initialState == null) {
        throw new StateMachineException(Code.INVALID_STATE);
      }
      this.initialState = initialState;
      defineState(initialState);
    }

    /**
     * Returns the mutable action set of the state, defining the state if it is not known yet.
     */
    ActionSet<E, M> defineState(final S state) throws StateMachineException {
      if (state == null) {
        throw new StateMachineException(Code.INVALID_STATE);
      }
      return actionSets.computeIfAbsent(state, key -> new ActionSet<>());
    }

    boolean isDefined(final S state) {
      return actionSets.containsKey(state);
    }

    /**
     * Register from->to for the event. A pair can be registered only once; the first registration
     * always wins.
     */
    void addTransition(final S from, final E event, final S to) throws StateMachineException {
      if (from == null || to == null) {
        throw new StateMachineException(Code.INVALID_STATE);
      }
      if (event == null) {
        throw new StateMachineException(Code.INVALID_EVENT);
      }
      if (!isDefined(from)) {
        throw new StateMachineException(Code.INVALID_STATE,
            "Transition source state " + from + " was never defined");
      }
      final TransitionKey<S, E> key = TransitionKey.of(from, event);
      final S existing = transitions.get(key);
      if (existing != null) {
        throw new StateMachineException(Code.DUPLICATE_TRANSITION,
            String.format("Transition %s --%s--> %s is already registered, refusing %s --%s--> %s",
                from, event, existing, from, event, to));
      }
      transitions.put(key, to);
      defineState(to);
    }

    TransitionTable<S, E, M> freeze() {
      final Map<S, ActionSet<E, M>> frozenActionSets = new LinkedHashMap<>();
      for (final Map.Entry<S, ActionSet<E, M>> entry : actionSets.entrySet()) {
        frozenActionSets.put(entry.getKey(), entry.getValue().freeze());
      }
      return new TransitionTable<>(initialState, Collections.unmodifiableMap(frozenActionSets),
          Collections.unmodifiableMap(new HashMap<>(transitions)));
    }
  }

}
