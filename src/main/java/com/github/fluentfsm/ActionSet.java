package com.github.fluentfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The actions attached to a single state: what runs when the state is entered, when it is left and
 * when a given event is fired while in it.
 *
 * Plain {@link Action}s are adapted to {@link ModelAction}s when they are registered, so each hook
 * keeps a single list in exact registration order. An ActionSet is append-only while its table is
 * being assembled and unmodifiable once {@link #freeze()} has produced the final copy.
 */
public final class ActionSet<E, M> {
  private final List<ModelAction<M>> enterActions;
  private final List<ModelAction<M>> leaveActions;
  private final Map<E, List<ModelAction<M>>> eventActions;
  private final boolean frozen;

  ActionSet() {
    this.enterActions = new ArrayList<>();
    this.leaveActions = new ArrayList<>();
    this.eventActions = new HashMap<>();
    this.frozen = false;
  }

  private ActionSet(final ActionSet<E, M> source) {
    this.enterActions = Collections.unmodifiableList(new ArrayList<>(source.enterActions));
    this.leaveActions = Collections.unmodifiableList(new ArrayList<>(source.leaveActions));
    final Map<E, List<ModelAction<M>>> copy = new HashMap<>();
    for (final Map.Entry<E, List<ModelAction<M>>> entry : source.eventActions.entrySet()) {
      copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
    }
    this.eventActions = Collections.unmodifiableMap(copy);
    this.frozen = true;
  }

  void addEnterAction(final ModelAction<M> action) {
    checkNotFrozen();
    enterActions.add(action);
  }

  void addLeaveAction(final ModelAction<M> action) {
    checkNotFrozen();
    leaveActions.add(action);
  }

  void addEventAction(final E event, final ModelAction<M> action) {
    checkNotFrozen();
    eventActions.computeIfAbsent(event, key -> new ArrayList<>()).add(action);
  }

  ActionSet<E, M> freeze() {
    return frozen ? this : new ActionSet<>(this);
  }

  public List<ModelAction<M>> getEnterActions() {
    return frozen ? enterActions : Collections.unmodifiableList(enterActions);
  }

  public List<ModelAction<M>> getLeaveActions() {
    return frozen ? leaveActions : Collections.unmodifiableList(leaveActions);
  }

  /**
   * Actions registered for the event in this state, in registration order. Empty if none.
   */
  public List<ModelAction<M>> getEventActions(final E event) {
    final List<ModelAction<M>> actions = eventActions.get(event);
    if (actions == null) {
      return Collections.emptyList();
    }
    return frozen ? actions : Collections.unmodifiableList(actions);
  }

  public boolean hasEventActions(final E event) {
    return eventActions.containsKey(event);
  }

  private void checkNotFrozen() {
    if (frozen) {
      throw new UnsupportedOperationException("ActionSet is frozen");
    }
  }

  @Override
  public String toString() {
    return "ActionSet [enterActions=" + enterActions.size() + ", leaveActions="
        + leaveActions.size() + ", events=" + eventActions.keySet() + "]";
  }
}
