package com.github.fluentfsm;

/**
 * This represents what an {@link ActiveStateMachine} does with events still queued when it is
 * stopped. A step already in flight is always completed.
 */
public enum ShutdownMode {
  // process every event fired before stop() was called, then stop the worker.
  DRAIN_PENDING_EVENTS,
  // drop queued events that the worker has not picked up yet.
  DISCARD_PENDING_EVENTS;
}
