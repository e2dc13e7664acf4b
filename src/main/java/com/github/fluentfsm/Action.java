package com.github.fluentfsm;

/**
 * An action that runs on enter, leave or event match without access to the machine's model.
 * Throwing from {@link #execute()} aborts the remainder of the step it belongs to.
 */
@FunctionalInterface
public interface Action {

  void execute() throws Exception;

}
