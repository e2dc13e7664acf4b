package com.github.fluentfsm;

/**
 * An action that is handed the machine's model for mutation. The model is only ever passed to one
 * action at a time.
 */
@FunctionalInterface
public interface ModelAction<M> {

  void execute(M model) throws Exception;

}
