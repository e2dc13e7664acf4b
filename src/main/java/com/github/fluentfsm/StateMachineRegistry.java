package com.github.fluentfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Global registry of all running active state machines within a jvm process. A machine registers
 * when its worker starts and unregisters when it stops. A shutdown hook stops whatever is still
 * registered when the jvm exits, so no worker is ever left behind mid-step.
 */
final class StateMachineRegistry {
  private static final Logger logger =
      LogManager.getLogger(StateMachineRegistry.class.getSimpleName());

  // keyed on identity, machine names are not required to be unique
  private final Set<ActiveStateMachine<?, ?, ?>> liveMachines =
      Collections.newSetFromMap(new ConcurrentHashMap<ActiveStateMachine<?, ?, ?>, Boolean>());

  private static final StateMachineRegistry instance = new StateMachineRegistry();

  static StateMachineRegistry getInstance() {
    return instance;
  }

  void register(final ActiveStateMachine<?, ?, ?> stateMachine) {
    liveMachines.add(stateMachine);
  }

  void unregister(final ActiveStateMachine<?, ?, ?> stateMachine) {
    liveMachines.remove(stateMachine);
  }

  boolean isRegistered(final ActiveStateMachine<?, ?, ?> stateMachine) {
    return liveMachines.contains(stateMachine);
  }

  void stopAll() {
    final List<ActiveStateMachine<?, ?, ?>> machines = new ArrayList<>(liveMachines);
    if (machines.isEmpty()) {
      return;
    }
    logger.info("Stopping " + machines.size() + " live active state machines");
    for (final ActiveStateMachine<?, ?, ?> stateMachine : machines) {
      try {
        stateMachine.stop();
      } catch (StateMachineException problem) {
        logger.error("Problem occurred while running stop() on machine:" + stateMachine.getId()
            + " as part of the shutdown hook sequence.", problem);
      }
    }
    logger.info("Successfully stopped all live active state machines");
  }

  private StateMachineRegistry() {
    Runtime.getRuntime().addShutdownHook(new Thread("fsm-destructor") {
      @Override
      public void run() {
        stopAll();
      }
    });
    logger.info("Fired up global state machine registry");
  }

}
