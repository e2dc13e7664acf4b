package com.github.fluentfsm;

import java.util.UUID;

/**
 * This class encapsulates all the configuration parameters for a state machine. Use the
 * {@code StateMachineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. machineName is used as the machine id in logs and to name the active machine's worker thread.
 * If not set, a random UUID is used.<br>
 * 2. shutdownMode and autoTransitionPollMillis only matter to active machines. If
 * autoTransitionPollMillis is not set, the worker re-evaluates its {@link AutoTransition} every
 * 10ms while idle.<br>
 */
public final class StateMachineConfiguration {
  static final long defaultAutoTransitionPollMillis = 10L;

  private final String machineName;
  private final ShutdownMode shutdownMode;
  private final long autoTransitionPollMillis;

  public String getMachineName() {
    return machineName;
  }

  public ShutdownMode getShutdownMode() {
    return shutdownMode;
  }

  public long getAutoTransitionPollMillis() {
    return autoTransitionPollMillis;
  }

  static StateMachineConfiguration defaults() {
    return new StateMachineConfiguration(null, ShutdownMode.DRAIN_PENDING_EVENTS, 0L);
  }

  public final static class StateMachineConfigurationBuilder {
    private String machineName;
    private ShutdownMode shutdownMode = ShutdownMode.DRAIN_PENDING_EVENTS;
    private long autoTransitionPollMillis;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder machineName(final String machineName) {
      this.machineName = machineName;
      return this;
    }

    public StateMachineConfigurationBuilder shutdownMode(final ShutdownMode shutdownMode) {
      this.shutdownMode = shutdownMode;
      return this;
    }

    public StateMachineConfigurationBuilder autoTransitionPollMillis(
        final long autoTransitionPollMillis) {
      this.autoTransitionPollMillis = autoTransitionPollMillis;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      validate();
      return new StateMachineConfiguration(machineName, shutdownMode, autoTransitionPollMillis);
    }

    private void validate() throws StateMachineException {
      StringBuilder messages = new StringBuilder();
      if (shutdownMode == null) {
        messages.append("ShutdownMode cannot be null. ");
      }
      if (machineName != null && machineName.trim().isEmpty()) {
        messages.append("Machine name cannot be blank. ");
      }
      if (messages.length() > 0) {
        throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
            messages.toString());
      }
    }

    private StateMachineConfigurationBuilder() {}
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [machineName=" + machineName + ", shutdownMode="
        + shutdownMode + ", autoTransitionPollMillis=" + autoTransitionPollMillis + "]";
  }

  private StateMachineConfiguration(final String machineName, final ShutdownMode shutdownMode,
      final long autoTransitionPollMillis) {
    this.machineName = machineName != null ? machineName.trim() : UUID.randomUUID().toString();
    this.shutdownMode = shutdownMode;
    if (autoTransitionPollMillis <= 0L) {
      this.autoTransitionPollMillis = defaultAutoTransitionPollMillis;
    } else {
      this.autoTransitionPollMillis = autoTransitionPollMillis;
    }
  }

}
