package com.github.machineruntime;

import java.util.Optional;

/**
 * This class encapsulates the history settings of an {@link EventMonitor}. Use the
 * {@code EventMonitorConfigurationBuilder} to build it.
 *
 * Each history has an independent capacity. An empty capacity keeps every entry, a capacity of 0
 * disables recording for that history while callbacks keep firing.
 *
 * Notes:<br>
 * 1. If nothing is set, the event history is disabled and the transition history keeps the last
 * transition only.<br>
 * 2. Unbounded histories grow for the whole lifetime of the machine, so they are meant for tests
 * and short-lived machines.<br>
 */
public final class EventMonitorConfiguration {
  static final Optional<Integer> defaultEventHistoryCapacity = Optional.of(0);
  static final Optional<Integer> defaultTransitionHistoryCapacity = Optional.of(1);

  private final Optional<Integer> eventHistoryCapacity;
  private final Optional<Integer> transitionHistoryCapacity;

  public Optional<Integer> getEventHistoryCapacity() {
    return eventHistoryCapacity;
  }

  public Optional<Integer> getTransitionHistoryCapacity() {
    return transitionHistoryCapacity;
  }

  public final static class EventMonitorConfigurationBuilder {
    private Optional<Integer> eventHistoryCapacity = defaultEventHistoryCapacity;
    private Optional<Integer> transitionHistoryCapacity = defaultTransitionHistoryCapacity;

    public static EventMonitorConfigurationBuilder newBuilder() {
      return new EventMonitorConfigurationBuilder();
    }

    public EventMonitorConfigurationBuilder eventHistoryCapacity(final int capacity) {
      this.eventHistoryCapacity = Optional.of(capacity);
      return this;
    }

    public EventMonitorConfigurationBuilder unboundedEventHistory() {
      this.eventHistoryCapacity = Optional.empty();
      return this;
    }

    public EventMonitorConfigurationBuilder transitionHistoryCapacity(final int capacity) {
      this.transitionHistoryCapacity = Optional.of(capacity);
      return this;
    }

    public EventMonitorConfigurationBuilder unboundedTransitionHistory() {
      this.transitionHistoryCapacity = Optional.empty();
      return this;
    }

    public EventMonitorConfiguration build() throws StateMachineException {
      final EventMonitorConfiguration config =
          new EventMonitorConfiguration(eventHistoryCapacity, transitionHistoryCapacity);
      config.validate();
      return config;
    }

    private EventMonitorConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    if (eventHistoryCapacity == null) {
      messages.append("Event history capacity cannot be null. ");
    } else if (eventHistoryCapacity.isPresent() && eventHistoryCapacity.get() < 0) {
      messages.append("Event history capacity cannot be negative. ");
    }
    if (transitionHistoryCapacity == null) {
      messages.append("Transition history capacity cannot be null. ");
    } else if (transitionHistoryCapacity.isPresent() && transitionHistoryCapacity.get() < 0) {
      messages.append("Transition history capacity cannot be negative. ");
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MONITOR_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "EventMonitorConfiguration [eventHistoryCapacity="
        + eventHistoryCapacity.map(String::valueOf).orElse("unbounded")
        + ", transitionHistoryCapacity="
        + transitionHistoryCapacity.map(String::valueOf).orElse("unbounded") + "]";
  }

  private EventMonitorConfiguration(final Optional<Integer> eventHistoryCapacity,
      final Optional<Integer> transitionHistoryCapacity) {
    this.eventHistoryCapacity = eventHistoryCapacity;
    this.transitionHistoryCapacity = transitionHistoryCapacity;
  }

}
