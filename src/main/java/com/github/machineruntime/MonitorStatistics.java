package com.github.machineruntime;

/**
 * Simple statistics holder for an event monitor. Counts every notification, whether or not the
 * corresponding history keeps it.
 */
public final class MonitorStatistics {
  private final long startMillis = System.currentTimeMillis();
  String monitorId;
  long eventsSent;
  long eventsHandled;
  long transitions;
  long changeStates;

  public String getMonitorId() {
    return monitorId;
  }

  public long getEventsSent() {
    return eventsSent;
  }

  public long getEventsHandled() {
    return eventsHandled;
  }

  /**
   * Transitions of both kinds.
   */
  public long getTransitions() {
    return transitions;
  }

  public long getChangeStates() {
    return changeStates;
  }

  /**
   * Events sent whose handled notification has not fired yet, i.e. the current dispatch depth.
   */
  public long getEventsInFlight() {
    return eventsSent - eventsHandled;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  @Override
  public String toString() {
    return "MonitorStatistics [monitorId=" + monitorId + ", eventsSent=" + eventsSent
        + ", eventsHandled=" + eventsHandled + ", transitions=" + transitions + ", changeStates="
        + changeStates + ", aliveTimeMillis=" + getAliveTimeMillis() + "]";
  }
}
