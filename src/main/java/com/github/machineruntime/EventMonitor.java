package com.github.machineruntime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The event monitor keeps a history of the events and transitions of one running machine and
 * notifies registered callbacks whenever an event is sent, an event is handled or a transition
 * occurs. Generated machines drive it through {@link #eventSent(MethodInstance)},
 * {@link #eventHandled(MethodInstance)} and {@link #transitionOccurred(TransitionInstance)};
 * embedding applications only register callbacks and read or tune the histories.
 *
 * Notification order for an event E that makes the machine transition from Old to New:<br>
 * 1. sent(E)<br>
 * 2. sent(Old:&lt;), exit handler of Old, handled(Old:&lt;)<br>
 * 3. transition(Old->New)<br>
 * 4. sent(New:&gt;), enter handler of New, handled(New:&gt;)<br>
 * 5. handled(E)<br>
 * Handlers in steps 2 and 4 may cause further transitions, each nesting the same sequence. Sent
 * notifications therefore arrive in the order events are issued while handled notifications
 * arrive in the order dispatches complete. A change-state only produces sent(E), the transition
 * notification and handled(E).
 *
 * Notes for users:<br>
 * 1. one monitor belongs to one machine instance and is not thread-safe; callers sharing a machine
 * across threads must serialize access to it<br>
 * 2. callbacks run synchronously, in registration order, on the thread dispatching the event<br>
 * 3. an exception thrown by a callback propagates to the code that dispatched the event<br>
 */
public final class EventMonitor {
  private static final Logger logger = LogManager.getLogger(EventMonitor.class.getSimpleName());

  private final String monitorId = UUID.randomUUID().toString();

  private Optional<Integer> eventHistoryCapacity;
  private Optional<Integer> transitionHistoryCapacity;
  private final Deque<MethodInstance> eventHistory = new ArrayDeque<>();
  private final Deque<TransitionInstance> transitionHistory = new ArrayDeque<>();

  // snapshot iteration lets a callback register further callbacks mid-notification
  private final List<EventCallback> eventSentCallbacks = new CopyOnWriteArrayList<>();
  private final List<EventCallback> eventHandledCallbacks = new CopyOnWriteArrayList<>();
  private final List<TransitionCallback> transitionCallbacks = new CopyOnWriteArrayList<>();

  private final MonitorStatistics monitorStats = new MonitorStatistics();

  /**
   * Monitor with the event history disabled and a transition history of one entry.
   */
  public EventMonitor() {
    this(EventMonitorConfiguration.defaultEventHistoryCapacity,
        EventMonitorConfiguration.defaultTransitionHistoryCapacity);
  }

  public EventMonitor(final EventMonitorConfiguration config) {
    this(config.getEventHistoryCapacity(), config.getTransitionHistoryCapacity());
  }

  /**
   * An empty capacity keeps every entry; a capacity of 0 disables that history.
   */
  public EventMonitor(final Optional<Integer> eventHistoryCapacity,
      final Optional<Integer> transitionHistoryCapacity) {
    this.eventHistoryCapacity = checkCapacity(eventHistoryCapacity);
    this.transitionHistoryCapacity = checkCapacity(transitionHistoryCapacity);
    monitorStats.monitorId = monitorId;
    logDebug(monitorId, "Created event monitor with eventHistoryCapacity="
        + describe(eventHistoryCapacity) + ", transitionHistoryCapacity="
        + describe(transitionHistoryCapacity));
  }

  public String getId() {
    return monitorId;
  }

  ///// Callback registration /////
  /**
   * Register a callback invoked when an event is sent, before any handler runs. The event's
   * return value is not available yet.
   */
  public void addEventSentCallback(final EventCallback callback) {
    eventSentCallbacks.add(checkCallback(callback));
  }

  /**
   * Register a callback invoked after an event has been completely handled, including every
   * transition it caused. The event carries its return value, if any.
   */
  public void addEventHandledCallback(final EventCallback callback) {
    eventHandledCallbacks.add(checkCallback(callback));
  }

  /**
   * Register a callback invoked right after the current state changed, before the new state's
   * enter event is sent.
   */
  public void addTransitionCallback(final TransitionCallback callback) {
    transitionCallbacks.add(checkCallback(callback));
  }

  public boolean removeEventSentCallback(final EventCallback callback) {
    return eventSentCallbacks.remove(callback);
  }

  public boolean removeEventHandledCallback(final EventCallback callback) {
    return eventHandledCallbacks.remove(callback);
  }

  public boolean removeTransitionCallback(final TransitionCallback callback) {
    return transitionCallbacks.remove(callback);
  }

  ///// Notifications, called by generated machines /////
  /**
   * Invoke the event-sent callbacks. The event only enters the history once it is handled.
   */
  public void eventSent(final MethodInstance event) {
    monitorStats.eventsSent++;
    if (logger.isDebugEnabled()) {
      logDebug(monitorId, "Sent " + event.getInfo().getName());
    }
    for (final EventCallback callback : eventSentCallbacks) {
      callback.onEvent(event);
    }
  }

  /**
   * Record a completely handled event in the history and invoke the event-handled callbacks.
   */
  public void eventHandled(final MethodInstance event) {
    monitorStats.eventsHandled++;
    if (logger.isDebugEnabled()) {
      logDebug(monitorId, "Handled " + event.getInfo().getName());
    }
    record(eventHistoryCapacity, eventHistory, event);
    for (final EventCallback callback : eventHandledCallbacks) {
      callback.onEvent(event);
    }
  }

  /**
   * Record a transition in the history and invoke the transition callbacks.
   */
  public void transitionOccurred(final TransitionInstance transition) {
    monitorStats.transitions++;
    if (transition.getKind() == TransitionKind.CHANGE_STATE) {
      monitorStats.changeStates++;
    }
    if (logger.isDebugEnabled()) {
      logDebug(monitorId, "Transition " + transition + " [id:" + transition.getInfo().getId()
          + "]");
    }
    record(transitionHistoryCapacity, transitionHistory, transition);
    for (final TransitionCallback callback : transitionCallbacks) {
      callback.onTransition(transition);
    }
  }

  ///// History /////
  /**
   * Handled events, oldest first.
   */
  public List<MethodInstance> getEventHistory() {
    return Collections.unmodifiableList(new ArrayList<>(eventHistory));
  }

  /**
   * Transitions, oldest first.
   */
  public List<TransitionInstance> getTransitionHistory() {
    return Collections.unmodifiableList(new ArrayList<>(transitionHistory));
  }

  /**
   * The most recent transition. Empty if the machine has not transitioned yet, if the history was
   * cleared since, or if the transition history is disabled.
   */
  public Optional<TransitionInstance> getLastTransition() {
    return Optional.ofNullable(transitionHistory.peekLast());
  }

  public void clearEventHistory() {
    eventHistory.clear();
  }

  public void clearTransitionHistory() {
    transitionHistory.clear();
  }

  public Optional<Integer> getEventHistoryCapacity() {
    return eventHistoryCapacity;
  }

  public Optional<Integer> getTransitionHistoryCapacity() {
    return transitionHistoryCapacity;
  }

  /**
   * Lowering the capacity evicts the oldest events at once; raising it or removing the bound
   * keeps every stored event.
   */
  public void setEventHistoryCapacity(final Optional<Integer> capacity) {
    eventHistoryCapacity = checkCapacity(capacity);
    final int evicted = shrink(capacity, eventHistory);
    logInfo(monitorId, "Event history capacity set to " + describe(capacity) + ", evicted "
        + evicted + " events");
  }

  /**
   * Lowering the capacity evicts the oldest transitions at once; raising it or removing the bound
   * keeps every stored transition.
   */
  public void setTransitionHistoryCapacity(final Optional<Integer> capacity) {
    transitionHistoryCapacity = checkCapacity(capacity);
    final int evicted = shrink(capacity, transitionHistory);
    logInfo(monitorId, "Transition history capacity set to " + describe(capacity) + ", evicted "
        + evicted + " transitions");
  }

  /**
   * Report statistics for this monitor.
   */
  public MonitorStatistics getStatistics() {
    return monitorStats;
  }

  @Override
  public String toString() {
    return "EventMonitor [monitorId=" + monitorId + ", eventHistory=" + eventHistory.size() + "/"
        + describe(eventHistoryCapacity) + ", transitionHistory=" + transitionHistory.size() + "/"
        + describe(transitionHistoryCapacity) + "]";
  }

  private static <T> void record(final Optional<Integer> capacity, final Deque<T> history,
      final T entry) {
    if (capacity.isPresent()) {
      final int bound = capacity.get();
      if (bound == 0) {
        return;
      }
      while (history.size() >= bound) {
        history.pollFirst();
      }
    }
    history.addLast(entry);
  }

  private static <T> int shrink(final Optional<Integer> capacity, final Deque<T> history) {
    int evicted = 0;
    if (capacity.isPresent()) {
      while (history.size() > capacity.get()) {
        history.pollFirst();
        evicted++;
      }
    }
    return evicted;
  }

  private static Optional<Integer> checkCapacity(final Optional<Integer> capacity) {
    if (capacity == null) {
      throw new IllegalArgumentException("History capacity cannot be null, use Optional.empty()");
    }
    if (capacity.isPresent() && capacity.get() < 0) {
      throw new IllegalArgumentException("History capacity cannot be negative: " + capacity.get());
    }
    return capacity;
  }

  private static <T> T checkCallback(final T callback) {
    if (callback == null) {
      throw new IllegalArgumentException("Callback cannot be null");
    }
    return callback;
  }

  private static String describe(final Optional<Integer> capacity) {
    return capacity.isPresent() ? String.valueOf(capacity.get()) : "unbounded";
  }

  private static void logInfo(final String monitorId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(monitorId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String monitorId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(monitorId).append("] ")
          .append(message).toString());
    }
  }
}
