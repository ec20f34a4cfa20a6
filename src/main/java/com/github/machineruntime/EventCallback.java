package com.github.machineruntime;

/**
 * Observer of sent or handled events.
 */
@FunctionalInterface
public interface EventCallback {
  void onEvent(final MethodInstance event);
}
