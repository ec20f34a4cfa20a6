package com.github.machineruntime;

/**
 * Observer of transitions and change-states.
 */
@FunctionalInterface
public interface TransitionCallback {
  void onTransition(final TransitionInstance transition);
}
