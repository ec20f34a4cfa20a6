package com.github.machineruntime;

/**
 * Kind of state change. A transition sends an exit event to the old state and an enter event to
 * the new one, a change-state swaps the current state and does nothing else.
 */
public enum TransitionKind {
  // ->
  TRANSITION("->"),
  // ->>
  CHANGE_STATE("->>");

  private final String arrow;

  private TransitionKind(final String arrow) {
    this.arrow = arrow;
  }

  public String getArrow() {
    return arrow;
  }
}
