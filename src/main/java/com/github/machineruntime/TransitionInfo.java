package com.github.machineruntime;

import java.util.Optional;

/**
 * Immutable metadata about one transition statement of a machine description.
 *
 * The id is assigned once when the machine is generated and is stable across runs. It is unique
 * within the machine but ids fired by a single run need not be contiguous.
 *
 * A transition either names a static target state or restores whatever state sits on top of the
 * state stack when it fires. The latter carries no target at all, see {@link #isStackPop()}.
 */
public final class TransitionInfo {
  static final String stackPopTargetName = "$$[-]";

  private final int id;
  private final TransitionKind kind;
  private final MethodInfo event;
  private final String label;
  private final StateInfo source;
  private final Optional<StateInfo> target;

  TransitionInfo(final int id, final TransitionKind kind, final MethodInfo event,
      final String label, final StateInfo source, final Optional<StateInfo> target) {
    this.id = id;
    this.kind = kind;
    this.event = event;
    this.label = label;
    this.source = source;
    this.target = target;
  }

  public int getId() {
    return id;
  }

  public TransitionKind getKind() {
    return kind;
  }

  /**
   * The event whose handler contains this transition.
   */
  public MethodInfo getEvent() {
    return event;
  }

  public String getLabel() {
    return label;
  }

  public StateInfo getSource() {
    return source;
  }

  /**
   * The static target, empty for stack pops.
   */
  public Optional<StateInfo> getTarget() {
    return target;
  }

  public boolean isStackPop() {
    return !target.isPresent();
  }

  public boolean isTransition() {
    return kind == TransitionKind.TRANSITION;
  }

  public boolean isChangeState() {
    return kind == TransitionKind.CHANGE_STATE;
  }

  @Override
  public String toString() {
    final String targetName = target.isPresent() ? target.get().getName() : stackPopTargetName;
    return source.getName() + kind.getArrow() + targetName;
  }
}
