package com.github.machineruntime;

/**
 * Record of one completed transition or change-state: the statement that fired, the state that
 * was left and the state that became current. For transitions the exit arguments sent to the old
 * state and the enter arguments sent to the new state are kept too; change-states carry empty
 * environments.
 *
 * The old state stays reachable through this record for as long as the record is, even after the
 * machine moved on.
 */
public final class TransitionInstance {
  private final TransitionInfo info;
  private final StateInstance oldState;
  private final StateInstance newState;
  private final Environment exitArguments;
  private final Environment enterArguments;

  private TransitionInstance(final TransitionInfo info, final StateInstance oldState,
      final StateInstance newState, final Environment exitArguments,
      final Environment enterArguments) {
    this.info = info;
    this.oldState = oldState;
    this.newState = newState;
    this.exitArguments = exitArguments;
    this.enterArguments = enterArguments;
  }

  public static TransitionInstance transition(final TransitionInfo info,
      final StateInstance oldState, final StateInstance newState, final Environment exitArguments,
      final Environment enterArguments) {
    return new TransitionInstance(info, oldState, newState, exitArguments, enterArguments);
  }

  public static TransitionInstance changeState(final TransitionInfo info,
      final StateInstance oldState, final StateInstance newState) {
    return new TransitionInstance(info, oldState, newState, Environment.EMPTY, Environment.EMPTY);
  }

  public TransitionInfo getInfo() {
    return info;
  }

  public TransitionKind getKind() {
    return info.getKind();
  }

  public StateInstance getOldState() {
    return oldState;
  }

  public StateInstance getNewState() {
    return newState;
  }

  public Environment getExitArguments() {
    return exitArguments;
  }

  public Environment getEnterArguments() {
    return enterArguments;
  }

  /**
   * Renders as {@code Old->New} or {@code Old->>New}, using the actual states, so a stack pop
   * shows the state it restored.
   */
  @Override
  public String toString() {
    return oldState.getInfo().getName() + info.getKind().getArrow()
        + newState.getInfo().getName();
  }
}
