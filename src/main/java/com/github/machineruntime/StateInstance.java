package com.github.machineruntime;

/**
 * Live value of a state: its static descriptor paired with the arguments bound when it was
 * constructed and its current variables. Generated machines provide one implementation per
 * declared state.
 *
 * An instance may be held at the same time by the machine's current-state slot, by entries of the
 * state stack and by an in-flight transition notification. Only the state's own handler code
 * changes its variables.
 */
public interface StateInstance {

  StateInfo getInfo();

  default Environment getArguments() {
    return Environment.EMPTY;
  }

  default Environment getVariables() {
    return Environment.EMPTY;
  }

  /**
   * Coerce this instance to the concrete generated shape an observer expects.
   */
  default <T extends StateInstance> T as(final Class<T> shape) {
    if (!shape.isInstance(this)) {
      throw new StateMachineFault(StateMachineFault.Code.INSTANCE_SHAPE_MISMATCH,
          "State " + getInfo().getName() + " is a " + getClass().getSimpleName() + ", not a "
              + shape.getSimpleName());
    }
    return shape.cast(this);
  }
}
