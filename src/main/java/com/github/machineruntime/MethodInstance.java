package com.github.machineruntime;

import java.util.Optional;

/**
 * Live value of one dispatched event or action call: the static descriptor, the bound arguments
 * and, once handling completed, the return value if the method produced one.
 */
public interface MethodInstance {

  MethodInfo getInfo();

  default Environment getArguments() {
    return Environment.EMPTY;
  }

  /**
   * Empty until the handler produced a value; always empty for methods without a return type.
   */
  Optional<Value> getReturnValue();

  /**
   * Coerce this instance to the concrete generated shape an observer expects.
   */
  default <T extends MethodInstance> T as(final Class<T> shape) {
    if (!shape.isInstance(this)) {
      throw new StateMachineFault(StateMachineFault.Code.INSTANCE_SHAPE_MISMATCH,
          "Event " + getInfo().getName() + " is a " + getClass().getSimpleName() + ", not a "
              + shape.getSimpleName());
    }
    return shape.cast(this);
  }
}
