package com.github.machineruntime;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A closed, read-only set of named values: the arguments of an event, the construction arguments
 * or variables of a state, or the domain variables of a machine. Observers read values through
 * this interface without knowing the concrete generated types.
 *
 * Looking up a name the environment does not define is not an error; it yields an empty result.
 */
public interface Environment {

  /**
   * Shared environment for sites without any parameters or variables.
   */
  Environment EMPTY = new Environment() {
    @Override
    public Optional<Value> lookup(final String name) {
      return Optional.empty();
    }

    @Override
    public List<String> getNames() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return "{}";
    }
  };

  /**
   * Read the current value bound to the given name.
   */
  Optional<Value> lookup(final String name);

  /**
   * Names defined by this environment, in declaration order.
   */
  List<String> getNames();

  default boolean isEmpty() {
    return getNames().isEmpty();
  }
}
