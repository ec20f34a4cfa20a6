package com.github.machineruntime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable metadata about a state. Instances are only created by
 * {@link MachineInfo.MachineInfoBuilder}, which wires the parent, children, handlers and the
 * back-link to the owning machine exactly once while building.
 */
public final class StateInfo {
  private final String name;
  private final List<NameInfo> parameters;
  private final List<NameInfo> variables;

  // populated once by the builder
  private Optional<StateInfo> parent = Optional.empty();
  private List<StateInfo> children = new ArrayList<>();
  private List<MethodInfo> handlers = new ArrayList<>();
  private MachineInfo machine;

  StateInfo(final String name, final List<NameInfo> parameters, final List<NameInfo> variables) {
    this.name = name;
    this.parameters = Collections.unmodifiableList(parameters);
    this.variables = Collections.unmodifiableList(variables);
  }

  public String getName() {
    return name;
  }

  public Optional<StateInfo> getParent() {
    return parent;
  }

  public List<StateInfo> getChildren() {
    return children;
  }

  /**
   * Descriptors of the arguments bound when the state is constructed.
   */
  public List<NameInfo> getParameters() {
    return parameters;
  }

  public List<NameInfo> getVariables() {
    return variables;
  }

  /**
   * Events this state handles itself, not counting the ones it inherits from ancestors.
   */
  public List<MethodInfo> getHandlers() {
    return handlers;
  }

  public MachineInfo getMachine() {
    return machine;
  }

  public boolean handles(final MethodInfo event) {
    return handlers.contains(event);
  }

  /**
   * Hierarchical handler lookup: walks from this state through its ancestors and returns the
   * first one that handles the given event.
   */
  public Optional<StateInfo> findHandler(final MethodInfo event) {
    StateInfo state = this;
    while (state != null) {
      if (state.handles(event)) {
        return Optional.of(state);
      }
      state = state.parent.orElse(null);
    }
    return Optional.empty();
  }

  /**
   * True iff the given state is a strict ancestor of this one.
   */
  public boolean isDescendantOf(final StateInfo ancestor) {
    Optional<StateInfo> current = parent;
    while (current.isPresent()) {
      if (current.get() == ancestor) {
        return true;
      }
      current = current.get().parent;
    }
    return false;
  }

  void bindParent(final StateInfo parent) {
    this.parent = Optional.of(parent);
    parent.children.add(this);
  }

  void bindHandler(final MethodInfo handler) {
    handlers.add(handler);
  }

  void bindMachine(final MachineInfo machine) {
    this.machine = machine;
    this.children = Collections.unmodifiableList(children);
    this.handlers = Collections.unmodifiableList(handlers);
  }

  @Override
  public String toString() {
    return "StateInfo [name=" + name + ", parent="
        + (parent.isPresent() ? parent.get().getName() : "none") + "]";
  }
}
