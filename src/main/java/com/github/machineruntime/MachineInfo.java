package com.github.machineruntime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.machineruntime.StateMachineException.Code;

/**
 * Immutable metadata describing the shape of one machine type: its domain variables, states,
 * events, actions and transitions. There is exactly one instance per machine type, built once by
 * generated code through {@link MachineInfoBuilder} and shared by every running instance of that
 * type for the lifetime of the process.
 *
 * States refer back to their machine. Since the states must exist before the machine does, the
 * builder creates all states first, resolves every cross-reference by name and only then binds
 * each state to the finished machine.
 */
public final class MachineInfo {
  private final String name;
  private final List<NameInfo> variables;
  private final List<StateInfo> states;
  private final List<MethodInfo> events;
  private final List<MethodInfo> actions;
  private final List<MethodInfo> interfaceMethods;
  private final List<TransitionInfo> transitions;

  private final Map<String, StateInfo> statesByName = new HashMap<>();
  private final Map<String, MethodInfo> eventsByName = new HashMap<>();
  private final Map<String, MethodInfo> actionsByName = new HashMap<>();
  private final Map<Integer, TransitionInfo> transitionsById = new HashMap<>();

  private MachineInfo(final String name, final List<NameInfo> variables,
      final List<StateInfo> states, final List<MethodInfo> events, final List<MethodInfo> actions,
      final List<MethodInfo> interfaceMethods, final List<TransitionInfo> transitions) {
    this.name = name;
    this.variables = Collections.unmodifiableList(variables);
    this.states = Collections.unmodifiableList(states);
    this.events = Collections.unmodifiableList(events);
    this.actions = Collections.unmodifiableList(actions);
    this.interfaceMethods = Collections.unmodifiableList(interfaceMethods);
    this.transitions = Collections.unmodifiableList(transitions);
    for (final StateInfo state : states) {
      statesByName.put(state.getName(), state);
    }
    for (final MethodInfo event : events) {
      eventsByName.put(event.getName(), event);
    }
    for (final MethodInfo action : actions) {
      actionsByName.put(action.getName(), action);
    }
    for (final TransitionInfo transition : transitions) {
      transitionsById.put(transition.getId(), transition);
    }
  }

  public String getName() {
    return name;
  }

  /**
   * Descriptors of the machine-wide domain variables.
   */
  public List<NameInfo> getVariables() {
    return variables;
  }

  public List<StateInfo> getStates() {
    return states;
  }

  /**
   * The state a freshly created machine starts in: the first one declared.
   */
  public StateInfo getInitialState() {
    return states.get(0);
  }

  /**
   * All events, including enter and exit sub-events.
   */
  public List<MethodInfo> getEvents() {
    return events;
  }

  public List<MethodInfo> getActions() {
    return actions;
  }

  /**
   * The events callers may send to the machine directly.
   */
  public List<MethodInfo> getInterface() {
    return interfaceMethods;
  }

  public List<TransitionInfo> getTransitions() {
    return transitions;
  }

  public Optional<StateInfo> getState(final String stateName) {
    return Optional.ofNullable(statesByName.get(stateName));
  }

  public Optional<MethodInfo> getEvent(final String eventName) {
    return Optional.ofNullable(eventsByName.get(eventName));
  }

  public Optional<MethodInfo> getAction(final String actionName) {
    return Optional.ofNullable(actionsByName.get(actionName));
  }

  public Optional<TransitionInfo> getTransition(final int id) {
    return Optional.ofNullable(transitionsById.get(id));
  }

  /**
   * Transitions whose statement lives in a handler of the given state.
   */
  public List<TransitionInfo> getTransitionsFrom(final StateInfo source) {
    final List<TransitionInfo> outgoing = new ArrayList<>();
    for (final TransitionInfo transition : transitions) {
      if (transition.getSource() == source) {
        outgoing.add(transition);
      }
    }
    return outgoing;
  }

  @Override
  public String toString() {
    return "MachineInfo [name=" + name + ", states=" + states.size() + ", events=" + events.size()
        + ", actions=" + actions.size() + ", transitions=" + transitions.size() + "]";
  }

  /**
   * Fluent builder used by generated code to declare its static tables. Declarations refer to
   * each other by name in any order; {@link #build()} resolves and validates them.
   */
  public final static class MachineInfoBuilder {
    private final String name;
    private final List<NameInfo> variables = new ArrayList<>();
    private final Map<String, StateDeclaration> states = new LinkedHashMap<>();
    private final Map<String, MethodInfo> events = new LinkedHashMap<>();
    private final Map<String, MethodInfo> actions = new LinkedHashMap<>();
    private final List<String> interfaceNames = new ArrayList<>();
    private final List<TransitionDeclaration> transitions = new ArrayList<>();

    // first problem found while declaring, reported by build()
    private Code problem;
    private final StringBuilder messages = new StringBuilder();

    public static MachineInfoBuilder newBuilder(final String name) {
      return new MachineInfoBuilder(name);
    }

    public MachineInfoBuilder variable(final String variableName, final String type) {
      variables.add(new NameInfo(variableName, type));
      return this;
    }

    public MachineInfoBuilder event(final String eventName, final NameInfo... parameters) {
      return event(eventName, Optional.empty(), parameters);
    }

    public MachineInfoBuilder event(final String eventName, final Optional<String> returnType,
        final NameInfo... parameters) {
      if (checkName(eventName) && events.containsKey(eventName)) {
        report(Code.DUPLICATE_METHOD, "Duplicate event " + eventName + ". ");
      }
      events.put(eventName, new MethodInfo(eventName, Arrays.asList(parameters), returnType));
      return this;
    }

    public MachineInfoBuilder action(final String actionName, final Optional<String> returnType,
        final NameInfo... parameters) {
      if (checkName(actionName) && actions.containsKey(actionName)) {
        report(Code.DUPLICATE_METHOD, "Duplicate action " + actionName + ". ");
      }
      actions.put(actionName, new MethodInfo(actionName, Arrays.asList(parameters), returnType));
      return this;
    }

    /**
     * Marks already or later declared events as part of the public interface.
     */
    public MachineInfoBuilder exposes(final String... eventNames) {
      interfaceNames.addAll(Arrays.asList(eventNames));
      return this;
    }

    public MachineInfoBuilder state(final String stateName) {
      return state(stateName, Optional.empty());
    }

    public MachineInfoBuilder state(final String stateName, final Optional<String> parentName) {
      if (checkName(stateName) && states.containsKey(stateName)) {
        report(Code.DUPLICATE_STATE, "Duplicate state " + stateName + ". ");
      }
      states.put(stateName, new StateDeclaration(stateName, parentName));
      return this;
    }

    public MachineInfoBuilder stateParameter(final String stateName, final String parameterName,
        final String type) {
      final StateDeclaration state = lookupDeclaration(stateName);
      if (state != null) {
        state.parameters.add(new NameInfo(parameterName, type));
      }
      return this;
    }

    public MachineInfoBuilder stateVariable(final String stateName, final String variableName,
        final String type) {
      final StateDeclaration state = lookupDeclaration(stateName);
      if (state != null) {
        state.variables.add(new NameInfo(variableName, type));
      }
      return this;
    }

    public MachineInfoBuilder handles(final String stateName, final String... eventNames) {
      final StateDeclaration state = lookupDeclaration(stateName);
      if (state != null) {
        state.handlers.addAll(Arrays.asList(eventNames));
      }
      return this;
    }

    public MachineInfoBuilder transition(final int id, final TransitionKind kind,
        final String eventName, final String label, final String sourceName,
        final String targetName) {
      transitions.add(new TransitionDeclaration(id, kind, eventName, label, sourceName,
          Optional.of(targetName)));
      return this;
    }

    /**
     * Declares a transition whose destination is popped off the state stack at dispatch time.
     */
    public MachineInfoBuilder popTransition(final int id, final TransitionKind kind,
        final String eventName, final String label, final String sourceName) {
      transitions.add(
          new TransitionDeclaration(id, kind, eventName, label, sourceName, Optional.empty()));
      return this;
    }

    public MachineInfo build() throws StateMachineException {
      checkName(name);
      if (states.isEmpty()) {
        report(Code.UNKNOWN_STATE, "Machine " + name + " declares no states. ");
      }
      throwIfInvalid();

      // 1. states
      final Map<String, StateInfo> stateInfos = new LinkedHashMap<>();
      for (final StateDeclaration declaration : states.values()) {
        stateInfos.put(declaration.name,
            new StateInfo(declaration.name, declaration.parameters, declaration.variables));
      }

      // 2. parents, rejecting unknown names and cycles
      for (final StateDeclaration declaration : states.values()) {
        if (declaration.parentName.isPresent()
            && !stateInfos.containsKey(declaration.parentName.get())) {
          report(Code.UNKNOWN_STATE, "State " + declaration.name + " has unknown parent "
              + declaration.parentName.get() + ". ");
        }
      }
      throwIfInvalid();
      for (final StateDeclaration declaration : states.values()) {
        final Set<String> seen = new HashSet<>();
        StateDeclaration current = declaration;
        while (current.parentName.isPresent()) {
          if (!seen.add(current.name)) {
            throw new StateMachineException(Code.CYCLIC_STATE_HIERARCHY,
                "State " + declaration.name + " is part of a parent cycle");
          }
          current = states.get(current.parentName.get());
        }
      }
      for (final StateDeclaration declaration : states.values()) {
        if (declaration.parentName.isPresent()) {
          stateInfos.get(declaration.name)
              .bindParent(stateInfos.get(declaration.parentName.get()));
        }
      }

      // 3. handlers
      for (final StateDeclaration declaration : states.values()) {
        for (final String handlerName : declaration.handlers) {
          final MethodInfo handler = events.get(handlerName);
          if (handler == null) {
            report(Code.UNKNOWN_METHOD,
                "State " + declaration.name + " handles unknown event " + handlerName + ". ");
          } else {
            stateInfos.get(declaration.name).bindHandler(handler);
          }
        }
      }

      // 4. interface
      final List<MethodInfo> interfaceMethods = new ArrayList<>();
      for (final String interfaceName : interfaceNames) {
        final MethodInfo method = events.get(interfaceName);
        if (method == null) {
          report(Code.UNKNOWN_METHOD, "Interface names unknown event " + interfaceName + ". ");
        } else if (!interfaceMethods.contains(method)) {
          interfaceMethods.add(method);
        }
      }

      // 5. transitions
      final List<TransitionInfo> transitionInfos = new ArrayList<>();
      final Set<Integer> ids = new HashSet<>();
      for (final TransitionDeclaration declaration : transitions) {
        if (!ids.add(declaration.id)) {
          report(Code.DUPLICATE_TRANSITION_ID, "Duplicate transition id " + declaration.id + ". ");
          continue;
        }
        if (declaration.kind == null) {
          report(Code.INVALID_TRANSITIONS,
              "Transition " + declaration.id + " has no kind. ");
          continue;
        }
        final MethodInfo event = events.get(declaration.eventName);
        final StateInfo source = stateInfos.get(declaration.sourceName);
        Optional<StateInfo> target = Optional.empty();
        if (declaration.targetName.isPresent()) {
          target = Optional.ofNullable(stateInfos.get(declaration.targetName.get()));
          if (!target.isPresent()) {
            report(Code.UNKNOWN_STATE, "Transition " + declaration.id + " targets unknown state "
                + declaration.targetName.get() + ". ");
          }
        }
        if (event == null) {
          report(Code.UNKNOWN_METHOD, "Transition " + declaration.id + " fires on unknown event "
              + declaration.eventName + ". ");
        }
        if (source == null) {
          report(Code.UNKNOWN_STATE, "Transition " + declaration.id
              + " starts from unknown state " + declaration.sourceName + ". ");
        }
        if (event != null && source != null) {
          transitionInfos.add(new TransitionInfo(declaration.id, declaration.kind, event,
              declaration.label == null ? "" : declaration.label, source, target));
        }
      }
      throwIfInvalid();

      // 6. the machine itself, then the back-links
      final MachineInfo machine = new MachineInfo(name, variables,
          new ArrayList<>(stateInfos.values()), new ArrayList<>(events.values()),
          new ArrayList<>(actions.values()), interfaceMethods, transitionInfos);
      for (final StateInfo state : stateInfos.values()) {
        state.bindMachine(machine);
      }
      return machine;
    }

    private StateDeclaration lookupDeclaration(final String stateName) {
      final StateDeclaration state = states.get(stateName);
      if (state == null) {
        report(Code.UNKNOWN_STATE, "State " + stateName + " must be declared before use. ");
      }
      return state;
    }

    private boolean checkName(final String candidate) {
      if (candidate == null || candidate.trim().isEmpty()) {
        report(Code.INVALID_NAME, "Blank name. ");
        return false;
      }
      return true;
    }

    private void report(final Code code, final String message) {
      if (problem == null) {
        problem = code;
      }
      messages.append(message);
    }

    private void throwIfInvalid() throws StateMachineException {
      if (problem != null) {
        throw new StateMachineException(problem, messages.toString().trim());
      }
    }

    private MachineInfoBuilder(final String name) {
      this.name = name;
    }
  }

  private final static class StateDeclaration {
    private final String name;
    private final Optional<String> parentName;
    private final List<NameInfo> parameters = new ArrayList<>();
    private final List<NameInfo> variables = new ArrayList<>();
    private final List<String> handlers = new ArrayList<>();

    private StateDeclaration(final String name, final Optional<String> parentName) {
      this.name = name;
      this.parentName = parentName;
    }
  }

  private final static class TransitionDeclaration {
    private final int id;
    private final TransitionKind kind;
    private final String eventName;
    private final String label;
    private final String sourceName;
    private final Optional<String> targetName;

    private TransitionDeclaration(final int id, final TransitionKind kind, final String eventName,
        final String label, final String sourceName, final Optional<String> targetName) {
      this.id = id;
      this.kind = kind;
      this.eventName = eventName;
      this.label = label;
      this.sourceName = sourceName;
      this.targetName = targetName;
    }
  }
}
