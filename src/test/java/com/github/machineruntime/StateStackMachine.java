package com.github.machineruntime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.github.machineruntime.MachineInfo.MachineInfoBuilder;
import com.github.machineruntime.StaticEnvironment.StaticEnvironmentBuilder;

/**
 * Machine in the shape the compiler generates, used to exercise the state stack.
 *
 * <pre>
 * #StateStack
 *   -interface-
 *   to_a
 *   to_b
 *   to_c
 *   push
 *   pop
 *   pop_change
 *   bump : i32
 *   -machine-
 *   $A                  $B                  $C [label:&amp;str]
 *                                             var count:i32 = 0
 *     |&gt;| log ^          |&gt;| log ^          |&gt;| log ^
 *     |&lt;| log ^          |&lt;| log ^          |&lt;| log ^
 *     |to_x| -> $X ^      |to_x| -> $X ^      |to_x| -> $X ^
 *     |push| $$[+] ^      |push| $$[+] ^      |push| $$[+] ^
 *     |pop| -> $$[-] ^    |pop| -> $$[-] ^    |pop| -> $$[-] ^
 *     |pop_change| ->> $$[-] ^ ...                |bump| count = count + 1 ^(count)
 *   -domain-
 *   var created:i32 = 0
 * </pre>
 *
 * Every entry into $C builds a new instance labelled after the {@code created} counter; a pop
 * brings back the pushed instance itself.
 */
public final class StateStackMachine extends AbstractStateMachine {
  static final MachineInfo INFO;
  static {
    try {
      final MachineInfoBuilder builder = MachineInfoBuilder.newBuilder("StateStack")
          .variable("created", "i32")
          .event("to_a").event("to_b").event("to_c")
          .event("push").event("pop").event("pop_change")
          .event("bump", Optional.of("i32"))
          .exposes("to_a", "to_b", "to_c", "push", "pop", "pop_change", "bump")
          .state("A").state("B").state("C")
          .stateParameter("C", "label", "&str")
          .stateVariable("C", "count", "i32")
          .handles("C", "bump");
      int id = 0;
      for (final String state : Arrays.asList("A", "B", "C")) {
        builder.event(state + ":>").event(state + ":<");
        builder.handles(state, state + ":>", state + ":<", "to_a", "to_b", "to_c", "push", "pop",
            "pop_change");
        for (final String target : Arrays.asList("A", "B", "C")) {
          builder.transition(id++, TransitionKind.TRANSITION, "to_" + target.toLowerCase(), "",
              state, target);
        }
        builder.popTransition(id++, TransitionKind.TRANSITION, "pop", "", state);
        builder.popTransition(id++, TransitionKind.CHANGE_STATE, "pop_change", "", state);
      }
      INFO = builder.build();
    } catch (StateMachineException problem) {
      throw new ExceptionInInitializerError(problem);
    }
  }

  private final List<String> tape = new ArrayList<>();
  private int created;

  public StateStackMachine() {
    super(INFO, new EventMonitor(Optional.of(0), Optional.empty()));
    initialize(new PlainState(INFO.getState("A").get()), Environment.EMPTY);
  }

  ///// Interface /////
  public void toA() {
    send("to_a");
  }

  public void toB() {
    send("to_b");
  }

  public void toC() {
    send("to_c");
  }

  public void push() {
    send("push");
  }

  public void pop() {
    send("pop");
  }

  public void popChange() {
    send("pop_change");
  }

  public int bump() {
    final Event event = new Event(INFO.getEvent("bump").get());
    dispatch(event);
    return event.getReturnValue().get().asInt();
  }

  public String getStateName() {
    return getCurrentState().getInfo().getName();
  }

  public List<String> getTape() {
    return tape;
  }

  @Override
  public Environment getDomainVariables() {
    return StaticEnvironmentBuilder.newBuilder().with("created", created).build();
  }

  private void send(final String eventName) {
    dispatch(new Event(INFO.getEvent(eventName).get()));
  }

  ///// Generated dispatch /////
  @Override
  protected void handle(final MethodInstance event) {
    final StateInstance current = getCurrentState();
    final String stateName = current.getInfo().getName();
    final String eventName = event.getInfo().getName();
    if (eventName.endsWith(":>") || eventName.endsWith(":<")) {
      tape.add(eventName);
      return;
    }
    switch (eventName) {
      case "to_a":
      case "to_b":
      case "to_c":
        final String target = eventName.substring(3).toUpperCase();
        transition(transitionFor(stateName, eventName, Optional.of(target)), newState(target),
            Environment.EMPTY, Environment.EMPTY);
        return;
      case "push":
        pushState();
        return;
      case "pop":
        popTransition(transitionFor(stateName, eventName, Optional.empty()), Environment.EMPTY);
        return;
      case "pop_change":
        popChangeState(transitionFor(stateName, eventName, Optional.empty()));
        return;
      case "bump":
        if (current instanceof CState) {
          final CState c = current.as(CState.class);
          c.count++;
          ((Event) event).setReturnValue(Value.of(c.count));
        }
        return;
      default:
        return;
    }
  }

  @Override
  protected MethodInstance createEnterEvent(final StateInstance state,
      final Environment arguments) {
    return new Event(INFO.getEvent(state.getInfo().getName() + ":>").get(), arguments);
  }

  @Override
  protected MethodInstance createExitEvent(final StateInstance state,
      final Environment arguments) {
    return new Event(INFO.getEvent(state.getInfo().getName() + ":<").get(), arguments);
  }

  private StateInstance newState(final String stateName) {
    final StateInfo info = INFO.getState(stateName).get();
    if ("C".equals(stateName)) {
      created++;
      return new CState(info, "c" + created);
    }
    return new PlainState(info);
  }

  private static TransitionInfo transitionFor(final String source, final String eventName,
      final Optional<String> target) {
    for (final TransitionInfo transition : INFO.getTransitions()) {
      if (transition.getSource().getName().equals(source)
          && transition.getEvent().getName().equals(eventName)
          && transition.getTarget().map(StateInfo::getName).equals(target)) {
        return transition;
      }
    }
    throw new IllegalStateException("No transition " + source + " " + eventName);
  }

  static final class PlainState implements StateInstance {
    private final StateInfo info;

    PlainState(final StateInfo info) {
      this.info = info;
    }

    @Override
    public StateInfo getInfo() {
      return info;
    }
  }

  static final class CState implements StateInstance {
    private final StateInfo info;
    private final String label;
    private int count;

    private final Environment arguments = new Environment() {
      @Override
      public Optional<Value> lookup(final String name) {
        return "label".equals(name) ? Optional.of(Value.of(label)) : Optional.empty();
      }

      @Override
      public List<String> getNames() {
        return Arrays.asList("label");
      }
    };

    private final Environment variables = new Environment() {
      @Override
      public Optional<Value> lookup(final String name) {
        return "count".equals(name) ? Optional.of(Value.of(count)) : Optional.empty();
      }

      @Override
      public List<String> getNames() {
        return Arrays.asList("count");
      }
    };

    CState(final StateInfo info, final String label) {
      this.info = info;
      this.label = label;
    }

    @Override
    public StateInfo getInfo() {
      return info;
    }

    @Override
    public Environment getArguments() {
      return arguments;
    }

    @Override
    public Environment getVariables() {
      return variables;
    }
  }
}
