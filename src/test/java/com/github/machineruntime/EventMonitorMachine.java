package com.github.machineruntime;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.github.machineruntime.MachineInfo.MachineInfoBuilder;
import com.github.machineruntime.StaticEnvironment.StaticEnvironmentBuilder;

/**
 * Machine in the shape the compiler generates, used to exercise the event monitor.
 *
 * <pre>
 * #EventMonitorSm
 *   -interface-
 *   mult [a:i32 b:i32] : i32
 *   reset
 *   change : i32
 *   transit [x:i32]
 *   -machine-
 *   $A
 *     |mult| [a b] ^(a * b)
 *     |change| ->> $B ^(#.changes)
 *     |transit| [x] -> (x) $B ^
 *   $B
 *     |&gt;| [x] transit(x) ^
 *     |mult| [a b] ^(a * b)
 *     |change| ->> $C ^(#.changes)
 *     |transit| [x] -> (x) $C ^
 *     |reset| ->> $A ^
 *   $C
 *     |&gt;| [x] transit(x) ^
 *     |mult| [a b] ^(a * b)
 *     |change| ->> $D ^(#.changes)
 *     |transit| [x] -> (x) $D ^
 *     |reset| ->> $A ^
 *   $D
 *     |&gt;| [x] change() ^
 *     |mult| [a b] ^(a * b)
 *     |change| ->> $A ^(#.changes)
 *     |reset| ->> $A ^
 *   -domain-
 *   var changes:i32 = 0
 * </pre>
 *
 * Every change-state bumps the {@code changes} domain variable; {@code change} returns it.
 */
public final class EventMonitorMachine extends AbstractStateMachine {
  static final MachineInfo INFO;
  static {
    try {
      INFO = MachineInfoBuilder.newBuilder("EventMonitorSm")
          .variable("changes", "i32")
          .event("mult", Optional.of("i32"), NameInfo.of("a", "i32"), NameInfo.of("b", "i32"))
          .event("reset")
          .event("change", Optional.of("i32"))
          .event("transit", NameInfo.of("x", "i32"))
          .event("A:>").event("A:<")
          .event("B:>", NameInfo.of("x", "i32")).event("B:<")
          .event("C:>", NameInfo.of("x", "i32")).event("C:<")
          .event("D:>", NameInfo.of("x", "i32")).event("D:<")
          .exposes("mult", "reset", "change", "transit")
          .state("A").handles("A", "mult", "change", "transit")
          .state("B").handles("B", "B:>", "mult", "change", "transit", "reset")
          .state("C").handles("C", "C:>", "mult", "change", "transit", "reset")
          .state("D").handles("D", "D:>", "mult", "change", "reset")
          .transition(0, TransitionKind.CHANGE_STATE, "change", "", "A", "B")
          .transition(1, TransitionKind.TRANSITION, "transit", "", "A", "B")
          .transition(2, TransitionKind.CHANGE_STATE, "change", "", "B", "C")
          .transition(3, TransitionKind.TRANSITION, "transit", "", "B", "C")
          .transition(4, TransitionKind.CHANGE_STATE, "reset", "", "B", "A")
          .transition(5, TransitionKind.CHANGE_STATE, "change", "", "C", "D")
          .transition(6, TransitionKind.TRANSITION, "transit", "", "C", "D")
          .transition(7, TransitionKind.CHANGE_STATE, "reset", "", "C", "A")
          .transition(8, TransitionKind.CHANGE_STATE, "change", "", "D", "A")
          .transition(9, TransitionKind.CHANGE_STATE, "reset", "", "D", "A")
          .build();
    } catch (StateMachineException problem) {
      throw new ExceptionInInitializerError(problem);
    }
  }

  private static final StateInfo stateA = INFO.getState("A").get();
  private static final StateInfo stateB = INFO.getState("B").get();
  private static final StateInfo stateC = INFO.getState("C").get();
  private static final StateInfo stateD = INFO.getState("D").get();

  private int changes;

  private final Environment domainVariables = new Environment() {
    @Override
    public Optional<Value> lookup(final String name) {
      return "changes".equals(name) ? Optional.of(Value.of(changes)) : Optional.empty();
    }

    @Override
    public List<String> getNames() {
      return Arrays.asList("changes");
    }
  };

  public EventMonitorMachine() {
    this(new EventMonitor(Optional.of(5), Optional.of(3)));
  }

  public EventMonitorMachine(final EventMonitor eventMonitor) {
    super(INFO, eventMonitor);
    initialize(new SimpleState(stateA), Environment.EMPTY);
  }

  ///// Interface /////
  public int mult(final int a, final int b) {
    final Event event = new Event(INFO.getEvent("mult").get(),
        StaticEnvironmentBuilder.newBuilder().with("a", a).with("b", b).build());
    dispatch(event);
    return event.getReturnValue().get().asInt();
  }

  public void reset() {
    dispatch(new Event(INFO.getEvent("reset").get()));
  }

  public int change() {
    final Event event = new Event(INFO.getEvent("change").get());
    dispatch(event);
    return event.getReturnValue().get().asInt();
  }

  public void transit(final int x) {
    dispatch(new Event(INFO.getEvent("transit").get(),
        StaticEnvironmentBuilder.newBuilder().with("x", x).build()));
  }

  public String getStateName() {
    return getCurrentState().getInfo().getName();
  }

  @Override
  public Environment getDomainVariables() {
    return domainVariables;
  }

  ///// Generated dispatch /////
  @Override
  protected void handle(final MethodInstance event) {
    final StateInfo state = getCurrentState().getInfo();
    if (state == stateA) {
      handleA(event);
    } else if (state == stateB) {
      handleB(event);
    } else if (state == stateC) {
      handleC(event);
    } else if (state == stateD) {
      handleD(event);
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

  private void handleA(final MethodInstance event) {
    switch (event.getInfo().getName()) {
      case "mult":
        returnProduct(event);
        return;
      case "change":
        changeTo(0, stateB, event);
        return;
      case "transit":
        transition(INFO.getTransition(1).get(), new SimpleState(stateB), Environment.EMPTY,
            argumentX(event));
        return;
      default:
        return;
    }
  }

  private void handleB(final MethodInstance event) {
    switch (event.getInfo().getName()) {
      case "B:>":
        transit(event.getArguments().lookup("x").get().asInt());
        return;
      case "mult":
        returnProduct(event);
        return;
      case "change":
        changeTo(2, stateC, event);
        return;
      case "transit":
        transition(INFO.getTransition(3).get(), new SimpleState(stateC), Environment.EMPTY,
            argumentX(event));
        return;
      case "reset":
        changeTo(4, stateA, event);
        return;
      default:
        return;
    }
  }

  private void handleC(final MethodInstance event) {
    switch (event.getInfo().getName()) {
      case "C:>":
        transit(event.getArguments().lookup("x").get().asInt());
        return;
      case "mult":
        returnProduct(event);
        return;
      case "change":
        changeTo(5, stateD, event);
        return;
      case "transit":
        transition(INFO.getTransition(6).get(), new SimpleState(stateD), Environment.EMPTY,
            argumentX(event));
        return;
      case "reset":
        changeTo(7, stateA, event);
        return;
      default:
        return;
    }
  }

  private void handleD(final MethodInstance event) {
    switch (event.getInfo().getName()) {
      case "D:>":
        change();
        return;
      case "mult":
        returnProduct(event);
        return;
      case "change":
        changeTo(8, stateA, event);
        return;
      case "reset":
        changeTo(9, stateA, event);
        return;
      default:
        return;
    }
  }

  private void changeTo(final int transitionId, final StateInfo target,
      final MethodInstance event) {
    changes++;
    if (event instanceof Event && event.getInfo().getReturnType().isPresent()) {
      ((Event) event).setReturnValue(Value.of(changes));
    }
    changeState(INFO.getTransition(transitionId).get(), new SimpleState(target));
  }

  private static void returnProduct(final MethodInstance event) {
    final Environment arguments = event.getArguments();
    ((Event) event).setReturnValue(Value.of(
        arguments.lookup("a").get().asInt() * arguments.lookup("b").get().asInt()));
  }

  private static Environment argumentX(final MethodInstance event) {
    return StaticEnvironmentBuilder.newBuilder()
        .with("x", event.getArguments().lookup("x").get()).build();
  }

  /**
   * None of this machine's states carry arguments or variables.
   */
  static final class SimpleState implements StateInstance {
    private final StateInfo info;

    SimpleState(final StateInfo info) {
      this.info = info;
    }

    @Override
    public StateInfo getInfo() {
      return info;
    }

    @Override
    public String toString() {
      return info.getName();
    }
  }
}
