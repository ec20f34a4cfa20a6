package com.github.machineruntime;

import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.machineruntime.StateMachineFault.Code;

/**
 * Base class of generated machines. It owns the current-state slot, the state stack and the event
 * monitor, and implements the dispatch envelope so that every generated machine drives its monitor
 * the same way.
 *
 * Generated subclasses supply three things: routing of an event to the current state's handler
 * ({@link #handle(MethodInstance)}) and construction of the enter and exit sub-events of their
 * states. Handlers change state only through {@link #transition}, {@link #changeState},
 * {@link #popTransition} and {@link #popChangeState}, and return right after doing so.
 *
 * Contract enforced here:<br>
 * 1. every dispatched event gets exactly one sent notification before its handler runs and
 * exactly one handled notification after everything it caused completed<br>
 * 2. a transition delivers the exit event to the old state, swaps the current state, notifies the
 * transition, then delivers the enter event to the new state<br>
 * 3. a change-state swaps the current state and notifies the transition, nothing else<br>
 * 4. the current state is replaced by a single field write, so observers never see it half
 * updated<br>
 */
public abstract class AbstractStateMachine implements StateMachine {
  private static final Logger logger =
      LogManager.getLogger(AbstractStateMachine.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();
  private final MachineInfo info;
  private final EventMonitor eventMonitor;
  private final StateStack stateStack = new StateStack();

  private StateInstance currentState;

  protected AbstractStateMachine(final MachineInfo info) {
    this(info, new EventMonitor());
  }

  protected AbstractStateMachine(final MachineInfo info, final EventMonitor eventMonitor) {
    if (info == null || eventMonitor == null) {
      throw new IllegalArgumentException("Machine info and event monitor cannot be null");
    }
    this.info = info;
    this.eventMonitor = eventMonitor;
    logDebug(machineId, "Created " + info.getName() + " machine with monitor "
        + eventMonitor.getId());
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public MachineInfo getInfo() {
    return info;
  }

  @Override
  public StateInstance getCurrentState() {
    requireInitialized();
    return currentState;
  }

  @Override
  public EventMonitor getEventMonitor() {
    return eventMonitor;
  }

  @Override
  public int getStateStackDepth() {
    return stateStack.size();
  }

  /**
   * Domain variables; machines without any keep this default.
   */
  @Override
  public Environment getDomainVariables() {
    return Environment.EMPTY;
  }

  ///// Hooks for generated code /////
  /**
   * Route an event to the handler of the current state, or of the ancestor that handles it.
   */
  protected abstract void handle(final MethodInstance event);

  /**
   * Build the enter sub-event ({@code State:>}) of the given state.
   */
  protected abstract MethodInstance createEnterEvent(final StateInstance state,
      final Environment arguments);

  /**
   * Build the exit sub-event ({@code State:<}) of the given state.
   */
  protected abstract MethodInstance createExitEvent(final StateInstance state,
      final Environment arguments);

  /**
   * Invoked right after the current state was swapped by a transition, before observers hear of
   * it. No-op unless the machine description declares a transition hook.
   */
  protected void onTransition(final StateInstance oldState, final StateInstance newState) {}

  /**
   * Invoked right after the current state was swapped by a change-state, before observers hear of
   * it. No-op unless the machine description declares a change-state hook.
   */
  protected void onChangeState(final StateInstance oldState, final StateInstance newState) {}

  ///// Dispatch envelope /////
  /**
   * Install the start state and deliver its enter event. Generated constructors call this once.
   */
  protected final void initialize(final StateInstance initialState,
      final Environment enterArguments) {
    if (currentState != null) {
      throw new StateMachineFault(Code.MACHINE_ALREADY_INITIALIZED,
          "Machine " + info.getName() + " is already in state "
              + currentState.getInfo().getName());
    }
    if (initialState == null) {
      throw new IllegalArgumentException("Initial state cannot be null");
    }
    currentState = initialState;
    logDebug(machineId, "Starting in " + initialState.getInfo().getName());
    deliver(createEnterEvent(initialState, enterArguments));
  }

  /**
   * Send an event to the machine. Returns once the event and everything it caused were handled.
   */
  protected final void dispatch(final MethodInstance event) {
    requireInitialized();
    deliver(event);
  }

  /**
   * Leave the current state for {@code nextState}, delivering exit and enter events.
   */
  protected final void transition(final TransitionInfo transition, final StateInstance nextState,
      final Environment exitArguments, final Environment enterArguments) {
    requireInitialized();
    checkTransition(transition, TransitionKind.TRANSITION, false);
    checkTarget(transition, nextState);
    performTransition(transition, nextState, exitArguments, enterArguments);
  }

  /**
   * Swap the current state for {@code nextState} without exit or enter events.
   */
  protected final void changeState(final TransitionInfo transition,
      final StateInstance nextState) {
    requireInitialized();
    checkTransition(transition, TransitionKind.CHANGE_STATE, false);
    checkTarget(transition, nextState);
    performChangeState(transition, nextState);
  }

  /**
   * Save a reference to the current state, arguments and variables included, on the state stack.
   */
  protected final void pushState() {
    requireInitialized();
    stateStack.push(currentState);
    logDebug(machineId, "Pushed " + currentState.getInfo().getName() + ", stack " + stateStack);
  }

  /**
   * Transition back to the state on top of the state stack. The restored instance is reused as
   * is: its enter event is delivered again but it is not constructed anew, and its enter
   * arguments are empty.
   *
   * Popping an empty stack does nothing and returns false.
   */
  protected final boolean popTransition(final TransitionInfo transition,
      final Environment exitArguments) {
    requireInitialized();
    checkTransition(transition, TransitionKind.TRANSITION, true);
    final Optional<StateInstance> restored = stateStack.pop();
    if (!restored.isPresent()) {
      logWarning(machineId, "State stack is empty, " + transition + " has nothing to restore");
      return false;
    }
    performTransition(transition, restored.get(), exitArguments, Environment.EMPTY);
    return true;
  }

  /**
   * Change-state back to the state on top of the state stack. Popping an empty stack does
   * nothing and returns false.
   */
  protected final boolean popChangeState(final TransitionInfo transition) {
    requireInitialized();
    checkTransition(transition, TransitionKind.CHANGE_STATE, true);
    final Optional<StateInstance> restored = stateStack.pop();
    if (!restored.isPresent()) {
      logWarning(machineId, "State stack is empty, " + transition + " has nothing to restore");
      return false;
    }
    performChangeState(transition, restored.get());
    return true;
  }

  private void deliver(final MethodInstance event) {
    eventMonitor.eventSent(event);
    handle(event);
    eventMonitor.eventHandled(event);
  }

  private void performTransition(final TransitionInfo transition, final StateInstance nextState,
      final Environment exitArguments, final Environment enterArguments) {
    // 1. exit event for the state being left; its handler may transition further
    deliver(createExitEvent(currentState, exitArguments));

    // 2. swap
    final StateInstance oldState = currentState;
    currentState = nextState;
    onTransition(oldState, nextState);
    logDebug(machineId, String.format("Transitioned %s->%s [id:%d]",
        oldState.getInfo().getName(), nextState.getInfo().getName(), transition.getId()));

    // 3. observers
    eventMonitor.transitionOccurred(TransitionInstance.transition(transition, oldState, nextState,
        exitArguments, enterArguments));

    // 4. enter event for the new state
    deliver(createEnterEvent(nextState, enterArguments));
  }

  private void performChangeState(final TransitionInfo transition,
      final StateInstance nextState) {
    final StateInstance oldState = currentState;
    currentState = nextState;
    onChangeState(oldState, nextState);
    logDebug(machineId, String.format("Changed state %s->>%s [id:%d]",
        oldState.getInfo().getName(), nextState.getInfo().getName(), transition.getId()));
    eventMonitor.transitionOccurred(TransitionInstance.changeState(transition, oldState,
        nextState));
  }

  private void checkTransition(final TransitionInfo transition, final TransitionKind kind,
      final boolean stackPop) {
    if (transition == null) {
      throw new StateMachineFault(Code.ILLEGAL_TRANSITION, "Transition info cannot be null");
    }
    if (transition.getKind() != kind || transition.isStackPop() != stackPop) {
      throw new StateMachineFault(Code.ILLEGAL_TRANSITION,
          String.format("Transition %s [id:%d] cannot be performed as a %s%s", transition,
              transition.getId(), stackPop ? "stack pop " : "", kind));
    }
    final StateInfo current = currentState.getInfo();
    if (current != transition.getSource() && !current.isDescendantOf(transition.getSource())) {
      throw new StateMachineFault(Code.ILLEGAL_TRANSITION,
          String.format("Transition %s [id:%d] fired while in state %s", transition,
              transition.getId(), current.getName()));
    }
  }

  private static void checkTarget(final TransitionInfo transition,
      final StateInstance nextState) {
    if (nextState == null || nextState.getInfo() != transition.getTarget().get()) {
      throw new StateMachineFault(Code.ILLEGAL_TRANSITION,
          String.format("Transition %s [id:%d] cannot enter %s", transition, transition.getId(),
              nextState == null ? "null" : nextState.getInfo().getName()));
    }
  }

  private void requireInitialized() {
    if (currentState == null) {
      throw new StateMachineFault(Code.MACHINE_NOT_INITIALIZED,
          "Machine " + info.getName() + " [m:" + machineId + "] was never initialized");
    }
  }

  private static void logWarning(final String machineId, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String machineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }
}
