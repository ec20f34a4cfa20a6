package com.github.machineruntime;

/**
 * Runtime view of a generated hierarchical state machine. Every machine produced by the compiler
 * implements this interface, normally by extending {@link AbstractStateMachine}, so embedding
 * applications and observers can inspect any machine without knowing its generated types.
 *
 * Notes for users:<br>
 * 1. a machine instance is single-threaded: dispatching an event is an ordinary, possibly
 * recursive, call that runs every cascaded transition and every callback to completion before it
 * returns<br>
 *
 * 2. machine instances are independent of each other; run as many as needed, on as many threads as
 * needed, as long as each instance is only touched by one thread at a time<br>
 *
 * 3. the static descriptors returned by {@link #getInfo()} are shared by all instances of a machine
 * type, the live state and the monitor belong to this instance alone<br>
 *
 * 4. recursion depth is bounded only by how many transitions the machine chains from enter and
 * exit handlers; a machine that cascades without end overflows the stack<br>
 */
public interface StateMachine {

  /**
   * Reports the id of this machine instance.
   */
  String getId();

  /**
   * Static description of this machine's type.
   */
  MachineInfo getInfo();

  /**
   * The live state the machine is currently in.
   */
  StateInstance getCurrentState();

  /**
   * Machine-wide variables.
   */
  Environment getDomainVariables();

  /**
   * The monitor to register callbacks on and to read histories from.
   */
  EventMonitor getEventMonitor();

  /**
   * Number of states currently saved on the state stack.
   */
  int getStateStackDepth();
}
