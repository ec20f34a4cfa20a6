package com.github.machineruntime;

/**
 * Unified checked exception thrown while assembling the static machine tables or the monitor
 * configuration. The code enum encapsulates the various error conditions. Faults raised while a
 * machine is running are reported through {@link StateMachineFault} instead.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_NAME("Name cannot be null or blank"),
    // 2.
    DUPLICATE_STATE("State names must be unique within a machine"),
    // 3.
    DUPLICATE_METHOD("Event and action names must be unique within a machine"),
    // 4.
    DUPLICATE_TRANSITION_ID("Transition ids must be unique within a machine"),
    // 5.
    UNKNOWN_STATE("Referenced state is not declared by the machine"),
    // 6.
    UNKNOWN_METHOD("Referenced event is not declared by the machine"),
    // 7.
    CYCLIC_STATE_HIERARCHY("State parent links must not form a cycle"),
    // 8.
    INVALID_TRANSITIONS("Transition declaration is incomplete"),
    // 9.
    INVALID_MONITOR_CONFIG("Event monitor configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
