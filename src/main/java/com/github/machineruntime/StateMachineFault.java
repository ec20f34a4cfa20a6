package com.github.machineruntime;

/**
 * Local, unrecoverable fault raised while a machine runs. A fault signals a defect in generated
 * code or in observer code: a value extracted as the wrong kind, a live instance coerced to a
 * shape it does not have, a transition performed through the wrong primitive. The runtime never
 * catches these.
 */
public final class StateMachineFault extends RuntimeException {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineFault(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineFault(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    VALUE_KIND_MISMATCH("Environment value was extracted as a different kind than it holds"),
    // 2.
    INSTANCE_SHAPE_MISMATCH("Live instance does not have the requested concrete shape"),
    // 3.
    ILLEGAL_TRANSITION("Transition info does not match the state change being performed"),
    // 4.
    MACHINE_NOT_INITIALIZED("Machine has no current state yet"),
    // 5.
    MACHINE_ALREADY_INITIALIZED("Machine already has a current state");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
