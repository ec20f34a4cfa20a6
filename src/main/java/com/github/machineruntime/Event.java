package com.github.machineruntime;

import java.util.Optional;

/**
 * Stock {@link MethodInstance} shape. Generated code creates one per dispatch and the handler
 * fills in the return value; observers only ever see it through the read-only interface.
 */
public final class Event implements MethodInstance {
  private final MethodInfo info;
  private final Environment arguments;
  private Optional<Value> returnValue = Optional.empty();

  public Event(final MethodInfo info) {
    this(info, Environment.EMPTY);
  }

  public Event(final MethodInfo info, final Environment arguments) {
    this.info = info;
    this.arguments = arguments;
  }

  @Override
  public MethodInfo getInfo() {
    return info;
  }

  @Override
  public Environment getArguments() {
    return arguments;
  }

  @Override
  public Optional<Value> getReturnValue() {
    return returnValue;
  }

  public void setReturnValue(final Value returnValue) {
    this.returnValue = Optional.of(returnValue);
  }

  @Override
  public String toString() {
    return "Event [name=" + info.getName() + ", arguments=" + arguments + ", returnValue="
        + returnValue.map(String::valueOf).orElse("none") + "]";
  }
}
