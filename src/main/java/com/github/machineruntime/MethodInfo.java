package com.github.machineruntime;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable metadata about an event or an action of a machine. Enter and exit sub-events are
 * methods too, conventionally named {@code State:>} and {@code State:<}.
 */
public final class MethodInfo {
  private final String name;
  private final List<NameInfo> parameters;
  private final Optional<String> returnType;

  MethodInfo(final String name, final List<NameInfo> parameters,
      final Optional<String> returnType) {
    this.name = name;
    this.parameters = Collections.unmodifiableList(parameters);
    this.returnType = returnType;
  }

  public String getName() {
    return name;
  }

  public List<NameInfo> getParameters() {
    return parameters;
  }

  public Optional<String> getReturnType() {
    return returnType;
  }

  @Override
  public String toString() {
    return "MethodInfo [name=" + name + ", parameters=" + parameters + ", returnType="
        + returnType.orElse("none") + "]";
  }
}
