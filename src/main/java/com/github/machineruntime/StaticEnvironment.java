package com.github.machineruntime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable environment with a fixed set of names, used by generated code for argument sites
 * whose values never change once bound: event arguments and state construction arguments. Live
 * state variables are exposed through generated {@link Environment} implementations reading the
 * state's fields instead.
 */
public final class StaticEnvironment implements Environment {
  private final Map<String, Value> values;
  private final List<String> names;

  private StaticEnvironment(final Map<String, Value> values) {
    this.values = Collections.unmodifiableMap(values);
    this.names = Collections.unmodifiableList(new ArrayList<>(values.keySet()));
  }

  @Override
  public Optional<Value> lookup(final String name) {
    return Optional.ofNullable(values.get(name));
  }

  @Override
  public List<String> getNames() {
    return names;
  }

  @Override
  public String toString() {
    return values.toString();
  }

  public final static class StaticEnvironmentBuilder {
    private final Map<String, Value> values = new LinkedHashMap<>();

    public static StaticEnvironmentBuilder newBuilder() {
      return new StaticEnvironmentBuilder();
    }

    public StaticEnvironmentBuilder with(final String name, final Value value) {
      if (name == null || value == null) {
        throw new IllegalArgumentException("Environment names and values cannot be null");
      }
      values.put(name, value);
      return this;
    }

    public StaticEnvironmentBuilder with(final String name, final int value) {
      return with(name, Value.of(value));
    }

    public StaticEnvironmentBuilder with(final String name, final String value) {
      return with(name, Value.of(value));
    }

    public StaticEnvironmentBuilder with(final String name, final boolean value) {
      return with(name, Value.of(value));
    }

    public Environment build() {
      if (values.isEmpty()) {
        return Environment.EMPTY;
      }
      return new StaticEnvironment(new LinkedHashMap<>(values));
    }

    private StaticEnvironmentBuilder() {}
  }
}
