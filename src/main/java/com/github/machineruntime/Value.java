package com.github.machineruntime;

import java.util.Objects;

/**
 * Dynamically typed value read out of an {@link Environment}. The set of kinds is closed and
 * mirrors the value types a machine description may declare. Extracting a value as a kind it does
 * not hold is a {@link StateMachineFault}.
 */
public final class Value {
  private final Kind kind;
  private final Object payload;

  private Value(final Kind kind, final Object payload) {
    this.kind = kind;
    this.payload = Objects.requireNonNull(payload, "payload");
  }

  public static Value of(final boolean value) {
    return new Value(Kind.BOOLEAN, value);
  }

  public static Value of(final int value) {
    return new Value(Kind.INTEGER, value);
  }

  public static Value of(final long value) {
    return new Value(Kind.LONG, value);
  }

  public static Value of(final double value) {
    return new Value(Kind.DOUBLE, value);
  }

  public static Value of(final String value) {
    return new Value(Kind.STRING, value);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean is(final Kind expected) {
    return kind == expected;
  }

  public boolean asBoolean() {
    return (Boolean) expect(Kind.BOOLEAN);
  }

  public int asInt() {
    return (Integer) expect(Kind.INTEGER);
  }

  public long asLong() {
    return (Long) expect(Kind.LONG);
  }

  public double asDouble() {
    return (Double) expect(Kind.DOUBLE);
  }

  public String asString() {
    return (String) expect(Kind.STRING);
  }

  private Object expect(final Kind expected) {
    if (kind != expected) {
      throw new StateMachineFault(StateMachineFault.Code.VALUE_KIND_MISMATCH,
          "Expected " + expected + " but value holds " + kind + " " + payload);
    }
    return payload;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Value)) {
      return false;
    }
    Value other = (Value) o;
    return kind == other.kind && payload.equals(other.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, payload);
  }

  @Override
  public String toString() {
    return kind == Kind.STRING ? "\"" + payload + "\"" : String.valueOf(payload);
  }

  public static enum Kind {
    BOOLEAN, INTEGER, LONG, DOUBLE, STRING;
  }
}
