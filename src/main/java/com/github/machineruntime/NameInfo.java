package com.github.machineruntime;

import java.util.Objects;

/**
 * Name and type descriptor of a parameter or a variable declared in a machine description. The
 * type is the descriptor the machine description used, kept verbatim.
 */
public final class NameInfo {
  private final String name;
  private final String type;

  public NameInfo(final String name, final String type) {
    this.name = name;
    this.type = type;
  }

  public static NameInfo of(final String name, final String type) {
    return new NameInfo(name, type);
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NameInfo)) {
      return false;
    }
    NameInfo other = (NameInfo) o;
    return Objects.equals(name, other.name) && Objects.equals(type, other.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override
  public String toString() {
    return name + ":" + type;
  }
}
