package com.github.machineruntime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * LIFO store of previously active states, letting a machine save its current state and restore it
 * later. Entries are references to the live instances, so a restored state comes back with the
 * very arguments and variables it had when pushed. The same instance may be pushed any number of
 * times.
 *
 * Owned and mutated by exactly one machine instance.
 */
public final class StateStack {
  private final Deque<StateInstance> entries = new ArrayDeque<>();

  public void push(final StateInstance state) {
    if (state == null) {
      throw new IllegalArgumentException("Cannot push a null state");
    }
    entries.push(state);
  }

  /**
   * Remove and return the top entry, empty if there is none.
   */
  public Optional<StateInstance> pop() {
    return Optional.ofNullable(entries.pollFirst());
  }

  public Optional<StateInstance> peek() {
    return Optional.ofNullable(entries.peekFirst());
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public void clear() {
    entries.clear();
  }

  /**
   * Snapshot of the entries, top of the stack first.
   */
  public List<StateInstance> getEntries() {
    return Collections.unmodifiableList(new ArrayList<>(entries));
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder("[");
    for (final StateInstance entry : entries) {
      if (builder.length() > 1) {
        builder.append(", ");
      }
      builder.append(entry.getInfo().getName());
    }
    return builder.append("]").toString();
  }
}
