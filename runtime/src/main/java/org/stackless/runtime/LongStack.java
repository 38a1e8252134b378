// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.runtime;

import java.util.Arrays;

/**
 * Growable region of encoded values. Positions passed to {@link #get} and {@link #set} are counted
 * from the top, so position 0 is the most recently pushed value.
 */
public final class LongStack {
  private static final int DEFAULT_CAPACITY = 8;

  private final String name;
  private long[] values = null;
  private int size = 0;

  public LongStack(String name) {
    this.name = name;
  }

  /**
   * Pushes {@code value}. {@code initialCapacity} sizes the backing array on first use; pass -1 for
   * the default.
   */
  public void push(long value, int initialCapacity) {
    if (values == null) {
      values = new long[initialCapacity > 0 ? initialCapacity : DEFAULT_CAPACITY];
    } else if (size == values.length) {
      values = Arrays.copyOf(values, values.length * 2);
    }
    values[size++] = value;
    if (Debug.isVerbose()) Debug.log("%s push: %d (size %d)", name, value, size);
  }

  public long pop() {
    if (size == 0) {
      throw new IllegalStateException("Cannot pop empty region: " + name);
    }
    long value = values[--size];
    if (Debug.isVerbose()) Debug.log("%s pop: %d (size %d)", name, value, size);
    return value;
  }

  public long top() {
    return get(0);
  }

  public long get(int position) {
    return values[index(position)];
  }

  public void set(int position, long value) {
    values[index(position)] = value;
    if (Debug.isVerbose()) Debug.log("%s set[%d]: %d", name, position, value);
  }

  /** Replaces the top value. */
  public void update(long value) {
    set(0, value);
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  private int index(int position) {
    if (position < 0 || position >= size) {
      throw new IllegalStateException(
          "Position %d out of range for region %s of size %d".formatted(position, name, size));
    }
    return size - 1 - position;
  }

  @Override
  public String toString() {
    return name + Arrays.toString(values == null ? new long[0] : Arrays.copyOf(values, size));
  }
}
