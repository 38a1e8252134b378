// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.runtime;

import java.util.Arrays;

/** Growable region of object references, indexed from the top like {@link LongStack}. */
public final class RefStack<T> {
  private static final int DEFAULT_CAPACITY = 8;

  private final String name;
  private Object[] values = null;
  private int size = 0;

  public RefStack(String name) {
    this.name = name;
  }

  public void push(T value, int initialCapacity) {
    if (values == null) {
      values = new Object[initialCapacity > 0 ? initialCapacity : DEFAULT_CAPACITY];
    } else if (size == values.length) {
      values = Arrays.copyOf(values, values.length * 2);
    }
    values[size++] = value;
    if (Debug.isVerbose()) Debug.log("%s push: %s (size %d)", name, value, size);
  }

  public T pop() {
    if (size == 0) {
      throw new IllegalStateException("Cannot pop empty region: " + name);
    }
    T value = get(0);
    values[--size] = null; // Release the reference.
    if (Debug.isVerbose()) Debug.log("%s pop: %s (size %d)", name, value, size);
    return value;
  }

  public T top() {
    return get(0);
  }

  @SuppressWarnings("unchecked")
  public T get(int position) {
    return (T) values[index(position)];
  }

  public void set(int position, T value) {
    values[index(position)] = value;
    if (Debug.isVerbose()) Debug.log("%s set[%d]: %s", name, position, value);
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
    return name + Arrays.toString(values == null ? new Object[0] : Arrays.copyOf(values, size));
  }
}
