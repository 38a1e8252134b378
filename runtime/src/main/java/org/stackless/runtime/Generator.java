// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.runtime;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/** Iterates over the values a coroutine instance yields, resuming it one step at a time. */
public final class Generator implements Iterator<Object>, Iterable<Object> {
  private final Coroutine coroutine;

  // Whether the coroutine has been resumed for the value that next() returns.
  private boolean advanced = false;

  public Generator(Coroutine coroutine) {
    this.coroutine = coroutine;
  }

  public static Generator of(Definition definition, Object... args) {
    return new Generator(definition.call(args));
  }

  public Coroutine coroutine() {
    return coroutine;
  }

  @Override
  public Iterator<Object> iterator() {
    return this;
  }

  @Override
  public boolean hasNext() {
    if (!advanced) {
      if (coroutine.isLive()) {
        coroutine.resume();
      }
      advanced = true;
    }
    return coroutine.hasResult();
  }

  @Override
  public Object next() {
    if (!hasNext()) {
      throw new NoSuchElementException("Coroutine has completed");
    }
    advanced = false;
    return coroutine.getResult();
  }

  public Stream<Object> stream() {
    return StreamSupport.stream(spliterator(), false);
  }
}
