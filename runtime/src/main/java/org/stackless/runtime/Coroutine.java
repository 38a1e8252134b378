// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.runtime;

/**
 * One coroutine instance: the storage regions shared by all frames running in it.
 *
 * <p>Instances are single-writer. Resuming the same instance from two threads at once is undefined;
 * distinct instances share nothing and may run on different threads.
 */
public final class Coroutine implements AutoCloseable {
  private final LongStack lstack = new LongStack("lstack");
  private final RefStack<Object> rstack = new RefStack<>("rstack");
  private final LongStack pcstack = new LongStack("pcstack");
  private final RefStack<Definition> costack = new RefStack<>("costack");

  private Object result = null;
  private boolean hasResult = false;
  private Object returnValue = null;
  private boolean completedLastStep = false;
  private boolean resumedByReturn = false;
  private boolean closed = false;
  private boolean running = false;

  Coroutine() {}

  /** Region of long-encoded primitive variables. */
  public LongStack lstack() {
    return lstack;
  }

  /** Region of reference variables. */
  public RefStack<Object> rstack() {
    return rstack;
  }

  /** Program counter of each frame, the id of the segment to run next. */
  public LongStack pcstack() {
    return pcstack;
  }

  /** Definition running at each nesting depth. */
  public RefStack<Definition> costack() {
    return costack;
  }

  /**
   * Runs the instance until it yields a value or its outermost frame completes. Nested frames are
   * driven by the same loop, so a yield inside a nested call suspends this instance as a whole.
   *
   * @return whether the instance can be resumed again
   */
  public boolean resume() {
    if (closed) {
      throw new IllegalStateException("Cannot resume a closed coroutine");
    }
    if (costack.isEmpty()) {
      throw new IllegalStateException("Cannot resume a coroutine that has already completed");
    }
    if (running) {
      throw new IllegalStateException("Cannot resume a coroutine that is already running");
    }
    result = null;
    hasResult = false;
    running = true;
    try {
      while (!hasResult && !costack.isEmpty()) {
        var definition = costack.top();
        if (Debug.isVerbose()) {
          Debug.log(
              "enter %s at pc %d (depth %d)", definition.name(), pcstack.top(), costack.size());
        }
        resumedByReturn = completedLastStep;
        completedLastStep = false;
        definition.enter(this);
      }
    } finally {
      running = false;
    }
    return isLive();
  }

  /** Records a value produced at a suspension point. */
  public void yieldValue(Object value) {
    result = value;
    hasResult = true;
  }

  /**
   * Resumes {@code other} once and, if it yields, yields the same value from this instance as
   * {@code yieldType}. A target that is no longer live, or that completes without yielding, yields
   * nothing and this instance keeps running.
   *
   * @return whether a value was yielded
   */
  public boolean yieldTo(Coroutine other, ValueType yieldType) {
    if (other == null) {
      throw new IllegalArgumentException("Cannot yield to a missing coroutine instance");
    }
    if (other == this) {
      throw new IllegalStateException("A coroutine cannot yield to itself");
    }
    if (other.isLive()) {
      other.resume();
      if (other.hasResult()) {
        yieldValue(yieldType.coerce(other.getResult()));
        return true;
      }
    }
    return false;
  }

  /** Pops the frame on top and hands {@code value} to the frame below, if any. */
  public void complete(Object value) {
    var definition = costack.top();
    definition.pop(this);
    returnValue = value;
    completedLastStep = true;
    if (Debug.isVerbose()) {
      Debug.log("%s completed with %s (depth %d)", definition.name(), value, costack.size());
    }
  }

  public boolean isLive() {
    return !closed && !costack.isEmpty();
  }

  public boolean hasResult() {
    return hasResult;
  }

  public Object getResult() {
    if (!hasResult) {
      throw new IllegalStateException("Coroutine has no result from its last resumption");
    }
    return result;
  }

  /**
   * Whether the frame now running was entered right after a frame above it completed, so that
   * {@link #getReturnValue} holds that frame's value rather than one left over from earlier.
   */
  public boolean resumedByReturn() {
    return resumedByReturn;
  }

  /** Value of the most recently completed frame; for a finished instance, its final value. */
  public Object getReturnValue() {
    return returnValue;
  }

  /** Number of active frames. */
  public int depth() {
    return costack.size();
  }

  /** Pops every remaining frame. The instance cannot be resumed afterwards. */
  @Override
  public void close() {
    while (!costack.isEmpty()) {
      costack.top().pop(this);
    }
    closed = true;
  }

  @Override
  public String toString() {
    if (closed) {
      return "<coroutine instance (closed)>";
    }
    if (costack.isEmpty()) {
      return "<coroutine instance (completed)>";
    }
    return "<coroutine instance of %s at depth %d>".formatted(costack.top().name(), costack.size());
  }
}
