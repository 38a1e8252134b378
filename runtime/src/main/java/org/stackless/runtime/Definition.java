// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.runtime;

import java.util.List;

/**
 * A suspendable procedure. One definition serves every arity: parameters are an ordered list of
 * typed values rather than a differently shaped type per parameter count.
 *
 * <p>A definition owns no per-instance state. Every call pushes a frame onto the storage regions of
 * a {@link Coroutine}: the definition itself onto the call-nesting region, program counter 0 onto
 * the program-counter region, and one slot per variable onto the value regions.
 */
public abstract class Definition {
  private final String name;
  private final List<ValueType> parameterTypes;
  private final ValueType resultType;

  protected Definition(String name, List<ValueType> parameterTypes, ValueType resultType) {
    this.name = name;
    this.parameterTypes = List.copyOf(parameterTypes);
    this.resultType = resultType;
  }

  public String name() {
    return name;
  }

  public List<ValueType> parameterTypes() {
    return parameterTypes;
  }

  public ValueType resultType() {
    return resultType;
  }

  public int arity() {
    return parameterTypes.size();
  }

  /** Starts a new coroutine instance whose first frame runs this definition. */
  public Coroutine call(Object... args) {
    var coroutine = new Coroutine();
    push(coroutine, args);
    return coroutine;
  }

  /**
   * Direct invocation is reserved for calls from within another coroutine, which the compiler
   * lowers into a frame push. Calling this from ordinary code always fails.
   */
  public Object apply(Object... args) {
    throw new IllegalStateException(
        ("Coroutines can only be invoked directly from within other coroutines. "
                + "Use `%s.call(<arg0>, ..., <argN>)` instead if you want to start a new "
                + "coroutine.")
            .formatted(name));
  }

  /** Pushes a new frame for this definition, initializing parameters from {@code args}. */
  public final void push(Coroutine coroutine, Object... args) {
    if (args.length != parameterTypes.size()) {
      throw new IllegalArgumentException(
          "Coroutine %s takes %d argument(s) but %d given"
              .formatted(name, parameterTypes.size(), args.length));
    }
    var coercedArgs = new Object[args.length];
    for (int i = 0; i < args.length; ++i) {
      coercedArgs[i] = parameterTypes.get(i).coerce(args[i]);
    }
    coroutine.costack().push(this, -1);
    coroutine.pcstack().push(0, -1);
    pushVariables(coroutine, coercedArgs);
  }

  /** Pops the frame pushed by {@link #push}. */
  public final void pop(Coroutine coroutine) {
    coroutine.pcstack().pop();
    coroutine.costack().pop();
    popVariables(coroutine);
  }

  /** Pushes one slot per variable, parameters holding {@code args} in order. */
  protected abstract void pushVariables(Coroutine coroutine, Object[] args);

  protected abstract void popVariables(Coroutine coroutine);

  /** Runs exactly one segment of the frame on top of {@code coroutine}'s regions. */
  public abstract void enter(Coroutine coroutine);

  @Override
  public String toString() {
    return "<coroutine %s>".formatted(name);
  }
}
