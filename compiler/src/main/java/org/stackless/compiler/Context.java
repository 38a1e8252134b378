// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.stackless.compiler.Tree.Identifier;
import org.stackless.runtime.Coroutine;
import org.stackless.runtime.Debug;
import org.stackless.runtime.Definition;

/** State of one entry procedure while it runs. Locals do not outlive the procedure. */
public final class Context {
  private final Coroutine coroutine;
  private final Table table;
  private final Function<String, Definition> definitions;
  private final Map<Symbol, Object> locals = new HashMap<>();
  private Object lastValue = null;
  private boolean returned = false;

  Context(Coroutine coroutine, Table table, Function<String, Definition> definitions) {
    this.coroutine = coroutine;
    this.table = table;
    this.definitions = definitions;
  }

  public Coroutine coroutine() {
    return coroutine;
  }

  public Definition definition(String name) {
    var definition = definitions.apply(name);
    if (definition == null) {
      throw new IllegalStateException("No coroutine named " + name);
    }
    return definition;
  }

  public Object get(Identifier identifier) {
    return get(table.symbolOf(identifier));
  }

  public Object get(Symbol symbol) {
    if (!locals.containsKey(symbol)) {
      throw new IllegalStateException(
          "Variable '%s' is not available in this procedure of %s"
              .formatted(symbol.name(), table.name()));
    }
    return locals.get(symbol);
  }

  public void declare(Symbol symbol, Object value) {
    if (Debug.isVerbose()) Debug.log("%s: %s = %s", table.name(), symbol, value);
    locals.put(symbol, value);
  }

  public void assign(Identifier identifier, Object value) {
    var symbol = table.symbolOf(identifier);
    locals.put(symbol, symbol.type().coerce(value));
  }

  public Object lastValue() {
    return lastValue;
  }

  public void setLastValue(Object value) {
    lastValue = value;
  }

  public void returnFromProcedure() {
    returned = true;
  }

  public boolean skipStatement() {
    return returned;
  }
}
