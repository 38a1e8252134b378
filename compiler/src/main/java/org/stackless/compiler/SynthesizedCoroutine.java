// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.function.Function;
import org.stackless.runtime.Coroutine;
import org.stackless.runtime.Debug;
import org.stackless.runtime.Definition;

/** Definition whose frames run the entry procedures of a compiled coroutine. */
public final class SynthesizedCoroutine extends Definition {
  private final Compiler.Compilation compilation;
  private final Function<String, Definition> definitions;

  SynthesizedCoroutine(
      Compiler.Compilation compilation, Function<String, Definition> definitions) {
    super(compilation.name(), compilation.parameterTypes(), compilation.table().resultType());
    this.compilation = compilation;
    this.definitions = definitions;
  }

  public Compiler.Compilation compilation() {
    return compilation;
  }

  @Override
  protected void pushVariables(Coroutine coroutine, Object[] args) {
    int argIndex = 0;
    for (var info : compilation.table().vars()) {
      var value = info.symbol().parameter() ? args[argIndex++] : info.type().defaultValue();
      info.push(coroutine, value);
    }
  }

  @Override
  protected void popVariables(Coroutine coroutine) {
    var vars = new ArrayList<>(compilation.table().vars());
    Collections.reverse(vars);
    for (var info : vars) {
      info.pop(coroutine);
    }
  }

  @Override
  public void enter(Coroutine coroutine) {
    var procedure = compilation.dispatcher().select(coroutine);
    if (Debug.isVerbose()) Debug.log("%s dispatching to %s", name(), procedure.name());
    procedure.exec(new Context(coroutine, compilation.table(), definitions));
  }
}
