// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.stackless.compiler.Code.Procedure;
import org.stackless.compiler.Tree.CoroutineDef;
import org.stackless.compiler.Tree.Lambda;
import org.stackless.runtime.Debug;
import org.stackless.runtime.ValueType;

/**
 * Lowers the coroutine definitions of one module. Definitions are compiled on demand, so a caller
 * whose callee has no declared result type compiles the callee first to infer it.
 */
public class Compiler {
  /** Everything produced for one definition. */
  public record Compilation(
      CoroutineDef definition,
      Table table,
      ControlFlowGraph cfg,
      List<Subgraph> subgraphs,
      List<Procedure> procedures,
      Dispatcher dispatcher) {
    public String name() {
      return definition.name();
    }

    public List<ValueType> parameterTypes() {
      return ((Lambda) definition.value())
          .parameters().stream().map(Tree.Parameter::type).toList();
    }
  }

  private final Map<String, CoroutineDef> definitions = new LinkedHashMap<>();
  private final Map<String, Compilation> compiled = new LinkedHashMap<>();
  private final Set<String> inProgress = new HashSet<>();

  public Compiler(List<CoroutineDef> definitions) {
    for (var definition : definitions) {
      this.definitions.put(definition.name(), definition);
    }
  }

  public List<Compilation> compileAll() {
    for (var name : definitions.keySet()) {
      compile(name);
    }
    return List.copyOf(compiled.values());
  }

  public Compilation compile(String name) {
    var compilation = compiled.get(name);
    if (compilation != null) {
      return compilation;
    }
    var definition = definitions.get(name);
    if (definition == null) {
      throw new IllegalArgumentException("No coroutine definition named " + name);
    }
    var lambda = requireLambda(definition);
    inProgress.add(name);
    try {
      compilation = compile(definition, lambda);
    } finally {
      inProgress.remove(name);
    }
    compiled.put(name, compilation);
    return compilation;
  }

  private Compilation compile(CoroutineDef definition, Lambda lambda) {
    var table = new Table(definition.name(), lambda);
    var cfg = ControlFlowGraph.build(lambda, table, this::signatureOf);
    if (Debug.isVerbose()) {
      Debug.log("Control-flow graph of %s:%n%s", definition.name(), cfg.prettyPrint());
    }

    var types = new TypeResolver(table);
    final ValueType resultType;
    if (definition.resultType().isPresent()) {
      resultType = definition.resultType().get();
      for (var yieldType : table.yieldTypes()) {
        TypeResolver.require(resultType, yieldType, definition.lineno(), "Yielded value");
      }
      TypeResolver.require(
          resultType, types.valueTypeOf(lambda.body()), definition.lineno(), "Coroutine body");
    } else {
      resultType = types.inferResultType(lambda.body());
    }
    table.setResultType(resultType);
    table.assignSlots();

    var subgraphs = Partitioner.partition(cfg, table);
    var procedures = subgraphs.stream().map(s -> Synthesizer.synthesize(s, table)).toList();
    var dispatcher = Dispatcher.synthesize(procedures);
    if (Debug.isVerbose()) {
      for (var procedure : procedures) {
        Debug.log("%s", procedure);
      }
      Debug.log("%s", dispatcher);
    }
    return new Compilation(definition, table, cfg, subgraphs, procedures, dispatcher);
  }

  private Table.Signature signatureOf(String name, int lineno) {
    var definition = definitions.get(name);
    if (definition == null) {
      throw new TransformException(lineno, "Unknown coroutine: " + name);
    }
    var lambda = requireLambda(definition);
    var parameterTypes = lambda.parameters().stream().map(Tree.Parameter::type).toList();
    if (definition.resultType().isPresent()) {
      return new Table.Signature(name, parameterTypes, definition.resultType().get());
    }
    if (inProgress.contains(name)) {
      throw new TransformException(
          lineno,
          "Recursive coroutine %s needs an explicit result type: def %s: <Type> = coroutine ..."
              .formatted(name, name));
    }
    return new Table.Signature(name, parameterTypes, compile(name).table().resultType());
  }

  private static Lambda requireLambda(CoroutineDef definition) {
    if (definition.value() instanceof Lambda lambda) {
      return lambda;
    }
    throw new TransformException(
        definition.value().lineno(), "The coroutine takes a single function literal.");
  }
}
