// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.stackless.parser.CoroutineParser;
import org.stackless.runtime.Coroutine;
import org.stackless.runtime.Debug;
import org.stackless.runtime.Definition;
import org.stackless.runtime.Generator;

/**
 * Compiled module of coroutine definitions.
 *
 * <pre>{@code
 * var program = Program.compile("""
 *     def f = coroutine (x: Int) => { yieldval(x); yieldval(x + 1) }
 *     """);
 * for (var value : program.generator("f", 1)) { ... }
 * }</pre>
 */
public class Program {
  private static VersionInfo versionInfo = null;

  private final Map<String, SynthesizedCoroutine> coroutines = new LinkedHashMap<>();

  public static VersionInfo versionInfo() {
    if (versionInfo == null) {
      versionInfo = VersionInfo.load();
    }
    return versionInfo;
  }

  // To enable debug logging to stderr:
  // Program.setDebugLogger((str, args) -> System.err.printf(str + "%n", args));
  public static void setDebugLogger(Debug.DebugLogger logger) {
    Debug.setLogger(logger);
  }

  public static void setVerboseDebugging(boolean enable) {
    Debug.setVerbose(enable);
  }

  public static Program compile(String source) {
    return compile("<stdin>", source);
  }

  public static Program compile(String filename, String source) {
    return fromJsonAst(CoroutineParser.parse(filename, source));
  }

  public static Program fromJsonAst(JsonElement jsonAst) {
    var program = new Program();
    var compiler = new Compiler(JsonAstParser.parseModule(jsonAst));
    for (var compilation : compiler.compileAll()) {
      program.coroutines.put(
          compilation.name(), new SynthesizedCoroutine(compilation, program.coroutines::get));
    }
    return program;
  }

  private Program() {}

  public Collection<SynthesizedCoroutine> coroutines() {
    return Collections.unmodifiableCollection(coroutines.values());
  }

  public SynthesizedCoroutine get(String name) {
    var coroutine = coroutines.get(name);
    if (coroutine == null) {
      throw new IllegalArgumentException("No coroutine named " + name);
    }
    return coroutine;
  }

  /** Starts a new instance of coroutine {@code name}. */
  public Coroutine call(String name, Object... args) {
    return get(name).call(args);
  }

  public Generator generator(String name, Object... args) {
    return Generator.of(get(name), args);
  }

  public Definition definition(String name) {
    return get(name);
  }

  /** Control-flow graphs of all definitions, as indented trees. */
  public String dumpControlFlowGraphs() {
    var out = new StringBuilder();
    for (var coroutine : coroutines.values()) {
      var cfg = coroutine.compilation().cfg();
      out.append("%s:%n%s".formatted(coroutine.name(), cfg.prettyPrint()));
    }
    return out.toString();
  }

  public JsonArray dumpSubgraphs() {
    var json = new JsonArray();
    for (var coroutine : coroutines.values()) {
      for (var subgraph : coroutine.compilation().subgraphs()) {
        var jsonSubgraph = subgraph.toJson();
        jsonSubgraph.addProperty("coroutine", coroutine.name());
        json.add(jsonSubgraph);
      }
    }
    return json;
  }

  /** Synthesized entry procedures and dispatcher of each definition, as readable pseudo-code. */
  public String dumpCode() {
    var out = new StringBuilder();
    for (var coroutine : coroutines.values()) {
      var compilation = coroutine.compilation();
      out.append("// %s%n".formatted(coroutine));
      for (var info : compilation.table().vars()) {
        out.append("// %s%n".formatted(info));
      }
      for (var procedure : compilation.procedures()) {
        out.append(procedure);
      }
      out.append(compilation.dispatcher());
      out.append('\n');
    }
    return out.toString();
  }
}
