// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.app;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.stackless.compiler.Program;
import org.stackless.compiler.TransformException;
import org.stackless.parser.CoroutineParser;
import org.stackless.parser.ParseException;
import org.stackless.runtime.Generator;

/**
 * Reads coroutine definitions from stdin and dumps intermediate forms or runs one of them.
 *
 * <pre>
 * app [read-ast] [dump-ast] [dump-cfg] [dump-subgraphs] [dump-code] [run NAME ARGS...]
 * app --version
 * </pre>
 */
public class App {
  public static void main(String[] args) throws Exception {
    if (System.getenv("STACKLESS_DEBUG") != null) {
      Program.setDebugLogger((message, params) -> System.err.printf(message + "%n", params));
      Program.setVerboseDebugging(true);
    }

    List<String> argsList = new ArrayList<>(Arrays.asList(args));
    if (argsList.contains("--version")) {
      System.out.println(Program.versionInfo());
      return;
    }

    String stdinString =
        new BufferedReader(new InputStreamReader(System.in))
            .lines()
            .collect(Collectors.joining("\n"));

    try {
      run(argsList, stdinString, System.out);
    } catch (ParseException e) {
      System.err.println(e.getMessage());
      System.exit(1);
    } catch (TransformException e) {
      System.err.println(e.describe());
      System.exit(1);
    }
  }

  static void run(List<String> argsList, String stdinString, PrintStream out) {
    argsList = new ArrayList<>(argsList);
    Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

    JsonElement jsonAst;
    if (argsList.remove("read-ast")) {
      jsonAst = JsonParser.parseString(stdinString);
    } else {
      jsonAst = CoroutineParser.parse("<stdin>", stdinString);
    }
    if (argsList.remove("dump-ast")) {
      out.println(gson.toJson(jsonAst));
    }

    var program = Program.fromJsonAst(jsonAst);
    if (argsList.remove("dump-cfg")) {
      out.print(program.dumpControlFlowGraphs());
    }
    if (argsList.remove("dump-subgraphs")) {
      out.println(gson.toJson(program.dumpSubgraphs()));
    }
    if (argsList.remove("dump-code")) {
      out.print(program.dumpCode());
    }

    int runIndex = argsList.indexOf("run");
    if (runIndex >= 0) {
      if (runIndex + 1 >= argsList.size()) {
        throw new IllegalArgumentException("Usage: run NAME ARGS...");
      }
      var coroutine = program.get(argsList.get(runIndex + 1));
      var textArgs = argsList.subList(runIndex + 2, argsList.size());
      var parameterTypes = coroutine.parameterTypes();
      if (textArgs.size() != parameterTypes.size()) {
        throw new IllegalArgumentException(
            "Coroutine %s takes %d argument(s) but %d given"
                .formatted(coroutine.name(), parameterTypes.size(), textArgs.size()));
      }
      var values = new Object[textArgs.size()];
      for (int i = 0; i < values.length; ++i) {
        values[i] = parameterTypes.get(i).parseValue(textArgs.get(i));
      }
      var generator = Generator.of(coroutine, values);
      for (var value : generator) {
        out.println("yield: " + value);
      }
      out.println("return: " + generator.coroutine().getReturnValue());
    }
  }
}
