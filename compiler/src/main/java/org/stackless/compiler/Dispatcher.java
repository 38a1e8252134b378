// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.stackless.compiler.Code.Procedure;
import org.stackless.runtime.Coroutine;

/** Resume entry point of a definition: picks the entry procedure for the saved program counter. */
public sealed interface Dispatcher {
  Procedure select(Coroutine coroutine);

  List<Procedure> procedures();

  /** Single procedure: called unconditionally, the program counter is never read. */
  record Direct(Procedure procedure) implements Dispatcher {
    @Override
    public Procedure select(Coroutine coroutine) {
      return procedure;
    }

    @Override
    public List<Procedure> procedures() {
      return List.of(procedure);
    }

    @Override
    public String toString() {
      return "def enter(c: Coroutine): Unit = %s(c)\n".formatted(procedure.name());
    }
  }

  /** Two procedures: program counter 0 selects the first, anything else the second. */
  record Binary(Procedure first, Procedure second) implements Dispatcher {
    @Override
    public Procedure select(Coroutine coroutine) {
      return coroutine.pcstack().top() == 0 ? first : second;
    }

    @Override
    public List<Procedure> procedures() {
      return List.of(first, second);
    }

    @Override
    public String toString() {
      return """
          def enter(c: Coroutine): Unit = {
            val pc = pcstack.top
            if (pc == 0) %s(c) else %s(c)
          }
          """
          .formatted(first.name(), second.name());
    }
  }

  /** Three or more procedures: exhaustive match on the program counter with no default. */
  record MultiWay(Map<Integer, Procedure> cases) implements Dispatcher {
    @Override
    public Procedure select(Coroutine coroutine) {
      long pc = coroutine.pcstack().top();
      var procedure = pc >= 0 && pc <= Integer.MAX_VALUE ? cases.get((int) pc) : null;
      if (procedure == null) {
        throw new IllegalStateException("No entry procedure for program counter " + pc);
      }
      return procedure;
    }

    @Override
    public List<Procedure> procedures() {
      return List.copyOf(cases.values());
    }

    @Override
    public String toString() {
      var out = new StringBuilder();
      out.append("def enter(c: Coroutine): Unit = {\n");
      out.append("  val pc = pcstack.top\n");
      out.append("  pc match {\n");
      for (var entry : cases.entrySet()) {
        out.append("    case %d => %s(c)\n".formatted(entry.getKey(), entry.getValue().name()));
      }
      out.append("  }\n");
      out.append("}\n");
      return out.toString();
    }
  }

  /**
   * Chooses the dispatch form by the number of procedures.
   *
   * @throws IllegalStateException if subgraph ids of {@code procedures} are not exactly 0..N-1
   */
  static Dispatcher synthesize(List<Procedure> procedures) {
    if (procedures.isEmpty()) {
      throw new IllegalArgumentException("Cannot dispatch to zero entry procedures");
    }
    var cases = new TreeMap<Integer, Procedure>();
    for (var procedure : procedures) {
      if (cases.put(procedure.subgraphId(), procedure) != null) {
        throw new IllegalStateException(
            "Duplicate entry procedure for subgraph " + procedure.subgraphId());
      }
    }
    if (cases.firstKey() != 0 || cases.lastKey() != cases.size() - 1) {
      throw new IllegalStateException("Entry procedure ids are not contiguous: " + cases.keySet());
    }
    switch (cases.size()) {
      case 1:
        return new Direct(cases.get(0));
      case 2:
        return new Binary(cases.get(0), cases.get(1));
      default:
        return new MultiWay(Collections.unmodifiableMap(cases));
    }
  }
}
