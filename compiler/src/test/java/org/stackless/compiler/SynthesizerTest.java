// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.stackless.compiler.Code.*;
import org.stackless.compiler.Compiler.Compilation;
import org.stackless.parser.CoroutineParser;
import org.stackless.runtime.ValueType;

public class SynthesizerTest {

  @Test
  public void preludeRestoresOuterChainsFirst() {
    var compilation =
        compile(
            """
            def f = coroutine (a: Int) => {
              val b = a + 1
              yieldval(b)
              {
                val c = b + a
                yieldval(c)
                val d = c + b + a
                yieldval(d)
              }
            }
            """);
    var procedure = compilation.procedures().get(2);
    assertEquals("ep2", procedure.name());
    assertEquals(List.of("a", "b", "c"), restoredNames(procedure));
    for (var statement : procedure.prelude()) {
      assertInstanceOf(StackRead.class, ((Restore) statement).source());
    }
  }

  @Test
  public void preludeRestoresOnlyReferencedVariables() {
    var compilation =
        compile(
            """
            def f = coroutine (a: Int, unused: String) => {
              val b = a + 1
              yieldval(b)
              val c = b * 2
              yieldval(c)
            }
            """);
    assertEquals(List.of("a"), restoredNames(compilation.procedures().get(0)));
    assertEquals(List.of("b"), restoredNames(compilation.procedures().get(1)));
    assertEquals(List.of(), restoredNames(compilation.procedures().get(2)));
  }

  @Test
  public void invocationResultIsRestoredFromReturnValue() {
    var compilation =
        compile(
            """
            def g: Int = coroutine (n: Int) => { yieldval(n); n * 10 }
            def f: Int = coroutine (x: Int) => {
              val r = g(x)
              yieldval(r + 1)
              r
            }
            """,
            "f");
    var invoking = compilation.procedures().get(0);
    assertEquals(List.of(SetPc.class, Invoke.class), classes(invoking.body().statements()));

    var resumed = compilation.procedures().get(1);
    var restore = (Restore) resumed.prelude().get(0);
    assertEquals("r", restore.symbol().name());
    assertInstanceOf(ReturnValue.class, restore.source());

    // The bound result is persisted before the next yield so the last subgraph can read it.
    var body = resumed.body().statements();
    assertEquals(List.of(Persist.class, SetPc.class, Suspend.class), classes(body));
    assertEquals("r", ((Persist) body.get(0)).info().symbol().name());
    assertEquals(2, ((SetPc) body.get(1)).pc());
  }

  @Test
  public void unboundInvocationResumesWithItsValue() {
    var compilation =
        compile(
            """
            def g = coroutine () => 5
            def f = coroutine () => g()
            """,
            "f");
    var resumed = compilation.procedures().get(1);
    assertEquals(List.of(ResumeValue.class), classes(resumed.prelude()));
    assertEquals(List.of(Complete.class), classes(resumed.body().statements()));
  }

  @Test
  public void mergeSuccessorIsEmittedOnceAfterBranch() {
    var compilation =
        compile(
            """
            def f = coroutine (x: Int) => {
              var y = 0
              if (x > 0) { yieldval(x) } else { y = 1 }
              yieldval(y)
            }
            """);
    var body = compilation.procedures().get(0).body().statements();
    assertEquals(
        List.of(Declare.class, If.class, Persist.class, SetPc.class, Suspend.class), classes(body));

    var branch = (If) body.get(1);
    var thenBody = branch.thenBody().statements();
    assertEquals(List.of(Persist.class, SetPc.class, Suspend.class), classes(thenBody));
    assertEquals(2, ((SetPc) thenBody.get(1)).pc());
    assertEquals(List.of(Exec.class), classes(branch.elseBody().statements()));
    assertEquals(1, ((SetPc) body.get(3)).pc());
  }

  @Test
  public void branchWithoutSuspensionsStaysInOneProcedure() {
    var compilation =
        compile(
            """
            def f = coroutine (x: Int) => {
              var s = "neg"
              if (x > 0) s = "pos"
              s
            }
            """);
    assertEquals(1, compilation.procedures().size());
    assertEquals(
        List.of(Declare.class, If.class, Exec.class, Complete.class),
        classes(compilation.procedures().get(0).body().statements()));
  }

  @Test
  public void leafCompletesTheFrame() {
    var compilation = compile("def f = coroutine (x: Int) => { val y = x; y + 1 }");
    var procedure = compilation.procedures().get(0);
    assertEquals(
        List.of(Declare.class, Exec.class, Complete.class), classes(procedure.body().statements()));
    assertEquals(
        """
        def ep0(c: Coroutine): Unit = {
          val x: Int = lstack[1]
          val y: Int = x
          (y + 1)
          c.complete(lastValue); return
        }
        """,
        procedure.toString());
  }

  @Test
  public void blockBuilderRejectsAppendAfterFinish() {
    var builder = new Block.Builder();
    builder.append(new Complete(ValueType.UNIT));
    var block = builder.finish();
    assertEquals(1, block.statements().size());
    assertThrows(IllegalStateException.class, () -> builder.append(new Complete(ValueType.UNIT)));
  }

  private static List<String> restoredNames(Procedure procedure) {
    return procedure.prelude().stream()
        .map(statement -> ((Restore) statement).symbol().name())
        .toList();
  }

  private static List<Class<?>> classes(List<Statement> statements) {
    return statements.stream().<Class<?>>map(Object::getClass).toList();
  }

  private static Compilation compile(String source) {
    return compile(source, "f");
  }

  private static Compilation compile(String source, String name) {
    var compiler = new Compiler(JsonAstParser.parseModule(CoroutineParser.parse("<test>", source)));
    return compiler.compile(name);
  }
}
