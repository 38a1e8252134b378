// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.stackless.runtime.Generator;
import org.stackless.runtime.ValueType;

public class ProgramTest {

  @Test
  public void yieldsInSourceOrder() {
    var program =
        Program.compile(
            """
            def f = coroutine (x: Int) => {
              val y = x + 1
              yieldval(y)
              val z = y * 2
              yieldval(z)
            }
            """);
    var generator = program.generator("f", 1);
    assertEquals(List.of(2, 4), values(generator));
    assertNull(generator.coroutine().getReturnValue());
    assertFalse(generator.coroutine().isLive());
  }

  @Test
  public void resumeVisitsSubgraphsInExecutionOrder() {
    var program =
        Program.compile(
            """
            def f = coroutine () => {
              yieldval("a")
              yieldval("b")
              yieldval("c")
            }
            """);
    var coroutine = program.call("f");
    var pcs = new ArrayList<Long>();
    var values = new ArrayList<Object>();
    while (coroutine.resume()) {
      pcs.add(coroutine.pcstack().top());
      values.add(coroutine.getResult());
    }
    assertEquals(List.of(1L, 2L, 3L), pcs);
    assertEquals(List.of("a", "b", "c"), values);
  }

  @Test
  public void varsSurviveSuspension() {
    var program =
        Program.compile(
            """
            def counter = coroutine (n: Int) => {
              var total = 0L
              total = total + n
              yieldval(total)
              total = total + n
              yieldval(total)
              total
            }
            """);
    var counter = program.get("counter");
    assertEquals(ValueType.LONG, counter.resultType());
    var generator = program.generator("counter", 5);
    assertEquals(List.of(5L, 10L), values(generator));
    assertEquals(10L, generator.coroutine().getReturnValue());
  }

  @Test
  public void nestedInvocationReturnsValue() {
    var program =
        Program.compile(
            """
            def g: Int = coroutine (n: Int) => { yieldval(n); n * 10 }
            def f: Int = coroutine (x: Int) => {
              val r = g(x)
              yieldval(r + 1)
              r
            }
            """);
    var generator = program.generator("f", 3);
    assertEquals(List.of(3, 31), values(generator));
    assertEquals(30, generator.coroutine().getReturnValue());
  }

  @Test
  public void branchesTakeEitherPath() {
    var program =
        Program.compile(
            """
            def f = coroutine (x: Int) => {
              var y = 0
              if (x > 0) { yieldval(x) } else { y = 1 }
              yieldval(y)
            }
            """);
    assertEquals(List.of(7, 0), values(program.generator("f", 7)));
    assertEquals(List.of(1), values(program.generator("f", -7)));
  }

  @Test
  public void shadowedVariablesAreRestoredSeparately() {
    var program =
        Program.compile(
            """
            def f = coroutine () => {
              val x = 1
              {
                val x = "inner"
                yieldval(x)
                yieldval(x + "!")
              }
              yieldval(x)
            }
            """);
    assertEquals(List.of("inner", "inner!", 1), values(program.generator("f")));
  }

  @Test
  public void recursionWithDeclaredResultType() {
    var program =
        Program.compile(
            """
            def countdown: Int = coroutine (n: Int) => {
              yieldval(n)
              if (n > 0) countdown(n - 1) else 0
            }
            """);
    var generator = program.generator("countdown", 2);
    assertEquals(List.of(2, 1, 0), values(generator));
    assertEquals(0, generator.coroutine().getReturnValue());
  }

  @Test
  public void recursionNeedsResultType() {
    var e =
        assertThrows(
            TransformException.class,
            () ->
                Program.compile(
                    """
                    def f = coroutine (n: Int) => {
                      if (n > 0) f(n - 1) else yieldval(n)
                    }
                    """));
    assertEquals(
        "Recursive coroutine f needs an explicit result type: def f: <Type> = coroutine ...",
        e.getMessage());
    assertEquals(2, e.lineno);
  }

  @Test
  public void definitionsMayCallLaterDefinitions() {
    var program =
        Program.compile(
            """
            def f = coroutine () => {
              val a = g(2)
              val b = g(a)
              a + b
            }
            def g = coroutine (n: Int) => { yieldval(n); n + 1 }
            """);
    var generator = program.generator("f");
    assertEquals(List.of(2, 3), values(generator));
    assertEquals(7, generator.coroutine().getReturnValue());
    assertEquals(ValueType.INT, program.get("f").resultType());
  }

  @Test
  public void completionAfterYieldIgnoresEarlierReturnValue() {
    var program =
        Program.compile(
            """
            def g = coroutine () => 7
            def f = coroutine (c: Boolean) => {
              val a = g()
              if (c) yieldval(1) else g()
            }
            """);
    var yielding = program.generator("f", true);
    assertEquals(List.of(1), values(yielding));
    assertNull(yielding.coroutine().getReturnValue());

    var returning = program.generator("f", false);
    assertEquals(List.of(), values(returning));
    assertEquals(7, returning.coroutine().getReturnValue());
  }

  @Test
  public void completionValueTakesDeclaredResultType() {
    var program = Program.compile("def f: Long = coroutine () => 1");
    var coroutine = program.call("f");
    assertFalse(coroutine.resume());
    assertEquals(1L, coroutine.getReturnValue());
  }

  @Test
  public void yieldtoPassesOnValuesOfAnotherInstance() {
    var program =
        Program.compile(
            """
            def numbers = coroutine (n: Int) => { yieldval(n); yieldval(n + 1) }
            def relay = coroutine (other: Coroutine) => {
              yieldval(0)
              yieldto[Int](other)
              yieldto[Int](other)
              yieldto[Int](other)
              yieldval(9)
            }
            """);
    var numbers = program.call("numbers", 5);
    assertEquals(List.of(0, 5, 6, 9), values(program.generator("relay", numbers)));
    assertFalse(numbers.isLive());
  }

  @Test
  public void yieldtoTypeArgumentCountsAsYieldedType() {
    var e =
        assertThrows(
            TransformException.class,
            () ->
                Program.compile(
                    "def f: Int = coroutine (o: Coroutine) => { yieldto[String](o); 1 }"));
    assertEquals(
        "Yielded value has invalid type.\nrequired: Int\nfound:    String", e.getMessage());

    var inferred = Program.compile("def f = coroutine (o: Coroutine) => { yieldto[Int](o); 1 }");
    assertEquals(ValueType.INT, inferred.get("f").resultType());
  }

  @Test
  public void yieldtoTargetMustBeCoroutine() {
    var e =
        assertThrows(
            TransformException.class,
            () -> Program.compile("def f = coroutine (n: Int) => yieldto(n)"));
    assertEquals(
        "Target of yieldto has invalid type.\nrequired: Coroutine\nfound:    Int",
        e.getMessage());

    e =
        assertThrows(
            TransformException.class,
            () -> Program.compile("def f = coroutine (o: Coroutine) => { val a = yieldto(o) }"));
    assertEquals("yieldto(...) may only be used as a statement", e.getMessage());
  }

  @Test
  public void coroutineBodyMustBeFunctionLiteral() {
    var e =
        assertThrows(
            TransformException.class, () -> Program.compile("def f = coroutine yieldval(1)"));
    assertEquals("The coroutine takes a single function literal.", e.getMessage());
  }

  @Test
  public void invocationSiteReturnTypeMustConform() {
    var e =
        assertThrows(
            TransformException.class,
            () ->
                Program.compile(
                    """
                    def g: String = coroutine () => "s"
                    def f: Int = coroutine () => { g(); 1 }
                    """));
    assertEquals(
        "Coroutine invocation site has invalid return type.\n"
            + "required: Int\n"
            + "found:    String (g)",
        e.getMessage());
  }

  @Test
  public void yieldedValuesMustConformToResultType() {
    var e =
        assertThrows(
            TransformException.class,
            () -> Program.compile("def f: Int = coroutine () => { yieldval(\"s\"); 1 }"));
    assertEquals(
        "Yielded value has invalid type.\nrequired: Int\nfound:    String", e.getMessage());
  }

  @Test
  public void invocationArityIsChecked() {
    var e =
        assertThrows(
            TransformException.class,
            () ->
                Program.compile(
                    """
                    def g = coroutine (a: Int) => a
                    def f = coroutine () => g(1, 2)
                    """));
    assertEquals("Coroutine g takes 1 argument(s) but 2 given", e.getMessage());
  }

  @Test
  public void yieldvalIsAStatementOnly() {
    var e =
        assertThrows(
            TransformException.class,
            () -> Program.compile("def f = coroutine () => { val a = yieldval(1) }"));
    assertEquals("yieldval(...) may only be used as a statement", e.getMessage());
  }

  @Test
  public void unknownFunction() {
    var e =
        assertThrows(
            TransformException.class, () -> Program.compile("def f = coroutine () => print(1)"));
    assertEquals("Unknown function: print", e.getMessage());
  }

  @Test
  public void duplicateDefinition() {
    var e =
        assertThrows(
            TransformException.class,
            () -> Program.compile("def f = coroutine () => 1\ndef f = coroutine () => 2"));
    assertEquals("Duplicate coroutine definition: f", e.getMessage());
    assertEquals(2, e.lineno);
  }

  @Test
  public void applyIsForbidden() {
    var program = Program.compile("def f = coroutine (x: Int) => yieldval(x)");
    var e = assertThrows(IllegalStateException.class, () -> program.get("f").apply(1));
    assertTrue(e.getMessage().contains("Use `f.call(<arg0>, ..., <argN>)` instead"));
  }

  @Test
  public void closeAbandonsInstance() {
    var program =
        Program.compile(
            """
            def g = coroutine () => { yieldval("inner"); yieldval("never") }
            def f = coroutine (s: String) => { val r = g(); yieldval(s) }
            """);
    var coroutine = program.call("f", "outer");
    assertTrue(coroutine.resume());
    assertEquals("inner", coroutine.getResult());
    assertEquals(2, coroutine.depth());

    coroutine.close();
    assertEquals(0, coroutine.depth());
    assertTrue(coroutine.rstack().isEmpty());
    assertThrows(IllegalStateException.class, coroutine::resume);
  }

  @Test
  public void argumentsAreCoercedToParameterTypes() {
    var program = Program.compile("def f = coroutine (d: Double) => yieldval(d / 2)");
    assertEquals(List.of(1.5), values(program.generator("f", 3)));
    assertThrows(IllegalArgumentException.class, () -> program.call("f", "3"));
    assertThrows(IllegalArgumentException.class, () -> program.get("missing"));
  }

  @Test
  public void arithmeticWidensOperands() {
    var program =
        Program.compile(
            """
            def f = coroutine () => {
              yieldval(7 / 2)
              yieldval(7L % 4)
              yieldval(1 + 0.5)
              yieldval(3 == 3.0)
              yieldval("n=" + 1)
              yieldval(-(2 - 5) * 2)
            }
            """);
    assertEquals(List.of(3, 3L, 1.5, true, "n=1", 6), values(program.generator("f")));
  }

  @Test
  public void versionInfo() {
    var versionInfo = Program.versionInfo();
    assertTrue(versionInfo.toString().startsWith("Stackless "), versionInfo.toString());
    assertSame(versionInfo, Program.versionInfo());
  }

  @Test
  public void dumps() {
    var program =
        Program.compile(
            """
            def f = coroutine (x: Int) => { yieldval(x); yieldval(x); yieldval(x) }
            """);
    String code = program.dumpCode();
    assertTrue(code.contains("def ep0(c: Coroutine): Unit = {"), code);
    assertTrue(code.contains("pc match {"), code);
    assertTrue(code.contains("// x: Int @ lstack[0]"), code);
    assertTrue(program.dumpControlFlowGraphs().startsWith("f:"));
    assertEquals(4, program.dumpSubgraphs().size());
  }

  private static List<Object> values(Generator generator) {
    var values = new ArrayList<Object>();
    generator.forEachRemaining(values::add);
    return values;
  }
}
