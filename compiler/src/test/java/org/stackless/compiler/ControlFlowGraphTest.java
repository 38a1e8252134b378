// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.stackless.compiler.Tree.*;
import org.stackless.parser.CoroutineParser;
import org.stackless.runtime.ValueType;

public class ControlFlowGraphTest {

  @Test
  public void straightLineEndsInExitNode() {
    var cfg =
        buildGraph(
            """
            def f = coroutine (x: Int) => {
              val y = x + 1
              yieldval(y)
            }
            """);
    assertEquals(3, cfg.size());

    var root = cfg.root();
    assertInstanceOf(Declaration.class, root.fragment());
    assertNull(root.marker());
    assertEquals(1, root.successors().size());

    var yield = cfg.node(root.successors().get(0));
    assertTrue(yield.isSuspension());
    assertEquals("yieldval(y)", yield.fragment().toString());

    var exit = cfg.node(yield.successors().get(0));
    assertTrue(exit.isExit());
    assertTrue(exit.successors().isEmpty());
  }

  @Test
  public void branchHeadListsElseBeforeThen() {
    var cfg =
        buildGraph(
            """
            def f = coroutine (x: Int) => {
              if (x > 0) yieldval("pos") else yieldval("neg")
              yieldval("done")
            }
            """);
    var head = cfg.root();
    assertTrue(head.isBranchHead());
    assertSame(head.fragment(), head.marker());

    var successors = head.successors();
    assertEquals(2, successors.size());
    var elseNode = cfg.node(successors.get(0));
    var thenNode = cfg.node(successors.get(1));
    assertEquals("yieldval(\"neg\")", elseNode.fragment().toString());
    assertEquals("yieldval(\"pos\")", thenNode.fragment().toString());

    // Both alternatives join at one merge node marked with the branch.
    assertEquals(elseNode.successors(), thenNode.successors());
    var merge = cfg.node(elseNode.successors().get(0));
    assertTrue(merge.isMerge());
    assertSame(head.fragment(), merge.marker());
    assertEquals("yieldval(\"done\")", cfg.node(merge.successors().get(0)).fragment().toString());

    // Each alternative gets a nested chain.
    assertSame(head.chain(), elseNode.chain().parent());
    assertSame(head.chain(), thenNode.chain().parent());
    assertNotSame(elseNode.chain(), thenNode.chain());
  }

  @Test
  public void prettyPrintLabelsRevisitedNodes() {
    var cfg =
        buildGraph(
            """
            def f = coroutine (x: Int) => {
              if (x > 0) yieldval(1) else yieldval(2)
            }
            """);
    String expected =
        """
        |-> 0: Node(if ((x > 0)))
        |   |-> 1: Node(yieldval(1))
        |   |-> 2: Node(<merge>)
        |   |-> 3: Node(<exit>)
        |-> 4: Node(yieldval(2))
        |-> label 2
        """;
    assertEquals(expected, cfg.prettyPrint().replace(System.lineSeparator(), "\n"));
  }

  @Test
  public void parametersAreDeclaredInTopChain() {
    var table = new Table("f", null);
    var definition =
        definition("def f = coroutine (a: Int, b: String) => { val c = a; yieldval(b) }");
    ControlFlowGraph.build((Lambda) definition.value(), table, (name, lineno) -> null);

    var topVars = table.topChain().vars().stream().toList();
    assertEquals(2, topVars.size());
    assertEquals("a", topVars.get(0).name());
    assertTrue(topVars.get(0).parameter());
    assertEquals(ValueType.STRING, topVars.get(1).type());

    var c = table.vars().stream().map(Table.VarInfo::symbol).skip(2).findFirst().get();
    assertEquals("c", c.name());
    assertFalse(c.parameter());
    assertEquals(ValueType.INT, c.type());
  }

  @Test
  public void innerBlocksMayShadow() {
    var cfg =
        buildGraph(
            """
            def f = coroutine () => {
              val x = 1
              {
                val x = "inner"
                yieldval(x)
              }
            }
            """);
    var outer = cfg.root();
    var inner = cfg.node(outer.successors().get(0));
    assertSame(outer.chain(), inner.chain().parent());
    var outerX = outer.chain().lookup("x").get();
    var innerX = inner.chain().lookup("x").get();
    assertNotEquals(outerX, innerX);
    assertEquals(ValueType.STRING, innerX.type());
    assertTrue(inner.chain().isVisible(outerX));
    assertFalse(outer.chain().isVisible(innerX));
  }

  @Test
  public void declarationOrderBoundsScope() {
    var cfg =
        buildGraph(
            """
            def f = coroutine () => {
              yieldval(0)
              val late = 1
              yieldval(late)
            }
            """);
    var late = cfg.root().chain().lookup("late").get();
    var first = cfg.root();
    var last = cfg.node(cfg.node(first.successors().get(0)).successors().get(0));
    assertFalse(first.isInScope(late));
    assertTrue(last.isInScope(late));
  }

  @Test
  public void undefinedName() {
    var e =
        assertThrows(
            TransformException.class,
            () -> buildGraph("def f = coroutine () => {\n  yieldval(y)\n}"));
    assertEquals("Name 'y' is not defined", e.getMessage());
    assertEquals(2, e.lineno);
    assertEquals("line 2: Name 'y' is not defined", e.describe());
  }

  @Test
  public void reassignmentToVal() {
    var e =
        assertThrows(
            TransformException.class,
            () -> buildGraph("def f = coroutine () => { val y = 1; y = 2 }"));
    assertEquals("Reassignment to val 'y'", e.getMessage());
  }

  @Test
  public void duplicateDeclarationInOneChain() {
    var e =
        assertThrows(
            TransformException.class,
            () -> buildGraph("def f = coroutine (y: Int) => { val y = 1; val y = 2 }"));
    assertEquals("Variable 'y' is already declared", e.getMessage());
  }

  @Test
  public void conditionMustBeBoolean() {
    var e =
        assertThrows(
            TransformException.class,
            () -> buildGraph("def f = coroutine (x: Int) => if (x) yieldval(1)"));
    assertEquals("Condition has invalid type.\nrequired: Boolean\nfound:    Int", e.getMessage());
  }

  @Test
  public void declaredTypeMustAcceptInitializer() {
    var e =
        assertThrows(
            TransformException.class,
            () -> buildGraph("def f = coroutine () => { val s: String = 1 }"));
    assertEquals("Initializer has invalid type.\nrequired: String\nfound:    Int", e.getMessage());
  }

  private static CoroutineDef definition(String source) {
    var definitions = JsonAstParser.parseModule(CoroutineParser.parse("<test>", source));
    return definitions.get(0);
  }

  private static ControlFlowGraph buildGraph(String source) {
    var definition = definition(source);
    var lambda = (Lambda) definition.value();
    return ControlFlowGraph.build(
        lambda,
        new Table(definition.name(), lambda),
        (name, lineno) -> {
          throw new TransformException(lineno, "Unknown coroutine: " + name);
        });
  }
}
