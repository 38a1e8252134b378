// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import org.stackless.compiler.Tree.*;
import org.stackless.runtime.Debug;

/**
 * Splits a control-flow graph at its suspension points into subgraphs. Subgraph ids are assigned in
 * the order their start nodes are dequeued, breadth-first over suspension boundaries, so the
 * subgraph containing the graph's root always has id 0.
 */
public final class Partitioner {
  private final ControlFlowGraph cfg;
  private final Table table;

  private final List<Subgraph> subgraphs = new ArrayList<>();

  // Per subgraph: index of a suspending clone -> index of its successor in the original graph.
  private final Map<Subgraph, Map<Integer, Integer>> exitPoints = new LinkedHashMap<>();

  // Original node index -> invocation whose return continues at that node.
  private final Map<Integer, NestedInvocation> continuations = new HashMap<>();

  private final Set<Integer> seenEntries = new HashSet<>();
  private final Deque<Integer> nodefront = new ArrayDeque<>();

  private Partitioner(ControlFlowGraph cfg, Table table) {
    this.cfg = cfg;
    this.table = table;
  }

  public static List<Subgraph> partition(ControlFlowGraph cfg, Table table) {
    return new Partitioner(cfg, table).extractSubgraphs();
  }

  private List<Subgraph> extractSubgraphs() {
    seenEntries.add(0);
    nodefront.add(0);

    while (!nodefront.isEmpty()) {
      var subgraph = new Subgraph(table.newSubgraphId());
      exitPoints.put(subgraph, new LinkedHashMap<>());
      extract(nodefront.remove(), new HashMap<>(), subgraph);
      subgraphs.add(subgraph);
    }

    // Resolve each exit point to the subgraph starting at its continuation.
    var startPoints = new HashMap<Integer, Subgraph>();
    for (var subgraph : subgraphs) {
      startPoints.put(subgraph.start().origin(), subgraph);
    }
    for (var entry : exitPoints.entrySet()) {
      var subgraph = entry.getKey();
      for (var exit : entry.getValue().entrySet()) {
        var target = startPoints.get(exit.getValue());
        if (target == null) {
          throw new IllegalStateException(
              "Exit at node %d of subgraph %d continues at node %d, which starts no subgraph"
                  .formatted(exit.getKey(), subgraph.id(), exit.getValue()));
        }
        subgraph.setExitSubgraph(exit.getKey(), target);
      }
    }
    for (var subgraph : subgraphs) {
      var invocation = continuations.get(subgraph.start().origin());
      if (invocation != null) {
        subgraph.setResumedFrom(invocation);
      }
    }

    if (Debug.isVerbose()) {
      for (var subgraph : subgraphs) {
        Debug.log("Subgraph of %s %s", table.name(), subgraph.prettyPrint());
      }
    }
    return subgraphs;
  }

  private int extract(int n, Map<Integer, Integer> seen, Subgraph subgraph) {
    var node = cfg.node(n);
    var current = subgraph.graph().addClone(node);
    seen.put(n, current.index());

    collectVars(node, subgraph);

    if (node.isSuspension()) {
      if (node.fragment() instanceof NestedInvocation invocation) {
        checkInvocation(invocation);
      }
      if (node.successors().size() != 1) {
        throw new IllegalStateException(
            "Suspension point without a unique continuation: " + node.fragment());
      }
      int next = node.successors().get(0);
      if (seenEntries.add(next)) {
        nodefront.add(next);
      }
      exitPoints.get(subgraph).put(current.index(), next);
      if (node.fragment() instanceof NestedInvocation invocation) {
        continuations.putIfAbsent(next, invocation);
      }
    } else {
      for (int s : node.successors()) {
        if (!seen.containsKey(s)) {
          extract(s, seen, subgraph);
        }
        subgraph.graph().addSuccessor(current.index(), seen.get(s));
      }
    }
    return current.index();
  }

  private void checkInvocation(NestedInvocation invocation) {
    var callee = table.calleeOf(invocation);
    var required = table.resultType();
    if (!required.accepts(callee.resultType())) {
      throw new TransformException(
          invocation.lineno(),
          "Coroutine invocation site has invalid return type.\nrequired: %s\nfound:    %s (%s)"
              .formatted(required, callee.resultType(), callee.name()));
    }
  }

  private void collectVars(ControlFlowGraph.Node node, Subgraph subgraph) {
    if (node.isMerge() || node.isExit()) {
      return;
    }
    Consumer<Expression> referenced =
        expression -> forEachIdentifier(expression, subgraph, id -> {});
    var fragment = node.fragment();
    if (fragment instanceof Declaration declaration) {
      referenced.accept(declaration.initializer());
      subgraph.addDeclaredVar(table.symbolOf(declaration));
    } else if (fragment instanceof Branch branch) {
      referenced.accept(branch.condition());
    } else if (fragment instanceof Leaf leaf) {
      forEachIdentifier(
          leaf.expression(), subgraph, assigned -> subgraph.addAssignedVar(assigned));
    } else if (fragment instanceof SuspensionPoint suspension) {
      referenced.accept(suspension.payload());
    } else if (fragment instanceof YieldTo yieldTo) {
      referenced.accept(yieldTo.target());
    } else if (fragment instanceof NestedInvocation invocation) {
      invocation.args().forEach(referenced);
      table.findSymbol(invocation).ifPresent(subgraph::addDeclaredVar);
    } else if (fragment instanceof Sequence) {
      throw new IllegalStateException("Sequence fragment in control-flow graph: " + fragment);
    }
  }

  /**
   * Records every identifier in {@code expression} as referenced, passing the symbols of
   * assignment targets to {@code onAssign}.
   */
  private void forEachIdentifier(
      Expression expression, Subgraph subgraph, Consumer<Symbol> onAssign) {
    if (expression instanceof Identifier identifier) {
      subgraph.addReferencedVar(table.symbolOf(identifier));
    } else if (expression instanceof UnaryOp unaryOp) {
      forEachIdentifier(unaryOp.operand(), subgraph, onAssign);
    } else if (expression instanceof BinaryOp binaryOp) {
      forEachIdentifier(binaryOp.lhs(), subgraph, onAssign);
      forEachIdentifier(binaryOp.rhs(), subgraph, onAssign);
    } else if (expression instanceof Assign assign) {
      var target = table.symbolOf(assign.target());
      subgraph.addReferencedVar(target);
      onAssign.accept(target);
      forEachIdentifier(assign.value(), subgraph, onAssign);
    }
  }
}
