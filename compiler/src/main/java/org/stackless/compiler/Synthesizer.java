// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.stackless.compiler.Code.*;
import org.stackless.compiler.Tree.*;

/** Emits the entry procedure of a subgraph. */
public final class Synthesizer {
  private final Subgraph subgraph;
  private final Table table;
  private final ControlFlowGraph graph;

  // Symbol bound by the nested invocation whose return resumes this subgraph, or null.
  private final Symbol boundByReturn;

  // Emission-time seen set over clone indices, separate from the one used while partitioning.
  private final Set<Integer> seen = new HashSet<>();

  private Synthesizer(Subgraph subgraph, Table table) {
    this.subgraph = subgraph;
    this.table = table;
    this.graph = subgraph.graph();
    var start = subgraph.start();
    this.boundByReturn =
        subgraph
            .resumedFrom()
            .flatMap(table::findSymbol)
            .filter(symbol -> start.chain().isVisible(symbol))
            .orElse(null);
  }

  public static Procedure synthesize(Subgraph subgraph, Table table) {
    var synthesizer = new Synthesizer(subgraph, table);
    var prelude = synthesizer.synthesizePrelude();
    var body = new Block.Builder();
    synthesizer.emit(0, body, null);
    return new Procedure(table.newProcedureId(), subgraph.id(), prelude, body.finish());
  }

  /**
   * Restores every variable the subgraph references but does not declare. Chains are walked from
   * the outermost ancestor of the start node's chain inward, each in declaration order.
   */
  private List<Statement> synthesizePrelude() {
    var prelude = new ArrayList<Statement>();
    for (var chain : subgraph.start().chain().ancestry()) {
      for (var symbol : chain.vars()) {
        if (symbol == boundByReturn) {
          prelude.add(new Restore(symbol, new ReturnValue()));
        } else if (subgraph.usesVar(symbol) && !subgraph.declaresVar(symbol)) {
          prelude.add(new Restore(symbol, new StackRead(table.varInfo(symbol))));
        }
      }
    }
    subgraph
        .resumedFrom()
        .filter(invocation -> invocation.result().isEmpty())
        .ifPresent(invocation -> prelude.add(new ResumeValue()));
    return prelude;
  }

  /**
   * Emits nodes from {@code index} onward into {@code out}, stopping at the merge node of {@code
   * enclosingBranch}. Returns the index of that merge node if it was reached, else -1.
   */
  private int emit(int index, Block.Builder out, Fragment enclosingBranch) {
    while (true) {
      var node = graph.node(index);
      if (node.isMerge() && node.marker() == enclosingBranch) {
        return index;
      }
      if (!seen.add(index)) {
        return -1;
      }
      if (node.isSuspension()) {
        emitSuspension(node, out);
        return -1;
      }
      if (node.isBranchHead()) {
        int merge = emitBranch(node, out);
        if (merge < 0 || !seen.add(merge)) {
          return -1;
        }
        // The merge node emits nothing; what follows the branch is appended once, after it.
        index = singleSuccessor(graph.node(merge));
        continue;
      }
      if (!node.isMerge() && !node.isExit()) {
        emitFragment(node.fragment(), out);
      }
      if (node.successors().isEmpty()) {
        out.append(new Complete(table.resultType()));
        return -1;
      }
      index = singleSuccessor(node);
    }
  }

  private int emitBranch(ControlFlowGraph.Node head, Block.Builder out) {
    if (!(head.fragment() instanceof Branch branch) || head.successors().size() != 2) {
      throw new IllegalStateException("Unsupported branch construct: " + head.fragment());
    }
    var elseBody = new Block.Builder();
    int elseMerge = emit(head.successors().get(0), elseBody, branch);
    var thenBody = new Block.Builder();
    int thenMerge = emit(head.successors().get(1), thenBody, branch);
    out.append(new If(branch.condition(), thenBody.finish(), elseBody.finish()));
    return elseMerge >= 0 ? elseMerge : thenMerge;
  }

  private void emitFragment(Fragment fragment, Block.Builder out) {
    if (fragment instanceof Declaration declaration) {
      out.append(new Declare(table.symbolOf(declaration), declaration.initializer()));
    } else if (fragment instanceof Leaf leaf) {
      out.append(new Exec(leaf.expression()));
    } else {
      throw new IllegalStateException("Unexpected fragment in straight-line code: " + fragment);
    }
  }

  /** Persists locals still needed, records the resumption target and suspends. */
  private void emitSuspension(ControlFlowGraph.Node node, Block.Builder out) {
    var target = subgraph.exitSubgraph(node.index());
    var pendingSymbol = table.findSymbol(node.fragment()).orElse(null);
    for (var info : table.vars()) {
      var symbol = info.symbol();
      if (symbol == pendingSymbol || !node.isInScope(symbol)) {
        continue;
      }
      if (subgraph.declaresVar(symbol)
          || subgraph.assignsVar(symbol)
          || symbol == boundByReturn) {
        out.append(new Persist(info));
      }
    }
    out.append(new SetPc(target.id()));
    if (node.fragment() instanceof SuspensionPoint suspension) {
      out.append(new Suspend(suspension.payload()));
    } else if (node.fragment() instanceof YieldTo yieldTo) {
      out.append(new Transfer(yieldTo.target(), yieldTo.yieldType()));
    } else if (node.fragment() instanceof NestedInvocation invocation) {
      out.append(new Invoke(invocation.callee(), invocation.args()));
    }
  }

  private static int singleSuccessor(ControlFlowGraph.Node node) {
    if (node.successors().size() != 1) {
      throw new IllegalStateException(
          "Expected one successor but found %d: %s".formatted(node.successors().size(), node));
    }
    return node.successors().get(0);
  }
}
