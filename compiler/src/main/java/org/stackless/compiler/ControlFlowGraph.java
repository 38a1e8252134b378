// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.stackless.compiler.Tree.*;
import org.stackless.runtime.ValueType;

/**
 * Index-addressed arena of control-flow nodes. Successors are indices into the same arena, so a
 * merge node reached from several predecessors is just an index that appears in several successor
 * lists.
 */
public final class ControlFlowGraph {
  private final List<Node> nodes = new ArrayList<>();

  public static final class Node {
    private final int index;
    private final Fragment fragment;
    private final Fragment marker;
    private final Chain chain;
    private final boolean exit;
    private final int origin;
    private final int declaredBefore;
    private final List<Integer> successors = new ArrayList<>();

    private Node(
        int index,
        Fragment fragment,
        Fragment marker,
        Chain chain,
        boolean exit,
        int origin,
        int declaredBefore) {
      this.index = index;
      this.fragment = fragment;
      this.marker = marker;
      this.chain = chain;
      this.exit = exit;
      this.origin = origin;
      this.declaredBefore = declaredBefore;
    }

    public int index() {
      return index;
    }

    public Fragment fragment() {
      return fragment;
    }

    /** Branch construct this node begins or ends, or null. */
    public Fragment marker() {
      return marker;
    }

    public Chain chain() {
      return chain;
    }

    /** Node appended after the body; emits nothing and completes the frame. */
    public boolean isExit() {
      return exit;
    }

    public boolean isBranchHead() {
      return marker != null && marker == fragment;
    }

    public boolean isMerge() {
      return marker != null && marker != fragment;
    }

    /** Whether this node suspends the frame: a yield or an invocation of another coroutine. */
    public boolean isSuspension() {
      return fragment instanceof SuspensionPoint
          || fragment instanceof YieldTo
          || fragment instanceof NestedInvocation;
    }

    /** Index of the node this one was cloned from, or its own index in an original graph. */
    public int origin() {
      return origin;
    }

    public List<Integer> successors() {
      return Collections.unmodifiableList(successors);
    }

    /**
     * Whether {@code symbol} holds a value whenever this node runs: it is declared in this node's
     * chain or an ancestor, and its declaration precedes this node.
     */
    public boolean isInScope(Symbol symbol) {
      return symbol.id() < declaredBefore && chain.isVisible(symbol);
    }

    @Override
    public String toString() {
      if (exit) {
        return "Node(<exit>)";
      }
      if (isMerge()) {
        return "Node(<merge>)";
      }
      if (fragment instanceof Branch branch) {
        return "Node(if (%s))".formatted(branch.condition());
      }
      return "Node(%s)".formatted(fragment);
    }
  }

  public Node node(int index) {
    return nodes.get(index);
  }

  public int size() {
    return nodes.size();
  }

  public List<Node> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  /** The entry node is always at index 0. */
  public Node root() {
    return nodes.get(0);
  }

  Node addNode(
      Fragment fragment, Fragment marker, Chain chain, boolean exit, int declaredBefore) {
    var node =
        new Node(nodes.size(), fragment, marker, chain, exit, nodes.size(), declaredBefore);
    nodes.add(node);
    return node;
  }

  /** Adds a copy of {@code node} without its successors, remembering where it came from. */
  Node addClone(Node node) {
    var clone =
        new Node(
            nodes.size(),
            node.fragment,
            node.marker,
            node.chain,
            node.exit,
            node.index,
            node.declaredBefore);
    nodes.add(clone);
    return clone;
  }

  void addSuccessor(int from, int to) {
    nodes.get(from).successors.add(to);
  }

  /**
   * Renders the graph reachable from the root as an indented tree. Nodes already printed appear as
   * {@code label N}. Non-first successors are indented one level deeper than the first.
   */
  public String prettyPrint() {
    var text = new StringBuilder();
    var seen = new HashMap<Integer, Integer>();
    prettyPrint(0, "", text, seen);
    return text.toString();
  }

  private void prettyPrint(
      int index, String prefix, StringBuilder text, Map<Integer, Integer> seen) {
    int count = seen.size();
    seen.put(index, count);
    text.append("%s|-> %d: %s%n".formatted(prefix, count, shorten(nodes.get(index).toString())));
    var successors = nodes.get(index).successors;
    if (successors.isEmpty()) {
      return;
    }
    for (int i = 1; i < successors.size(); ++i) {
      prettyPrintChild(successors.get(i), prefix + "|   ", text, seen);
    }
    prettyPrintChild(successors.get(0), prefix, text, seen);
  }

  private void prettyPrintChild(
      int index, String prefix, StringBuilder text, Map<Integer, Integer> seen) {
    var label = seen.get(index);
    if (label != null) {
      text.append("%s|-> label %d%n".formatted(prefix, label));
    } else {
      prettyPrint(index, prefix, text, seen);
    }
  }

  private static String shorten(String s) {
    int newline = s.indexOf('\n');
    return newline >= 0 ? s.substring(0, newline) + "..." : s;
  }

  /** Resolves callee signatures at invocation sites while the graph is built. */
  public interface CalleeResolver {
    /** Returns the signature of coroutine {@code name}, or throws {@link TransformException}. */
    Table.Signature resolve(String name, int lineno);
  }

  /**
   * Builds the graph of {@code lambda}'s body, registering parameters and declarations in {@code
   * table}'s chains and binding every identifier to its symbol.
   */
  public static ControlFlowGraph build(Lambda lambda, Table table, CalleeResolver callees) {
    var builder = new Builder(table, callees);
    var topChain = table.topChain();
    for (var parameter : lambda.parameters()) {
      table.declare(
          topChain,
          parameter.name(),
          parameter.type(),
          /* mutable= */ false,
          /* parameter= */ true,
          lambda.lineno());
    }
    var body = builder.traverse(lambda.body(), topChain);
    var exit = builder.addNode(new Leaf(lambda.lineno(), Constant.unit()), null, topChain, true);
    builder.graph.addSuccessor(body.exit(), exit.index());
    if (body.entry() != 0) {
      throw new IllegalStateException("Entry node of %s is not at index 0".formatted(table.name()));
    }
    return builder.graph;
  }

  private record Span(int entry, int exit) {}

  private static class Builder {
    private final ControlFlowGraph graph = new ControlFlowGraph();
    private final Table table;
    private final TypeResolver types;
    private final CalleeResolver callees;

    Builder(Table table, CalleeResolver callees) {
      this.table = table;
      this.types = new TypeResolver(table);
      this.callees = callees;
    }

    Span traverse(Fragment fragment, Chain chain) {
      if (fragment instanceof Declaration declaration) {
        resolve(declaration.initializer(), chain, declaration.lineno());
        var initType = types.typeOf(declaration.initializer(), declaration.lineno());
        var type = declaredOr(declaration.declaredType(), initType, declaration.lineno());
        var symbol =
            table.declare(
                chain,
                declaration.name(),
                type,
                declaration.mutable(),
                /* parameter= */ false,
                declaration.lineno());
        table.bind(declaration, symbol);
        return single(fragment, chain);
      } else if (fragment instanceof Branch branch) {
        resolve(branch.condition(), chain, branch.lineno());
        TypeResolver.require(
            ValueType.BOOLEAN,
            types.typeOf(branch.condition(), branch.lineno()),
            branch.lineno(),
            "Condition");
        var head = addNode(branch, branch, chain, false);
        var merge = addNode(new Leaf(branch.lineno(), Constant.unit()), branch, chain, false);
        // Negative alternative first, then positive.
        for (var alternative : List.of(branch.elseBranch(), branch.thenBranch())) {
          var span = traverse(alternative, chain.newChain(alternative));
          graph.addSuccessor(head.index(), span.entry());
          graph.addSuccessor(span.exit(), merge.index());
        }
        return new Span(head.index(), merge.index());
      } else if (fragment instanceof Sequence sequence) {
        var blockChain = chain.newChain(sequence);
        if (sequence.statements().isEmpty()) {
          return single(new Leaf(sequence.lineno(), Constant.unit()), blockChain);
        }
        Span result = null;
        for (var statement : sequence.statements()) {
          var span = traverse(statement, blockChain);
          if (result == null) {
            result = span;
          } else {
            graph.addSuccessor(result.exit(), span.entry());
            result = new Span(result.entry(), span.exit());
          }
        }
        return result;
      } else if (fragment instanceof Leaf leaf) {
        resolve(leaf.expression(), chain, leaf.lineno());
        types.typeOf(leaf.expression(), leaf.lineno());
        return single(fragment, chain);
      } else if (fragment instanceof SuspensionPoint suspension) {
        resolve(suspension.payload(), chain, suspension.lineno());
        table.addYieldType(types.typeOf(suspension.payload(), suspension.lineno()));
        return single(fragment, chain);
      } else if (fragment instanceof YieldTo yieldTo) {
        resolve(yieldTo.target(), chain, yieldTo.lineno());
        TypeResolver.require(
            ValueType.COROUTINE,
            types.typeOf(yieldTo.target(), yieldTo.lineno()),
            yieldTo.lineno(),
            "Target of yieldto");
        table.addYieldType(yieldTo.yieldType());
        return single(fragment, chain);
      } else if (fragment instanceof NestedInvocation invocation) {
        traverseInvocation(invocation, chain);
        return single(fragment, chain);
      } else {
        throw new IllegalStateException("Unexpected fragment: " + fragment);
      }
    }

    private void traverseInvocation(NestedInvocation invocation, Chain chain) {
      int lineno = invocation.lineno();
      var signature = callees.resolve(invocation.callee(), lineno);
      var args = invocation.args();
      if (args.size() != signature.parameterTypes().size()) {
        throw new TransformException(
            lineno,
            "Coroutine %s takes %d argument(s) but %d given"
                .formatted(signature.name(), signature.parameterTypes().size(), args.size()));
      }
      for (int i = 0; i < args.size(); ++i) {
        resolve(args.get(i), chain, lineno);
        TypeResolver.require(
            signature.parameterTypes().get(i),
            types.typeOf(args.get(i), lineno),
            lineno,
            "Argument %d of %s".formatted(i + 1, signature.name()));
      }
      table.bindCallee(invocation, signature);
      if (invocation.result().isPresent()) {
        var target = invocation.result().get();
        var type = declaredOr(target.declaredType(), signature.resultType(), lineno);
        var symbol =
            table.declare(
                chain, target.name(), type, target.mutable(), /* parameter= */ false, lineno);
        table.bind(invocation, symbol);
      }
    }

    private static ValueType declaredOr(
        Optional<ValueType> declared, ValueType found, int lineno) {
      if (declared.isPresent()) {
        TypeResolver.require(declared.get(), found, lineno, "Initializer");
        return declared.get();
      }
      return found;
    }

    Node addNode(Fragment fragment, Fragment marker, Chain chain, boolean exit) {
      return graph.addNode(fragment, marker, chain, exit, table.symbolCount());
    }

    private Span single(Fragment fragment, Chain chain) {
      var node = addNode(fragment, null, chain, false);
      return new Span(node.index(), node.index());
    }

    /** Binds identifiers in {@code expression} to the declarations visible in {@code chain}. */
    private void resolve(Expression expression, Chain chain, int lineno) {
      if (expression instanceof Identifier identifier) {
        var symbol =
            chain
                .lookup(identifier.name())
                .orElseThrow(
                    () ->
                        new TransformException(
                            lineno, "Name '%s' is not defined".formatted(identifier.name())));
        table.bind(identifier, symbol);
      } else if (expression instanceof UnaryOp unaryOp) {
        resolve(unaryOp.operand(), chain, lineno);
      } else if (expression instanceof BinaryOp binaryOp) {
        resolve(binaryOp.lhs(), chain, lineno);
        resolve(binaryOp.rhs(), chain, lineno);
      } else if (expression instanceof Assign assign) {
        resolve(assign.target(), chain, lineno);
        var symbol = table.symbolOf(assign.target());
        if (!symbol.mutable()) {
          throw new TransformException(
              lineno, "Reassignment to val '%s'".formatted(symbol.name()));
        }
        resolve(assign.value(), chain, lineno);
      }
    }
  }
}
