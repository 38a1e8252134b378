// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.stackless.compiler.Tree.NestedInvocation;

/**
 * Straight-line region of a control-flow graph between suspension points. Owns private clones of
 * its nodes, so it can be rewritten without affecting the graph it was extracted from.
 */
public final class Subgraph {
  private final int id;
  private final ControlFlowGraph graph = new ControlFlowGraph();
  private final Set<Symbol> referencedVars = new LinkedHashSet<>();
  private final Set<Symbol> declaredVars = new LinkedHashSet<>();
  private final Set<Symbol> assignedVars = new LinkedHashSet<>();
  private final Map<Integer, Subgraph> exitSubgraphs = new LinkedHashMap<>();
  private NestedInvocation resumedFrom = null;

  Subgraph(int id) {
    this.id = id;
  }

  public int id() {
    return id;
  }

  /** Cloned nodes; the start node is at index 0. */
  public ControlFlowGraph graph() {
    return graph;
  }

  public ControlFlowGraph.Node start() {
    return graph.root();
  }

  public Set<Symbol> referencedVars() {
    return Collections.unmodifiableSet(referencedVars);
  }

  public Set<Symbol> declaredVars() {
    return Collections.unmodifiableSet(declaredVars);
  }

  public Set<Symbol> assignedVars() {
    return Collections.unmodifiableSet(assignedVars);
  }

  public boolean usesVar(Symbol symbol) {
    return referencedVars.contains(symbol);
  }

  public boolean declaresVar(Symbol symbol) {
    return declaredVars.contains(symbol);
  }

  public boolean assignsVar(Symbol symbol) {
    return assignedVars.contains(symbol);
  }

  void addReferencedVar(Symbol symbol) {
    referencedVars.add(symbol);
  }

  void addDeclaredVar(Symbol symbol) {
    referencedVars.add(symbol);
    declaredVars.add(symbol);
  }

  void addAssignedVar(Symbol symbol) {
    assignedVars.add(symbol);
  }

  /** Subgraph that resumption continues into, keyed by index of the suspending node. */
  public Map<Integer, Subgraph> exitSubgraphs() {
    return Collections.unmodifiableMap(exitSubgraphs);
  }

  public Subgraph exitSubgraph(int nodeIndex) {
    var target = exitSubgraphs.get(nodeIndex);
    if (target == null) {
      throw new IllegalStateException(
          "Node %d of subgraph %d has no resumption target".formatted(nodeIndex, id));
    }
    return target;
  }

  void setExitSubgraph(int nodeIndex, Subgraph target) {
    exitSubgraphs.put(nodeIndex, target);
  }

  /** Nested invocation whose return resumes this subgraph, if any. */
  public Optional<NestedInvocation> resumedFrom() {
    return Optional.ofNullable(resumedFrom);
  }

  void setResumedFrom(NestedInvocation invocation) {
    this.resumedFrom = invocation;
  }

  public String prettyPrint() {
    return "%d: [%s]%n%s".formatted(id, names(referencedVars), graph.prettyPrint());
  }

  public JsonObject toJson() {
    var json = new JsonObject();
    json.addProperty("id", id);
    json.add("referenced", toJsonArray(referencedVars));
    json.add("declared", toJsonArray(declaredVars));
    json.add("assigned", toJsonArray(assignedVars));
    if (resumedFrom != null) {
      json.addProperty("resumedFrom", resumedFrom.toString());
    } else {
      json.add("resumedFrom", JsonNull.INSTANCE);
    }
    var nodes = new JsonArray();
    for (var node : graph.nodes()) {
      var jsonNode = new JsonObject();
      jsonNode.addProperty("index", node.index());
      jsonNode.addProperty("origin", node.origin());
      jsonNode.addProperty("node", node.toString());
      var successors = new JsonArray();
      node.successors().forEach(successors::add);
      jsonNode.add("successors", successors);
      if (exitSubgraphs.containsKey(node.index())) {
        jsonNode.addProperty("exitSubgraph", exitSubgraphs.get(node.index()).id);
      }
      nodes.add(jsonNode);
    }
    json.add("nodes", nodes);
    return json;
  }

  private static JsonArray toJsonArray(Collection<Symbol> symbols) {
    var array = new JsonArray();
    symbols.forEach(s -> array.add(s.name()));
    return array;
  }

  private static String names(Collection<Symbol> symbols) {
    return symbols.stream().map(Symbol::name).collect(Collectors.joining(", "));
  }

  @Override
  public String toString() {
    return "Subgraph(%d)".formatted(id);
  }
}
