// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Lexical scope. Child chains are created for blocks and for each branch alternative. */
public final class Chain {
  private final Chain parent;
  private final Object owner;
  private final Map<String, Symbol> vars = new LinkedHashMap<>();

  Chain(Chain parent, Object owner) {
    this.parent = parent;
    this.owner = owner;
  }

  public Chain newChain(Object owner) {
    return new Chain(this, owner);
  }

  public Chain parent() {
    return parent;
  }

  /** Construct that introduced this chain: a lambda, block or branch alternative. */
  public Object owner() {
    return owner;
  }

  /** Variables declared directly in this chain, in declaration order. */
  public Collection<Symbol> vars() {
    return Collections.unmodifiableCollection(vars.values());
  }

  void declare(Symbol symbol) {
    vars.put(symbol.name(), symbol);
  }

  public boolean declaresName(String name) {
    return vars.containsKey(name);
  }

  /** Finds the innermost visible declaration of {@code name}. */
  public Optional<Symbol> lookup(String name) {
    for (var chain = this; chain != null; chain = chain.parent) {
      var symbol = chain.vars.get(name);
      if (symbol != null) {
        return Optional.of(symbol);
      }
    }
    return Optional.empty();
  }

  /** Whether {@code symbol} is declared in this chain or an ancestor, even if shadowed. */
  public boolean isVisible(Symbol symbol) {
    for (var chain = this; chain != null; chain = chain.parent) {
      if (chain.vars.get(symbol.name()) == symbol) {
        return true;
      }
    }
    return false;
  }

  /** This chain and its ancestors, outermost first. */
  public List<Chain> ancestry() {
    var chains = new ArrayList<Chain>();
    for (var chain = this; chain != null; chain = chain.parent) {
      chains.add(chain);
    }
    Collections.reverse(chains);
    return chains;
  }

  public int depth() {
    int depth = 0;
    for (var chain = parent; chain != null; chain = chain.parent) {
      ++depth;
    }
    return depth;
  }

  @Override
  public String toString() {
    return "Chain%s(depth=%d)".formatted(vars.keySet(), depth());
  }
}
