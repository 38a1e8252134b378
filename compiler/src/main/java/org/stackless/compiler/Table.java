// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.stackless.runtime.Coroutine;
import org.stackless.runtime.ValueType;

/**
 * Transformation state of one coroutine definition: its chains, the symbol each tree node resolves
 * to, storage slots of each symbol and id counters. Created per definition and passed explicitly to
 * each phase.
 */
public final class Table {
  /** Parameter and result types of a coroutine callable from another coroutine. */
  public record Signature(String name, List<ValueType> parameterTypes, ValueType resultType) {}

  private final String name;
  private final Chain topChain;

  // Keyed by tree node identity: Identifier, Declaration and NestedInvocation instances.
  private final Map<Object, Symbol> bindings = new IdentityHashMap<>();
  private final Map<Tree.NestedInvocation, Signature> callees = new IdentityHashMap<>();

  private final Map<Symbol, VarInfo> vars = new LinkedHashMap<>();
  private final List<ValueType> yieldTypes = new ArrayList<>();
  private final Map<ValueType.Category, Integer> regionSizes =
      new EnumMap<>(ValueType.Category.class);
  private ValueType resultType = null;
  private boolean slotsAssigned = false;

  private int nextSymbolId = 0;
  private int nextSubgraphId = 0;
  private int nextProcedureId = 0;

  public Table(String name, Object owner) {
    this.name = name;
    this.topChain = new Chain(null, owner);
  }

  public String name() {
    return name;
  }

  public Chain topChain() {
    return topChain;
  }

  /**
   * Declares a variable in {@code chain}.
   *
   * @throws TransformException if {@code chain} already declares the name
   */
  public Symbol declare(
      Chain chain, String name, ValueType type, boolean mutable, boolean parameter, int lineno) {
    if (slotsAssigned) {
      throw new IllegalStateException("Cannot declare %s after slots are assigned".formatted(name));
    }
    if (chain.declaresName(name)) {
      throw new TransformException(lineno, "Variable '%s' is already declared".formatted(name));
    }
    var symbol = new Symbol(nextSymbolId++, name, type, mutable, parameter, lineno);
    chain.declare(symbol);
    vars.put(symbol, new VarInfo(symbol));
    return symbol;
  }

  /** Number of symbols declared so far; symbol ids are below this. */
  public int symbolCount() {
    return nextSymbolId;
  }

  public void bind(Object node, Symbol symbol) {
    bindings.put(node, symbol);
  }

  public Optional<Symbol> findSymbol(Object node) {
    return Optional.ofNullable(bindings.get(node));
  }

  public Symbol symbolOf(Object node) {
    var symbol = bindings.get(node);
    if (symbol == null) {
      throw new IllegalStateException("No symbol bound to: " + node);
    }
    return symbol;
  }

  public void bindCallee(Tree.NestedInvocation invocation, Signature signature) {
    callees.put(invocation, signature);
  }

  public Signature calleeOf(Tree.NestedInvocation invocation) {
    var signature = callees.get(invocation);
    if (signature == null) {
      throw new IllegalStateException("Unresolved coroutine invocation: " + invocation);
    }
    return signature;
  }

  public void addYieldType(ValueType type) {
    yieldTypes.add(type);
  }

  public List<ValueType> yieldTypes() {
    return Collections.unmodifiableList(yieldTypes);
  }

  public ValueType resultType() {
    if (resultType == null) {
      throw new IllegalStateException("Result type of %s is not yet resolved".formatted(name));
    }
    return resultType;
  }

  public void setResultType(ValueType resultType) {
    this.resultType = resultType;
  }

  public int newSubgraphId() {
    return nextSubgraphId++;
  }

  public int newProcedureId() {
    return nextProcedureId++;
  }

  /** All variables in declaration order, which is also the order their slots are pushed. */
  public Collection<VarInfo> vars() {
    return Collections.unmodifiableCollection(vars.values());
  }

  public VarInfo varInfo(Symbol symbol) {
    var info = vars.get(symbol);
    if (info == null) {
      throw new IllegalStateException("Unknown symbol: " + symbol);
    }
    return info;
  }

  /** Number of slots a frame of this definition occupies in the region of {@code category}. */
  public int regionSize(ValueType.Category category) {
    return regionSizes.getOrDefault(category, 0);
  }

  /**
   * Assigns each variable a position in its category's region. Positions count from the top of the
   * region while this definition's frame is on top, so the last variable pushed is at position 0.
   */
  public void assignSlots() {
    var counts = new EnumMap<ValueType.Category, Integer>(ValueType.Category.class);
    for (var info : vars.values()) {
      var category = info.category();
      int slot = counts.getOrDefault(category, 0);
      info.slot = slot;
      counts.put(category, slot + 1);
    }
    for (var info : vars.values()) {
      info.stackpos = counts.get(info.category()) - 1 - info.slot;
    }
    regionSizes.putAll(counts);
    slotsAssigned = true;
  }

  /** Storage metadata of one variable. */
  public static final class VarInfo {
    private final Symbol symbol;
    private int slot = -1;
    private int stackpos = -1;

    private VarInfo(Symbol symbol) {
      this.symbol = symbol;
    }

    public Symbol symbol() {
      return symbol;
    }

    public ValueType type() {
      return symbol.type();
    }

    public ValueType.Category category() {
      return symbol.type().category();
    }

    /** Index of this variable among its category's variables, in push order. */
    public int slot() {
      return slot;
    }

    public int stackpos() {
      if (stackpos < 0) {
        throw new IllegalStateException("Slot not assigned for " + symbol);
      }
      return stackpos;
    }

    public String regionName() {
      return category() == ValueType.Category.PRIMITIVE ? "lstack" : "rstack";
    }

    public Object read(Coroutine coroutine) {
      if (category() == ValueType.Category.PRIMITIVE) {
        return type().decode(coroutine.lstack().get(stackpos()));
      } else {
        return coroutine.rstack().get(stackpos());
      }
    }

    public void write(Coroutine coroutine, Object value) {
      if (category() == ValueType.Category.PRIMITIVE) {
        coroutine.lstack().set(stackpos(), type().encode(value));
      } else {
        coroutine.rstack().set(stackpos(), value);
      }
    }

    public void push(Coroutine coroutine, Object value) {
      if (category() == ValueType.Category.PRIMITIVE) {
        coroutine.lstack().push(type().encode(value), -1);
      } else {
        coroutine.rstack().push(value, -1);
      }
    }

    public void pop(Coroutine coroutine) {
      if (category() == ValueType.Category.PRIMITIVE) {
        coroutine.lstack().pop();
      } else {
        coroutine.rstack().pop();
      }
    }

    @Override
    public String toString() {
      return "%s: %s @ %s[%d]".formatted(symbol.name(), type(), regionName(), stackpos);
    }
  }
}
